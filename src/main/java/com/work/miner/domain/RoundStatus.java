package com.work.miner.domain;

public enum RoundStatus {
    OPEN,
    COMPLETED,
    /**
     * 多数交易确认超时，下一轮必须缩小 batch。
     */
    DEGRADED,
    ABORTED,
    /**
     * 在任何广播之前被拒绝（例如 quota 不足）。
     */
    REJECTED,
    /**
     * 在 create 与 finalize 的边界处被取消。
     */
    CANCELLED
}
