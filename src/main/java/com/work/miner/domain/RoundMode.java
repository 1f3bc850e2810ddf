package com.work.miner.domain;

public enum RoundMode {
    SEQUENTIAL,
    BATCH,
    PIPELINE;

    /**
     * 一轮在 quota 内需要的操作数：pipeline 在同一轮发送 finalize + create，需 2B。
     */
    public long requiredOps(int batchSize) {
        return this == PIPELINE ? 2L * batchSize : batchSize;
    }
}
