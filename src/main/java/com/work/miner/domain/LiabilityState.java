package com.work.miner.domain;

/**
 * liability 状态机：只允许前进。
 *
 * PENDING -> CREATED -> FINALIZED
 * PENDING/CREATED -> FAILED | ABANDONED
 */
public enum LiabilityState {
    PENDING,
    CREATED,
    FINALIZED,
    FAILED,
    ABANDONED;

    public boolean isTerminal() {
        return this == FINALIZED || this == FAILED || this == ABANDONED;
    }

    public boolean canTransitionTo(LiabilityState next) {
        if (next == null || isTerminal()) {
            return false;
        }
        switch (next) {
            case CREATED:
                return this == PENDING;
            case FINALIZED:
                return this == CREATED;
            case FAILED:
            case ABANDONED:
                return true;
            default:
                return false;
        }
    }
}
