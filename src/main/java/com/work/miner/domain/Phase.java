package com.work.miner.domain;

/**
 * 顶层阶段：Idle -> Pumping -> Mining -> Terminated，只能前进。
 */
public enum Phase {
    IDLE,
    PUMPING,
    MINING,
    TERMINATED;

    public boolean isActive() {
        return this == PUMPING || this == MINING;
    }

    public boolean canTransitionTo(Phase next) {
        return next != null && next.ordinal() > ordinal();
    }
}
