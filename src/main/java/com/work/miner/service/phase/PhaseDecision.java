package com.work.miner.service.phase;

import com.work.miner.domain.Phase;
import com.work.miner.domain.PhaseConfig;

/**
 * 决策函数的输出：下一轮的配置、更新后的连续计数，以及给运维的信号。
 */
public class PhaseDecision {

    /**
     * 跨轮次的连续计数，随每次决策整体替换。
     */
    public static class Streaks {
        private final int unprofitable;
        private final int belowFloor;
        private final int errors;

        public Streaks(int unprofitable, int belowFloor, int errors) {
            this.unprofitable = unprofitable;
            this.belowFloor = belowFloor;
            this.errors = errors;
        }

        public static Streaks zero() {
            return new Streaks(0, 0, 0);
        }

        public int getUnprofitable() {
            return unprofitable;
        }

        public int getBelowFloor() {
            return belowFloor;
        }

        public int getErrors() {
            return errors;
        }
    }

    private final PhaseConfig config;
    private final Streaks streaks;
    private final boolean awaitingOperator;
    private final boolean targetReached;
    private final String reason;

    public PhaseDecision(PhaseConfig config, Streaks streaks, boolean awaitingOperator, boolean targetReached,
                         String reason) {
        this.config = config;
        this.streaks = streaks;
        this.awaitingOperator = awaitingOperator;
        this.targetReached = targetReached;
        this.reason = reason;
    }

    public boolean isTerminated() {
        return config.getPhase() == Phase.TERMINATED;
    }

    public PhaseConfig getConfig() {
        return config;
    }

    public Streaks getStreaks() {
        return streaks;
    }

    /**
     * pump 预算耗尽：不自动进入 mining，等待外部切换。
     */
    public boolean isAwaitingOperator() {
        return awaitingOperator;
    }

    /**
     * pump 阶段 SMMA 已达到目标上限。
     */
    public boolean isTargetReached() {
        return targetReached;
    }

    public String getReason() {
        return reason;
    }
}
