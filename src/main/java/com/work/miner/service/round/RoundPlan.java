package com.work.miner.service.round;

import com.work.miner.domain.RoundMode;

import java.math.BigInteger;

/**
 * 一轮的调度参数。drain=true 时只 finalize 已创建的 liability，不再 create。
 */
public class RoundPlan {
    private final RoundMode mode;
    private final int batchSize;
    private final BigInteger priorityFee;
    private final boolean drain;

    private RoundPlan(RoundMode mode, int batchSize, BigInteger priorityFee, boolean drain) {
        if (mode == null) {
            throw new IllegalArgumentException("mode 不能为null");
        }
        if (batchSize < 0) {
            throw new IllegalArgumentException("batchSize 不能为负数");
        }
        this.mode = mode;
        this.batchSize = batchSize;
        this.priorityFee = priorityFee == null ? BigInteger.ZERO : priorityFee;
        this.drain = drain;
    }

    public static RoundPlan of(RoundMode mode, int batchSize, BigInteger priorityFee) {
        return new RoundPlan(mode, batchSize, priorityFee, false);
    }

    public static RoundPlan drain(RoundMode mode, int batchSize, BigInteger priorityFee) {
        return new RoundPlan(mode, batchSize, priorityFee, true);
    }

    public RoundMode getMode() {
        return mode;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public BigInteger getPriorityFee() {
        return priorityFee;
    }

    public boolean isDrain() {
        return drain;
    }

    /**
     * 本轮在 quota 内需要的操作数；drain 只有 finalize 半轮。
     */
    public long requiredOps() {
        return drain ? batchSize : mode.requiredOps(batchSize);
    }

    @Override
    public String toString() {
        return "RoundPlan{" + mode + " B=" + batchSize + " prio=" + priorityFee + (drain ? " drain" : "") + '}';
    }
}
