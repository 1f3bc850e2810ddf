package com.work.miner.domain;

import java.math.BigInteger;

/**
 * 阶段内的调度参数。不可变，阶段切换或反馈决策时整体替换。
 *
 * smmaTarget 在 PUMPING 下是上限目标，在 MINING 下是盈亏平衡的下限。
 */
public class PhaseConfig {
    private final Phase phase;
    private final RoundMode mode;
    private final BigInteger priorityFee;
    private final int batchSize;
    private final BigInteger remainingBudget;
    private final BigInteger smmaTarget;

    public PhaseConfig(Phase phase, RoundMode mode, BigInteger priorityFee, int batchSize,
                       BigInteger remainingBudget, BigInteger smmaTarget) {
        if (batchSize < 0) {
            throw new IllegalArgumentException("batchSize must be >= 0");
        }
        this.phase = phase;
        this.mode = mode;
        this.priorityFee = priorityFee == null ? BigInteger.ZERO : priorityFee;
        this.batchSize = batchSize;
        this.remainingBudget = remainingBudget == null ? BigInteger.ZERO : remainingBudget.max(BigInteger.ZERO);
        this.smmaTarget = smmaTarget == null ? BigInteger.ZERO : smmaTarget;
    }

    public static PhaseConfig idle() {
        return new PhaseConfig(Phase.IDLE, RoundMode.PIPELINE, BigInteger.ZERO, 0, BigInteger.ZERO, BigInteger.ZERO);
    }

    public PhaseConfig withBatchSize(int newBatchSize) {
        return new PhaseConfig(phase, mode, priorityFee, newBatchSize, remainingBudget, smmaTarget);
    }

    public PhaseConfig withRemainingBudget(BigInteger budget) {
        return new PhaseConfig(phase, mode, priorityFee, batchSize, budget, smmaTarget);
    }

    public PhaseConfig withPhase(Phase newPhase) {
        return new PhaseConfig(newPhase, mode, priorityFee, batchSize, remainingBudget, smmaTarget);
    }

    public boolean isBudgetExhausted() {
        return remainingBudget.signum() <= 0;
    }

    public Phase getPhase() {
        return phase;
    }

    public RoundMode getMode() {
        return mode;
    }

    public BigInteger getPriorityFee() {
        return priorityFee;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public BigInteger getRemainingBudget() {
        return remainingBudget;
    }

    public BigInteger getSmmaTarget() {
        return smmaTarget;
    }

    @Override
    public String toString() {
        return "PhaseConfig{phase=" + phase + ", mode=" + mode + ", priorityFee=" + priorityFee
                + ", batchSize=" + batchSize + ", remainingBudget=" + remainingBudget
                + ", smmaTarget=" + smmaTarget + '}';
    }
}
