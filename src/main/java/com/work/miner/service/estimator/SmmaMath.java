package com.work.miner.service.estimator;

/**
 * SMMA 的闭式近似：连续 n 次以固定价格 target 更新后，
 * smma_n = target + (smma_0 - target) × ((P-1)/P)^n。
 */
public final class SmmaMath {

    private SmmaMath() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static double predict(double smma0, double target, long updates, int period) {
        double keep = Math.pow((period - 1) / (double) period, updates);
        return target + (smma0 - target) * keep;
    }

    /**
     * 每轮 updatesPerRound 次更新时，偏差减半所需的轮数，约为 ln(2)×P/N。
     */
    public static double halfLifeRounds(int period, int updatesPerRound) {
        return Math.log(2) * period / updatesPerRound;
    }

    /**
     * 从 smma0 以 target 价格推进到 goal 所需的更新次数；goal 不在 smma0 与 target 之间时返回 -1。
     */
    public static long updatesToReach(double smma0, double target, double goal, int period) {
        double remaining = (goal - target) / (smma0 - target);
        if (remaining <= 0 || remaining > 1) {
            return -1L;
        }
        double n = Math.log(remaining) / Math.log((period - 1) / (double) period);
        return (long) Math.ceil(n);
    }
}
