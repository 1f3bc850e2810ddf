package com.work.miner.service.phase;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 估算器状态报告。
 */
public class EstimatorReport {
    private BigInteger smma;
    private int period;
    private BigInteger lastResyncValue;
    private Instant lastResyncAt;
    private long observationsSinceResync;
    private boolean stale;
    private BigInteger emissionPerLiability;
    private BigInteger smmaTarget;
    /**
     * 以当前有效 gas 价格推进到 smmaTarget 还需的更新次数，无法到达时为 -1。
     */
    private long updatesToTarget;
    private double halfLifeRounds;
    /**
     * 以当前有效 gas 价格再执行一轮（2 × batch 次更新）后的预测 SMMA。
     */
    private BigInteger projectedSmma;

    public BigInteger getSmma() {
        return smma;
    }

    public void setSmma(BigInteger smma) {
        this.smma = smma;
    }

    public int getPeriod() {
        return period;
    }

    public void setPeriod(int period) {
        this.period = period;
    }

    public BigInteger getLastResyncValue() {
        return lastResyncValue;
    }

    public void setLastResyncValue(BigInteger lastResyncValue) {
        this.lastResyncValue = lastResyncValue;
    }

    public Instant getLastResyncAt() {
        return lastResyncAt;
    }

    public void setLastResyncAt(Instant lastResyncAt) {
        this.lastResyncAt = lastResyncAt;
    }

    public long getObservationsSinceResync() {
        return observationsSinceResync;
    }

    public void setObservationsSinceResync(long observationsSinceResync) {
        this.observationsSinceResync = observationsSinceResync;
    }

    public boolean isStale() {
        return stale;
    }

    public void setStale(boolean stale) {
        this.stale = stale;
    }

    public BigInteger getEmissionPerLiability() {
        return emissionPerLiability;
    }

    public void setEmissionPerLiability(BigInteger emissionPerLiability) {
        this.emissionPerLiability = emissionPerLiability;
    }

    public BigInteger getSmmaTarget() {
        return smmaTarget;
    }

    public void setSmmaTarget(BigInteger smmaTarget) {
        this.smmaTarget = smmaTarget;
    }

    public long getUpdatesToTarget() {
        return updatesToTarget;
    }

    public void setUpdatesToTarget(long updatesToTarget) {
        this.updatesToTarget = updatesToTarget;
    }

    public double getHalfLifeRounds() {
        return halfLifeRounds;
    }

    public void setHalfLifeRounds(double halfLifeRounds) {
        this.halfLifeRounds = halfLifeRounds;
    }

    public BigInteger getProjectedSmma() {
        return projectedSmma;
    }

    public void setProjectedSmma(BigInteger projectedSmma) {
        this.projectedSmma = projectedSmma;
    }
}
