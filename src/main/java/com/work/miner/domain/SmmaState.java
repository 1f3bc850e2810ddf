package com.work.miner.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 本地 SMMA 副本的不可变快照（wei）。
 */
public class SmmaState {
    private final BigInteger value;
    private final int period;
    private final BigInteger lastResyncValue;
    private final Instant lastResyncAt;
    private final long observationsSinceResync;

    public SmmaState(BigInteger value, int period, BigInteger lastResyncValue, Instant lastResyncAt,
                     long observationsSinceResync) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("smma must be non-negative");
        }
        if (period < 2) {
            throw new IllegalArgumentException("smma period must be >= 2");
        }
        this.value = value;
        this.period = period;
        this.lastResyncValue = lastResyncValue;
        this.lastResyncAt = lastResyncAt;
        this.observationsSinceResync = observationsSinceResync;
    }

    public SmmaState observe(BigInteger effectiveGasPrice) {
        BigInteger p = BigInteger.valueOf(period);
        BigInteger next = value.multiply(p.subtract(BigInteger.ONE)).add(effectiveGasPrice).divide(p);
        return new SmmaState(next, period, lastResyncValue, lastResyncAt, observationsSinceResync + 1);
    }

    public SmmaState resynced(BigInteger authoritative, Instant at) {
        return new SmmaState(authoritative, period, authoritative, at, 0);
    }

    public BigInteger getValue() {
        return value;
    }

    public int getPeriod() {
        return period;
    }

    public BigInteger getLastResyncValue() {
        return lastResyncValue;
    }

    public Instant getLastResyncAt() {
        return lastResyncAt;
    }

    public long getObservationsSinceResync() {
        return observationsSinceResync;
    }

    public boolean isSynchronizedOnce() {
        return lastResyncAt != null;
    }
}
