package com.work.miner.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.Instant;

/**
 * 一次成功的出售。只追加，不修改。
 */
public class SaleEvent {
    private final long sequence;
    private final BigInteger amount;
    private final BigInteger proceeds;
    private final BigDecimal realizedPrice;
    private final double slippageTolerance;
    private final BigInteger retainedBalance;
    private final Instant soldAt;

    public SaleEvent(long sequence, BigInteger amount, BigInteger proceeds, double slippageTolerance,
                     BigInteger retainedBalance, Instant soldAt) {
        this.sequence = sequence;
        this.amount = amount;
        this.proceeds = proceeds;
        this.realizedPrice = amount.signum() == 0 ? BigDecimal.ZERO
                : new BigDecimal(proceeds).divide(new BigDecimal(amount), MathContext.DECIMAL64);
        this.slippageTolerance = slippageTolerance;
        this.retainedBalance = retainedBalance;
        this.soldAt = soldAt;
    }

    public long getSequence() {
        return sequence;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public BigInteger getProceeds() {
        return proceeds;
    }

    /**
     * 每单位 token 换得的 wei。
     */
    public BigDecimal getRealizedPrice() {
        return realizedPrice;
    }

    public double getSlippageTolerance() {
        return slippageTolerance;
    }

    public BigInteger getRetainedBalance() {
        return retainedBalance;
    }

    public Instant getSoldAt() {
        return soldAt;
    }
}
