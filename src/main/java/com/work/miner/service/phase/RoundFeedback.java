package com.work.miner.service.phase;

import com.work.miner.domain.Profitability;
import com.work.miner.domain.Round;
import com.work.miner.domain.RoundErrorKind;
import com.work.miner.domain.RoundStatus;

import java.math.BigInteger;

/**
 * 决策函数的输入：上一轮的结果、成本、收益评估与当前 SMMA 估计。不含任何网络句柄。
 */
public class RoundFeedback {
    private final RoundStatus status;
    private final RoundErrorKind errorKind;
    private final BigInteger gasCost;
    /**
     * 本轮没有可评估的链上活动时为 null。
     */
    private final Profitability profitability;
    private final BigInteger smma;
    private final long quota;

    public RoundFeedback(RoundStatus status, RoundErrorKind errorKind, BigInteger gasCost,
                         Profitability profitability, BigInteger smma, long quota) {
        this.status = status;
        this.errorKind = errorKind == null ? RoundErrorKind.NONE : errorKind;
        this.gasCost = gasCost == null ? BigInteger.ZERO : gasCost;
        this.profitability = profitability;
        this.smma = smma == null ? BigInteger.ZERO : smma;
        this.quota = quota;
    }

    public static RoundFeedback of(Round round, Profitability profitability, BigInteger smma, long quota) {
        return new RoundFeedback(round.getStatus(), round.getErrorKind(), round.getGasCost(), profitability, smma, quota);
    }

    public boolean isError() {
        return errorKind != RoundErrorKind.NONE;
    }

    public RoundStatus getStatus() {
        return status;
    }

    public RoundErrorKind getErrorKind() {
        return errorKind;
    }

    public BigInteger getGasCost() {
        return gasCost;
    }

    public Profitability getProfitability() {
        return profitability;
    }

    public BigInteger getSmma() {
        return smma;
    }

    public long getQuota() {
        return quota;
    }
}
