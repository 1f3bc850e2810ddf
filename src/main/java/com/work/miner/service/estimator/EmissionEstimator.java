package com.work.miner.service.estimator;

import com.work.miner.chain.ChainConnector;
import com.work.miner.domain.Profitability;
import com.work.miner.domain.SmmaState;
import com.work.miner.support.metrics.MinerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.work.miner.support.ValidationUtils.requireNonNegative;
import static com.work.miner.support.ValidationUtils.requirePositive;

/**
 * 权威 SMMA 的本地副本，只用于决策，不参与记账。
 *
 * 其他参与者也在推进权威值，本地副本会漂移：超过 resyncMaxAge 或自上次 resync 以来观测次数达到
 * resyncMaxObservations 时视为陈旧，由调用方在下一次决策前 resync。
 */
public class EmissionEstimator {

    private static final Logger log = LoggerFactory.getLogger(EmissionEstimator.class);

    private static final BigInteger GWEI = BigInteger.valueOf(1_000_000_000L);

    private final ChainConnector chain;
    private final Duration resyncMaxAge;
    private final int resyncMaxObservations;
    private final double marginalBand;
    private final Clock clock;
    private final MinerMetrics metrics;

    private SmmaState state;

    public EmissionEstimator(ChainConnector chain, int period, Duration resyncMaxAge, int resyncMaxObservations,
                             double marginalBand, Clock clock, MinerMetrics metrics) {
        this.chain = chain;
        this.resyncMaxAge = requirePositive(resyncMaxAge, "resyncMaxAge");
        this.resyncMaxObservations = requirePositive(resyncMaxObservations, "resyncMaxObservations");
        this.marginalBand = marginalBand;
        this.clock = clock;
        this.metrics = metrics;
        this.state = new SmmaState(BigInteger.ZERO, period, null, null, 0);
    }

    /**
     * 本账户一次成功的 create/finalize：smma' = (smma×(P-1) + price) / P。
     */
    public synchronized SmmaState observe(BigInteger effectiveGasPrice) {
        requireNonNegative(effectiveGasPrice, "effectiveGasPrice");
        state = state.observe(effectiveGasPrice);
        return state;
    }

    public synchronized SmmaState observeAll(List<BigInteger> prices) {
        for (BigInteger p : prices) {
            observe(p);
        }
        return state;
    }

    /**
     * 以链上权威值覆盖本地副本。链上无新活动时重复调用结果不变。
     */
    public synchronized SmmaState resync() {
        BigInteger authoritative = chain.getAuthoritativeSmma();
        BigInteger drift = authoritative.subtract(state.getValue());
        state = state.resynced(authoritative, clock.instant());
        metrics.estimatorResync(drift.longValue());
        if (drift.signum() != 0) {
            log.info("smma resync value={} drift={}", authoritative, drift);
        }
        return state;
    }

    public synchronized boolean isStale() {
        if (!state.isSynchronizedOnce()) {
            return true;
        }
        if (state.getObservationsSinceResync() >= resyncMaxObservations) {
            return true;
        }
        Instant deadline = state.getLastResyncAt().plus(resyncMaxAge);
        return !clock.instant().isBefore(deadline);
    }

    public synchronized SmmaState state() {
        return state;
    }

    /**
     * 从当前值以 target 价格再更新 updates 次后的预测值（wei）。
     */
    public synchronized BigInteger project(BigInteger target, long updates) {
        double predicted = SmmaMath.predict(state.getValue().doubleValue(), target.doubleValue(), updates,
                state.getPeriod());
        return BigDecimal.valueOf(predicted).setScale(0, RoundingMode.HALF_UP).toBigInteger();
    }

    /**
     * wnFromGas：emission = gasUsed × smma × 1e9 / auctionFinalPrice（wn）。
     */
    public BigInteger estimateEmission(long gasUsed, BigInteger smma, BigInteger auctionFinalPrice) {
        if (auctionFinalPrice == null || auctionFinalPrice.signum() <= 0) {
            throw new IllegalArgumentException("auctionFinalPrice 必须大于0");
        }
        return BigInteger.valueOf(gasUsed).multiply(smma).multiply(GWEI).divide(auctionFinalPrice);
    }

    /**
     * margin = (emission × marketPrice - gasCost) / gasCost；marketPrice 为每 wn 可换得的 wei。
     */
    public Profitability estimateProfitability(BigInteger emission, BigDecimal marketPrice, BigInteger gasCost) {
        BigDecimal value = new BigDecimal(emission).multiply(marketPrice);
        if (gasCost == null || gasCost.signum() == 0) {
            return value.signum() > 0 ? Profitability.profitable(Double.POSITIVE_INFINITY) : Profitability.marginal(0.0);
        }
        BigDecimal cost = new BigDecimal(gasCost);
        double margin = value.subtract(cost).divide(cost, MathContext.DECIMAL64).doubleValue();
        if (margin > marginalBand) {
            return Profitability.profitable(margin);
        }
        if (margin >= 0) {
            return Profitability.marginal(margin);
        }
        return Profitability.unprofitable(margin);
    }
}
