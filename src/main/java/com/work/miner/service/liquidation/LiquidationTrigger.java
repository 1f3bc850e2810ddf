package com.work.miner.service.liquidation;

import com.work.miner.domain.SaleEvent;
import com.work.miner.exception.SlippageExceededException;
import com.work.miner.exception.TransportException;
import com.work.miner.swap.SwapConnector;
import com.work.miner.support.metrics.MinerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

import static com.work.miner.support.ValidationUtils.requireNonNegative;
import static com.work.miner.support.ValidationUtils.requireNonNull;

/**
 * 按阈值出售已铸造但未售出的余额。
 *
 * 余额 >= threshold 时出售 threshold 的最大整数倍，不足阈值的部分留待下次；
 * 滑点超限或传输失败时不出售，余额原样保留。
 */
public class LiquidationTrigger {

    private static final Logger log = LoggerFactory.getLogger(LiquidationTrigger.class);

    private final SwapConnector swap;
    private final SaleEventLog saleLog;
    private final BigInteger threshold;
    private final double slippageTolerance;
    private final Duration deadline;
    private final Clock clock;
    private final MinerMetrics metrics;

    private BigInteger unsold = BigInteger.ZERO;

    public LiquidationTrigger(SwapConnector swap, SaleEventLog saleLog, BigInteger threshold,
                              double slippageTolerance, Duration deadline, Clock clock, MinerMetrics metrics) {
        this.swap = requireNonNull(swap, "swap");
        this.saleLog = requireNonNull(saleLog, "saleLog");
        if (threshold == null || threshold.signum() <= 0) {
            throw new IllegalArgumentException("threshold 必须大于0");
        }
        if (slippageTolerance < 0 || slippageTolerance >= 1) {
            throw new IllegalArgumentException("slippageTolerance 必须在 [0, 1) 之间");
        }
        this.threshold = threshold;
        this.slippageTolerance = slippageTolerance;
        this.deadline = deadline;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * 累加新铸造的数量后检查阈值。
     */
    public synchronized SaleEvent onMinted(BigInteger minted) {
        requireNonNegative(minted, "minted");
        unsold = unsold.add(minted);
        return check();
    }

    /**
     * 余额达到阈值时尝试出售；未出售时返回 null。
     */
    public synchronized SaleEvent check() {
        if (unsold.compareTo(threshold) < 0) {
            return null;
        }
        BigInteger amount = unsold.divide(threshold).multiply(threshold);
        try {
            BigInteger proceeds = swap.swap(amount, slippageTolerance, deadline);
            unsold = unsold.subtract(amount);
            SaleEvent e = saleLog.append(amount, proceeds, slippageTolerance, unsold, clock.instant());
            metrics.sale("sold");
            log.info("sold amount={} proceeds={} price={} retained={}", amount, proceeds, e.getRealizedPrice(), unsold);
            return e;
        } catch (SlippageExceededException e) {
            metrics.sale("slippage");
            log.warn("sale skipped amount={} err={}", amount, e.toString());
            return null;
        } catch (TransportException e) {
            metrics.sale("transport");
            log.warn("sale failed amount={} err={}", amount, e.toString());
            return null;
        }
    }

    public synchronized BigInteger getUnsold() {
        return unsold;
    }

    public BigInteger getThreshold() {
        return threshold;
    }

    public SaleEventLog getSaleLog() {
        return saleLog;
    }
}
