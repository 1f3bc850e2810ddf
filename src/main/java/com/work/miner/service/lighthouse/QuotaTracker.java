package com.work.miner.service.lighthouse;

import com.work.miner.chain.ChainConnector;
import com.work.miner.chain.LighthouseState;
import com.work.miner.domain.ClaimResult;
import com.work.miner.domain.MarkerState;
import com.work.miner.exception.QuotaExceededException;
import com.work.miner.support.Sleeper;
import com.work.miner.support.metrics.MinerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;

import static com.work.miner.support.ValidationUtils.requireNonEmpty;
import static com.work.miner.support.ValidationUtils.requirePositive;

/**
 * lighthouse 轮次状态机：NOT_OWNER / ACTIVE / WAITING_TIMEOUT。
 *
 * lighthouse 状态由外部参与者修改，每次 claim/quota 查询都重新读取，不跨挂起点缓存。
 * 等待接管是显式的状态迁移：claim 返回 retryAtBlock，调用方通过 {@link #awaitReclaim()} 一次性等待到该区块再 claim。
 */
public class QuotaTracker {

    private static final Logger log = LoggerFactory.getLogger(QuotaTracker.class);

    private final ChainConnector chain;
    private final String lighthouse;
    private final String provider;
    private final Duration blockTime;
    private final Sleeper sleeper;
    private final MinerMetrics metrics;

    private MarkerState state = MarkerState.NOT_OWNER;
    private long retryAtBlock = -1L;

    public QuotaTracker(ChainConnector chain, String lighthouse, String provider, Duration blockTime,
                        Sleeper sleeper, MinerMetrics metrics) {
        this.chain = chain;
        this.lighthouse = requireNonEmpty(lighthouse, "lighthouse");
        this.provider = requireNonEmpty(provider, "provider");
        this.blockTime = requirePositive(blockTime, "blockTime");
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * marker 未被持有、由本账户持有，或上一持有者已超时，则进入 ACTIVE；
     * 否则进入 WAITING_TIMEOUT，并给出可以重新 claim 的区块。
     */
    public synchronized ClaimResult claim() {
        long latest = chain.getLatestBlockNumber();
        if (state == MarkerState.WAITING_TIMEOUT && latest < retryAtBlock) {
            metrics.markerClaim("retry_later");
            return ClaimResult.retryLater(retryAtBlock, "waiting until block " + retryAtBlock);
        }

        LighthouseState ls = chain.getLighthouseState(lighthouse, provider);
        if (!ls.isProvider()) {
            state = MarkerState.NOT_OWNER;
            retryAtBlock = -1L;
            metrics.markerClaim("not_provider");
            return ClaimResult.notOwner("account " + provider + " has no stake in lighthouse " + lighthouse);
        }

        if (ls.getMarker() == 0 || ls.isMarkerHeldBy(ls.getProviderIndex()) || latest >= ls.getTakeoverBlock()) {
            state = MarkerState.ACTIVE;
            retryAtBlock = -1L;
            metrics.markerClaim("active");
            return ClaimResult.active();
        }

        state = MarkerState.WAITING_TIMEOUT;
        retryAtBlock = ls.getTakeoverBlock();
        metrics.markerClaim("waiting");
        log.info("marker held by provider {} (we are {}), retry at block {} (latest {})",
                ls.getMarker(), ls.getProviderIndex(), retryAtBlock, latest);
        return ClaimResult.retryLater(retryAtBlock, "marker held by provider " + ls.getMarker());
    }

    /**
     * 按区块时间一次性挂起到 retryAtBlock，然后重新 claim。非 WAITING_TIMEOUT 状态下直接 claim。
     */
    public ClaimResult awaitReclaim() throws InterruptedException {
        long target;
        synchronized (this) {
            target = retryAtBlock;
        }
        if (target > 0) {
            long latest = chain.getLatestBlockNumber();
            long blocks = target - latest;
            if (blocks > 0) {
                Duration wait = blockTime.multipliedBy(blocks);
                log.info("awaiting marker timeout: {} blocks (~{})", blocks, wait);
                sleeper.sleep(wait);
            }
        }
        return claim();
    }

    /**
     * 当前 quota，总是重新读取。
     */
    public long currentQuota() {
        return chain.getLighthouseState(lighthouse, provider).getQuota();
    }

    /**
     * 本轮所需操作数超过 quota 时抛出 {@link QuotaExceededException}，返回读取到的 quota。
     */
    public long requireCapacity(long requiredOps) {
        long quota = currentQuota();
        if (requiredOps > quota) {
            throw new QuotaExceededException("round needs " + requiredOps + " ops but quota is " + quota);
        }
        return quota;
    }

    /**
     * 提交 ops 笔交易所需的质押 = ops × minimalStake。
     */
    public BigInteger requiredStake(long ops) {
        LighthouseState ls = chain.getLighthouseState(lighthouse, provider);
        return ls.getStakeMinimum().multiply(BigInteger.valueOf(ops));
    }

    public LighthouseState snapshot() {
        return chain.getLighthouseState(lighthouse, provider);
    }

    public synchronized MarkerState getState() {
        return state;
    }

    public synchronized long getRetryAtBlock() {
        return retryAtBlock;
    }
}
