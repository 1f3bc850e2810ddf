package com.work.miner.service.nonce;

import com.work.miner.chain.ChainConnector;
import com.work.miner.chain.TxReceipt;
import com.work.miner.exception.TransportException;
import com.work.miner.support.Sleeper;
import com.work.miner.support.metrics.MinerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static com.work.miner.support.ValidationUtils.requirePositive;

/**
 * 屏障等待：对一批已广播交易做有界轮询，直到全部出现 receipt 或超时。
 *
 * NotFound 不算错误；RPC 错误按指数退避，退避时间同样计入总超时。
 */
public class ConfirmationWaiter {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationWaiter.class);

    private static final long MAX_BACKOFF_MS = 30_000L;

    private final ChainConnector chain;
    private final Duration timeout;
    private final Duration pollInterval;
    private final Sleeper sleeper;
    private final MinerMetrics metrics;

    public ConfirmationWaiter(ChainConnector chain, Duration timeout, Duration pollInterval, Sleeper sleeper,
                              MinerMetrics metrics) {
        this.chain = chain;
        this.timeout = requirePositive(timeout, "timeout");
        this.pollInterval = requirePositive(pollInterval, "pollInterval");
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * 返回已找到 receipt 的 txHash -> receipt；超时仍未找到的不在结果中。
     */
    public Map<String, TxReceipt> awaitAll(Collection<String> txHashes) throws InterruptedException {
        Map<String, TxReceipt> found = new LinkedHashMap<>();
        Set<String> unresolved = new LinkedHashSet<>(txHashes);
        long waitedMs = 0L;
        int errorAttempt = 0;

        while (true) {
            boolean rpcError = false;
            for (String txHash : unresolved.toArray(new String[0])) {
                try {
                    TxReceipt r = chain.getTransactionReceipt(txHash);
                    if (r != null) {
                        found.put(txHash, r);
                        unresolved.remove(txHash);
                        metrics.confirmation("found");
                    }
                } catch (TransportException e) {
                    rpcError = true;
                    metrics.confirmation("error");
                    log.warn("getReceipt error txHash={} err={}", txHash, e.toString());
                    break;
                }
            }
            if (unresolved.isEmpty()) {
                return found;
            }

            long delay;
            if (rpcError) {
                errorAttempt++;
                delay = backoff(errorAttempt);
            } else {
                errorAttempt = 0;
                delay = pollInterval.toMillis();
            }
            if (waitedMs >= timeout.toMillis()) {
                break;
            }
            delay = Math.min(delay, timeout.toMillis() - waitedMs);
            sleeper.sleep(Duration.ofMillis(delay));
            waitedMs += delay;
        }

        metrics.confirmation("timeout");
        log.info("barrier timed out after {}ms found={} pending={}", waitedMs, found.size(), unresolved.size());
        return found;
    }

    /**
     * 单次查询，不等待。用于下一轮开始时对账遗留交易。
     */
    public TxReceipt checkOnce(String txHash) {
        return chain.getTransactionReceipt(txHash);
    }

    private long backoff(int attempt) {
        long base = Math.max(1L, pollInterval.toMillis());
        long pow = 1L << Math.min(10, Math.max(0, attempt - 1));
        return Math.min(MAX_BACKOFF_MS, base * pow);
    }
}
