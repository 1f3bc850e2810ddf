package com.work.miner.service.nonce;

import com.work.miner.chain.ChainConnector;
import com.work.miner.chain.TxReceipt;
import com.work.miner.domain.LeaseDecision;
import com.work.miner.exception.LeaseNotOwnedException;
import com.work.miner.exception.NonceConflictException;
import com.work.miner.exception.TransportException;
import com.work.miner.service.lease.AccountLeaseManager;
import com.work.miner.signer.SignedTransaction;
import com.work.miner.support.metrics.MinerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.work.miner.support.ValidationUtils.requireNonEmpty;
import static com.work.miner.support.ValidationUtils.requirePositive;

/**
 * 单账户 nonce 分配 + burst 广播 + 屏障等待。
 *
 * 约束：
 * - 只有 lease 持有者可以 reserve/submit（fencing token 校验）
 * - 每次 reserve 都与链上 pending nonce 比对，不一致即 poison，直到 resync
 * - 已发出的 nonce 不会被自动重发；失败的交易由调度方以新 nonce 重新签名
 */
public class NonceSequencer {

    private static final Logger log = LoggerFactory.getLogger(NonceSequencer.class);

    private final String account;
    private final ChainConnector chain;
    private final AccountLeaseManager leaseManager;
    private final ConfirmationWaiter waiter;
    private final MinerMetrics metrics;
    private final Clock clock;
    private final NonceLedger ledger;

    public NonceSequencer(String account, ChainConnector chain, AccountLeaseManager leaseManager,
                          ConfirmationWaiter waiter, MinerMetrics metrics, Clock clock) {
        this.account = requireNonEmpty(account, "account");
        this.chain = chain;
        this.leaseManager = leaseManager;
        this.waiter = waiter;
        this.metrics = metrics;
        this.clock = clock;
        this.ledger = new NonceLedger(account);
    }

    public String getAccount() {
        return account;
    }

    /**
     * 获取或续期账户租约；未成为 leader 时抛出 {@link LeaseNotOwnedException}。
     */
    public LeaseDecision acquire(String owner) {
        LeaseDecision lease = leaseManager.acquireOrRenew(account, owner);
        if (!lease.isLeader()) {
            throw new LeaseNotOwnedException("account " + account + " leased by " + lease.getOwner()
                    + " until " + lease.getExpiresAt());
        }
        return lease;
    }

    /**
     * 原子地分配 n 个连续 nonce。
     */
    public NonceReservation reserve(LeaseDecision lease, int n) {
        requirePositive(n, "n");
        leaseManager.verify(lease);
        synchronized (ledger) {
            if (ledger.isPoisoned()) {
                metrics.nonceReserve("poisoned");
                throw new NonceConflictException("ledger poisoned: " + ledger.getPoisonReason());
            }
            long chainNext = chain.getPendingNonce(account);
            if (!ledger.isInitialized()) {
                ledger.resetTo(chainNext, clock.instant());
                log.info("nonce ledger initialized account={} next={} epoch={}", account, chainNext, ledger.getEpoch());
            } else if (chainNext != ledger.getNextNonce()) {
                String reason = "chain pending nonce " + chainNext + " != ledger " + ledger.getNextNonce();
                ledger.poison(reason);
                metrics.nonceReserve("conflict");
                log.warn("nonce conflict account={} {}", account, reason);
                throw new NonceConflictException(reason);
            }
            long first = ledger.issue(n);
            metrics.nonceReserve("ok");
            return new NonceReservation(account, ledger.getEpoch(), first, n);
        }
    }

    /**
     * 按 nonce 顺序连续广播（中间不等待），再做一次屏障等待。
     *
     * 结果与 txs 按下标一一对应。某笔广播失败后，其后的交易因 nonce 断档不再广播，一并标记为
     * TRANSPORT_FAILED，账本置为 poisoned 等待 resync。
     */
    public List<SubmitOutcome> submitBatch(LeaseDecision lease, List<SignedTransaction> txs) throws InterruptedException {
        leaseManager.verify(lease);
        if (txs == null || txs.isEmpty()) {
            return Collections.emptyList();
        }
        requireAscending(txs);

        List<String> sent = new ArrayList<>(txs.size());
        String failure = null;
        for (SignedTransaction tx : txs) {
            if (failure != null) {
                break;
            }
            try {
                chain.sendRawTransaction(tx.getRawTransaction());
                sent.add(tx.getTxHash());
                metrics.broadcast("sent");
            } catch (TransportException e) {
                failure = e.toString();
                metrics.broadcast("failed");
                log.warn("broadcast failed account={} nonce={} err={}", account, tx.getNonce(), failure);
                synchronized (ledger) {
                    ledger.poison("broadcast gap at nonce " + tx.getNonce());
                }
            }
        }

        Map<String, TxReceipt> receipts = sent.isEmpty()
                ? Collections.<String, TxReceipt>emptyMap()
                : waiter.awaitAll(sent);

        List<SubmitOutcome> outcomes = new ArrayList<>(txs.size());
        for (int i = 0; i < txs.size(); i++) {
            SignedTransaction tx = txs.get(i);
            if (i >= sent.size()) {
                outcomes.add(SubmitOutcome.transportFailed(tx.getNonce(), failure));
                continue;
            }
            TxReceipt r = receipts.get(tx.getTxHash());
            outcomes.add(r == null
                    ? SubmitOutcome.pending(tx.getNonce(), tx.getTxHash())
                    : SubmitOutcome.included(tx.getNonce(), tx.getTxHash(), r));
        }
        return outcomes;
    }

    /**
     * 以链上 pending nonce 开启新 epoch。幂等：链上状态不变时重复调用得到相同的 nextNonce。
     */
    public long resync(LeaseDecision lease) {
        leaseManager.verify(lease);
        synchronized (ledger) {
            long chainNext = chain.getPendingNonce(account);
            long previous = ledger.resetTo(chainNext, clock.instant());
            if (previous > chainNext) {
                log.warn("nonce resync account={} rewinds {} -> {}, nonces [{}, {}) will be reissued in epoch {}",
                        account, previous, chainNext, chainNext, previous, ledger.getEpoch());
            } else {
                log.info("nonce resync account={} next={} epoch={}", account, chainNext, ledger.getEpoch());
            }
            metrics.nonceReserve("resync");
            return chainNext;
        }
    }

    /**
     * 已 reserve 的 nonce 不会被使用（例如签名失败）：置为 poisoned，下一次 reserve 前必须 resync。
     */
    public void invalidate(String reason) {
        synchronized (ledger) {
            ledger.poison(reason);
        }
        log.warn("nonce ledger invalidated account={} reason={}", account, reason);
    }

    public boolean needsResync() {
        synchronized (ledger) {
            return ledger.isPoisoned();
        }
    }

    public long getEpoch() {
        synchronized (ledger) {
            return ledger.getEpoch();
        }
    }

    public long peekNextNonce() {
        synchronized (ledger) {
            return ledger.getNextNonce();
        }
    }

    private static void requireAscending(List<SignedTransaction> txs) {
        for (int i = 1; i < txs.size(); i++) {
            if (txs.get(i).getNonce() != txs.get(i - 1).getNonce() + 1) {
                throw new IllegalArgumentException("batch nonces must be consecutive, got "
                        + txs.get(i - 1).getNonce() + " then " + txs.get(i).getNonce());
            }
        }
    }
}
