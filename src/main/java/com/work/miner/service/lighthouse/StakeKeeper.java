package com.work.miner.service.lighthouse;

import com.work.miner.chain.ChainConnector;
import com.work.miner.domain.LeaseDecision;
import com.work.miner.exception.LeaseNotOwnedException;
import com.work.miner.exception.NonceConflictException;
import com.work.miner.exception.SignatureInvalidException;
import com.work.miner.exception.TransportException;
import com.work.miner.exception.TransportTimeoutException;
import com.work.miner.service.nonce.NonceReservation;
import com.work.miner.service.nonce.NonceSequencer;
import com.work.miner.service.nonce.SubmitOutcome;
import com.work.miner.signer.LiabilitySigner;
import com.work.miner.signer.SignedTransaction;
import com.work.miner.signer.TxFees;
import com.work.miner.support.metrics.MinerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.work.miner.support.ValidationUtils.requireAddress;
import static com.work.miner.support.ValidationUtils.requireNonEmpty;

/**
 * 质押补足：一轮需要 ops 笔交易时，保证本账户在 lighthouse 上的质押不少于 ops × minimalStake。
 *
 * 补足量以 token 余额为上限；allowance 不足时先 approve(lighthouse)，再 refill。
 * 交易与 liability 交易共用账户，nonce 经 {@link NonceSequencer} 分配。
 */
public class StakeKeeper {

    private static final Logger log = LoggerFactory.getLogger(StakeKeeper.class);

    private final ChainConnector chain;
    private final LiabilitySigner signer;
    private final NonceSequencer sequencer;
    private final QuotaTracker tracker;
    private final String ownerId;
    private final String lighthouse;
    private final MinerMetrics metrics;

    public StakeKeeper(ChainConnector chain, LiabilitySigner signer, NonceSequencer sequencer, QuotaTracker tracker,
                       String ownerId, String lighthouse, MinerMetrics metrics) {
        this.chain = chain;
        this.signer = signer;
        this.sequencer = sequencer;
        this.tracker = tracker;
        this.ownerId = requireNonEmpty(ownerId, "ownerId");
        this.lighthouse = requireAddress(lighthouse, "lighthouse");
        this.metrics = metrics;
    }

    /**
     * 返回本次转入的质押量；质押已足够、余额为 0 或 refill 被 revert 时返回 0。
     * 广播失败、未确认或 nonce 账本不可用时抛出 {@link TransportException}。
     */
    public BigInteger ensureStake(long ops, BigInteger priorityFee) {
        BigInteger needed = tracker.requiredStake(ops);
        BigInteger stake = tracker.snapshot().getProviderStake();
        if (stake.compareTo(needed) >= 0) {
            return BigInteger.ZERO;
        }
        String account = signer.getAccount();
        BigInteger extra = needed.subtract(stake);
        BigInteger balance = chain.getTokenBalance(account);
        if (balance.signum() == 0) {
            log.warn("stake {} below required {} for {} ops, no token balance to top up", stake, needed, ops);
            metrics.stakeTopUp("no_balance");
            return BigInteger.ZERO;
        }
        if (balance.compareTo(extra) < 0) {
            log.warn("stake top-up capped by balance: wanted={} balance={}", extra, balance);
            extra = balance;
        }
        boolean needsApprove = chain.getAllowance(account, lighthouse).compareTo(extra) < 0;
        TxFees fees = TxFees.of(chain.getGasPrice(), priorityFee);

        List<SubmitOutcome> outcomes;
        try {
            LeaseDecision lease = sequencer.acquire(ownerId);
            NonceReservation reservation = sequencer.reserve(lease, needsApprove ? 2 : 1);
            List<SignedTransaction> txs = new ArrayList<>(2);
            try {
                int i = 0;
                if (needsApprove) {
                    txs.add(signer.signApprove(reservation.nonceAt(i++), lighthouse, extra, fees));
                }
                txs.add(signer.signRefill(reservation.nonceAt(i), extra, fees));
            } catch (SignatureInvalidException e) {
                sequencer.invalidate("stake signing failed after reserving " + reservation);
                throw e;
            }
            log.info("stake top-up stake={} needed={} extra={} approve={}", stake, needed, extra, needsApprove);
            outcomes = sequencer.submitBatch(lease, txs);
        } catch (LeaseNotOwnedException | NonceConflictException e) {
            throw new TransportException("nonce ledger unavailable for stake top-up: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("stake top-up interrupted", e);
        }

        SubmitOutcome last = outcomes.get(outcomes.size() - 1);
        switch (last.getStatus()) {
            case INCLUDED:
                if (!last.getReceipt().isSuccess()) {
                    log.warn("refill reverted tx={} amount={}", last.getTxHash(), extra);
                    metrics.stakeTopUp("reverted");
                    return BigInteger.ZERO;
                }
                log.info("stake refilled amount={} tx={} block={}", extra, last.getTxHash(),
                        last.getReceipt().getBlockNumber());
                metrics.stakeTopUp("refilled");
                return extra;
            case PENDING:
                metrics.stakeTopUp("pending");
                throw new TransportTimeoutException("refill tx " + last.getTxHash() + " still pending");
            case TRANSPORT_FAILED:
            default:
                metrics.stakeTopUp("failed");
                throw new TransportException("refill broadcast failed: " + last.getError());
        }
    }
}
