package com.work.miner.service.round;

import com.work.miner.chain.ChainConnector;
import com.work.miner.chain.TxReceipt;
import com.work.miner.domain.ClaimResult;
import com.work.miner.domain.LeaseDecision;
import com.work.miner.domain.Liability;
import com.work.miner.domain.LiabilityState;
import com.work.miner.domain.MarkerState;
import com.work.miner.domain.Round;
import com.work.miner.domain.RoundErrorKind;
import com.work.miner.domain.RoundMode;
import com.work.miner.domain.RoundStatus;
import com.work.miner.exception.LeaseNotOwnedException;
import com.work.miner.exception.MarkerNotOwnedException;
import com.work.miner.exception.NonceConflictException;
import com.work.miner.exception.QuotaExceededException;
import com.work.miner.exception.SignatureInvalidException;
import com.work.miner.exception.TransportException;
import com.work.miner.service.lighthouse.QuotaTracker;
import com.work.miner.service.nonce.NonceReservation;
import com.work.miner.service.nonce.NonceSequencer;
import com.work.miner.service.nonce.SubmitOutcome;
import com.work.miner.signer.DemandFields;
import com.work.miner.signer.LiabilitySigner;
import com.work.miner.signer.LiabilityTerms;
import com.work.miner.signer.OfferFields;
import com.work.miner.signer.ResultFields;
import com.work.miner.signer.SignedPayload;
import com.work.miner.signer.SignedTransaction;
import com.work.miner.signer.TxFees;
import com.work.miner.support.metrics.MinerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.work.miner.support.ValidationUtils.requireAddress;
import static com.work.miner.support.ValidationUtils.requireNonEmpty;

/**
 * 轮次调度：SEQUENTIAL / BATCH / PIPELINE 三种模式，构建在 NonceSequencer 与 QuotaTracker 之上。
 *
 * 单 liability 失败只影响该 liability；轮次级失败（多数超时、nonce 冲突、marker 丢失）中止本轮，
 * 未决的 liability 跨轮保持在途，直到找到 receipt 或其 nonce 被其他交易消耗后才以新 nonce 重发。
 * 取消只在 create 广播与 finalize 广播之间的边界生效。
 */
public class RoundScheduler {

    private static final Logger log = LoggerFactory.getLogger(RoundScheduler.class);

    /**
     * model/objective/result 使用 34 字节（multihash 长度）的随机内容。
     */
    private static final int PAYLOAD_BYTES = 34;

    private final ChainConnector chain;
    private final LiabilitySigner signer;
    private final NonceSequencer sequencer;
    private final QuotaTracker tracker;
    private final RoundHistory history;
    private final MinerMetrics metrics;
    private final Clock clock;
    private final String ownerId;
    private final Settings settings;
    private final SecureRandom random = new SecureRandom();

    /**
     * 跨轮次保留的未终结 liability（PENDING 或 CREATED）。
     */
    private final List<Liability> open = new ArrayList<>();

    private int roundCounter;
    private long liabilityCounter;
    private volatile boolean cancelRequested;

    /**
     * 构造 demand/offer 所需的静态参数。
     */
    public static class Settings {
        private final String lighthouse;
        private final String validator;
        private final String token;
        private final long deadlineBlocks;

        public Settings(String lighthouse, String validator, String token, long deadlineBlocks) {
            this.lighthouse = requireAddress(lighthouse, "lighthouse");
            this.validator = requireAddress(validator, "validator");
            this.token = requireAddress(token, "token");
            this.deadlineBlocks = deadlineBlocks;
        }
    }

    public RoundScheduler(ChainConnector chain, LiabilitySigner signer, NonceSequencer sequencer,
                          QuotaTracker tracker, RoundHistory history, MinerMetrics metrics, Clock clock,
                          String ownerId, Settings settings) {
        this.chain = chain;
        this.signer = signer;
        this.sequencer = sequencer;
        this.tracker = tracker;
        this.history = history;
        this.metrics = metrics;
        this.clock = clock;
        this.ownerId = requireNonEmpty(ownerId, "ownerId");
        this.settings = settings;
    }

    /**
     * 请求在下一个广播边界取消当前轮次。已发出 finalize 半轮的 pipeline burst 不受影响。
     */
    public void requestCancel() {
        this.cancelRequested = true;
    }

    /**
     * 不做任何网络写入，直接以 REJECTED 关闭一轮（例如成本上限导致 batch 为 0）。
     */
    public synchronized Round reject(RoundPlan plan, RoundErrorKind kind, String reason) {
        Round round = new Round(++roundCounter, plan.getMode(), plan.getBatchSize(), clock.instant());
        return finish(round, RoundStatus.REJECTED, kind, reason);
    }

    public synchronized Round runRound(RoundPlan plan) {
        Round round = new Round(++roundCounter, plan.getMode(), plan.getBatchSize(), clock.instant());
        cancelRequested = false;
        log.info("round {} start {} open={}", round.getIndex(), plan, open.size());
        try {
            // quota 检查在任何网络写入之前
            try {
                tracker.requireCapacity(plan.requiredOps());
            } catch (QuotaExceededException e) {
                return finish(round, RoundStatus.REJECTED, RoundErrorKind.QUOTA_EXCEEDED, e.getMessage());
            }

            LeaseDecision lease = sequencer.acquire(ownerId);
            reconcile(round);
            requireMarker();

            switch (plan.getMode()) {
                case PIPELINE:
                    return runPipeline(round, plan, lease);
                case BATCH:
                    return runBatch(round, plan, lease);
                case SEQUENTIAL:
                default:
                    return runSequential(round, plan, lease);
            }
        } catch (LeaseNotOwnedException e) {
            return finish(round, RoundStatus.ABORTED, RoundErrorKind.LEASE_NOT_OWNED, e.getMessage());
        } catch (MarkerNotOwnedException e) {
            return finish(round, RoundStatus.ABORTED, RoundErrorKind.MARKER_NOT_OWNED, e.getMessage());
        } catch (NonceConflictException e) {
            return finish(round, RoundStatus.ABORTED, RoundErrorKind.NONCE_CONFLICT, e.getMessage());
        } catch (QuotaExceededException e) {
            // finalize 半轮前重新读取 quota 时下降
            return finish(round, RoundStatus.ABORTED, RoundErrorKind.QUOTA_EXCEEDED, e.getMessage());
        } catch (SigningAbort e) {
            return finish(round, RoundStatus.ABORTED, RoundErrorKind.SIGNING_FAILED, e.getMessage());
        } catch (TransportException e) {
            log.warn("round {} transport error err={}", round.getIndex(), e.toString());
            return finish(round, RoundStatus.ABORTED, RoundErrorKind.TRANSPORT_FAILED, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(round, RoundStatus.CANCELLED, RoundErrorKind.NONE, "interrupted");
        } finally {
            retainOpen();
        }
    }

    /**
     * 只 finalize 的收尾轮次，直到没有可推进的 liability 或某轮失败。
     * 在途的 create 也计入：对账找到 receipt 后同一轮即可 finalize。
     */
    public List<Round> drain(RoundMode mode, int batchSize, BigInteger priorityFee) {
        List<Round> rounds = new ArrayList<>();
        while (true) {
            int unfinished = countDrainable();
            if (unfinished == 0) {
                return rounds;
            }
            int b = batchSize > 0 ? Math.min(batchSize, unfinished) : unfinished;
            Round r = runRound(RoundPlan.drain(mode, b, priorityFee));
            rounds.add(r);
            if (r.getStatus() != RoundStatus.COMPLETED || r.getFinalizedCount() == 0) {
                return rounds;
            }
        }
    }

    /**
     * nonce 冲突或广播断档之后，以链上状态重建账本。
     */
    public synchronized long resyncNonces() {
        LeaseDecision lease = sequencer.acquire(ownerId);
        return sequencer.resync(lease);
    }

    public boolean needsNonceResync() {
        return sequencer.needsResync();
    }

    public synchronized List<Liability> openLiabilities() {
        return Collections.unmodifiableList(new ArrayList<>(open));
    }

    public String getAccount() {
        return signer.getAccount();
    }

    public RoundHistory getHistory() {
        return history;
    }

    // ---------------------------------------------------------------- modes

    private Round runPipeline(Round round, RoundPlan plan, LeaseDecision lease) throws InterruptedException {
        int b = plan.getBatchSize();
        List<Liability> finalizes = finalizable(b);
        List<Liability> creates = plan.isDrain() ? Collections.<Liability>emptyList() : prepareCreates(round, b);
        if (finalizes.isEmpty() && creates.isEmpty()) {
            return finish(round, RoundStatus.COMPLETED, RoundErrorKind.NONE, "nothing to submit");
        }
        if (cancelRequested) {
            return finish(round, RoundStatus.CANCELLED, RoundErrorKind.NONE, "cancelled before burst");
        }

        // finalize 的 nonce 在前，create 在后，一次 burst 广播
        BurstResult burst = burst(round, lease, finalizes, creates, plan);
        return closeAfterBurst(round, burst, finalizes.size() + creates.size());
    }

    private Round runBatch(Round round, RoundPlan plan, LeaseDecision lease) throws InterruptedException {
        int b = plan.getBatchSize();
        if (!plan.isDrain()) {
            if (cancelRequested) {
                return finish(round, RoundStatus.CANCELLED, RoundErrorKind.NONE, "cancelled before create burst");
            }
            List<Liability> creates = prepareCreates(round, b);
            if (!creates.isEmpty()) {
                BurstResult createBurst = burst(round, lease, Collections.<Liability>emptyList(), creates, plan);
                RoundErrorKind kind = createBurst.degradedKind();
                if (kind != RoundErrorKind.NONE) {
                    return finish(round, RoundStatus.DEGRADED, kind, createBurst.summary());
                }
            }
            if (cancelRequested) {
                return finish(round, RoundStatus.CANCELLED, RoundErrorKind.NONE, "cancelled after create burst");
            }
            // lighthouse 状态可能在等待期间变化
            requireMarker();
        }

        List<Liability> finalizes = finalizable(b);
        if (finalizes.isEmpty()) {
            return finish(round, RoundStatus.COMPLETED, RoundErrorKind.NONE, "no liability to finalize");
        }
        tracker.requireCapacity(finalizes.size());
        BurstResult finalizeBurst = burst(round, lease, finalizes, Collections.<Liability>emptyList(), plan);
        return closeAfterBurst(round, finalizeBurst, finalizes.size());
    }

    private Round runSequential(Round round, RoundPlan plan, LeaseDecision lease) throws InterruptedException {
        int b = plan.getBatchSize();
        // 先处理遗留的 CREATED
        for (Liability l : finalizable(b)) {
            if (cancelRequested) {
                return finish(round, RoundStatus.CANCELLED, RoundErrorKind.NONE, "cancelled");
            }
            BurstResult r = burst(round, lease, Collections.singletonList(l), Collections.<Liability>emptyList(), plan);
            if (r.degradedKind() != RoundErrorKind.NONE) {
                return finish(round, RoundStatus.DEGRADED, r.degradedKind(), r.summary());
            }
        }
        if (plan.isDrain()) {
            return finish(round, RoundStatus.COMPLETED, RoundErrorKind.NONE, null);
        }
        for (int i = 0; i < b; i++) {
            if (cancelRequested) {
                return finish(round, RoundStatus.CANCELLED, RoundErrorKind.NONE, "cancelled");
            }
            List<Liability> one = prepareCreates(round, 1);
            if (one.isEmpty()) {
                continue;
            }
            BurstResult c = burst(round, lease, Collections.<Liability>emptyList(), one, plan);
            if (c.degradedKind() != RoundErrorKind.NONE) {
                return finish(round, RoundStatus.DEGRADED, c.degradedKind(), c.summary());
            }
            Liability l = one.get(0);
            if (l.getState() != LiabilityState.CREATED) {
                continue;
            }
            if (cancelRequested) {
                return finish(round, RoundStatus.CANCELLED, RoundErrorKind.NONE, "cancelled after create");
            }
            BurstResult f = burst(round, lease, Collections.singletonList(l), Collections.<Liability>emptyList(), plan);
            if (f.degradedKind() != RoundErrorKind.NONE) {
                return finish(round, RoundStatus.DEGRADED, f.degradedKind(), f.summary());
            }
        }
        return finish(round, RoundStatus.COMPLETED, RoundErrorKind.NONE, null);
    }

    // ---------------------------------------------------------------- burst

    /**
     * reserve + 签名 + 广播 + 屏障，finalize 在前。
     */
    private BurstResult burst(Round round, LeaseDecision lease, List<Liability> finalizes, List<Liability> creates,
                              RoundPlan plan) throws InterruptedException {
        // 结果签名在 reserve 之前完成，失败只放弃该 liability
        List<Liability> readyFinalizes = new ArrayList<>();
        for (Liability l : finalizes) {
            if (attachResult(round, l)) {
                readyFinalizes.add(l);
            }
        }
        int n = readyFinalizes.size() + creates.size();
        if (n == 0) {
            return new BurstResult(0, 0, 0);
        }

        TxFees fees = TxFees.of(chain.getGasPrice(), plan.getPriorityFee());
        NonceReservation reservation = sequencer.reserve(lease, n);

        List<Liability> ordered = new ArrayList<>(readyFinalizes);
        ordered.addAll(creates);
        List<SignedTransaction> txs = new ArrayList<>(n);
        try {
            for (int i = 0; i < ordered.size(); i++) {
                Liability l = ordered.get(i);
                long nonce = reservation.nonceAt(i);
                SignedTransaction tx;
                if (i < readyFinalizes.size()) {
                    tx = signer.signFinalize(nonce, resultFields(l), l.getResultSignature(), fees);
                } else {
                    tx = signer.signCreate(nonce, l.getDemand(), l.getOffer(), fees);
                }
                txs.add(tx);
            }
        } catch (SignatureInvalidException e) {
            sequencer.invalidate("signing failed after reserving " + reservation);
            throw new SigningAbort("transaction signing failed: " + e.getMessage(), e);
        }

        for (int i = 0; i < ordered.size(); i++) {
            Liability l = ordered.get(i);
            SignedTransaction tx = txs.get(i);
            if (i < readyFinalizes.size()) {
                l.finalizeSent(tx.getTxHash(), tx.getNonce());
            } else {
                l.createSent(tx.getTxHash(), tx.getNonce());
            }
        }

        List<SubmitOutcome> outcomes = sequencer.submitBatch(lease, txs);
        round.recordBurst(n);

        int pending = 0;
        int failed = 0;
        for (int i = 0; i < outcomes.size(); i++) {
            SubmitOutcome o = outcomes.get(i);
            Liability l = ordered.get(i);
            switch (o.getStatus()) {
                case INCLUDED:
                    apply(round, l, o.getReceipt());
                    break;
                case PENDING:
                    pending++;
                    break;
                case TRANSPORT_FAILED:
                default:
                    // 节点拒绝了广播，交易未进入内存池
                    failed++;
                    l.clearUnresolvedTx();
                    break;
            }
        }
        log.info("round {} burst sent={} finalizes={} creates={} pending={} failed={}",
                round.getIndex(), n, readyFinalizes.size(), creates.size(), pending, failed);
        return new BurstResult(n, pending, failed);
    }

    private Round closeAfterBurst(Round round, BurstResult burst, int expected) {
        RoundErrorKind kind = burst.degradedKind();
        if (kind != RoundErrorKind.NONE) {
            return finish(round, RoundStatus.DEGRADED, kind, burst.summary());
        }
        String msg = burst.pending + burst.failed > 0 ? burst.summary() : null;
        if (burst.sent < expected) {
            msg = (msg == null ? "" : msg + "; ") + (expected - burst.sent) + " abandoned before broadcast";
        }
        return finish(round, RoundStatus.COMPLETED, RoundErrorKind.NONE, msg);
    }

    // ---------------------------------------------------------------- liabilities

    /**
     * 为本轮准备 count 个待 create 的 liability：先复用遗留的 PENDING（无在途交易），不足再新建。
     * demand/offer 在 reserve 之前签名，签名失败只放弃该 liability。
     */
    private List<Liability> prepareCreates(Round round, int count) {
        List<Liability> candidates = new ArrayList<>();
        for (Liability l : open) {
            if (candidates.size() >= count) {
                break;
            }
            if (l.getState() == LiabilityState.PENDING && l.getInFlightTxHash() == null) {
                candidates.add(l);
            }
        }
        while (candidates.size() < count) {
            Liability l = new Liability("L" + (++liabilityCounter), round.getIndex());
            open.add(l);
            candidates.add(l);
        }
        if (candidates.isEmpty()) {
            return candidates;
        }

        BigInteger messageNonce = chain.getMessageNonce(signer.getAccount());
        BigInteger deadline = BigInteger.valueOf(chain.getLatestBlockNumber() + settings.deadlineBlocks);
        List<Liability> ready = new ArrayList<>();
        for (Liability l : candidates) {
            round.include(l);
            // demand 使用 nonceOf + 2i，offer 使用 nonceOf + 2i + 1
            BigInteger base = messageNonce.add(BigInteger.valueOf(2L * ready.size()));
            LiabilityTerms terms = new LiabilityTerms(randomBytes(), randomBytes(), settings.token,
                    BigInteger.ZERO, deadline);
            try {
                SignedPayload demand = signer.signDemand(new DemandFields(terms, settings.lighthouse,
                        settings.validator, BigInteger.ZERO, base, signer.getAccount()));
                SignedPayload offer = signer.signOffer(new OfferFields(terms, settings.validator,
                        settings.lighthouse, BigInteger.ZERO, base.add(BigInteger.ONE), signer.getAccount()));
                l.attachPayloads(demand, offer);
                ready.add(l);
            } catch (SignatureInvalidException e) {
                abandon(round, l, "payload signing failed: " + e.getMessage());
            }
        }
        return ready;
    }

    private boolean attachResult(Round round, Liability l) {
        round.include(l);
        if (l.getResultSignature() != null) {
            return true;
        }
        try {
            byte[] result = l.getResultData() == null ? randomBytes() : l.getResultData();
            l.attachResultData(result);
            l.attachResultSignature(signer.signResult(new ResultFields(l.getAddress(), result, true)));
            return true;
        } catch (SignatureInvalidException e) {
            abandon(round, l, "result signing failed: " + e.getMessage());
            return false;
        }
    }

    private ResultFields resultFields(Liability l) {
        return new ResultFields(l.getAddress(), l.getResultData(), true);
    }

    private List<Liability> finalizable(int cap) {
        List<Liability> list = new ArrayList<>();
        for (Liability l : open) {
            if (list.size() >= cap) {
                break;
            }
            if (l.getState() == LiabilityState.CREATED && l.getInFlightTxHash() == null) {
                list.add(l);
            }
        }
        return list;
    }

    /**
     * 收尾还需处理的数量：CREATED（包括 finalize 在途的），以及 create 在途的 PENDING。
     */
    private synchronized int countDrainable() {
        int n = 0;
        for (Liability l : open) {
            if (l.getState() == LiabilityState.CREATED
                    || (l.getState() == LiabilityState.PENDING && l.getInFlightTxHash() != null)) {
                n++;
            }
        }
        return n;
    }

    /**
     * 轮次开始时对账遗留的在途交易：找到 receipt 则推进状态。
     * 没有 receipt 时，只有确认 nonce 已越过该交易（nonce 被其他交易消耗）才清除 txHash 等待重发；
     * 否则交易可能仍在内存池中，保持在途，下一轮继续对账。
     */
    private void reconcile(Round round) {
        long confirmed = -1;
        for (Liability l : new ArrayList<>(open)) {
            String inFlight = l.getInFlightTxHash();
            if (inFlight == null) {
                continue;
            }
            long nonce = l.getInFlightNonce();
            TxReceipt r = chain.getTransactionReceipt(inFlight);
            if (r == null) {
                r = findStaleReceipt(l, null);
            }
            if (r != null) {
                round.include(l);
                apply(round, l, r);
                continue;
            }
            if (confirmed < 0) {
                confirmed = chain.getConfirmedNonce(signer.getAccount());
            }
            if (confirmed > nonce) {
                log.warn("liability {} tx {} nonce={} dropped (confirmed nonce {}), will resend",
                        l.getId(), inFlight, nonce, confirmed);
                l.clearUnresolvedTx();
            } else {
                log.info("liability {} tx {} nonce={} still pending (confirmed nonce {})",
                        l.getId(), inFlight, nonce, confirmed);
            }
        }
    }

    /**
     * 已被替换的旧交易中第一个成功打包的 receipt；except 为正在处理的 txHash。
     */
    private TxReceipt findStaleReceipt(Liability l, String except) {
        for (String stale : l.getStaleTxHashes()) {
            if (stale.equals(except)) {
                continue;
            }
            TxReceipt r = chain.getTransactionReceipt(stale);
            if (r != null && r.isSuccess()) {
                return r;
            }
        }
        return null;
    }

    private void apply(Round round, Liability l, TxReceipt r) {
        round.recordReceipt(r);
        if (!r.isSuccess()) {
            // 旧交易迟到打包成功时以它为准，revert 只计入花费
            TxReceipt landed = findStaleReceipt(l, r.getTxHash());
            if (landed != null) {
                log.info("liability {} tx {} reverted but earlier tx {} landed", l.getId(), r.getTxHash(),
                        landed.getTxHash());
                l.recordSpend(r.getGasUsed(), r.getGasCost());
                apply(round, l, landed);
                return;
            }
        }
        if (l.getState() == LiabilityState.PENDING) {
            if (r.isSuccess() && r.getLiabilityAddress() != null) {
                l.markCreated(r.getLiabilityAddress(), r.getGasUsed(), r.getGasCost());
                round.recordTransition(LiabilityState.CREATED);
            } else {
                l.markFailed("create reverted in tx " + r.getTxHash(), r.getGasUsed(), r.getGasCost());
                round.recordTransition(LiabilityState.FAILED);
            }
        } else if (l.getState() == LiabilityState.CREATED) {
            if (r.isSuccess()) {
                l.markFinalized(r.getGasUsed(), r.getGasCost(), r.getMintedAmount());
                round.recordTransition(LiabilityState.FINALIZED);
            } else {
                l.markFailed("finalize reverted in tx " + r.getTxHash(), r.getGasUsed(), r.getGasCost());
                round.recordTransition(LiabilityState.FAILED);
            }
        }
    }

    private void abandon(Round round, Liability l, String reason) {
        log.warn("liability {} abandoned: {}", l.getId(), reason);
        l.markAbandoned(reason);
        round.recordTransition(LiabilityState.ABANDONED);
    }

    private void requireMarker() throws InterruptedException {
        ClaimResult claim = tracker.claim();
        if (claim.getState() == MarkerState.WAITING_TIMEOUT) {
            claim = tracker.awaitReclaim();
        }
        if (!claim.isActive()) {
            throw new MarkerNotOwnedException(claim.getReason());
        }
    }

    private void retainOpen() {
        List<Liability> keep = new ArrayList<>();
        for (Liability l : open) {
            if (!l.getState().isTerminal()) {
                keep.add(l);
            }
        }
        open.clear();
        open.addAll(keep);
    }

    private Round finish(Round round, RoundStatus status, RoundErrorKind kind, String message) {
        round.close(status, kind, message, clock.instant());
        history.add(round);
        metrics.round(round.getMode().name(), status.name());
        log.info("round {} {} kind={} created={} finalized={} gasCost={} minted={} msg={}",
                round.getIndex(), status, kind, round.getCreatedCount(), round.getFinalizedCount(),
                round.getGasCost(), round.getMinted(), message);
        return round;
    }

    private byte[] randomBytes() {
        byte[] b = new byte[PAYLOAD_BYTES];
        random.nextBytes(b);
        return b;
    }

    /**
     * 一次 burst 的统计。多数 Pending 视为超时，多数广播失败视为传输失败。
     */
    private static class BurstResult {
        final int sent;
        final int pending;
        final int failed;

        BurstResult(int sent, int pending, int failed) {
            this.sent = sent;
            this.pending = pending;
            this.failed = failed;
        }

        RoundErrorKind degradedKind() {
            if (sent == 0) {
                return RoundErrorKind.NONE;
            }
            if (pending * 2 > sent) {
                return RoundErrorKind.TRANSPORT_TIMEOUT;
            }
            if (failed * 2 > sent) {
                return RoundErrorKind.TRANSPORT_FAILED;
            }
            return RoundErrorKind.NONE;
        }

        String summary() {
            return "sent=" + sent + " pending=" + pending + " failed=" + failed;
        }
    }

    /**
     * reserve 之后的交易签名失败：本轮中止，已 reserve 的 nonce 作废。
     */
    private static class SigningAbort extends RuntimeException {
        SigningAbort(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
