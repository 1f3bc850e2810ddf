package com.work.miner.service.round;

import com.work.miner.chain.MockChainConnector;
import com.work.miner.domain.Liability;
import com.work.miner.domain.LiabilityState;
import com.work.miner.domain.Round;
import com.work.miner.domain.RoundErrorKind;
import com.work.miner.domain.RoundMode;
import com.work.miner.domain.RoundStatus;
import com.work.miner.exception.SignatureInvalidException;
import com.work.miner.service.lease.AccountLeaseManager;
import com.work.miner.service.lighthouse.QuotaTracker;
import com.work.miner.service.nonce.ConfirmationWaiter;
import com.work.miner.service.nonce.NonceSequencer;
import com.work.miner.signer.DemandFields;
import com.work.miner.signer.LiabilitySigner;
import com.work.miner.signer.MockLiabilitySigner;
import com.work.miner.signer.SignedPayload;
import com.work.miner.support.metrics.MinerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class RoundSchedulerTest {

    private static final String ACCOUNT = "0x00000000000000000000000000000000000000a1";
    private static final String LIGHTHOUSE = "0x00000000000000000000000000000000000000b1";
    private static final String VALIDATOR = "0x0000000000000000000000000000000000000000";
    private static final String TOKEN = "0x7de91b204c1c737bcee6f000aaa6569cf7061cb7";
    private static final BigInteger PRIO = BigInteger.valueOf(200_000_000L);

    private MockChainConnector chain;
    private MinerMetrics metrics;

    @BeforeEach
    public void setUp() {
        chain = MockChainConnector.withDefaults();
        chain.registerProvider(ACCOUNT, 1);
        metrics = mock(MinerMetrics.class);
    }

    private RoundScheduler scheduler(LiabilitySigner signer) {
        AccountLeaseManager leases = new AccountLeaseManager(Clock.systemUTC(), Duration.ofSeconds(30), metrics);
        ConfirmationWaiter waiter = new ConfirmationWaiter(chain, Duration.ofSeconds(10), Duration.ofSeconds(1),
                d -> {
                }, metrics);
        NonceSequencer sequencer = new NonceSequencer(ACCOUNT, chain, leases, waiter, metrics, Clock.systemUTC());
        QuotaTracker tracker = new QuotaTracker(chain, LIGHTHOUSE, ACCOUNT, Duration.ofSeconds(12), d -> {
        }, metrics);
        return new RoundScheduler(chain, signer, sequencer, tracker, new RoundHistory(50), metrics,
                Clock.systemUTC(), "nodeA", new RoundScheduler.Settings(LIGHTHOUSE, VALIDATOR, TOKEN, 300));
    }

    private RoundScheduler scheduler() {
        return scheduler(new MockLiabilitySigner(ACCOUNT, LIGHTHOUSE));
    }

    @Test
    public void quota_below_required_ops_rejects_without_network_write() {
        chain.setQuota(20);
        RoundScheduler s = scheduler();

        Round r = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 15, PRIO));

        assertEquals(RoundStatus.REJECTED, r.getStatus());
        assertEquals(RoundErrorKind.QUOTA_EXCEEDED, r.getErrorKind());
        assertEquals(0L, chain.getSendCount());
        assertEquals(0, r.getTransactionsSent());
        verify(metrics, times(1)).round(eq("PIPELINE"), eq("REJECTED"));
    }

    @Test
    public void pipeline_sends_two_batches_per_confirmation_cycle() {
        RoundScheduler s = scheduler();

        Round warmup = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 5, PRIO));
        assertEquals(5, warmup.getCreatedCount());
        assertEquals(1, warmup.getConfirmationCycles());

        Round steady = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 5, PRIO));
        assertEquals(RoundStatus.COMPLETED, steady.getStatus());
        assertEquals(5, steady.getFinalizedCount());
        assertEquals(5, steady.getCreatedCount());
        assertEquals(10, steady.getTransactionsSent());
        assertEquals(1, steady.getConfirmationCycles());
        assertTrue(steady.getMinted().signum() > 0);

        Round batch = s.runRound(RoundPlan.of(RoundMode.BATCH, 5, PRIO));
        assertEquals(RoundStatus.COMPLETED, batch.getStatus());
        // 遗留的 5 个 CREATED 先在 batch 的 finalize 半轮中处理，最多 B 个
        assertEquals(2, batch.getConfirmationCycles());
        assertEquals(10, batch.getTransactionsSent());

        double pipelinePerCycle = (double) steady.getTransactionsSent() / steady.getConfirmationCycles();
        double batchPerCycle = (double) batch.getTransactionsSent() / batch.getConfirmationCycles();
        assertEquals(2.0, pipelinePerCycle / batchPerCycle, 1e-9);
    }

    @Test
    public void reverted_creates_fail_only_their_liability() {
        RoundScheduler s = scheduler();
        chain.revertNextCreates(2);

        Round r = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 5, PRIO));

        assertEquals(RoundStatus.COMPLETED, r.getStatus());
        assertEquals(3, r.getCreatedCount());
        assertEquals(2, r.count(LiabilityState.FAILED));
        assertEquals(3, s.openLiabilities().size());

        Round next = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 5, PRIO));
        assertEquals(3, next.getFinalizedCount());
    }

    @Test
    public void broadcast_failure_degrades_round_and_requires_resync() {
        RoundScheduler s = scheduler();
        chain.failNextSends(1);

        Round degraded = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 5, PRIO));
        assertEquals(RoundStatus.DEGRADED, degraded.getStatus());
        assertEquals(RoundErrorKind.TRANSPORT_FAILED, degraded.getErrorKind());
        assertTrue(s.needsNonceResync());

        Round conflict = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 5, PRIO));
        assertEquals(RoundStatus.ABORTED, conflict.getStatus());
        assertEquals(RoundErrorKind.NONCE_CONFLICT, conflict.getErrorKind());

        assertEquals(0L, s.resyncNonces());
        Round recovered = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 5, PRIO));
        assertEquals(RoundStatus.COMPLETED, recovered.getStatus());
        assertEquals(5, recovered.getCreatedCount());
        // 未广播成功的 liability 被复用，而不是新建
        assertEquals(5, s.openLiabilities().size());
    }

    @Test
    public void missing_receipts_are_reconciled_next_round_without_resend() {
        RoundScheduler s = scheduler();
        chain.setReceiptsWithheld(true);

        Round timedOut = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 4, PRIO));
        assertEquals(RoundStatus.DEGRADED, timedOut.getStatus());
        assertEquals(RoundErrorKind.TRANSPORT_TIMEOUT, timedOut.getErrorKind());

        chain.setReceiptsWithheld(false);
        Round next = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 4, PRIO));

        assertEquals(RoundStatus.COMPLETED, next.getStatus());
        assertEquals(4, next.getFinalizedCount());
        assertEquals(12L, chain.getSendCount());
    }

    @Test
    public void unconfirmed_create_stays_in_flight_until_it_lands() {
        RoundScheduler s = scheduler();
        chain.setReceiptsWithheld(true);

        Round first = s.runRound(RoundPlan.of(RoundMode.BATCH, 1, PRIO));
        assertEquals(RoundErrorKind.TRANSPORT_TIMEOUT, first.getErrorKind());
        Liability original = s.openLiabilities().get(0);
        String originalTx = original.getCreateTxHash();

        Round second = s.runRound(RoundPlan.of(RoundMode.BATCH, 1, PRIO));
        assertEquals(RoundStatus.DEGRADED, second.getStatus());
        // 原交易仍可能打包：不重发，只为新的 liability 广播 create
        assertEquals(2L, chain.getSendCount());
        assertEquals(originalTx, original.getCreateTxHash());
        assertEquals(1, original.getAttempts());

        chain.setReceiptsWithheld(false);
        Round third = s.runRound(RoundPlan.of(RoundMode.BATCH, 1, PRIO));
        assertEquals(RoundStatus.COMPLETED, third.getStatus());
        s.drain(RoundMode.BATCH, 0, PRIO);

        assertEquals(LiabilityState.FINALIZED, original.getState());
        assertTrue(s.openLiabilities().isEmpty());
        assertEquals(3L, chain.getLiabilitiesCreated());
        assertEquals(3L, chain.getLiabilitiesFinalized());
        assertEquals(3L, s.getHistory().getTotalFinalized());
        assertEquals(6L, chain.getSendCount());
    }

    @Test
    public void dropped_create_is_resent_after_its_nonce_is_consumed() {
        RoundScheduler s = scheduler();
        chain.setReceiptsWithheld(true);
        s.runRound(RoundPlan.of(RoundMode.BATCH, 1, PRIO));
        Liability l = s.openLiabilities().get(0);

        chain.dropPendingTransactions();
        chain.setReceiptsWithheld(false);
        chain.advanceNonceExternally(ACCOUNT, 1);
        Round r = s.runRound(RoundPlan.of(RoundMode.BATCH, 1, PRIO));

        assertEquals(RoundStatus.COMPLETED, r.getStatus());
        assertEquals(1, r.getFinalizedCount());
        assertEquals(LiabilityState.FINALIZED, l.getState());
        assertEquals(3, l.getAttempts());
        assertEquals(1L, chain.getLiabilitiesCreated());
        assertTrue(s.openLiabilities().isEmpty());
    }

    @Test
    public void reverted_resend_defers_to_earlier_create_that_landed() {
        chain = spy(chain);
        RoundScheduler s = scheduler();
        chain.setReceiptsWithheld(true);
        s.runRound(RoundPlan.of(RoundMode.BATCH, 1, PRIO));
        Liability l = s.openLiabilities().get(0);
        String earlier = l.getCreateTxHash();

        // 原交易已打包，但对账时节点还查不到它的 receipt
        chain.setReceiptsWithheld(false);
        doReturn(null).doCallRealMethod().when(chain).getTransactionReceipt(earlier);
        chain.revertNextCreates(1);
        Round r = s.runRound(RoundPlan.of(RoundMode.BATCH, 1, PRIO));

        assertEquals(RoundStatus.COMPLETED, r.getStatus());
        assertEquals(LiabilityState.FINALIZED, l.getState());
        assertEquals(chain.getTransactionReceipt(earlier).getLiabilityAddress(), l.getAddress());
        assertEquals(1L, chain.getLiabilitiesCreated());
        assertEquals(MockChainConnector.CREATE_GAS + MockChainConnector.CREATE_GAS / 2
                + MockChainConnector.FINALIZE_GAS, l.getGasUsed());
    }

    @Test
    public void cancel_request_stops_at_next_broadcast_boundary() {
        final RoundScheduler[] holder = new RoundScheduler[1];
        LiabilitySigner signer = new MockLiabilitySigner(ACCOUNT, LIGHTHOUSE) {
            @Override
            public SignedPayload signDemand(DemandFields fields) {
                holder[0].requestCancel();
                return super.signDemand(fields);
            }
        };
        RoundScheduler s = scheduler(signer);
        holder[0] = s;

        Round r = s.runRound(RoundPlan.of(RoundMode.SEQUENTIAL, 3, PRIO));

        assertEquals(RoundStatus.CANCELLED, r.getStatus());
        assertEquals(1, r.getCreatedCount());
        assertEquals(0, r.getFinalizedCount());
        assertEquals(1L, chain.getSendCount());

        List<Liability> open = s.openLiabilities();
        assertEquals(1, open.size());
        assertEquals(LiabilityState.CREATED, open.get(0).getState());
    }

    @Test
    public void payload_signing_failure_abandons_single_liability() {
        LiabilitySigner signer = new MockLiabilitySigner(ACCOUNT, LIGHTHOUSE) {
            private int calls;

            @Override
            public SignedPayload signDemand(DemandFields fields) {
                if (++calls == 2) {
                    throw new SignatureInvalidException("hsm unavailable");
                }
                return super.signDemand(fields);
            }
        };
        RoundScheduler s = scheduler(signer);

        Round r = s.runRound(RoundPlan.of(RoundMode.PIPELINE, 4, PRIO));

        assertEquals(RoundStatus.COMPLETED, r.getStatus());
        assertEquals(3, r.getCreatedCount());
        assertEquals(1, r.count(LiabilityState.ABANDONED));
        assertEquals(3L, chain.getSendCount());
    }

    @Test
    public void drain_finalizes_everything_without_new_creates() {
        RoundScheduler s = scheduler();
        s.runRound(RoundPlan.of(RoundMode.PIPELINE, 6, PRIO));
        long sendsBefore = chain.getSendCount();

        List<Round> rounds = s.drain(RoundMode.PIPELINE, 4, PRIO);

        assertEquals(2, rounds.size());
        assertEquals(4, rounds.get(0).getFinalizedCount());
        assertEquals(2, rounds.get(1).getFinalizedCount());
        assertEquals(0, rounds.get(0).getCreatedCount());
        assertTrue(s.openLiabilities().isEmpty());
        assertEquals(sendsBefore + 6, chain.getSendCount());
    }

    @Test
    public void account_without_stake_aborts_with_marker_not_owned() {
        chain = MockChainConnector.withDefaults();
        RoundScheduler s = scheduler();

        Round r = s.runRound(RoundPlan.of(RoundMode.BATCH, 3, PRIO));

        assertEquals(RoundStatus.ABORTED, r.getStatus());
        assertEquals(RoundErrorKind.MARKER_NOT_OWNED, r.getErrorKind());
        assertEquals(0L, chain.getSendCount());
    }

    @Test
    public void history_tracks_totals() {
        RoundScheduler s = scheduler();
        s.runRound(RoundPlan.of(RoundMode.PIPELINE, 2, PRIO));
        s.runRound(RoundPlan.of(RoundMode.PIPELINE, 2, PRIO));

        RoundHistory h = s.getHistory();
        assertEquals(2L, h.getTotalRounds());
        assertEquals(4L, h.getTotalCreated());
        assertEquals(2L, h.getTotalFinalized());
        assertTrue(h.getTotalGasCost().signum() > 0);
        assertEquals(2, h.last().getIndex());
    }
}
