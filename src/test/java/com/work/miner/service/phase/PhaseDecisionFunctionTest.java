package com.work.miner.service.phase;

import com.work.miner.domain.Phase;
import com.work.miner.domain.PhaseConfig;
import com.work.miner.domain.Profitability;
import com.work.miner.domain.RoundErrorKind;
import com.work.miner.domain.RoundMode;
import com.work.miner.domain.RoundStatus;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class PhaseDecisionFunctionTest {

    private static final BigInteger GWEI = BigInteger.valueOf(1_000_000_000L);
    private static final BigInteger ETH = BigInteger.TEN.pow(18);

    private final PhaseDecisionFunction fn =
            new PhaseDecisionFunction(new BatchBackoffPolicy(Arrays.asList(56, 20, 10, 5)), 3, 10);

    private static PhaseConfig mining(int batch, BigInteger budget) {
        return new PhaseConfig(Phase.MINING, RoundMode.PIPELINE, GWEI.divide(BigInteger.valueOf(5)), batch, budget,
                BigInteger.valueOf(674_000_000L));
    }

    private static PhaseConfig pumping(int batch, BigInteger budget, BigInteger target) {
        return new PhaseConfig(Phase.PUMPING, RoundMode.PIPELINE, GWEI.multiply(BigInteger.TEN), batch, budget, target);
    }

    private static RoundFeedback ok(BigInteger cost, Profitability p, BigInteger smma) {
        return new RoundFeedback(RoundStatus.COMPLETED, RoundErrorKind.NONE, cost, p, smma, 40);
    }

    private static RoundFeedback timeout() {
        return new RoundFeedback(RoundStatus.DEGRADED, RoundErrorKind.TRANSPORT_TIMEOUT, BigInteger.ZERO, null, GWEI, 40);
    }

    @Test
    public void transport_errors_walk_backoff_sequence_then_recover() {
        PhaseConfig c = pumping(56, ETH, GWEI.multiply(BigInteger.valueOf(4)));
        PhaseDecision.Streaks s = PhaseDecision.Streaks.zero();

        int[] expected = {20, 10, 5};
        for (int b : expected) {
            PhaseDecision d = fn.decide(c, s, timeout());
            assertEquals(b, d.getConfig().getBatchSize());
            assertEquals(Phase.PUMPING, d.getConfig().getPhase());
            c = d.getConfig();
            s = d.getStreaks();
        }
        assertEquals(3, s.getErrors());

        PhaseDecision done = fn.decide(c, s, ok(GWEI, null, GWEI));
        assertEquals(5, done.getConfig().getBatchSize());
        assertEquals(0, done.getStreaks().getErrors());
        assertFalse(done.isTerminated());
    }

    @Test
    public void terminates_when_batch_cannot_shrink() {
        PhaseDecision d = fn.decide(mining(1, ETH), PhaseDecision.Streaks.zero(), timeout());

        assertTrue(d.isTerminated());
    }

    @Test
    public void transport_error_before_auto_batch_is_sized_only_counts() {
        PhaseDecision d = fn.decide(pumping(0, ETH, GWEI.multiply(BigInteger.valueOf(4))),
                PhaseDecision.Streaks.zero(), timeout());

        assertFalse(d.isTerminated());
        assertEquals(0, d.getConfig().getBatchSize());
        assertEquals(1, d.getStreaks().getErrors());
    }

    @Test
    public void k_unprofitable_rounds_terminate_mining() {
        PhaseConfig c = mining(10, ETH);
        PhaseDecision.Streaks s = PhaseDecision.Streaks.zero();
        BigInteger smma = GWEI;

        PhaseDecision d1 = fn.decide(c, s, ok(GWEI, Profitability.unprofitable(-0.2), smma));
        PhaseDecision d2 = fn.decide(d1.getConfig(), d1.getStreaks(), ok(GWEI, Profitability.unprofitable(-0.2), smma));
        assertFalse(d2.isTerminated());
        assertEquals(2, d2.getStreaks().getUnprofitable());

        // 一次盈利的轮次重置计数
        PhaseDecision d3 = fn.decide(d2.getConfig(), d2.getStreaks(), ok(GWEI, Profitability.profitable(0.5), smma));
        assertEquals(0, d3.getStreaks().getUnprofitable());

        PhaseDecision d = d3;
        for (int i = 0; i < 3; i++) {
            d = fn.decide(d.getConfig(), d.getStreaks(), ok(GWEI, Profitability.unprofitable(-0.1), smma));
        }
        assertTrue(d.isTerminated());
        assertEquals(Phase.TERMINATED, d.getConfig().getPhase());
    }

    @Test
    public void marginal_rounds_do_not_count_as_unprofitable() {
        PhaseDecision d = fn.decide(mining(10, ETH), PhaseDecision.Streaks.zero(), ok(GWEI, Profitability.marginal(0.01), GWEI));
        d = fn.decide(d.getConfig(), d.getStreaks(), ok(GWEI, Profitability.marginal(0.01), GWEI));
        d = fn.decide(d.getConfig(), d.getStreaks(), ok(GWEI, Profitability.marginal(0.01), GWEI));

        assertFalse(d.isTerminated());
        assertEquals(0, d.getStreaks().getUnprofitable());
    }

    @Test
    public void smma_below_floor_for_k_rounds_terminates() {
        BigInteger low = BigInteger.valueOf(600_000_000L);
        PhaseDecision d = fn.decide(mining(10, ETH), PhaseDecision.Streaks.zero(), ok(GWEI, null, low));
        d = fn.decide(d.getConfig(), d.getStreaks(), ok(GWEI, null, low));
        assertFalse(d.isTerminated());
        d = fn.decide(d.getConfig(), d.getStreaks(), ok(GWEI, null, low));

        assertTrue(d.isTerminated());
        assertEquals(3, d.getStreaks().getBelowFloor());
    }

    @Test
    public void mining_budget_exhaustion_terminates() {
        PhaseDecision d = fn.decide(mining(10, GWEI.multiply(BigInteger.valueOf(3))), PhaseDecision.Streaks.zero(),
                ok(GWEI.multiply(BigInteger.valueOf(5)), Profitability.profitable(1.0), GWEI));

        assertTrue(d.isTerminated());
        assertEquals(BigInteger.ZERO, d.getConfig().getRemainingBudget());
    }

    @Test
    public void pump_budget_exhaustion_awaits_operator() {
        PhaseDecision d = fn.decide(pumping(20, GWEI, GWEI.multiply(BigInteger.valueOf(4))), PhaseDecision.Streaks.zero(),
                ok(GWEI.multiply(BigInteger.valueOf(2)), null, GWEI));

        assertFalse(d.isTerminated());
        assertTrue(d.isAwaitingOperator());
        assertEquals(Phase.PUMPING, d.getConfig().getPhase());
    }

    @Test
    public void pump_target_reached_is_signalled() {
        BigInteger target = GWEI.multiply(BigInteger.valueOf(4));
        PhaseDecision d = fn.decide(pumping(20, ETH, target), PhaseDecision.Streaks.zero(),
                ok(GWEI, null, target.add(BigInteger.ONE)));

        assertTrue(d.isTargetReached());
        assertFalse(d.isAwaitingOperator());
        assertEquals(Phase.PUMPING, d.getConfig().getPhase());
    }

    @Test
    public void quota_exceeded_fits_batch_to_quota() {
        RoundFeedback rejected = new RoundFeedback(RoundStatus.REJECTED, RoundErrorKind.QUOTA_EXCEEDED, BigInteger.ZERO,
                null, GWEI, 20);

        PhaseDecision d = fn.decide(pumping(15, ETH, BigInteger.ZERO), PhaseDecision.Streaks.zero(), rejected);

        assertEquals(10, d.getConfig().getBatchSize());
        assertEquals(1, d.getStreaks().getErrors());
    }

    @Test
    public void consecutive_round_errors_terminate() {
        RoundFeedback conflict = new RoundFeedback(RoundStatus.ABORTED, RoundErrorKind.NONCE_CONFLICT, BigInteger.ZERO,
                null, GWEI, 40);
        PhaseDecision d = new PhaseDecision(mining(10, ETH), PhaseDecision.Streaks.zero(), false, false, null);
        for (int i = 0; i < 9; i++) {
            d = fn.decide(d.getConfig(), d.getStreaks(), conflict);
            assertFalse(d.isTerminated());
        }
        d = fn.decide(d.getConfig(), d.getStreaks(), conflict);

        assertTrue(d.isTerminated());
    }

    @Test
    public void inactive_phase_is_left_unchanged() {
        PhaseDecision d = fn.decide(PhaseConfig.idle(), PhaseDecision.Streaks.zero(), timeout());

        assertEquals(Phase.IDLE, d.getConfig().getPhase());
        assertFalse(d.isTerminated());
    }
}
