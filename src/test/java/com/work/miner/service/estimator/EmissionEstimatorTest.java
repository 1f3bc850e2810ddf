package com.work.miner.service.estimator;

import com.work.miner.chain.ChainConnector;
import com.work.miner.domain.Profitability;
import com.work.miner.domain.SmmaState;
import com.work.miner.support.MutableClock;
import com.work.miner.support.metrics.MinerMetrics;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class EmissionEstimatorTest {

    private static EmissionEstimator estimator(ChainConnector chain, int period, Clock clock, MinerMetrics metrics) {
        return new EmissionEstimator(chain, period, Duration.ofSeconds(60), 100, 0.10, clock, metrics);
    }

    @Test
    public void simulated_half_life_matches_closed_form() {
        int[][] cases = {{1000, 20}, {1000, 56}, {500, 10}, {2000, 112}};
        for (int[] c : cases) {
            int period = c[0];
            int perRound = c[1];
            ChainConnector chain = mock(ChainConnector.class);
            // 大数值避免整数截断影响
            BigInteger start = BigInteger.TEN.pow(18);
            when(chain.getAuthoritativeSmma()).thenReturn(start);
            EmissionEstimator est = estimator(chain, period, Clock.systemUTC(), mock(MinerMetrics.class));
            est.resync();

            BigInteger half = start.divide(BigInteger.valueOf(2));
            int rounds = 0;
            while (est.state().getValue().compareTo(half) > 0) {
                for (int i = 0; i < perRound; i++) {
                    est.observe(BigInteger.ZERO);
                }
                rounds++;
            }
            double expected = SmmaMath.halfLifeRounds(period, perRound);
            assertTrue(Math.abs(rounds - expected) <= 1.0,
                    "P=" + period + " N=" + perRound + " simulated=" + rounds + " expected=" + expected);
        }
    }

    @Test
    public void resync_is_idempotent_without_chain_activity() {
        ChainConnector chain = mock(ChainConnector.class);
        when(chain.getAuthoritativeSmma()).thenReturn(BigInteger.valueOf(1_030_000_000L));
        MinerMetrics metrics = mock(MinerMetrics.class);
        EmissionEstimator est = estimator(chain, 1000, Clock.systemUTC(), metrics);

        SmmaState first = est.resync();
        SmmaState second = est.resync();

        assertEquals(first.getValue(), second.getValue());
        assertEquals(0L, second.getObservationsSinceResync());
        verify(metrics, times(1)).estimatorResync(eq(1_030_000_000L));
        verify(metrics, times(1)).estimatorResync(eq(0L));
    }

    @Test
    public void observe_applies_smma_update() {
        ChainConnector chain = mock(ChainConnector.class);
        when(chain.getAuthoritativeSmma()).thenReturn(BigInteger.valueOf(1_000_000_000L));
        EmissionEstimator est = estimator(chain, 1000, Clock.systemUTC(), mock(MinerMetrics.class));
        est.resync();

        SmmaState s = est.observe(BigInteger.valueOf(11_000_000_000L));

        // (1e9 × 999 + 11e9) / 1000
        assertEquals(BigInteger.valueOf(1_010_000_000L), s.getValue());
        assertEquals(1L, s.getObservationsSinceResync());
    }

    @Test
    public void stale_after_max_age_or_observations() {
        ChainConnector chain = mock(ChainConnector.class);
        when(chain.getAuthoritativeSmma()).thenReturn(BigInteger.valueOf(1_000_000_000L));
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        EmissionEstimator est = new EmissionEstimator(chain, 1000, Duration.ofSeconds(60), 3, 0.10, clock,
                mock(MinerMetrics.class));

        assertTrue(est.isStale());
        est.resync();
        assertFalse(est.isStale());

        est.observe(BigInteger.ONE);
        est.observe(BigInteger.ONE);
        assertFalse(est.isStale());
        est.observe(BigInteger.ONE);
        assertTrue(est.isStale());

        est.resync();
        clock.advance(Duration.ofSeconds(59));
        assertFalse(est.isStale());
        clock.advance(Duration.ofSeconds(1));
        assertTrue(est.isStale());
    }

    @Test
    public void emission_follows_wn_from_gas() {
        EmissionEstimator est = estimator(mock(ChainConnector.class), 1000, Clock.systemUTC(), mock(MinerMetrics.class));

        BigInteger emission = est.estimateEmission(1_058_000L, BigInteger.valueOf(1_000_000_000L),
                BigInteger.valueOf(1_000_000_000_000_000L));

        assertEquals(BigInteger.valueOf(1_058_000L), emission);
    }

    @Test
    public void profitability_classification_uses_marginal_band() {
        EmissionEstimator est = estimator(mock(ChainConnector.class), 1000, Clock.systemUTC(), mock(MinerMetrics.class));
        BigInteger emission = BigInteger.valueOf(1000);

        assertEquals(Profitability.Verdict.PROFITABLE,
                est.estimateProfitability(emission, BigDecimal.ONE, BigInteger.valueOf(800)).getVerdict());
        assertEquals(Profitability.Verdict.MARGINAL,
                est.estimateProfitability(emission, BigDecimal.ONE, BigInteger.valueOf(950)).getVerdict());
        assertEquals(Profitability.Verdict.UNPROFITABLE,
                est.estimateProfitability(emission, BigDecimal.ONE, BigInteger.valueOf(1200)).getVerdict());
        assertEquals(Profitability.Verdict.PROFITABLE,
                est.estimateProfitability(emission, BigDecimal.ONE, BigInteger.ZERO).getVerdict());
    }

    @Test
    public void projection_uses_current_value() {
        ChainConnector chain = mock(ChainConnector.class);
        when(chain.getAuthoritativeSmma()).thenReturn(BigInteger.valueOf(1_940_000_000L));
        EmissionEstimator est = estimator(chain, 1000, Clock.systemUTC(), mock(MinerMetrics.class));
        est.resync();

        BigInteger projected = est.project(BigInteger.valueOf(1_200_000_000L), 1380);

        assertEquals(1.41e9, projected.doubleValue(), 0.03e9);
    }
}
