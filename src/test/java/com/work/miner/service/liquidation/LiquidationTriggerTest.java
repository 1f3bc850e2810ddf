package com.work.miner.service.liquidation;

import com.work.miner.domain.SaleEvent;
import com.work.miner.exception.TransportException;
import com.work.miner.support.metrics.MinerMetrics;
import com.work.miner.swap.MockSwapConnector;
import com.work.miner.swap.SwapConnector;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class LiquidationTriggerTest {

    private static final BigInteger THRESHOLD = BigInteger.valueOf(1_000);

    private static LiquidationTrigger trigger(SwapConnector swap, SaleEventLog log, MinerMetrics metrics) {
        return new LiquidationTrigger(swap, log, THRESHOLD, 0.05, Duration.ofMinutes(5), Clock.systemUTC(), metrics);
    }

    @Test
    public void sold_plus_unsold_equals_minted() {
        MockSwapConnector swap = new MockSwapConnector(BigDecimal.valueOf(3));
        SaleEventLog saleLog = new SaleEventLog();
        LiquidationTrigger t = trigger(swap, saleLog, mock(MinerMetrics.class));

        long[] mints = {400, 350, 900, 2_600, 10, 999, 1};
        BigInteger total = BigInteger.ZERO;
        for (long m : mints) {
            t.onMinted(BigInteger.valueOf(m));
            total = total.add(BigInteger.valueOf(m));
            assertEquals(total, saleLog.totalSold().add(t.getUnsold()));
            assertTrue(t.getUnsold().compareTo(THRESHOLD) < 0);
        }
        for (SaleEvent e : saleLog.all()) {
            assertEquals(BigInteger.ZERO, e.getAmount().mod(THRESHOLD));
            assertEquals(e.getAmount().multiply(BigInteger.valueOf(3)), e.getProceeds());
        }
        assertEquals(BigInteger.valueOf(5_000), saleLog.totalSold());
        assertEquals(BigInteger.valueOf(260), t.getUnsold());
    }

    @Test
    public void below_threshold_never_sells() {
        SwapConnector swap = mock(SwapConnector.class);
        LiquidationTrigger t = trigger(swap, new SaleEventLog(), mock(MinerMetrics.class));

        assertNull(t.onMinted(BigInteger.valueOf(999)));

        verify(swap, never()).swap(any(), anyDouble(), any());
        assertEquals(BigInteger.valueOf(999), t.getUnsold());
    }

    @Test
    public void slippage_keeps_balance_for_next_check() {
        MockSwapConnector swap = new MockSwapConnector(BigDecimal.ONE);
        swap.setExecutionImpact(0.2);
        SaleEventLog saleLog = new SaleEventLog();
        MinerMetrics metrics = mock(MinerMetrics.class);
        LiquidationTrigger t = trigger(swap, saleLog, metrics);

        assertNull(t.onMinted(BigInteger.valueOf(1_500)));
        assertEquals(BigInteger.valueOf(1_500), t.getUnsold());
        assertEquals(0, saleLog.size());
        verify(metrics, times(1)).sale(eq("slippage"));

        swap.setExecutionImpact(0.01);
        SaleEvent e = t.check();
        assertNotNull(e);
        assertEquals(BigInteger.valueOf(1_000), e.getAmount());
        assertEquals(BigInteger.valueOf(990), e.getProceeds());
        assertEquals(BigInteger.valueOf(500), e.getRetainedBalance());
    }

    @Test
    public void transport_failure_keeps_balance() {
        SwapConnector swap = mock(SwapConnector.class);
        when(swap.swap(any(), anyDouble(), any())).thenThrow(new TransportException("router unreachable"));
        LiquidationTrigger t = trigger(swap, new SaleEventLog(), mock(MinerMetrics.class));

        t.onMinted(BigInteger.valueOf(2_000));

        assertEquals(BigInteger.valueOf(2_000), t.getUnsold());
    }

    @Test
    public void swap_receives_threshold_multiple_and_configured_slippage() {
        SwapConnector swap = mock(SwapConnector.class);
        when(swap.swap(any(), anyDouble(), any())).thenReturn(BigInteger.valueOf(42));
        LiquidationTrigger t = trigger(swap, new SaleEventLog(), mock(MinerMetrics.class));

        t.onMinted(BigInteger.valueOf(3_456));

        verify(swap, times(1)).swap(eq(BigInteger.valueOf(3_000)), eq(0.05), eq(Duration.ofMinutes(5)));
        assertEquals(BigInteger.valueOf(456), t.getUnsold());
    }
}
