package com.work.miner.service.lease;

import com.work.miner.domain.LeaseDecision;
import com.work.miner.exception.LeaseNotOwnedException;
import com.work.miner.support.MutableClock;
import com.work.miner.support.metrics.MinerMetrics;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class AccountLeaseManagerTest {

    private static final String ACCOUNT = "0x00000000000000000000000000000000000000a1";

    @Test
    public void second_owner_is_not_leader_while_lease_is_live() {
        MinerMetrics metrics = mock(MinerMetrics.class);
        AccountLeaseManager mgr = new AccountLeaseManager(Clock.systemUTC(), Duration.ofSeconds(30), metrics);

        LeaseDecision a = mgr.acquireOrRenew(ACCOUNT, "nodeA");
        LeaseDecision b = mgr.acquireOrRenew(ACCOUNT, "nodeB");

        assertTrue(a.isLeader());
        assertFalse(b.isLeader());
        assertEquals("nodeA", b.getOwner());
        verify(metrics, times(1)).leaseAcquire(eq("insert"));
        verify(metrics, times(1)).leaseAcquire(eq("not_leader"));
    }

    @Test
    public void takeover_after_expiry_fences_old_token() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        AccountLeaseManager mgr = new AccountLeaseManager(clock, Duration.ofSeconds(30), mock(MinerMetrics.class));

        LeaseDecision old = mgr.acquireOrRenew(ACCOUNT, "nodeA");
        clock.advance(Duration.ofSeconds(31));
        LeaseDecision fresh = mgr.acquireOrRenew(ACCOUNT, "nodeB");

        assertTrue(fresh.isLeader());
        assertEquals(old.getFencingToken() + 1, fresh.getFencingToken());
        assertThrows(LeaseNotOwnedException.class, () -> mgr.verify(old));
        mgr.verify(fresh);
    }

    @Test
    public void release_keeps_token_monotonic() {
        AccountLeaseManager mgr = new AccountLeaseManager(Clock.systemUTC(), Duration.ofSeconds(30), mock(MinerMetrics.class));

        LeaseDecision first = mgr.acquireOrRenew(ACCOUNT, "nodeA");
        mgr.release(first);
        LeaseDecision second = mgr.acquireOrRenew(ACCOUNT, "nodeB");

        assertTrue(second.isLeader());
        assertTrue(second.getFencingToken() > first.getFencingToken());
        assertThrows(LeaseNotOwnedException.class, () -> mgr.verify(first));
    }
}
