package com.work.miner.service.lighthouse;

import com.work.miner.chain.MockChainConnector;
import com.work.miner.chain.LighthouseState;
import com.work.miner.exception.TransportTimeoutException;
import com.work.miner.service.lease.AccountLeaseManager;
import com.work.miner.service.nonce.ConfirmationWaiter;
import com.work.miner.service.nonce.NonceSequencer;
import com.work.miner.signer.MockLiabilitySigner;
import com.work.miner.signer.SignedTransaction;
import com.work.miner.signer.TxFees;
import com.work.miner.support.metrics.MinerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class StakeKeeperTest {

    private static final String ACCOUNT = "0x00000000000000000000000000000000000000a1";
    private static final String LIGHTHOUSE = "0x00000000000000000000000000000000000000b1";
    private static final BigInteger PRIO = BigInteger.valueOf(200_000_000L);

    private MockChainConnector chain;
    private MinerMetrics metrics;
    private MockLiabilitySigner signer;

    @BeforeEach
    public void setUp() {
        chain = MockChainConnector.withDefaults();
        metrics = mock(MinerMetrics.class);
        signer = new MockLiabilitySigner(ACCOUNT, LIGHTHOUSE);
    }

    private StakeKeeper keeper() {
        AccountLeaseManager leases = new AccountLeaseManager(Clock.systemUTC(), Duration.ofSeconds(30), metrics);
        ConfirmationWaiter waiter = new ConfirmationWaiter(chain, Duration.ofSeconds(10), Duration.ofSeconds(1),
                d -> {
                }, metrics);
        NonceSequencer sequencer = new NonceSequencer(ACCOUNT, chain, leases, waiter, metrics, Clock.systemUTC());
        QuotaTracker tracker = new QuotaTracker(chain, LIGHTHOUSE, ACCOUNT, Duration.ofSeconds(12), d -> {
        }, metrics);
        return new StakeKeeper(chain, signer, sequencer, tracker, "nodeA", LIGHTHOUSE, metrics);
    }

    private LighthouseState state() {
        return chain.getLighthouseState(LIGHTHOUSE, ACCOUNT);
    }

    @Test
    public void sufficient_stake_sends_nothing() {
        chain.registerProvider(ACCOUNT, 1);
        chain.creditTokens(ACCOUNT, BigInteger.valueOf(100));

        BigInteger staked = keeper().ensureStake(40, PRIO);

        assertEquals(BigInteger.ZERO, staked);
        assertEquals(0L, chain.getSendCount());
    }

    @Test
    public void new_account_approves_then_refills_and_becomes_provider() {
        chain.creditTokens(ACCOUNT, BigInteger.valueOf(100));

        BigInteger staked = keeper().ensureStake(20, PRIO);

        assertEquals(BigInteger.valueOf(20), staked);
        assertEquals(2L, chain.getSendCount());
        assertTrue(state().isProvider());
        assertEquals(BigInteger.valueOf(80), chain.getTokenBalance(ACCOUNT));
        assertEquals(BigInteger.ZERO, chain.getAllowance(ACCOUNT, LIGHTHOUSE));
        verify(metrics, times(1)).stakeTopUp("refilled");
    }

    @Test
    public void existing_allowance_skips_approve() {
        chain.registerProvider(ACCOUNT, 1);
        chain.creditTokens(ACCOUNT, BigInteger.valueOf(100));
        SignedTransaction approve = signer.signApprove(0, LIGHTHOUSE, BigInteger.valueOf(1_000),
                TxFees.of(chain.getGasPrice(), PRIO));
        chain.sendRawTransaction(approve.getRawTransaction());

        BigInteger staked = keeper().ensureStake(50, PRIO);

        assertEquals(BigInteger.valueOf(10), staked);
        assertEquals(2L, chain.getSendCount());
        assertEquals(BigInteger.valueOf(990), chain.getAllowance(ACCOUNT, LIGHTHOUSE));
        assertEquals(50L, state().getQuota());
    }

    @Test
    public void empty_balance_leaves_stake_unchanged() {
        chain.registerProvider(ACCOUNT, 1);

        BigInteger staked = keeper().ensureStake(80, PRIO);

        assertEquals(BigInteger.ZERO, staked);
        assertEquals(0L, chain.getSendCount());
        assertEquals(BigInteger.valueOf(40), state().getProviderStake());
        verify(metrics, times(1)).stakeTopUp("no_balance");
    }

    @Test
    public void unconfirmed_refill_surfaces_as_timeout() {
        chain.registerProvider(ACCOUNT, 1);
        chain.creditTokens(ACCOUNT, BigInteger.valueOf(100));
        chain.setReceiptsWithheld(true);

        assertThrows(TransportTimeoutException.class, () -> keeper().ensureStake(60, PRIO));
        assertEquals(BigInteger.valueOf(40), state().getProviderStake());

        chain.setReceiptsWithheld(false);
        assertEquals(BigInteger.valueOf(60), state().getProviderStake());
    }
}
