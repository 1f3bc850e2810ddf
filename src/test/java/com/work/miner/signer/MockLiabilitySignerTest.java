package com.work.miner.signer;

import com.work.miner.exception.SignatureInvalidException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class MockLiabilitySignerTest {

    private static final String ACCOUNT = "0x00000000000000000000000000000000000000a1";
    private static final String LIGHTHOUSE = "0x00000000000000000000000000000000000000b1";
    private static final String VALIDATOR = "0x0000000000000000000000000000000000000000";
    private static final String TOKEN = "0x7de91b204c1c737bcee6f000aaa6569cf7061cb7";

    private static LiabilityTerms terms() {
        return new LiabilityTerms(new byte[34], new byte[34], TOKEN, BigInteger.ZERO, BigInteger.valueOf(500));
    }

    @Test
    public void demand_and_offer_pack_differently_for_same_terms() {
        LiabilityTerms t = terms();
        DemandFields demand = new DemandFields(t, LIGHTHOUSE, VALIDATOR, BigInteger.ZERO, BigInteger.ONE, ACCOUNT);
        OfferFields offer = new OfferFields(t, VALIDATOR, LIGHTHOUSE, BigInteger.ZERO, BigInteger.ONE, ACCOUNT);

        assertEquals(demand.packed().length, offer.packed().length);
        assertFalse(Arrays.equals(demand.packed(), offer.packed()));
    }

    @Test
    public void create_rejects_swapped_roles() {
        MockLiabilitySigner signer = new MockLiabilitySigner(ACCOUNT, LIGHTHOUSE);
        LiabilityTerms t = terms();
        SignedPayload demand = signer.signDemand(new DemandFields(t, LIGHTHOUSE, VALIDATOR, BigInteger.ZERO,
                BigInteger.ZERO, ACCOUNT));
        SignedPayload offer = signer.signOffer(new OfferFields(t, VALIDATOR, LIGHTHOUSE, BigInteger.ZERO,
                BigInteger.ONE, ACCOUNT));
        TxFees fees = TxFees.of(BigInteger.valueOf(1_000_000_000L), BigInteger.valueOf(200_000_000L));

        assertThrows(SignatureInvalidException.class, () -> signer.signCreate(0, offer, demand, fees));
        assertThrows(SignatureInvalidException.class, () -> signer.signCreate(0, demand, demand, fees));
        SignedTransaction tx = signer.signCreate(0, demand, offer, fees);
        assertEquals(0L, tx.getNonce());
        assertNotNull(tx.getTxHash());
    }

    @Test
    public void fees_floor_max_fee_at_one_gwei() {
        TxFees low = TxFees.of(BigInteger.valueOf(100), BigInteger.valueOf(50));
        TxFees normal = TxFees.of(BigInteger.valueOf(2_000_000_000L), BigInteger.valueOf(200_000_000L));

        assertEquals(BigInteger.valueOf(1_000_000_000L), low.getMaxFeePerGas());
        assertEquals(BigInteger.valueOf(50), low.getMaxPriorityFeePerGas());
        assertEquals(BigInteger.valueOf(2_200_000_000L), normal.getMaxFeePerGas());
    }
}
