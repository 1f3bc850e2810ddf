package com.work.miner.service.phase;

import com.work.miner.domain.RoundMode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class BatchBackoffPolicyTest {

    @Test
    public void steps_through_sequence_then_halves() {
        BatchBackoffPolicy p = new BatchBackoffPolicy(Arrays.asList(5, 56, 10, 20, 10));

        assertEquals(Arrays.asList(56, 20, 10, 5), p.getSequence());
        assertEquals(20, p.stepDown(56));
        assertEquals(20, p.stepDown(40));
        assertEquals(5, p.stepDown(10));
        assertEquals(2, p.stepDown(5));
        assertEquals(0, p.stepDown(1));
    }

    @Test
    public void fit_to_quota_halves_for_pipeline() {
        BatchBackoffPolicy p = new BatchBackoffPolicy(Arrays.asList(56, 20));

        assertEquals(10, p.fitToQuota(20, RoundMode.PIPELINE));
        assertEquals(20, p.fitToQuota(20, RoundMode.BATCH));
        assertEquals(0, p.fitToQuota(1, RoundMode.PIPELINE));
    }
}
