package com.work.miner.web;

import com.work.miner.domain.Phase;
import com.work.miner.domain.PhaseConfig;
import com.work.miner.domain.Round;
import com.work.miner.domain.RoundErrorKind;
import com.work.miner.domain.RoundMode;
import com.work.miner.domain.RoundStatus;
import com.work.miner.exception.MarkerNotOwnedException;
import com.work.miner.exception.TransportException;
import com.work.miner.service.liquidation.SaleEventLog;
import com.work.miner.service.phase.PhaseController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class MinerControllerTest {

    private PhaseController controller;
    private SaleEventLog saleLog;
    private MockMvc mvc;

    @BeforeEach
    public void setUp() {
        controller = mock(PhaseController.class);
        saleLog = new SaleEventLog();
        mvc = MockMvcBuilders.standaloneSetup(new MinerController(controller, saleLog)).build();
    }

    private static Round completed(int index) {
        Round r = new Round(index, RoundMode.PIPELINE, 10, Instant.now());
        r.close(RoundStatus.COMPLETED, RoundErrorKind.NONE, null, Instant.now());
        return r;
    }

    @Test
    public void run_one_round_returns_view() throws Exception {
        when(controller.runOneRound()).thenReturn(completed(3));

        mvc.perform(post("/api/v1/miner/rounds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.index").value(3))
                .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    public void inactive_phase_maps_to_conflict() throws Exception {
        when(controller.runOneRound()).thenThrow(new IllegalStateException("phase IDLE does not run rounds"));

        mvc.perform(post("/api/v1/miner/rounds")).andExpect(status().isConflict());
    }

    @Test
    public void non_retryable_miner_error_maps_to_conflict() throws Exception {
        when(controller.runOneRound()).thenThrow(new MarkerNotOwnedException("no stake"));

        mvc.perform(post("/api/v1/miner/rounds")).andExpect(status().isConflict());
    }

    @Test
    public void transport_error_maps_to_service_unavailable() throws Exception {
        when(controller.status()).thenThrow(new TransportException("rpc down"));

        mvc.perform(get("/api/v1/miner/status")).andExpect(status().isServiceUnavailable());
    }

    @Test
    public void batch_rounds_validates_count() throws Exception {
        mvc.perform(post("/api/v1/miner/rounds/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rounds\":0}"))
                .andExpect(status().isBadRequest());
        verify(controller, never()).runRounds(anyInt());

        when(controller.runRounds(eq(2))).thenReturn(Arrays.asList(completed(1), completed(2)));
        mvc.perform(post("/api/v1/miner/rounds/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rounds\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    public void force_phase_delegates_to_controller() throws Exception {
        when(controller.forcePhase(eq(Phase.MINING))).thenReturn(PhaseConfig.idle().withPhase(Phase.MINING));

        mvc.perform(post("/api/v1/miner/phase")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phase\":\"MINING\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("MINING"));
        verify(controller, times(1)).forcePhase(eq(Phase.MINING));
    }

    @Test
    public void sales_lists_log() throws Exception {
        saleLog.append(BigInteger.valueOf(1000), BigInteger.valueOf(3000), 0.05, BigInteger.ZERO, Instant.now());

        mvc.perform(get("/api/v1/miner/sales"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].amount").value(1000));
    }
}
