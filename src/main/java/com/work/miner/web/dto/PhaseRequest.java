package com.work.miner.web.dto;

import com.work.miner.domain.Phase;

import javax.validation.constraints.NotNull;

public class PhaseRequest {

    /** 目标阶段，只能前进。 */
    @NotNull(message = "phase 不能为空")
    private Phase phase;

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }
}
