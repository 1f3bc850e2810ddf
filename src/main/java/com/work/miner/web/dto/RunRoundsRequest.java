package com.work.miner.web.dto;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;

/**
 * 连续执行 N 轮。
 */
public class RunRoundsRequest {

    @Min(value = 1, message = "rounds 至少为 1")
    @Max(value = 1000, message = "rounds 不能超过 1000")
    private int rounds = 1;

    public int getRounds() {
        return rounds;
    }

    public void setRounds(int rounds) {
        this.rounds = rounds;
    }
}
