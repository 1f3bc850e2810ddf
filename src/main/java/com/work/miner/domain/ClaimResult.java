package com.work.miner.domain;

/**
 * marker claim 的结果：成功（Active），或在 retryAtBlock 之后再试。
 */
public class ClaimResult {
    private final MarkerState state;
    private final long retryAtBlock;
    private final String reason;

    private ClaimResult(MarkerState state, long retryAtBlock, String reason) {
        this.state = state;
        this.retryAtBlock = retryAtBlock;
        this.reason = reason;
    }

    public static ClaimResult active() {
        return new ClaimResult(MarkerState.ACTIVE, -1L, null);
    }

    public static ClaimResult retryLater(long retryAtBlock, String reason) {
        return new ClaimResult(MarkerState.WAITING_TIMEOUT, retryAtBlock, reason);
    }

    public static ClaimResult notOwner(String reason) {
        return new ClaimResult(MarkerState.NOT_OWNER, -1L, reason);
    }

    public boolean isActive() {
        return state == MarkerState.ACTIVE;
    }

    public MarkerState getState() {
        return state;
    }

    public long getRetryAtBlock() {
        return retryAtBlock;
    }

    public String getReason() {
        return reason;
    }
}
