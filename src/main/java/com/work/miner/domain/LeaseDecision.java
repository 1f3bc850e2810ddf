package com.work.miner.domain;

import java.time.Instant;

public class LeaseDecision {
    private final String account;
    private final String owner;
    private final boolean leader;
    private final long fencingToken;
    private final Instant expiresAt;

    public LeaseDecision(String account, String owner, boolean leader, long fencingToken, Instant expiresAt) {
        this.account = account;
        this.owner = owner;
        this.leader = leader;
        this.fencingToken = fencingToken;
        this.expiresAt = expiresAt;
    }

    public String getAccount() {
        return account;
    }

    public String getOwner() {
        return owner;
    }

    public boolean isLeader() {
        return leader;
    }

    public long getFencingToken() {
        return fencingToken;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
