package com.work.miner.signer;

import java.math.BigInteger;
import java.util.Arrays;

import static com.work.miner.support.ValidationUtils.requireNonNegative;
import static com.work.miner.support.ValidationUtils.requireNonNull;

/**
 * demand 与 offer 共享的语义字段。
 */
public class LiabilityTerms {
    private final byte[] model;
    private final byte[] objective;
    private final String token;
    private final BigInteger cost;
    /**
     * 截止区块。
     */
    private final BigInteger deadline;

    public LiabilityTerms(byte[] model, byte[] objective, String token, BigInteger cost, BigInteger deadline) {
        this.model = Arrays.copyOf(requireNonNull(model, "model"), model.length);
        this.objective = Arrays.copyOf(requireNonNull(objective, "objective"), objective.length);
        this.token = requireNonNull(token, "token");
        this.cost = requireNonNegative(cost, "cost");
        this.deadline = requireNonNegative(deadline, "deadline");
    }

    public byte[] getModel() {
        return Arrays.copyOf(model, model.length);
    }

    public byte[] getObjective() {
        return Arrays.copyOf(objective, objective.length);
    }

    public String getToken() {
        return token;
    }

    public BigInteger getCost() {
        return cost;
    }

    public BigInteger getDeadline() {
        return deadline;
    }
}
