package com.work.miner.domain;

import com.work.miner.chain.TxReceipt;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 一个调度周期。close 之后不可再修改。
 */
public class Round {

    private final int index;
    private final RoundMode mode;
    private final int batchSize;
    private final Instant startedAt;

    private final List<Liability> liabilities = new ArrayList<>();
    private final Map<LiabilityState, Integer> transitions = new EnumMap<>(LiabilityState.class);
    private final List<BigInteger> observedGasPrices = new ArrayList<>();

    private RoundStatus status = RoundStatus.OPEN;
    private RoundErrorKind errorKind = RoundErrorKind.NONE;
    private String message;
    private long gasUsed;
    private BigInteger gasCost = BigInteger.ZERO;
    private BigInteger minted = BigInteger.ZERO;
    private int transactionsSent;
    private int confirmationCycles;
    private Instant closedAt;

    public Round(int index, RoundMode mode, int batchSize, Instant startedAt) {
        this.index = index;
        this.mode = mode;
        this.batchSize = batchSize;
        this.startedAt = startedAt;
    }

    public synchronized void include(Liability liability) {
        requireOpen();
        if (!liabilities.contains(liability)) {
            liabilities.add(liability);
        }
    }

    public synchronized void recordReceipt(TxReceipt receipt) {
        requireOpen();
        gasUsed += receipt.getGasUsed();
        gasCost = gasCost.add(receipt.getGasCost());
        minted = minted.add(receipt.getMintedAmount());
        // 只有成功的 create/finalize 会推进权威 SMMA
        if (receipt.isSuccess()) {
            observedGasPrices.add(receipt.getEffectiveGasPrice());
        }
    }

    public synchronized void recordTransition(LiabilityState state) {
        requireOpen();
        transitions.merge(state, 1, Integer::sum);
    }

    /**
     * 一次 burst 广播 + 一次屏障等待。
     */
    public synchronized void recordBurst(int sent) {
        requireOpen();
        transactionsSent += sent;
        confirmationCycles++;
    }

    public synchronized void close(RoundStatus finalStatus, RoundErrorKind kind, String closeMessage, Instant now) {
        requireOpen();
        if (finalStatus == null || finalStatus == RoundStatus.OPEN) {
            throw new IllegalArgumentException("round must close with a final status");
        }
        this.status = finalStatus;
        this.errorKind = kind == null ? RoundErrorKind.NONE : kind;
        this.message = closeMessage;
        this.closedAt = now;
    }

    private void requireOpen() {
        if (status != RoundStatus.OPEN) {
            throw new IllegalStateException("round " + index + " already closed as " + status);
        }
    }

    public int getIndex() {
        return index;
    }

    public RoundMode getMode() {
        return mode;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getClosedAt() {
        return closedAt;
    }

    public synchronized boolean isClosed() {
        return status != RoundStatus.OPEN;
    }

    public synchronized List<Liability> getLiabilities() {
        return Collections.unmodifiableList(new ArrayList<>(liabilities));
    }

    public synchronized RoundStatus getStatus() {
        return status;
    }

    public synchronized RoundErrorKind getErrorKind() {
        return errorKind;
    }

    public synchronized String getMessage() {
        return message;
    }

    public synchronized long getGasUsed() {
        return gasUsed;
    }

    public synchronized BigInteger getGasCost() {
        return gasCost;
    }

    public synchronized BigInteger getMinted() {
        return minted;
    }

    public synchronized List<BigInteger> getObservedGasPrices() {
        return Collections.unmodifiableList(new ArrayList<>(observedGasPrices));
    }

    public synchronized int getTransactionsSent() {
        return transactionsSent;
    }

    public synchronized int getConfirmationCycles() {
        return confirmationCycles;
    }

    public synchronized int count(LiabilityState state) {
        return transitions.getOrDefault(state, 0);
    }

    public synchronized int getCreatedCount() {
        return count(LiabilityState.CREATED);
    }

    public synchronized int getFinalizedCount() {
        return count(LiabilityState.FINALIZED);
    }
}
