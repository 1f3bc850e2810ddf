package com.work.miner.web.dto;

import com.work.miner.domain.Round;
import com.work.miner.domain.RoundErrorKind;
import com.work.miner.domain.RoundMode;
import com.work.miner.domain.RoundStatus;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 已关闭轮次的对外视图。
 */
public class RoundView {
    private int index;
    private RoundMode mode;
    private int batchSize;
    private RoundStatus status;
    private RoundErrorKind errorKind;
    private String message;
    private int liabilities;
    private int created;
    private int finalized;
    private int transactionsSent;
    private int confirmationCycles;
    private long gasUsed;
    private BigInteger gasCost;
    private BigInteger minted;
    private Instant startedAt;
    private Instant closedAt;

    public static RoundView of(Round r) {
        RoundView v = new RoundView();
        v.setIndex(r.getIndex());
        v.setMode(r.getMode());
        v.setBatchSize(r.getBatchSize());
        v.setStatus(r.getStatus());
        v.setErrorKind(r.getErrorKind());
        v.setMessage(r.getMessage());
        v.setLiabilities(r.getLiabilities().size());
        v.setCreated(r.getCreatedCount());
        v.setFinalized(r.getFinalizedCount());
        v.setTransactionsSent(r.getTransactionsSent());
        v.setConfirmationCycles(r.getConfirmationCycles());
        v.setGasUsed(r.getGasUsed());
        v.setGasCost(r.getGasCost());
        v.setMinted(r.getMinted());
        v.setStartedAt(r.getStartedAt());
        v.setClosedAt(r.getClosedAt());
        return v;
    }

    public int getIndex() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    public RoundMode getMode() {
        return mode;
    }

    public void setMode(RoundMode mode) {
        this.mode = mode;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public RoundStatus getStatus() {
        return status;
    }

    public void setStatus(RoundStatus status) {
        this.status = status;
    }

    public RoundErrorKind getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(RoundErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public int getLiabilities() {
        return liabilities;
    }

    public void setLiabilities(int liabilities) {
        this.liabilities = liabilities;
    }

    public int getCreated() {
        return created;
    }

    public void setCreated(int created) {
        this.created = created;
    }

    public int getFinalized() {
        return finalized;
    }

    public void setFinalized(int finalized) {
        this.finalized = finalized;
    }

    public int getTransactionsSent() {
        return transactionsSent;
    }

    public void setTransactionsSent(int transactionsSent) {
        this.transactionsSent = transactionsSent;
    }

    public int getConfirmationCycles() {
        return confirmationCycles;
    }

    public void setConfirmationCycles(int confirmationCycles) {
        this.confirmationCycles = confirmationCycles;
    }

    public long getGasUsed() {
        return gasUsed;
    }

    public void setGasUsed(long gasUsed) {
        this.gasUsed = gasUsed;
    }

    public BigInteger getGasCost() {
        return gasCost;
    }

    public void setGasCost(BigInteger gasCost) {
        this.gasCost = gasCost;
    }

    public BigInteger getMinted() {
        return minted;
    }

    public void setMinted(BigInteger minted) {
        this.minted = minted;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(Instant closedAt) {
        this.closedAt = closedAt;
    }
}
