package com.work.miner.service.phase;

import com.work.miner.domain.MarkerState;
import com.work.miner.domain.Phase;
import com.work.miner.domain.PhaseConfig;

import java.math.BigInteger;

/**
 * 编排器状态快照。lighthouse 相关字段在生成快照时读取，读取失败时为 null。
 */
public class ControllerStatus {
    private Phase phase;
    private PhaseConfig config;
    private boolean awaitingOperator;
    private boolean targetReached;
    private String lastDecision;
    private int unprofitableStreak;
    private int errorStreak;

    private long totalRounds;
    private long totalCreated;
    private long totalFinalized;
    private BigInteger totalGasCost;
    private BigInteger totalMinted;
    private int openLiabilities;

    private MarkerState markerState;
    private Long marker;
    private Long quota;
    private Long keepAliveBlock;
    private Long providerIndex;
    private BigInteger providerStake;
    private BigInteger requiredStake;
    private BigInteger tokenBalance;
    private BigInteger unsoldBalance;
    private int sales;

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }

    public PhaseConfig getConfig() {
        return config;
    }

    public void setConfig(PhaseConfig config) {
        this.config = config;
    }

    public boolean isAwaitingOperator() {
        return awaitingOperator;
    }

    public void setAwaitingOperator(boolean awaitingOperator) {
        this.awaitingOperator = awaitingOperator;
    }

    public boolean isTargetReached() {
        return targetReached;
    }

    public void setTargetReached(boolean targetReached) {
        this.targetReached = targetReached;
    }

    public String getLastDecision() {
        return lastDecision;
    }

    public void setLastDecision(String lastDecision) {
        this.lastDecision = lastDecision;
    }

    public int getUnprofitableStreak() {
        return unprofitableStreak;
    }

    public void setUnprofitableStreak(int unprofitableStreak) {
        this.unprofitableStreak = unprofitableStreak;
    }

    public int getErrorStreak() {
        return errorStreak;
    }

    public void setErrorStreak(int errorStreak) {
        this.errorStreak = errorStreak;
    }

    public long getTotalRounds() {
        return totalRounds;
    }

    public void setTotalRounds(long totalRounds) {
        this.totalRounds = totalRounds;
    }

    public long getTotalCreated() {
        return totalCreated;
    }

    public void setTotalCreated(long totalCreated) {
        this.totalCreated = totalCreated;
    }

    public long getTotalFinalized() {
        return totalFinalized;
    }

    public void setTotalFinalized(long totalFinalized) {
        this.totalFinalized = totalFinalized;
    }

    public BigInteger getTotalGasCost() {
        return totalGasCost;
    }

    public void setTotalGasCost(BigInteger totalGasCost) {
        this.totalGasCost = totalGasCost;
    }

    public BigInteger getTotalMinted() {
        return totalMinted;
    }

    public void setTotalMinted(BigInteger totalMinted) {
        this.totalMinted = totalMinted;
    }

    public int getOpenLiabilities() {
        return openLiabilities;
    }

    public void setOpenLiabilities(int openLiabilities) {
        this.openLiabilities = openLiabilities;
    }

    public MarkerState getMarkerState() {
        return markerState;
    }

    public void setMarkerState(MarkerState markerState) {
        this.markerState = markerState;
    }

    public Long getMarker() {
        return marker;
    }

    public void setMarker(Long marker) {
        this.marker = marker;
    }

    public Long getQuota() {
        return quota;
    }

    public void setQuota(Long quota) {
        this.quota = quota;
    }

    public Long getKeepAliveBlock() {
        return keepAliveBlock;
    }

    public void setKeepAliveBlock(Long keepAliveBlock) {
        this.keepAliveBlock = keepAliveBlock;
    }

    public Long getProviderIndex() {
        return providerIndex;
    }

    public void setProviderIndex(Long providerIndex) {
        this.providerIndex = providerIndex;
    }

    public BigInteger getProviderStake() {
        return providerStake;
    }

    public void setProviderStake(BigInteger providerStake) {
        this.providerStake = providerStake;
    }

    public BigInteger getRequiredStake() {
        return requiredStake;
    }

    public void setRequiredStake(BigInteger requiredStake) {
        this.requiredStake = requiredStake;
    }

    public BigInteger getTokenBalance() {
        return tokenBalance;
    }

    public void setTokenBalance(BigInteger tokenBalance) {
        this.tokenBalance = tokenBalance;
    }

    public BigInteger getUnsoldBalance() {
        return unsoldBalance;
    }

    public void setUnsoldBalance(BigInteger unsoldBalance) {
        this.unsoldBalance = unsoldBalance;
    }

    public int getSales() {
        return sales;
    }

    public void setSales(int sales) {
        this.sales = sales;
    }
}
