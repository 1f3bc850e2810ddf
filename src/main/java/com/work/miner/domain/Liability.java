package com.work.miner.domain;

import com.work.miner.signer.SignedPayload;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一对 demand/offer 及其 create/finalize 生命周期。
 *
 * 状态只前进；每个终态都带记录原因。未决的 txHash 在下一轮开始时对账，
 * 被替换的 create/finalize txHash 分别保留，以便识别迟到的打包。
 */
public class Liability {

    private final String id;
    private final int originRound;
    private LiabilityState state = LiabilityState.PENDING;

    private SignedPayload demand;
    private SignedPayload offer;
    private byte[] resultData;
    private byte[] resultSignature;

    private String address;
    private String createTxHash;
    private String finalizeTxHash;
    private final List<String> staleCreateTxHashes = new ArrayList<>();
    private final List<String> staleFinalizeTxHashes = new ArrayList<>();
    private long inFlightNonce = -1;

    private long gasUsed;
    private BigInteger gasCost = BigInteger.ZERO;
    private BigInteger minted = BigInteger.ZERO;
    private String reason;
    private int attempts;

    public Liability(String id, int originRound) {
        this.id = id;
        this.originRound = originRound;
    }

    public synchronized void attachPayloads(SignedPayload demand, SignedPayload offer) {
        requireState(LiabilityState.PENDING, "attach payloads");
        this.demand = demand;
        this.offer = offer;
    }

    public synchronized void attachResultData(byte[] resultData) {
        requireState(LiabilityState.CREATED, "attach result");
        this.resultData = resultData;
    }

    public synchronized void attachResultSignature(byte[] signature) {
        requireState(LiabilityState.CREATED, "attach result signature");
        this.resultSignature = signature;
    }

    /**
     * 记录已广播（尚未打包）的 create 交易及其 nonce。
     */
    public synchronized void createSent(String txHash, long nonce) {
        requireState(LiabilityState.PENDING, "send create");
        retire(staleCreateTxHashes, createTxHash);
        this.createTxHash = txHash;
        this.inFlightNonce = nonce;
        this.attempts++;
    }

    public synchronized void finalizeSent(String txHash, long nonce) {
        requireState(LiabilityState.CREATED, "send finalize");
        retire(staleFinalizeTxHashes, finalizeTxHash);
        this.finalizeTxHash = txHash;
        this.inFlightNonce = nonce;
        this.attempts++;
    }

    /**
     * 在途交易确认已失效（广播失败，或其 nonce 已被其他交易消耗）：保留原状态，等待以新 nonce 重发。
     */
    public synchronized void clearUnresolvedTx() {
        if (state == LiabilityState.PENDING) {
            retire(staleCreateTxHashes, createTxHash);
            createTxHash = null;
        } else if (state == LiabilityState.CREATED) {
            retire(staleFinalizeTxHashes, finalizeTxHash);
            finalizeTxHash = null;
        }
        inFlightNonce = -1;
    }

    /**
     * 计入不改变状态的链上花费（例如被迟到打包的旧交易取代的 revert）。
     */
    public synchronized void recordSpend(long gas, BigInteger cost) {
        addGas(gas, cost);
    }

    public synchronized void markCreated(String address, long gas, BigInteger cost) {
        transition(LiabilityState.CREATED);
        this.address = address;
        addGas(gas, cost);
    }

    public synchronized void markFinalized(long gas, BigInteger cost, BigInteger mintedAmount) {
        transition(LiabilityState.FINALIZED);
        addGas(gas, cost);
        this.minted = mintedAmount == null ? BigInteger.ZERO : mintedAmount;
        this.reason = "finalized";
    }

    public synchronized void markFailed(String reason, long gas, BigInteger cost) {
        transition(LiabilityState.FAILED);
        addGas(gas, cost);
        this.reason = reason;
    }

    public synchronized void markAbandoned(String reason) {
        transition(LiabilityState.ABANDONED);
        this.reason = reason;
    }

    private void transition(LiabilityState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("liability " + id + " cannot move " + state + " -> " + next);
        }
        this.state = next;
        this.inFlightNonce = -1;
    }

    private void requireState(LiabilityState expected, String action) {
        if (state != expected) {
            throw new IllegalStateException("liability " + id + " in " + state + " cannot " + action);
        }
    }

    private static void retire(List<String> stale, String txHash) {
        if (txHash != null) {
            stale.add(txHash);
        }
    }

    private void addGas(long gas, BigInteger cost) {
        this.gasUsed += gas;
        if (cost != null) {
            this.gasCost = this.gasCost.add(cost);
        }
    }

    /**
     * 当前状态下待确认的交易（PENDING 看 create，CREATED 看 finalize）。
     */
    public synchronized String getInFlightTxHash() {
        if (state == LiabilityState.PENDING) {
            return createTxHash;
        }
        if (state == LiabilityState.CREATED) {
            return finalizeTxHash;
        }
        return null;
    }

    /**
     * 在途交易的 nonce；没有在途交易时为 -1。
     */
    public synchronized long getInFlightNonce() {
        return getInFlightTxHash() == null ? -1 : inFlightNonce;
    }

    public String getId() {
        return id;
    }

    public int getOriginRound() {
        return originRound;
    }

    public synchronized LiabilityState getState() {
        return state;
    }

    public synchronized SignedPayload getDemand() {
        return demand;
    }

    public synchronized SignedPayload getOffer() {
        return offer;
    }

    public synchronized byte[] getResultData() {
        return resultData;
    }

    public synchronized byte[] getResultSignature() {
        return resultSignature;
    }

    public synchronized String getAddress() {
        return address;
    }

    public synchronized String getCreateTxHash() {
        return createTxHash;
    }

    public synchronized String getFinalizeTxHash() {
        return finalizeTxHash;
    }

    /**
     * 当前阶段被替换的旧交易（PENDING 看 create，CREATED 看 finalize）。
     */
    public synchronized List<String> getStaleTxHashes() {
        List<String> stale;
        if (state == LiabilityState.PENDING) {
            stale = staleCreateTxHashes;
        } else if (state == LiabilityState.CREATED) {
            stale = staleFinalizeTxHashes;
        } else {
            stale = Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(stale));
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

    public synchronized String getReason() {
        return reason;
    }

    public synchronized int getAttempts() {
        return attempts;
    }
}
