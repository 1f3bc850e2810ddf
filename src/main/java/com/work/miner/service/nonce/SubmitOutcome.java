package com.work.miner.service.nonce;

import com.work.miner.chain.TxReceipt;

/**
 * burst 中单笔交易在屏障等待后的结果。
 */
public class SubmitOutcome {

    public enum Status {
        /**
         * 已打包（receipt 可能是 success=false 的 revert）。
         */
        INCLUDED,
        /**
         * 已广播，但屏障超时前未见 receipt。
         */
        PENDING,
        /**
         * 广播失败，nonce 未被链消耗。
         */
        TRANSPORT_FAILED
    }

    private final Status status;
    private final long nonce;
    private final String txHash;
    private final TxReceipt receipt;
    private final String error;

    private SubmitOutcome(Status status, long nonce, String txHash, TxReceipt receipt, String error) {
        this.status = status;
        this.nonce = nonce;
        this.txHash = txHash;
        this.receipt = receipt;
        this.error = error;
    }

    public static SubmitOutcome included(long nonce, String txHash, TxReceipt receipt) {
        return new SubmitOutcome(Status.INCLUDED, nonce, txHash, receipt, null);
    }

    public static SubmitOutcome pending(long nonce, String txHash) {
        return new SubmitOutcome(Status.PENDING, nonce, txHash, null, null);
    }

    public static SubmitOutcome transportFailed(long nonce, String error) {
        return new SubmitOutcome(Status.TRANSPORT_FAILED, nonce, null, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public long getNonce() {
        return nonce;
    }

    public String getTxHash() {
        return txHash;
    }

    public TxReceipt getReceipt() {
        return receipt;
    }

    public String getError() {
        return error;
    }

    public boolean isIncluded() {
        return status == Status.INCLUDED;
    }

    public boolean isSuccess() {
        return status == Status.INCLUDED && receipt.isSuccess();
    }
}
