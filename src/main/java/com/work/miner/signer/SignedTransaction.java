package com.work.miner.signer;

/**
 * 已签名、可直接广播的交易。txHash 在本地由签名字节计算得出。
 */
public class SignedTransaction {
    private final long nonce;
    private final String rawTransaction;
    private final String txHash;

    public SignedTransaction(long nonce, String rawTransaction, String txHash) {
        this.nonce = nonce;
        this.rawTransaction = rawTransaction;
        this.txHash = txHash;
    }

    public long getNonce() {
        return nonce;
    }

    public String getRawTransaction() {
        return rawTransaction;
    }

    public String getTxHash() {
        return txHash;
    }
}
