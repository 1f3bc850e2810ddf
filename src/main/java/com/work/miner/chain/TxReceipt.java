package com.work.miner.chain;

import java.math.BigInteger;

/**
 * 最小 receipt 表达：只保留编排与估算需要的字段。
 *
 * 在 EVM 语义中，只要 receipt 出现，该 nonce 就已被链消耗（无论 success=true/false）。
 */
public class TxReceipt {
    private final String txHash;
    private final long blockNumber;
    private final String blockHash;
    private final boolean success;
    private final long gasUsed;
    private final BigInteger effectiveGasPrice;
    /**
     * createLiability 的 NewLiability 事件地址；其他交易为 null。
     */
    private final String liabilityAddress;
    /**
     * finalizeLiability 触发的 Transfer 铸币总量（wn）。
     */
    private final BigInteger mintedAmount;

    public TxReceipt(String txHash, long blockNumber, String blockHash, boolean success, long gasUsed,
                     BigInteger effectiveGasPrice, String liabilityAddress, BigInteger mintedAmount) {
        this.txHash = txHash;
        this.blockNumber = blockNumber;
        this.blockHash = blockHash;
        this.success = success;
        this.gasUsed = gasUsed;
        this.effectiveGasPrice = effectiveGasPrice == null ? BigInteger.ZERO : effectiveGasPrice;
        this.liabilityAddress = liabilityAddress;
        this.mintedAmount = mintedAmount == null ? BigInteger.ZERO : mintedAmount;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public boolean isSuccess() {
        return success;
    }

    public long getGasUsed() {
        return gasUsed;
    }

    public BigInteger getEffectiveGasPrice() {
        return effectiveGasPrice;
    }

    public String getLiabilityAddress() {
        return liabilityAddress;
    }

    public BigInteger getMintedAmount() {
        return mintedAmount;
    }

    public BigInteger getGasCost() {
        return effectiveGasPrice.multiply(BigInteger.valueOf(gasUsed));
    }
}
