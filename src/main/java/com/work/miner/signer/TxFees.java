package com.work.miner.signer;

import java.math.BigInteger;

/**
 * EIP-1559 费用参数。
 */
public class TxFees {

    private static final BigInteger MIN_MAX_FEE = BigInteger.valueOf(1_000_000_000L);

    private final BigInteger maxFeePerGas;
    private final BigInteger maxPriorityFeePerGas;

    public TxFees(BigInteger maxFeePerGas, BigInteger maxPriorityFeePerGas) {
        this.maxFeePerGas = maxFeePerGas;
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
    }

    /**
     * maxFee = max(base + priority, 1 gwei)，priority 不超过 maxFee。
     */
    public static TxFees of(BigInteger baseFee, BigInteger priorityFee) {
        BigInteger maxFee = baseFee.add(priorityFee).max(MIN_MAX_FEE);
        return new TxFees(maxFee, priorityFee.min(maxFee));
    }

    public BigInteger getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public BigInteger getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }
}
