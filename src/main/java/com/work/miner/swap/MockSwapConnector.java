package com.work.miner.swap;

import com.work.miner.exception.SlippageExceededException;
import com.work.miner.exception.TransportException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * 内存 AMM：固定报价（每 wn 的 wei），可注入成交偏移与传输失败。
 */
public class MockSwapConnector implements SwapConnector {

    private BigDecimal pricePerUnit;
    private double executionImpact;
    private int failNextSwaps;
    private long swapCount;

    public MockSwapConnector(BigDecimal pricePerUnit) {
        this.pricePerUnit = pricePerUnit;
    }

    @Override
    public synchronized BigInteger quote(BigInteger amountIn) {
        return new BigDecimal(amountIn).multiply(pricePerUnit).setScale(0, RoundingMode.DOWN).toBigInteger();
    }

    @Override
    public synchronized BigInteger swap(BigInteger amountIn, double slippageTolerance, Duration deadline) {
        swapCount++;
        if (failNextSwaps > 0) {
            failNextSwaps--;
            throw new TransportException("mock swap transport failure");
        }
        BigInteger quoted = quote(amountIn);
        BigInteger minOut = new BigDecimal(quoted).multiply(BigDecimal.valueOf(1.0 - slippageTolerance))
                .setScale(0, RoundingMode.DOWN).toBigInteger();
        BigInteger out = new BigDecimal(quoted).multiply(BigDecimal.valueOf(1.0 - executionImpact))
                .setScale(0, RoundingMode.DOWN).toBigInteger();
        if (out.compareTo(minOut) < 0) {
            throw new SlippageExceededException("output " + out + " below minimum " + minOut);
        }
        return out;
    }

    public synchronized void setPricePerUnit(BigDecimal pricePerUnit) {
        this.pricePerUnit = pricePerUnit;
    }

    /**
     * 实际成交相对报价的偏移比例，例如 0.1 表示少 10%。
     */
    public synchronized void setExecutionImpact(double executionImpact) {
        this.executionImpact = executionImpact;
    }

    public synchronized void failNextSwaps(int count) {
        this.failNextSwaps = count;
    }

    public synchronized long getSwapCount() {
        return swapCount;
    }
}
