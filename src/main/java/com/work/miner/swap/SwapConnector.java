package com.work.miner.swap;

import java.math.BigInteger;
import java.time.Duration;

/**
 * AMM 兑换端口：把挖出的 token 换成原生币。
 *
 * RPC 失败抛出 {@link com.work.miner.exception.TransportException}。
 */
public interface SwapConnector {

    /**
     * 按当前池子状态估算 amountIn 可换得的原生币（wei），不发生交易。
     */
    BigInteger quote(BigInteger amountIn);

    /**
     * 以 minOut = quote × (1 - slippageTolerance) 为下限执行兑换，返回实际所得。
     * 低于下限时抛出 {@link com.work.miner.exception.SlippageExceededException}。
     */
    BigInteger swap(BigInteger amountIn, double slippageTolerance, Duration deadline);
}
