package com.work.miner.chain;

import java.math.BigInteger;

/**
 * 链交互最小端口。
 *
 * 注意：这里只定义编排所需的能力；签名、ABI 构造由 signer 端口负责。
 * 所有方法在 RPC 失败时抛出 {@link com.work.miner.exception.TransportException}。
 */
public interface ChainConnector {

    /**
     * 查询 pending nonce（EVM: eth_getTransactionCount(pending)）。
     */
    long getPendingNonce(String account);

    /**
     * 已打包交易数（EVM: eth_getTransactionCount(latest)）。小于等于该值的 nonce 不会再被打包。
     */
    long getConfirmedNonce(String account);

    /**
     * 广播已签名交易，返回 txHash。不等待打包。
     */
    String sendRawTransaction(String signedTransaction);

    /**
     * 查询交易 receipt。返回 null 表示 NotFound（尚未打包）。
     */
    TxReceipt getTransactionReceipt(String txHash);

    long getLatestBlockNumber();

    /**
     * 当前 base gas price（wei）。
     */
    BigInteger getGasPrice();

    /**
     * factory 上权威的 SMMA 值（wei）。
     */
    BigInteger getAuthoritativeSmma();

    /**
     * 读取 lighthouse 当前状态快照；provider 用于查询本账户的索引与质押。
     */
    LighthouseState getLighthouseState(String lighthouse, String provider);

    BigInteger getTokenBalance(String account);

    /**
     * token.allowance(owner, spender)。
     */
    BigInteger getAllowance(String owner, String spender);

    /**
     * factory 为 demand/offer 消息维护的 nonce（nonceOf），与交易 nonce 无关。
     */
    BigInteger getMessageNonce(String account);
}
