package com.work.miner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

/**
 * 链连接配置。
 *
 * mode=mock: 使用 MockChainConnector / MockLiabilitySigner / MockSwapConnector
 * mode=web3j: 使用 Web3jChainConnector / Web3jLiabilitySigner / Web3jSwapConnector
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    private Duration requestTimeout = Duration.ofSeconds(10);

    private long chainId = 1;

    /**
     * 签名私钥（hex）。仅 web3j 模式使用，不要写入配置文件，通过环境变量注入。
     */
    private String privateKey;

    /**
     * liability factory 合约地址（gasPrice/nonceOf/NewLiability）。
     */
    private String factory = "0x7e384ad1fe06747594a6102ee5b377b273dc1225";

    /**
     * 出块间隔，用于估算 marker 超时的等待时长。
     */
    private Duration blockTime = Duration.ofSeconds(12);

    private BigInteger createGasLimit = BigInteger.valueOf(1_500_000L);

    private BigInteger finalizeGasLimit = BigInteger.valueOf(400_000L);

    /**
     * lighthouse.refill 的 gas limit（质押补足）。
     */
    private BigInteger refillGasLimit = BigInteger.valueOf(200_000L);

    /**
     * Uniswap V2 router 与 WETH，用于 token 报价与出售。
     */
    private String router = "0x7a250d5630b4cf539739df2c5dacb4c659f2488d";

    private String weth = "0xc02aaa39b223fe8d0a5e3c73cc6fbe8f3b1ac04c";

    private BigInteger approveGasLimit = BigInteger.valueOf(60_000L);

    private BigInteger swapGasLimit = BigInteger.valueOf(200_000L);

    /** 出售交易的 priority fee（wei） */
    private BigInteger swapPriorityFee = BigInteger.valueOf(1_000_000_000L);

    private final Mock mock = new Mock();

    /**
     * mock 链的初始状态。
     */
    public static class Mock {
        private long quota = 40;
        private long timeoutBlocks = 1;
        private BigInteger baseFee = BigInteger.valueOf(1_000_000_000L);
        private BigInteger initialSmma = BigInteger.valueOf(1_030_000_000L);
        /**
         * mock AMM 报价：每 wn 的 wei。
         */
        private BigDecimal swapPrice = BigDecimal.valueOf(1_000_000L);

        public long getQuota() {
            return quota;
        }

        public void setQuota(long quota) {
            this.quota = quota;
        }

        public long getTimeoutBlocks() {
            return timeoutBlocks;
        }

        public void setTimeoutBlocks(long timeoutBlocks) {
            this.timeoutBlocks = timeoutBlocks;
        }

        public BigInteger getBaseFee() {
            return baseFee;
        }

        public void setBaseFee(BigInteger baseFee) {
            this.baseFee = baseFee;
        }

        public BigInteger getInitialSmma() {
            return initialSmma;
        }

        public void setInitialSmma(BigInteger initialSmma) {
            this.initialSmma = initialSmma;
        }

        public BigDecimal getSwapPrice() {
            return swapPrice;
        }

        public void setSwapPrice(BigDecimal swapPrice) {
            this.swapPrice = swapPrice;
        }
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public String getFactory() {
        return factory;
    }

    public void setFactory(String factory) {
        this.factory = factory;
    }

    public Duration getBlockTime() {
        return blockTime;
    }

    public void setBlockTime(Duration blockTime) {
        this.blockTime = blockTime;
    }

    public BigInteger getCreateGasLimit() {
        return createGasLimit;
    }

    public void setCreateGasLimit(BigInteger createGasLimit) {
        this.createGasLimit = createGasLimit;
    }

    public BigInteger getFinalizeGasLimit() {
        return finalizeGasLimit;
    }

    public void setFinalizeGasLimit(BigInteger finalizeGasLimit) {
        this.finalizeGasLimit = finalizeGasLimit;
    }

    public BigInteger getRefillGasLimit() {
        return refillGasLimit;
    }

    public void setRefillGasLimit(BigInteger refillGasLimit) {
        this.refillGasLimit = refillGasLimit;
    }

    public String getRouter() {
        return router;
    }

    public void setRouter(String router) {
        this.router = router;
    }

    public String getWeth() {
        return weth;
    }

    public void setWeth(String weth) {
        this.weth = weth;
    }

    public BigInteger getApproveGasLimit() {
        return approveGasLimit;
    }

    public void setApproveGasLimit(BigInteger approveGasLimit) {
        this.approveGasLimit = approveGasLimit;
    }

    public BigInteger getSwapGasLimit() {
        return swapGasLimit;
    }

    public void setSwapGasLimit(BigInteger swapGasLimit) {
        this.swapGasLimit = swapGasLimit;
    }

    public BigInteger getSwapPriorityFee() {
        return swapPriorityFee;
    }

    public void setSwapPriorityFee(BigInteger swapPriorityFee) {
        this.swapPriorityFee = swapPriorityFee;
    }

    public Mock getMock() {
        return mock;
    }
}
