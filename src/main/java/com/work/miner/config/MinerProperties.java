package com.work.miner.config;

import com.work.miner.domain.RoundMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 编排器配置项。金额单位：gas 价格与预算为 wei，token 数量为 wn（1 XRT = 1e9 wn）。
 */
@ConfigurationProperties(prefix = "miner")
public class MinerProperties {

    /**
     * 发送交易的账户（promisee/promisor）。
     */
    private String account = "0x00000000000000000000000000000000000000a1";

    private String lighthouse = "0x00000000000000000000000000000000000000b1";

    private String validator = "0x0000000000000000000000000000000000000000";

    private String token = "0x7de91b204c1c737bcee6f000aaa6569cf7061cb7";

    /**
     * 账户租约时长：同一账户同一时刻只允许一个持有者分配 nonce。
     */
    private Duration leaseDuration = Duration.ofSeconds(30);

    /**
     * 屏障等待的总时长上限，超时的交易视为 Pending。
     */
    private Duration confirmationTimeout = Duration.ofSeconds(300);

    private Duration confirmationPollInterval = Duration.ofSeconds(2);

    /**
     * demand/offer 截止区块 = 当前区块 + deadlineBlocks。
     */
    private long deadlineBlocks = 300;

    private int smmaPeriod = 1000;

    /**
     * 估算器最大陈旧时长，超过后在下一次决策前 resync。
     */
    private Duration resyncMaxAge = Duration.ofSeconds(60);

    /**
     * 自上次 resync 起本地观测到的最大更新次数。
     */
    private int resyncMaxObservations = 100;

    /**
     * wnFromGas 中的拍卖终价常量。
     */
    private BigInteger auctionFinalPrice = new BigInteger("1000000000000000");

    /**
     * 单个 liability（create + finalize）的 gas 估计，在没有观测值时使用。
     */
    private long gasPerLiability = 1_058_000L;

    /**
     * margin 不超过该值视为 Marginal。
     */
    private double marginalBand = 0.10;

    /**
     * 单个 liability 的最大 gas 成本（wei），0 表示不限制。
     */
    private BigInteger maxCostPerLiability = BigInteger.ZERO;

    /**
     * Mining 阶段连续 Unprofitable 轮数上限（K）。
     */
    private int unprofitableRoundsLimit = 3;

    /**
     * 连续轮次级错误上限，超过后终止。
     */
    private int maxConsecutiveRoundErrors = 10;

    /**
     * 传输失败后的 batch 递减序列，序列之下按减半继续。
     */
    private List<Integer> backoffSequence = new ArrayList<>(Arrays.asList(56, 20, 10, 5));

    private BigInteger liquidationThreshold = new BigInteger("1000000000000");

    private double liquidationSlippage = 0.05;

    private Duration liquidationDeadline = Duration.ofMinutes(5);

    /**
     * 内存中保留的最近轮次数。
     */
    private int historySize = 200;

    /**
     * 每轮开始前按本轮所需操作数补足 lighthouse 质押（以 token 余额为上限）。
     */
    private boolean stakeTopUpEnabled = true;

    private boolean autoRunEnabled = false;

    private long autoRunIntervalMs = 15_000L;

    private PhaseSettings pump = PhaseSettings.of(RoundMode.PIPELINE, new BigInteger("10000000000"), 0,
            new BigInteger("1000000000000000000"), new BigInteger("4000000000"));

    private PhaseSettings mine = PhaseSettings.of(RoundMode.PIPELINE, new BigInteger("200000000"), 10,
            new BigInteger("1000000000000000000"), new BigInteger("674000000"));

    public static class PhaseSettings {

        private RoundMode mode = RoundMode.PIPELINE;

        private BigInteger priorityFee = BigInteger.ZERO;

        /**
         * 0 表示按 quota 允许的最大值取（pipeline 为 quota/2）。
         */
        private int batchSize;

        private BigInteger budget = BigInteger.ZERO;

        private BigInteger smmaTarget = BigInteger.ZERO;

        static PhaseSettings of(RoundMode mode, BigInteger priorityFee, int batchSize, BigInteger budget,
                                BigInteger smmaTarget) {
            PhaseSettings s = new PhaseSettings();
            s.setMode(mode);
            s.setPriorityFee(priorityFee);
            s.setBatchSize(batchSize);
            s.setBudget(budget);
            s.setSmmaTarget(smmaTarget);
            return s;
        }

        public RoundMode getMode() {
            return mode;
        }

        public void setMode(RoundMode mode) {
            this.mode = mode;
        }

        public BigInteger getPriorityFee() {
            return priorityFee;
        }

        public void setPriorityFee(BigInteger priorityFee) {
            this.priorityFee = priorityFee;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public BigInteger getBudget() {
            return budget;
        }

        public void setBudget(BigInteger budget) {
            this.budget = budget;
        }

        public BigInteger getSmmaTarget() {
            return smmaTarget;
        }

        public void setSmmaTarget(BigInteger smmaTarget) {
            this.smmaTarget = smmaTarget;
        }
    }

    public String getAccount() {
        return account;
    }

    public void setAccount(String account) {
        this.account = account;
    }

    public String getLighthouse() {
        return lighthouse;
    }

    public void setLighthouse(String lighthouse) {
        this.lighthouse = lighthouse;
    }

    public String getValidator() {
        return validator;
    }

    public void setValidator(String validator) {
        this.validator = validator;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public void setLeaseDuration(Duration leaseDuration) {
        this.leaseDuration = leaseDuration;
    }

    public Duration getConfirmationTimeout() {
        return confirmationTimeout;
    }

    public void setConfirmationTimeout(Duration confirmationTimeout) {
        this.confirmationTimeout = confirmationTimeout;
    }

    public Duration getConfirmationPollInterval() {
        return confirmationPollInterval;
    }

    public void setConfirmationPollInterval(Duration confirmationPollInterval) {
        this.confirmationPollInterval = confirmationPollInterval;
    }

    public long getDeadlineBlocks() {
        return deadlineBlocks;
    }

    public void setDeadlineBlocks(long deadlineBlocks) {
        this.deadlineBlocks = deadlineBlocks;
    }

    public int getSmmaPeriod() {
        return smmaPeriod;
    }

    public void setSmmaPeriod(int smmaPeriod) {
        this.smmaPeriod = smmaPeriod;
    }

    public Duration getResyncMaxAge() {
        return resyncMaxAge;
    }

    public void setResyncMaxAge(Duration resyncMaxAge) {
        this.resyncMaxAge = resyncMaxAge;
    }

    public int getResyncMaxObservations() {
        return resyncMaxObservations;
    }

    public void setResyncMaxObservations(int resyncMaxObservations) {
        this.resyncMaxObservations = resyncMaxObservations;
    }

    public BigInteger getAuctionFinalPrice() {
        return auctionFinalPrice;
    }

    public void setAuctionFinalPrice(BigInteger auctionFinalPrice) {
        this.auctionFinalPrice = auctionFinalPrice;
    }

    public long getGasPerLiability() {
        return gasPerLiability;
    }

    public void setGasPerLiability(long gasPerLiability) {
        this.gasPerLiability = gasPerLiability;
    }

    public double getMarginalBand() {
        return marginalBand;
    }

    public void setMarginalBand(double marginalBand) {
        this.marginalBand = marginalBand;
    }

    public BigInteger getMaxCostPerLiability() {
        return maxCostPerLiability;
    }

    public void setMaxCostPerLiability(BigInteger maxCostPerLiability) {
        this.maxCostPerLiability = maxCostPerLiability;
    }

    public int getUnprofitableRoundsLimit() {
        return unprofitableRoundsLimit;
    }

    public void setUnprofitableRoundsLimit(int unprofitableRoundsLimit) {
        this.unprofitableRoundsLimit = unprofitableRoundsLimit;
    }

    public int getMaxConsecutiveRoundErrors() {
        return maxConsecutiveRoundErrors;
    }

    public void setMaxConsecutiveRoundErrors(int maxConsecutiveRoundErrors) {
        this.maxConsecutiveRoundErrors = maxConsecutiveRoundErrors;
    }

    public List<Integer> getBackoffSequence() {
        return backoffSequence;
    }

    public void setBackoffSequence(List<Integer> backoffSequence) {
        this.backoffSequence = backoffSequence;
    }

    public BigInteger getLiquidationThreshold() {
        return liquidationThreshold;
    }

    public void setLiquidationThreshold(BigInteger liquidationThreshold) {
        this.liquidationThreshold = liquidationThreshold;
    }

    public double getLiquidationSlippage() {
        return liquidationSlippage;
    }

    public void setLiquidationSlippage(double liquidationSlippage) {
        this.liquidationSlippage = liquidationSlippage;
    }

    public Duration getLiquidationDeadline() {
        return liquidationDeadline;
    }

    public void setLiquidationDeadline(Duration liquidationDeadline) {
        this.liquidationDeadline = liquidationDeadline;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public boolean isStakeTopUpEnabled() {
        return stakeTopUpEnabled;
    }

    public void setStakeTopUpEnabled(boolean stakeTopUpEnabled) {
        this.stakeTopUpEnabled = stakeTopUpEnabled;
    }

    public boolean isAutoRunEnabled() {
        return autoRunEnabled;
    }

    public void setAutoRunEnabled(boolean autoRunEnabled) {
        this.autoRunEnabled = autoRunEnabled;
    }

    public long getAutoRunIntervalMs() {
        return autoRunIntervalMs;
    }

    public void setAutoRunIntervalMs(long autoRunIntervalMs) {
        this.autoRunIntervalMs = autoRunIntervalMs;
    }

    public PhaseSettings getPump() {
        return pump;
    }

    public void setPump(PhaseSettings pump) {
        this.pump = pump;
    }

    public PhaseSettings getMine() {
        return mine;
    }

    public void setMine(PhaseSettings mine) {
        this.mine = mine;
    }
}
