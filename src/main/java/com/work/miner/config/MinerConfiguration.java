package com.work.miner.config;

import com.work.miner.chain.ChainConnector;
import com.work.miner.chain.MockChainConnector;
import com.work.miner.service.estimator.EmissionEstimator;
import com.work.miner.service.lease.AccountLeaseManager;
import com.work.miner.service.lighthouse.QuotaTracker;
import com.work.miner.service.lighthouse.StakeKeeper;
import com.work.miner.service.liquidation.LiquidationTrigger;
import com.work.miner.service.liquidation.SaleEventLog;
import com.work.miner.service.nonce.ConfirmationWaiter;
import com.work.miner.service.nonce.NonceSequencer;
import com.work.miner.service.phase.BatchBackoffPolicy;
import com.work.miner.service.phase.PhaseDecisionFunction;
import com.work.miner.service.round.RoundHistory;
import com.work.miner.service.round.RoundScheduler;
import com.work.miner.signer.LiabilitySigner;
import com.work.miner.signer.MockLiabilitySigner;
import com.work.miner.support.NodeIdProvider;
import com.work.miner.support.SimpleNodeIdProvider;
import com.work.miner.support.Sleeper;
import com.work.miner.support.metrics.MinerMetrics;
import com.work.miner.support.metrics.NoopMinerMetrics;
import com.work.miner.swap.MockSwapConnector;
import com.work.miner.swap.SwapConnector;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 编排组件装配。链、签名、swap 三个端口默认使用 mock；chain.mode=web3j 时由 {@link Web3jConfiguration} 提供。
 */
@Configuration
@EnableConfigurationProperties({MinerProperties.class, ChainProperties.class})
public class MinerConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    /**
     * 宿主可提供 Micrometer 等实现覆盖。
     */
    @Bean
    @ConditionalOnMissingBean
    public MinerMetrics minerMetrics() {
        return new NoopMinerMetrics();
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeIdProvider nodeIdProvider() {
        return new SimpleNodeIdProvider();
    }

    @Bean
    @ConditionalOnMissingBean(ChainConnector.class)
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public ChainConnector mockChainConnector(ChainProperties chain, MinerProperties props) {
        ChainProperties.Mock mock = chain.getMock();
        MockChainConnector connector = new MockChainConnector(mock.getBaseFee(), mock.getInitialSmma(),
                props.getSmmaPeriod(), props.getAuctionFinalPrice(), mock.getQuota(), mock.getTimeoutBlocks());
        connector.registerProvider(props.getAccount(), 1);
        return connector;
    }

    @Bean
    @ConditionalOnMissingBean(LiabilitySigner.class)
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public LiabilitySigner mockLiabilitySigner(MinerProperties props) {
        return new MockLiabilitySigner(props.getAccount(), props.getLighthouse());
    }

    @Bean
    @ConditionalOnMissingBean(SwapConnector.class)
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public SwapConnector mockSwapConnector(ChainProperties chain) {
        return new MockSwapConnector(chain.getMock().getSwapPrice());
    }

    @Bean
    public AccountLeaseManager accountLeaseManager(Clock clock, MinerProperties props, MinerMetrics metrics) {
        return new AccountLeaseManager(clock, props.getLeaseDuration(), metrics);
    }

    @Bean
    public ConfirmationWaiter confirmationWaiter(ChainConnector chain, MinerProperties props, Sleeper sleeper,
                                                 MinerMetrics metrics) {
        return new ConfirmationWaiter(chain, props.getConfirmationTimeout(), props.getConfirmationPollInterval(),
                sleeper, metrics);
    }

    @Bean
    public NonceSequencer nonceSequencer(LiabilitySigner signer, ChainConnector chain, AccountLeaseManager leases,
                                         ConfirmationWaiter waiter, MinerMetrics metrics, Clock clock) {
        // 交易 from 即签名账户
        return new NonceSequencer(signer.getAccount(), chain, leases, waiter, metrics, clock);
    }

    @Bean
    public QuotaTracker quotaTracker(ChainConnector chain, LiabilitySigner signer, MinerProperties props,
                                     ChainProperties chainProps, Sleeper sleeper, MinerMetrics metrics) {
        return new QuotaTracker(chain, props.getLighthouse(), signer.getAccount(), chainProps.getBlockTime(),
                sleeper, metrics);
    }

    @Bean
    public RoundHistory roundHistory(MinerProperties props) {
        return new RoundHistory(props.getHistorySize());
    }

    @Bean
    public RoundScheduler roundScheduler(ChainConnector chain, LiabilitySigner signer, NonceSequencer sequencer,
                                         QuotaTracker tracker, RoundHistory history, MinerMetrics metrics,
                                         Clock clock, NodeIdProvider nodeIdProvider, MinerProperties props) {
        RoundScheduler.Settings settings = new RoundScheduler.Settings(props.getLighthouse(), props.getValidator(),
                props.getToken(), props.getDeadlineBlocks());
        return new RoundScheduler(chain, signer, sequencer, tracker, history, metrics, clock,
                nodeIdProvider.getNodeId(), settings);
    }

    @Bean
    public EmissionEstimator emissionEstimator(ChainConnector chain, MinerProperties props, Clock clock,
                                               MinerMetrics metrics) {
        return new EmissionEstimator(chain, props.getSmmaPeriod(), props.getResyncMaxAge(),
                props.getResyncMaxObservations(), props.getMarginalBand(), clock, metrics);
    }

    @Bean
    public SaleEventLog saleEventLog() {
        return new SaleEventLog();
    }

    @Bean
    public LiquidationTrigger liquidationTrigger(SwapConnector swap, SaleEventLog saleLog, MinerProperties props,
                                                 Clock clock, MinerMetrics metrics) {
        return new LiquidationTrigger(swap, saleLog, props.getLiquidationThreshold(), props.getLiquidationSlippage(),
                props.getLiquidationDeadline(), clock, metrics);
    }

    @Bean
    public StakeKeeper stakeKeeper(ChainConnector chain, LiabilitySigner signer, NonceSequencer sequencer,
                                   QuotaTracker tracker, NodeIdProvider nodeIdProvider, MinerProperties props,
                                   MinerMetrics metrics) {
        return new StakeKeeper(chain, signer, sequencer, tracker, nodeIdProvider.getNodeId(), props.getLighthouse(),
                metrics);
    }

    @Bean
    public BatchBackoffPolicy batchBackoffPolicy(MinerProperties props) {
        return new BatchBackoffPolicy(props.getBackoffSequence());
    }

    @Bean
    public PhaseDecisionFunction phaseDecisionFunction(BatchBackoffPolicy backoff, MinerProperties props) {
        return new PhaseDecisionFunction(backoff, props.getUnprofitableRoundsLimit(),
                props.getMaxConsecutiveRoundErrors());
    }
}
