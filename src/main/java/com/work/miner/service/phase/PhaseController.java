package com.work.miner.service.phase;

import com.work.miner.chain.ChainConnector;
import com.work.miner.chain.LighthouseState;
import com.work.miner.config.MinerProperties;
import com.work.miner.domain.Phase;
import com.work.miner.domain.PhaseConfig;
import com.work.miner.domain.Profitability;
import com.work.miner.domain.Round;
import com.work.miner.domain.RoundErrorKind;
import com.work.miner.domain.SmmaState;
import com.work.miner.exception.MinerException;
import com.work.miner.exception.TransportException;
import com.work.miner.service.estimator.EmissionEstimator;
import com.work.miner.service.estimator.SmmaMath;
import com.work.miner.service.lighthouse.QuotaTracker;
import com.work.miner.service.lighthouse.StakeKeeper;
import com.work.miner.service.liquidation.LiquidationTrigger;
import com.work.miner.service.round.RoundHistory;
import com.work.miner.service.round.RoundPlan;
import com.work.miner.service.round.RoundScheduler;
import com.work.miner.support.metrics.MinerMetrics;
import com.work.miner.swap.SwapConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * 顶层阶段机：IDLE -> PUMPING -> MINING -> TERMINATED。
 *
 * 每轮：必要时 resync 估算器，按成本上限与 quota 确定 batch，补足质押，执行一轮，把观测到的 gas 价格喂给估算器，
 * 铸造量交给 liquidation，再由 {@link PhaseDecisionFunction} 得出下一轮配置。
 * PUMPING -> MINING 只能由外部触发；进入 TERMINATED 时执行 finalize-only 收尾。
 */
@Service
public class PhaseController {

    private static final Logger log = LoggerFactory.getLogger(PhaseController.class);

    private final RoundScheduler scheduler;
    private final EmissionEstimator estimator;
    private final LiquidationTrigger liquidation;
    private final SwapConnector swap;
    private final QuotaTracker tracker;
    private final StakeKeeper stakeKeeper;
    private final ChainConnector chain;
    private final PhaseDecisionFunction decisions;
    private final BatchBackoffPolicy backoff;
    private final MinerProperties props;
    private final MinerMetrics metrics;

    private PhaseConfig config = PhaseConfig.idle();
    private PhaseDecision.Streaks streaks = PhaseDecision.Streaks.zero();
    private boolean awaitingOperator;
    private boolean targetReached;
    private String lastDecision;

    public PhaseController(RoundScheduler scheduler, EmissionEstimator estimator, LiquidationTrigger liquidation,
                           SwapConnector swap, QuotaTracker tracker, StakeKeeper stakeKeeper,
                           ChainConnector chain, PhaseDecisionFunction decisions, BatchBackoffPolicy backoff,
                           MinerProperties props, MinerMetrics metrics) {
        this.scheduler = scheduler;
        this.estimator = estimator;
        this.liquidation = liquidation;
        this.swap = swap;
        this.tracker = tracker;
        this.stakeKeeper = stakeKeeper;
        this.chain = chain;
        this.decisions = decisions;
        this.backoff = backoff;
        this.props = props;
        this.metrics = metrics;
    }

    public synchronized Round runOneRound() {
        if (!config.getPhase().isActive()) {
            throw new IllegalStateException("phase " + config.getPhase() + " does not run rounds");
        }
        if (awaitingOperator) {
            throw new IllegalStateException("pump budget exhausted, awaiting operator");
        }
        refreshEstimatorIfStale();

        Round round = executeRound();

        estimator.observeAll(round.getObservedGasPrices());
        if (round.getErrorKind() == RoundErrorKind.NONCE_CONFLICT || scheduler.needsNonceResync()) {
            resyncNonces();
        }
        if (round.getMinted().signum() > 0) {
            liquidation.onMinted(round.getMinted());
        }

        Profitability profitability = evaluate(round);
        long quota = round.getErrorKind() == RoundErrorKind.QUOTA_EXCEEDED ? readQuota() : -1L;
        RoundFeedback fb = RoundFeedback.of(round, profitability, estimator.state().getValue(), quota);

        PhaseConfig input = config;
        if (config.getBatchSize() == 0 && round.getBatchSize() > 0 && fb.getErrorKind().isTransport()) {
            // 自动 batch：以本轮实际大小为起点缩小
            input = config.withBatchSize(round.getBatchSize());
        }
        apply(decisions.decide(input, streaks, fb));
        return round;
    }

    /**
     * 连续执行至多 n 轮，阶段结束或等待运维时提前返回。
     */
    public synchronized List<Round> runRounds(int n) {
        List<Round> rounds = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (!config.getPhase().isActive() || awaitingOperator) {
                break;
            }
            rounds.add(runOneRound());
        }
        return rounds;
    }

    /**
     * 外部强制切换阶段，只能前进。进入新阶段时重置计数并 resync 估算器；进入 TERMINATED 时收尾。
     */
    public synchronized PhaseConfig forcePhase(Phase target) {
        Phase current = config.getPhase();
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("cannot move phase " + current + " -> " + target);
        }
        switch (target) {
            case PUMPING:
                config = fromSettings(Phase.PUMPING, props.getPump());
                break;
            case MINING:
                config = fromSettings(Phase.MINING, props.getMine());
                break;
            case TERMINATED:
            default:
                config = config.withPhase(Phase.TERMINATED);
                break;
        }
        streaks = PhaseDecision.Streaks.zero();
        awaitingOperator = false;
        targetReached = false;
        lastDecision = "forced " + current + " -> " + target;
        metrics.phaseTransition(current.name(), target.name());
        log.info("phase {} -> {} config={}", current, target, config);

        if (target == Phase.TERMINATED) {
            drain();
        } else {
            try {
                estimator.resync();
            } catch (TransportException e) {
                log.warn("estimator resync on phase change failed err={}", e.toString());
            }
        }
        return config;
    }

    public synchronized EstimatorReport reportEstimator() {
        SmmaState s = estimator.state();
        EstimatorReport r = new EstimatorReport();
        r.setSmma(s.getValue());
        r.setPeriod(s.getPeriod());
        r.setLastResyncValue(s.getLastResyncValue());
        r.setLastResyncAt(s.getLastResyncAt());
        r.setObservationsSinceResync(s.getObservationsSinceResync());
        r.setStale(estimator.isStale());
        r.setEmissionPerLiability(estimator.estimateEmission(props.getGasPerLiability(), s.getValue(),
                props.getAuctionFinalPrice()));
        r.setSmmaTarget(config.getSmmaTarget());
        r.setHalfLifeRounds(SmmaMath.halfLifeRounds(s.getPeriod(), Math.max(1, 2 * Math.max(1, config.getBatchSize()))));
        long updates = -1L;
        try {
            BigInteger effective = chain.getGasPrice().add(config.getPriorityFee());
            updates = SmmaMath.updatesToReach(s.getValue().doubleValue(), effective.doubleValue(),
                    config.getSmmaTarget().doubleValue(), s.getPeriod());
            r.setProjectedSmma(estimator.project(effective, 2L * Math.max(1, config.getBatchSize())));
        } catch (TransportException e) {
            log.warn("gas price read failed err={}", e.toString());
        }
        r.setUpdatesToTarget(updates);
        return r;
    }

    public synchronized ControllerStatus status() {
        ControllerStatus st = new ControllerStatus();
        st.setPhase(config.getPhase());
        st.setConfig(config);
        st.setAwaitingOperator(awaitingOperator);
        st.setTargetReached(targetReached);
        st.setLastDecision(lastDecision);
        st.setUnprofitableStreak(streaks.getUnprofitable());
        st.setErrorStreak(streaks.getErrors());

        RoundHistory h = scheduler.getHistory();
        st.setTotalRounds(h.getTotalRounds());
        st.setTotalCreated(h.getTotalCreated());
        st.setTotalFinalized(h.getTotalFinalized());
        st.setTotalGasCost(h.getTotalGasCost());
        st.setTotalMinted(h.getTotalMinted());
        st.setOpenLiabilities(scheduler.openLiabilities().size());
        st.setMarkerState(tracker.getState());
        st.setUnsoldBalance(liquidation.getUnsold());
        st.setSales(liquidation.getSaleLog().size());

        try {
            LighthouseState ls = tracker.snapshot();
            st.setMarker(ls.getMarker());
            st.setQuota(ls.getQuota());
            st.setKeepAliveBlock(ls.getKeepAliveBlock());
            st.setProviderIndex(ls.getProviderIndex());
            st.setProviderStake(ls.getProviderStake());
            st.setRequiredStake(tracker.requiredStake(ls.getQuota()));
            st.setTokenBalance(chain.getTokenBalance(scheduler.getAccount()));
        } catch (TransportException e) {
            log.warn("status chain read failed err={}", e.toString());
        }
        return st;
    }

    public synchronized PhaseConfig currentConfig() {
        return config;
    }

    public synchronized boolean isRunnable() {
        return config.getPhase().isActive() && !awaitingOperator;
    }

    // ------------------------------------------------------------------

    private Round executeRound() {
        int batch = config.getBatchSize();
        RoundPlan plan = RoundPlan.of(config.getMode(), batch, config.getPriorityFee());
        BigInteger perLiability = null;
        BigInteger cap = props.getMaxCostPerLiability();
        try {
            if (batch == 0) {
                batch = backoff.fitToQuota(tracker.currentQuota(), config.getMode());
                plan = RoundPlan.of(config.getMode(), batch, config.getPriorityFee());
            }
            if (batch > 0) {
                topUpStake(plan);
            }
            if (cap != null && cap.signum() > 0 && batch > 0) {
                perLiability = chain.getGasPrice().add(config.getPriorityFee())
                        .multiply(BigInteger.valueOf(props.getGasPerLiability()));
            }
        } catch (TransportException e) {
            // 轮次开始前的链上读取失败，同样计入连续错误
            log.warn("pre-round chain read failed err={}", e.toString());
            return scheduler.reject(plan, RoundErrorKind.TRANSPORT_FAILED, "pre-round chain read failed: " + e.getMessage());
        }

        if (perLiability != null) {
            if (perLiability.compareTo(cap) > 0) {
                int scaled = BigInteger.valueOf(batch).multiply(cap).divide(perLiability).intValue();
                if (scaled == 0) {
                    return scheduler.reject(plan, RoundErrorKind.TOO_EXPENSIVE,
                            "cost per liability " + perLiability + " exceeds cap " + cap);
                }
                log.info("cost cap scales batch {} -> {} (cost {} > cap {})", batch, scaled, perLiability, cap);
                plan = RoundPlan.of(config.getMode(), scaled, config.getPriorityFee());
            }
        }
        if (plan.getBatchSize() == 0) {
            return scheduler.reject(plan, RoundErrorKind.QUOTA_EXCEEDED, "quota leaves no room for a batch");
        }
        return scheduler.runRound(plan);
    }

    /**
     * 补足失败不阻止本轮：质押不足时由 quota 检查拒绝本轮。
     */
    private void topUpStake(RoundPlan plan) {
        if (!props.isStakeTopUpEnabled()) {
            return;
        }
        try {
            stakeKeeper.ensureStake(plan.requiredOps(), config.getPriorityFee());
        } catch (MinerException e) {
            log.warn("stake top-up for {} ops failed err={}", plan.requiredOps(), e.toString());
        }
    }

    /**
     * 用估算的产出（wn）乘以当前报价，与本轮 gas 成本比较。本轮没有上链成本时不评估。
     */
    private Profitability evaluate(Round round) {
        if (round.getGasCost().signum() == 0) {
            return null;
        }
        try {
            BigInteger emission = estimator.estimateEmission(round.getGasUsed(), estimator.state().getValue(),
                    props.getAuctionFinalPrice());
            BigInteger unit = liquidation.getThreshold();
            BigDecimal price = new BigDecimal(swap.quote(unit)).divide(new BigDecimal(unit), MathContext.DECIMAL64);
            Profitability p = estimator.estimateProfitability(emission, price, round.getGasCost());
            log.info("round {} emission={} cost={} -> {}", round.getIndex(), emission, round.getGasCost(), p);
            return p;
        } catch (TransportException e) {
            log.warn("profitability quote failed err={}", e.toString());
            return null;
        }
    }

    private void apply(PhaseDecision d) {
        Phase before = config.getPhase();
        config = d.getConfig();
        streaks = d.getStreaks();
        awaitingOperator = d.isAwaitingOperator();
        targetReached = d.isTargetReached();
        if (d.getReason() != null) {
            lastDecision = d.getReason();
            log.info("decision: {} -> {}", d.getReason(), config);
        }
        if (d.isTerminated() && before != Phase.TERMINATED) {
            metrics.phaseTransition(before.name(), Phase.TERMINATED.name());
            log.warn("phase {} terminated: {}", before, d.getReason());
            drain();
        }
    }

    private void drain() {
        int b = config.getBatchSize() > 0 ? config.getBatchSize() : backoff.fitToQuota(readQuota(), config.getMode());
        List<Round> rounds = scheduler.drain(config.getMode(), Math.max(1, b), config.getPriorityFee());
        for (Round r : rounds) {
            estimator.observeAll(r.getObservedGasPrices());
            if (r.getMinted().signum() > 0) {
                liquidation.onMinted(r.getMinted());
            }
        }
        log.info("drain finished rounds={} open={}", rounds.size(), scheduler.openLiabilities().size());
    }

    private void refreshEstimatorIfStale() {
        if (!estimator.isStale()) {
            return;
        }
        try {
            estimator.resync();
        } catch (TransportException e) {
            log.warn("estimator resync failed, using local replica err={}", e.toString());
        }
    }

    private void resyncNonces() {
        try {
            scheduler.resyncNonces();
        } catch (MinerException e) {
            log.warn("nonce resync failed err={}", e.toString());
        }
    }

    private long readQuota() {
        try {
            return tracker.currentQuota();
        } catch (TransportException e) {
            log.warn("quota read failed err={}", e.toString());
            return 0L;
        }
    }

    private static PhaseConfig fromSettings(Phase phase, MinerProperties.PhaseSettings s) {
        return new PhaseConfig(phase, s.getMode(), s.getPriorityFee(), s.getBatchSize(), s.getBudget(),
                s.getSmmaTarget());
    }
}
