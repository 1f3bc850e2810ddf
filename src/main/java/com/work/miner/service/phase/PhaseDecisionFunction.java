package com.work.miner.service.phase;

import com.work.miner.domain.Phase;
import com.work.miner.domain.PhaseConfig;
import com.work.miner.domain.RoundErrorKind;
import com.work.miner.domain.RoundStatus;

import java.math.BigInteger;

/**
 * pump/mine 反馈回路的纯函数：由上一轮结果得出下一轮配置。不访问网络，便于用合成历史测试。
 *
 * 规则：
 * - 每轮扣减 gas 成本；传输类错误按 {@link BatchBackoffPolicy} 缩小 batch，已无法缩小时终止
 * - QUOTA_EXCEEDED 按当前 quota 收缩 batch
 * - 连续轮次级错误达到上限时终止
 * - MINING：连续 K 轮 Unprofitable、连续 K 轮 SMMA 低于下限或预算耗尽时终止
 * - PUMPING：预算耗尽或 SMMA 达到上限只产生信号，切换到 MINING 由外部决定
 */
public class PhaseDecisionFunction {

    private final BatchBackoffPolicy backoff;
    private final int unprofitableLimit;
    private final int maxConsecutiveErrors;

    public PhaseDecisionFunction(BatchBackoffPolicy backoff, int unprofitableLimit, int maxConsecutiveErrors) {
        this.backoff = backoff;
        this.unprofitableLimit = Math.max(1, unprofitableLimit);
        this.maxConsecutiveErrors = Math.max(1, maxConsecutiveErrors);
    }

    public PhaseDecision decide(PhaseConfig config, PhaseDecision.Streaks streaks, RoundFeedback fb) {
        if (!config.getPhase().isActive()) {
            return new PhaseDecision(config, streaks, false, false, "phase " + config.getPhase() + " is not active");
        }
        PhaseConfig next = config.withRemainingBudget(config.getRemainingBudget().subtract(fb.getGasCost()));

        int errors = countsAsError(fb) ? streaks.getErrors() + 1 : 0;
        String reason = null;

        if (fb.getErrorKind().isTransport() && config.getBatchSize() == 0) {
            // 自动 batch 在定出大小之前就失败：保持自动，只累计错误
            reason = fb.getErrorKind() + " before batch was sized";
        } else if (fb.getErrorKind().isTransport()) {
            int smaller = backoff.stepDown(config.getBatchSize());
            if (smaller <= 0) {
                return terminate(next, new PhaseDecision.Streaks(streaks.getUnprofitable(), streaks.getBelowFloor(), errors),
                        "batch " + config.getBatchSize() + " still fails with " + fb.getErrorKind());
            }
            next = next.withBatchSize(smaller);
            reason = fb.getErrorKind() + ": batch " + config.getBatchSize() + " -> " + smaller;
        } else if (fb.getErrorKind() == RoundErrorKind.QUOTA_EXCEEDED) {
            int fit = backoff.fitToQuota(fb.getQuota(), config.getMode());
            if (fit > 0 && (config.getBatchSize() == 0 || fit < config.getBatchSize())) {
                next = next.withBatchSize(fit);
                reason = "quota " + fb.getQuota() + ": batch -> " + fit;
            }
        }

        if (errors >= maxConsecutiveErrors) {
            return terminate(next, new PhaseDecision.Streaks(streaks.getUnprofitable(), streaks.getBelowFloor(), errors),
                    errors + " consecutive round errors");
        }

        if (config.getPhase() == Phase.MINING) {
            int unprofitable = streaks.getUnprofitable();
            if (fb.getProfitability() != null) {
                unprofitable = fb.getProfitability().isUnprofitable() ? unprofitable + 1 : 0;
            }
            int belowFloor = belowTarget(fb.getSmma(), config.getSmmaTarget()) ? streaks.getBelowFloor() + 1 : 0;
            PhaseDecision.Streaks updated = new PhaseDecision.Streaks(unprofitable, belowFloor, errors);

            if (unprofitable >= unprofitableLimit) {
                return terminate(next, updated, unprofitable + " consecutive unprofitable rounds");
            }
            if (belowFloor >= unprofitableLimit) {
                return terminate(next, updated, "smma " + fb.getSmma() + " below floor " + config.getSmmaTarget()
                        + " for " + belowFloor + " rounds");
            }
            if (next.isBudgetExhausted()) {
                return terminate(next, updated, "mining budget exhausted");
            }
            return new PhaseDecision(next, updated, false, false, reason);
        }

        // PUMPING
        PhaseDecision.Streaks updated = new PhaseDecision.Streaks(0, 0, errors);
        boolean exhausted = next.isBudgetExhausted();
        boolean reached = config.getSmmaTarget().signum() > 0 && fb.getSmma().compareTo(config.getSmmaTarget()) >= 0;
        if (exhausted) {
            reason = "pump budget exhausted, awaiting operator";
        } else if (reached) {
            reason = "smma " + fb.getSmma() + " reached pump target " + config.getSmmaTarget();
        }
        return new PhaseDecision(next, updated, exhausted, reached, reason);
    }

    private static boolean countsAsError(RoundFeedback fb) {
        if (fb.getErrorKind() == RoundErrorKind.NONE || fb.getErrorKind() == RoundErrorKind.TOO_EXPENSIVE) {
            return false;
        }
        return fb.getStatus() != RoundStatus.COMPLETED;
    }

    private static boolean belowTarget(BigInteger smma, BigInteger floor) {
        return floor.signum() > 0 && smma.compareTo(floor) < 0;
    }

    private static PhaseDecision terminate(PhaseConfig next, PhaseDecision.Streaks streaks, String reason) {
        return new PhaseDecision(next.withPhase(Phase.TERMINATED), streaks, false, false, reason);
    }
}
