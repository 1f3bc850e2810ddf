package com.work.miner.service.phase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 自动挖矿循环：阶段处于 PUMPING/MINING 且无需运维介入时，每个间隔执行一轮。
 */
@Component
@ConditionalOnProperty(prefix = "miner", name = "auto-run-enabled", havingValue = "true")
public class MiningLoopJob {

    private static final Logger log = LoggerFactory.getLogger(MiningLoopJob.class);

    private final PhaseController controller;

    public MiningLoopJob(PhaseController controller) {
        this.controller = controller;
    }

    @Scheduled(fixedDelayString = "${miner.auto-run-interval-ms:15000}")
    public void runOnce() {
        if (!controller.isRunnable()) {
            return;
        }
        try {
            controller.runOneRound();
        } catch (IllegalStateException e) {
            log.info("mining loop skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            // 循环不因单轮异常退出
            log.error("mining loop round failed", e);
        }
    }
}
