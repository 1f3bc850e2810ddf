package com.work.miner.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口，宿主可通过自定义 Bean 接入具体实现。
 */
public interface MinerMetrics {

    default void leaseAcquire(String result) {
    }

    default void nonceReserve(String result) {
    }

    default void broadcast(String result) {
    }

    default void confirmation(String result) {
    }

    default void markerClaim(String result) {
    }

    default void round(String mode, String status) {
    }

    default void phaseTransition(String from, String to) {
    }

    default void estimatorResync(long drift) {
    }

    default void sale(String result) {
    }

    default void stakeTopUp(String result) {
    }
}
