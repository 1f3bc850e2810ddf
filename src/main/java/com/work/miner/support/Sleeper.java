package com.work.miner.support;

import java.time.Duration;

/**
 * 等待抽象：确认轮询与 marker 超时等待都通过它挂起，测试中可替换为不阻塞的实现。
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> {
            if (duration != null && !duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
