package com.work.miner.service.phase;

import com.work.miner.domain.RoundMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 传输失败后的 batch 递减：先按配置序列逐级下降（例如 56 → 20 → 10 → 5），低于序列末尾后减半。
 */
public class BatchBackoffPolicy {

    private final List<Integer> sequence;

    public BatchBackoffPolicy(List<Integer> sequence) {
        List<Integer> sorted = new ArrayList<>();
        if (sequence != null) {
            for (Integer s : sequence) {
                if (s != null && s > 0 && !sorted.contains(s)) {
                    sorted.add(s);
                }
            }
        }
        sorted.sort(Collections.reverseOrder());
        this.sequence = Collections.unmodifiableList(sorted);
    }

    /**
     * 比 current 小的下一个 batch；已无法再缩小时返回 0。
     */
    public int stepDown(int current) {
        for (Integer s : sequence) {
            if (s < current) {
                return s;
            }
        }
        return current / 2;
    }

    /**
     * quota 允许的最大 batch：pipeline 每轮需要 2B 次操作。
     */
    public int fitToQuota(long quota, RoundMode mode) {
        long fit = mode == RoundMode.PIPELINE ? quota / 2 : quota;
        return (int) Math.max(0L, Math.min(Integer.MAX_VALUE, fit));
    }

    public List<Integer> getSequence() {
        return sequence;
    }
}
