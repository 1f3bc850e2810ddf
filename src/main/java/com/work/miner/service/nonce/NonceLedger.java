package com.work.miner.service.nonce;

import java.time.Instant;

/**
 * 单账户的 nonce 账本，只由 {@link NonceSequencer} 持有和修改。
 *
 * epoch 在每次 resync 时递增；同一 epoch 内发出的 nonce 严格递增且不重复。
 * 检测到与链上不一致后账本被置为 poisoned，直到下一次 resync 之前拒绝分配。
 */
public class NonceLedger {

    private final String account;
    private long nextNonce = -1L;
    private long epoch;
    private boolean poisoned;
    private String poisonReason;
    private Instant syncedAt;

    public NonceLedger(String account) {
        this.account = account;
    }

    public boolean isInitialized() {
        return nextNonce >= 0;
    }

    /**
     * 以链上 pending nonce 开启新的 epoch，返回旧的 nextNonce（未初始化时为 -1）。
     */
    long resetTo(long chainNext, Instant now) {
        long previous = nextNonce;
        this.nextNonce = chainNext;
        this.epoch++;
        this.poisoned = false;
        this.poisonReason = null;
        this.syncedAt = now;
        return previous;
    }

    /**
     * 发出 n 个连续 nonce，返回第一个。
     */
    long issue(int n) {
        long first = nextNonce;
        nextNonce += n;
        return first;
    }

    void poison(String reason) {
        this.poisoned = true;
        this.poisonReason = reason;
    }

    public String getAccount() {
        return account;
    }

    public long getNextNonce() {
        return nextNonce;
    }

    public long getEpoch() {
        return epoch;
    }

    public boolean isPoisoned() {
        return poisoned;
    }

    public String getPoisonReason() {
        return poisonReason;
    }

    public Instant getSyncedAt() {
        return syncedAt;
    }
}
