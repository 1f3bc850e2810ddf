package com.work.miner.exception;

/**
 * 链上观测到的 nonce 与本地账本不一致；在完整 resync 之前不得继续分配。
 */
public class NonceConflictException extends MinerException {

    public NonceConflictException(String message) {
        super(message);
    }

    public NonceConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
