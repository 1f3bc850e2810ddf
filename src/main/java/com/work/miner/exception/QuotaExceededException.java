package com.work.miner.exception;

/**
 * 本轮所需操作数超过 lighthouse quota，在任何广播之前拒绝。
 */
public class QuotaExceededException extends MinerException {

    public QuotaExceededException(String message) {
        super(message);
    }

    public QuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
