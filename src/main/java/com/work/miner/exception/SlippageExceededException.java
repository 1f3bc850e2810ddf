package com.work.miner.exception;

/**
 * 兑换结果低于滑点下限，本次出售跳过，余额保留。
 */
public class SlippageExceededException extends MinerException {

    public SlippageExceededException(String message) {
        super(message);
    }

    public SlippageExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
