package com.work.miner.exception;

/**
 * marker 不属于本账户且上一持有者尚未超时，需等待后重新 claim。
 */
public class MarkerNotOwnedException extends MinerException {

    public MarkerNotOwnedException(String message) {
        super(message);
    }

    public MarkerNotOwnedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
