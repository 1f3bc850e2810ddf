package com.work.miner.exception;

/**
 * 链/RPC 传输失败：请求可能未送达节点。
 */
public class TransportException extends MinerException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
