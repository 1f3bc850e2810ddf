package com.work.miner.exception;

/**
 * 确认等待超时：多数交易在限定轮询次数内未被打包。
 */
public class TransportTimeoutException extends TransportException {

    public TransportTimeoutException(String message) {
        super(message);
    }

    public TransportTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
