package com.work.miner.exception;

/**
 * 组件内部的统一异常类型，便于调用方捕获或转换为 HTTP 错误码。
 */
public class MinerException extends RuntimeException {

    public MinerException(String message) {
        super(message);
    }

    public MinerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过等待/缩小规模后重试解决。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
