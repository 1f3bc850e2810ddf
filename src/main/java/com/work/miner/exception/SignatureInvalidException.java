package com.work.miner.exception;

/**
 * 单个 liability 的签名无效或角色不匹配，仅放弃该 liability。
 */
public class SignatureInvalidException extends MinerException {

    public SignatureInvalidException(String message) {
        super(message);
    }

    public SignatureInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
