package com.work.miner.exception;

/**
 * 调用方不持有账户租约（或 fencing token 已过期），不得分配 nonce 或广播。
 */
public class LeaseNotOwnedException extends MinerException {

    public LeaseNotOwnedException(String message) {
        super(message);
    }

    public LeaseNotOwnedException(String message, Throwable cause) {
        super(message, cause);
    }
}
