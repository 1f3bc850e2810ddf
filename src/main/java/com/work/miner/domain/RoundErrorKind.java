package com.work.miner.domain;

/**
 * 轮次级错误分类，作为 Phase Controller 的输入。
 */
public enum RoundErrorKind {
    NONE,
    TRANSPORT_TIMEOUT,
    TRANSPORT_FAILED,
    NONCE_CONFLICT,
    QUOTA_EXCEEDED,
    MARKER_NOT_OWNED,
    LEASE_NOT_OWNED,
    SIGNING_FAILED,
    TOO_EXPENSIVE;

    public boolean isTransport() {
        return this == TRANSPORT_TIMEOUT || this == TRANSPORT_FAILED;
    }
}
