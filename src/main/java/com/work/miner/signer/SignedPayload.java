package com.work.miner.signer;

import com.work.miner.exception.SignatureInvalidException;

import java.util.Arrays;

import static com.work.miner.support.ValidationUtils.requireNonNull;

/**
 * 已签名的 demand/offer 载荷，角色作为标签随载荷一起携带。
 */
public final class SignedPayload {

    private final MessageRole role;
    private final byte[] body;

    private SignedPayload(MessageRole role, byte[] body) {
        this.role = requireNonNull(role, "role");
        this.body = Arrays.copyOf(requireNonNull(body, "body"), body.length);
    }

    public static SignedPayload demand(byte[] body) {
        return new SignedPayload(MessageRole.DEMAND, body);
    }

    public static SignedPayload offer(byte[] body) {
        return new SignedPayload(MessageRole.OFFER, body);
    }

    /**
     * 角色不符时拒绝：demand 的签名不允许出现在 offer 位置上，反之亦然。
     */
    public SignedPayload requireRole(MessageRole expected) {
        if (role != expected) {
            throw new SignatureInvalidException("payload role " + role + " used as " + expected);
        }
        return this;
    }

    public MessageRole getRole() {
        return role;
    }

    public byte[] getBody() {
        return Arrays.copyOf(body, body.length);
    }
}
