package com.work.miner.signer;

/**
 * 签名消息的角色。demand 与 offer 的字段顺序不对称，一个角色的签名不能被当作另一个角色使用。
 */
public enum MessageRole {
    DEMAND,
    OFFER
}
