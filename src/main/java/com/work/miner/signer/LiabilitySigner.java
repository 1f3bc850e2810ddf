package com.work.miner.signer;

import java.math.BigInteger;

/**
 * 签名端口：消息编码与密钥管理由实现方负责。
 *
 * 所有方法在签名无法生成或输入不合法时抛出 {@link com.work.miner.exception.SignatureInvalidException}。
 */
public interface LiabilitySigner {

    /**
     * 签名账户地址（交易 from，也是 promisee/promisor）。
     */
    String getAccount();

    SignedPayload signDemand(DemandFields fields);

    SignedPayload signOffer(OfferFields fields);

    byte[] signResult(ResultFields fields);

    /**
     * 构造 lighthouse.createLiability(demand, offer) 交易；demand/offer 角色不符时拒绝。
     */
    SignedTransaction signCreate(long nonce, SignedPayload demand, SignedPayload offer, TxFees fees);

    /**
     * 构造 lighthouse.finalizeLiability(liability, result, success, signature) 交易。
     */
    SignedTransaction signFinalize(long nonce, ResultFields result, byte[] resultSignature, TxFees fees);

    /**
     * 构造 token.approve(spender, amount) 交易。
     */
    SignedTransaction signApprove(long nonce, String spender, BigInteger amount, TxFees fees);

    /**
     * 构造 lighthouse.refill(amount) 交易，把 token 转入本账户在 lighthouse 上的质押。
     */
    SignedTransaction signRefill(long nonce, BigInteger amount, TxFees fees);
}
