package com.work.miner.signer;

import com.work.miner.chain.MockTransactionCodec;
import org.web3j.crypto.Hash;

import java.math.BigInteger;

import static com.work.miner.support.ValidationUtils.requireNonEmpty;

/**
 * mock 签名器：生成确定性的伪签名，交易以 {@link MockTransactionCodec} 编码，供 mock 链解析。
 */
public class MockLiabilitySigner implements LiabilitySigner {

    private final String account;
    private final String lighthouse;

    public MockLiabilitySigner(String account, String lighthouse) {
        this.account = requireNonEmpty(account, "account");
        this.lighthouse = requireNonEmpty(lighthouse, "lighthouse");
    }

    @Override
    public String getAccount() {
        return account;
    }

    @Override
    public SignedPayload signDemand(DemandFields fields) {
        return SignedPayload.demand(withSignature(fields.packed()));
    }

    @Override
    public SignedPayload signOffer(OfferFields fields) {
        return SignedPayload.offer(withSignature(fields.packed()));
    }

    @Override
    public byte[] signResult(ResultFields fields) {
        return fakeSignature(fields.packed());
    }

    @Override
    public SignedTransaction signCreate(long nonce, SignedPayload demand, SignedPayload offer, TxFees fees) {
        demand.requireRole(MessageRole.DEMAND);
        offer.requireRole(MessageRole.OFFER);
        String raw = MockTransactionCodec.encode(MockTransactionCodec.CREATE, account, nonce,
                fees.getMaxFeePerGas(), fees.getMaxPriorityFeePerGas(), null);
        return new SignedTransaction(nonce, raw, MockTransactionCodec.hashOf(raw));
    }

    @Override
    public SignedTransaction signFinalize(long nonce, ResultFields result, byte[] resultSignature, TxFees fees) {
        String raw = MockTransactionCodec.encode(MockTransactionCodec.FINALIZE, account, nonce,
                fees.getMaxFeePerGas(), fees.getMaxPriorityFeePerGas(), result.getLiability());
        return new SignedTransaction(nonce, raw, MockTransactionCodec.hashOf(raw));
    }

    @Override
    public SignedTransaction signApprove(long nonce, String spender, BigInteger amount, TxFees fees) {
        String raw = MockTransactionCodec.encode(MockTransactionCodec.APPROVE, account, nonce,
                fees.getMaxFeePerGas(), fees.getMaxPriorityFeePerGas(), requireNonEmpty(spender, "spender") + ":" + amount);
        return new SignedTransaction(nonce, raw, MockTransactionCodec.hashOf(raw));
    }

    @Override
    public SignedTransaction signRefill(long nonce, BigInteger amount, TxFees fees) {
        String raw = MockTransactionCodec.encode(MockTransactionCodec.REFILL, account, nonce,
                fees.getMaxFeePerGas(), fees.getMaxPriorityFeePerGas(), lighthouse + ":" + amount);
        return new SignedTransaction(nonce, raw, MockTransactionCodec.hashOf(raw));
    }

    private byte[] withSignature(byte[] packed) {
        byte[] sig = fakeSignature(packed);
        byte[] body = new byte[packed.length + sig.length];
        System.arraycopy(packed, 0, body, 0, packed.length);
        System.arraycopy(sig, 0, body, packed.length, sig.length);
        return body;
    }

    private byte[] fakeSignature(byte[] packed) {
        byte[] digest = Hash.sha3(packed);
        byte[] sig = new byte[65];
        System.arraycopy(digest, 0, sig, 0, 32);
        System.arraycopy(Hash.sha3(digest), 0, sig, 32, 32);
        sig[64] = 27;
        return sig;
    }
}
