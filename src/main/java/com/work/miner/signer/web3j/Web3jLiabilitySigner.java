package com.work.miner.signer.web3j;

import com.work.miner.exception.SignatureInvalidException;
import com.work.miner.signer.DemandFields;
import com.work.miner.signer.LiabilitySigner;
import com.work.miner.signer.LiabilityTerms;
import com.work.miner.signer.MessageRole;
import com.work.miner.signer.OfferFields;
import com.work.miner.signer.ResultFields;
import com.work.miner.signer.SignedPayload;
import com.work.miner.signer.SignedTransaction;
import com.work.miner.signer.TxFees;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.Sign;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

import static com.work.miner.support.ValidationUtils.requireNonNull;

/**
 * 基于 Web3j 的签名实现。
 *
 * - 消息签名：EIP-191 personal_sign(keccak256(encodePacked(...)))，65 字节 r||s||v
 * - demand/offer 载荷：abi.encode(model, objective, token, cost, addrA, addrB, fee, deadline, sender, signature)
 * - 交易：EIP-1559，value = 0；create/finalize/refill 发往 lighthouse，approve 发往 token
 */
public class Web3jLiabilitySigner implements LiabilitySigner {

    private final Credentials credentials;
    private final long chainId;
    private final String lighthouse;
    private final String token;
    private final BigInteger createGasLimit;
    private final BigInteger finalizeGasLimit;
    private final BigInteger approveGasLimit;
    private final BigInteger refillGasLimit;

    public Web3jLiabilitySigner(Credentials credentials, long chainId, String lighthouse, String token,
                                BigInteger createGasLimit, BigInteger finalizeGasLimit,
                                BigInteger approveGasLimit, BigInteger refillGasLimit) {
        this.credentials = requireNonNull(credentials, "credentials");
        this.chainId = chainId;
        this.lighthouse = requireNonNull(lighthouse, "lighthouse");
        this.token = requireNonNull(token, "token");
        this.createGasLimit = requireNonNull(createGasLimit, "createGasLimit");
        this.finalizeGasLimit = requireNonNull(finalizeGasLimit, "finalizeGasLimit");
        this.approveGasLimit = requireNonNull(approveGasLimit, "approveGasLimit");
        this.refillGasLimit = requireNonNull(refillGasLimit, "refillGasLimit");
    }

    @Override
    public String getAccount() {
        return credentials.getAddress();
    }

    @Override
    public SignedPayload signDemand(DemandFields fields) {
        byte[] signature = signPacked(fields.packed());
        return SignedPayload.demand(encodePayload(fields.getTerms(), fields.getLighthouse(), fields.getValidator(),
                fields.getValidatorFee(), fields.getPromisee(), signature));
    }

    @Override
    public SignedPayload signOffer(OfferFields fields) {
        byte[] signature = signPacked(fields.packed());
        return SignedPayload.offer(encodePayload(fields.getTerms(), fields.getValidator(), fields.getLighthouse(),
                fields.getLighthouseFee(), fields.getPromisor(), signature));
    }

    @Override
    public byte[] signResult(ResultFields fields) {
        return signPacked(fields.packed());
    }

    @Override
    public SignedTransaction signCreate(long nonce, SignedPayload demand, SignedPayload offer, TxFees fees) {
        demand.requireRole(MessageRole.DEMAND);
        offer.requireRole(MessageRole.OFFER);
        Function fn = new Function("createLiability",
                Arrays.<Type>asList(new DynamicBytes(demand.getBody()), new DynamicBytes(offer.getBody())),
                Collections.<TypeReference<?>>emptyList());
        return signTx(nonce, lighthouse, createGasLimit, FunctionEncoder.encode(fn), fees);
    }

    @Override
    public SignedTransaction signFinalize(long nonce, ResultFields result, byte[] resultSignature, TxFees fees) {
        if (resultSignature == null || resultSignature.length != 65) {
            throw new SignatureInvalidException("result signature must be 65 bytes for liability " + result.getLiability());
        }
        Function fn = new Function("finalizeLiability",
                Arrays.<Type>asList(new Address(result.getLiability()), new DynamicBytes(result.getResult()),
                        new Bool(result.isSuccess()), new DynamicBytes(resultSignature)),
                Collections.<TypeReference<?>>emptyList());
        return signTx(nonce, lighthouse, finalizeGasLimit, FunctionEncoder.encode(fn), fees);
    }

    @Override
    public SignedTransaction signApprove(long nonce, String spender, BigInteger amount, TxFees fees) {
        Function fn = new Function("approve",
                Arrays.<Type>asList(new Address(spender), new Uint256(amount)),
                Collections.<TypeReference<?>>emptyList());
        return signTx(nonce, token, approveGasLimit, FunctionEncoder.encode(fn), fees);
    }

    @Override
    public SignedTransaction signRefill(long nonce, BigInteger amount, TxFees fees) {
        Function fn = new Function("refill",
                Collections.<Type>singletonList(new Uint256(amount)),
                Collections.<TypeReference<?>>emptyList());
        return signTx(nonce, lighthouse, refillGasLimit, FunctionEncoder.encode(fn), fees);
    }

    private SignedTransaction signTx(long nonce, String to, BigInteger gasLimit, String data, TxFees fees) {
        RawTransaction raw = RawTransaction.createTransaction(chainId, BigInteger.valueOf(nonce), gasLimit,
                to, BigInteger.ZERO, data, fees.getMaxPriorityFeePerGas(), fees.getMaxFeePerGas());
        String hex;
        try {
            hex = Numeric.toHexString(TransactionEncoder.signMessage(raw, chainId, credentials));
        } catch (RuntimeException e) {
            throw new SignatureInvalidException("failed to sign transaction nonce=" + nonce, e);
        }
        return new SignedTransaction(nonce, hex, Hash.sha3(hex));
    }

    private byte[] signPacked(byte[] packed) {
        try {
            Sign.SignatureData sig = Sign.signPrefixedMessage(Hash.sha3(packed), credentials.getEcKeyPair());
            byte[] out = new byte[65];
            System.arraycopy(sig.getR(), 0, out, 0, 32);
            System.arraycopy(sig.getS(), 0, out, 32, 32);
            out[64] = sig.getV()[0];
            return out;
        } catch (RuntimeException e) {
            throw new SignatureInvalidException("failed to sign message", e);
        }
    }

    private static byte[] encodePayload(LiabilityTerms terms, String first, String second, BigInteger fee,
                                        String sender, byte[] signature) {
        String encoded = FunctionEncoder.encodeConstructor(Arrays.<Type>asList(
                new DynamicBytes(terms.getModel()),
                new DynamicBytes(terms.getObjective()),
                new Address(terms.getToken()),
                new Uint256(terms.getCost()),
                new Address(first),
                new Address(second),
                new Uint256(fee),
                new Uint256(terms.getDeadline()),
                new Address(sender),
                new DynamicBytes(signature)));
        return Numeric.hexStringToByteArray(encoded);
    }
}
