package com.work.miner.signer;

import java.math.BigInteger;

import static com.work.miner.support.ValidationUtils.requireNonNull;

/**
 * demand 角色字段。字段顺序在 {@link #packed()} 中固定：lighthouse 在 validator 之前。
 */
public class DemandFields {
    private final LiabilityTerms terms;
    private final String lighthouse;
    private final String validator;
    private final BigInteger validatorFee;
    private final BigInteger nonce;
    /**
     * demand 的发起方（promisee）。
     */
    private final String promisee;

    public DemandFields(LiabilityTerms terms, String lighthouse, String validator, BigInteger validatorFee,
                        BigInteger nonce, String promisee) {
        this.terms = requireNonNull(terms, "terms");
        this.lighthouse = requireNonNull(lighthouse, "lighthouse");
        this.validator = requireNonNull(validator, "validator");
        this.validatorFee = requireNonNull(validatorFee, "validatorFee");
        this.nonce = requireNonNull(nonce, "nonce");
        this.promisee = requireNonNull(promisee, "promisee");
    }

    public byte[] packed() {
        return PackedEncoding.builder()
                .bytes(terms.getModel())
                .bytes(terms.getObjective())
                .address(terms.getToken())
                .uint256(terms.getCost())
                .address(lighthouse)
                .address(validator)
                .uint256(validatorFee)
                .uint256(terms.getDeadline())
                .uint256(nonce)
                .address(promisee)
                .toByteArray();
    }

    public LiabilityTerms getTerms() {
        return terms;
    }

    public String getLighthouse() {
        return lighthouse;
    }

    public String getValidator() {
        return validator;
    }

    public BigInteger getValidatorFee() {
        return validatorFee;
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public String getPromisee() {
        return promisee;
    }
}
