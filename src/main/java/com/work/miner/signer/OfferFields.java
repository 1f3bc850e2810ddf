package com.work.miner.signer;

import java.math.BigInteger;

import static com.work.miner.support.ValidationUtils.requireNonNull;

/**
 * offer 角色字段。与 demand 相反，validator 在 lighthouse 之前，费用字段为 lighthouseFee。
 */
public class OfferFields {
    private final LiabilityTerms terms;
    private final String validator;
    private final String lighthouse;
    private final BigInteger lighthouseFee;
    private final BigInteger nonce;
    /**
     * offer 的执行方（promisor）。
     */
    private final String promisor;

    public OfferFields(LiabilityTerms terms, String validator, String lighthouse, BigInteger lighthouseFee,
                       BigInteger nonce, String promisor) {
        this.terms = requireNonNull(terms, "terms");
        this.validator = requireNonNull(validator, "validator");
        this.lighthouse = requireNonNull(lighthouse, "lighthouse");
        this.lighthouseFee = requireNonNull(lighthouseFee, "lighthouseFee");
        this.nonce = requireNonNull(nonce, "nonce");
        this.promisor = requireNonNull(promisor, "promisor");
    }

    public byte[] packed() {
        return PackedEncoding.builder()
                .bytes(terms.getModel())
                .bytes(terms.getObjective())
                .address(terms.getToken())
                .uint256(terms.getCost())
                .address(validator)
                .address(lighthouse)
                .uint256(lighthouseFee)
                .uint256(terms.getDeadline())
                .uint256(nonce)
                .address(promisor)
                .toByteArray();
    }

    public LiabilityTerms getTerms() {
        return terms;
    }

    public String getValidator() {
        return validator;
    }

    public String getLighthouse() {
        return lighthouse;
    }

    public BigInteger getLighthouseFee() {
        return lighthouseFee;
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public String getPromisor() {
        return promisor;
    }
}
