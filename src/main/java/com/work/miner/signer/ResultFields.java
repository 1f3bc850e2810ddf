package com.work.miner.signer;

import java.util.Arrays;

import static com.work.miner.support.ValidationUtils.requireNonNull;

/**
 * finalizeLiability 的结果字段。
 */
public class ResultFields {
    private final String liability;
    private final byte[] result;
    private final boolean success;

    public ResultFields(String liability, byte[] result, boolean success) {
        this.liability = requireNonNull(liability, "liability");
        this.result = Arrays.copyOf(requireNonNull(result, "result"), result.length);
        this.success = success;
    }

    public byte[] packed() {
        return PackedEncoding.builder()
                .address(liability)
                .bytes(result)
                .bool(success)
                .toByteArray();
    }

    public String getLiability() {
        return liability;
    }

    public byte[] getResult() {
        return Arrays.copyOf(result, result.length);
    }

    public boolean isSuccess() {
        return success;
    }
}
