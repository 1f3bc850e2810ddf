package com.work.miner.chain;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * mock 模式下的交易编码：签名端与 mock 链共享，用可读文本代替 RLP。
 */
public final class MockTransactionCodec {

    public static final String CREATE = "CREATE";
    public static final String FINALIZE = "FINALIZE";
    /**
     * ref = spender:amount
     */
    public static final String APPROVE = "APPROVE";
    /**
     * ref = lighthouse:amount
     */
    public static final String REFILL = "REFILL";

    private static final String PREFIX = "mocktx";
    private static final String SEPARATOR = "|";

    private MockTransactionCodec() {
    }

    public static String encode(String kind, String from, long nonce, BigInteger maxFeePerGas,
                                BigInteger maxPriorityFeePerGas, String ref) {
        String text = String.join(SEPARATOR, PREFIX, kind, from, Long.toString(nonce),
                maxFeePerGas.toString(), maxPriorityFeePerGas.toString(), ref == null ? "-" : ref);
        return Numeric.toHexString(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String hashOf(String rawTransaction) {
        return Hash.sha3(rawTransaction);
    }

    public static MockTransaction decode(String rawTransaction) {
        String text = new String(Numeric.hexStringToByteArray(rawTransaction), StandardCharsets.UTF_8);
        String[] parts = text.split("\\|", -1);
        if (parts.length != 7 || !PREFIX.equals(parts[0])) {
            throw new IllegalArgumentException("not a mock transaction");
        }
        return new MockTransaction(parts[1], parts[2], Long.parseLong(parts[3]),
                new BigInteger(parts[4]), new BigInteger(parts[5]), "-".equals(parts[6]) ? null : parts[6]);
    }

    public static class MockTransaction {
        private final String kind;
        private final String from;
        private final long nonce;
        private final BigInteger maxFeePerGas;
        private final BigInteger maxPriorityFeePerGas;
        private final String ref;

        MockTransaction(String kind, String from, long nonce, BigInteger maxFeePerGas,
                        BigInteger maxPriorityFeePerGas, String ref) {
            this.kind = kind;
            this.from = from;
            this.nonce = nonce;
            this.maxFeePerGas = maxFeePerGas;
            this.maxPriorityFeePerGas = maxPriorityFeePerGas;
            this.ref = ref;
        }

        public String getKind() {
            return kind;
        }

        public String getFrom() {
            return from;
        }

        public long getNonce() {
            return nonce;
        }

        public BigInteger getMaxFeePerGas() {
            return maxFeePerGas;
        }

        public BigInteger getMaxPriorityFeePerGas() {
            return maxPriorityFeePerGas;
        }

        public String getRef() {
            return ref;
        }
    }
}
