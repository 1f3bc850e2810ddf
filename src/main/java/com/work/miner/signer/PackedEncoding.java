package com.work.miner.signer;

import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * Solidity abi.encodePacked 的最小实现：address 20 字节，uint256 32 字节，bytes 原样拼接。
 */
public final class PackedEncoding {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public static PackedEncoding builder() {
        return new PackedEncoding();
    }

    public PackedEncoding bytes(byte[] value) {
        out.write(value, 0, value.length);
        return this;
    }

    public PackedEncoding address(String address) {
        return bytes(Numeric.toBytesPadded(Numeric.toBigInt(address), 20));
    }

    public PackedEncoding uint256(BigInteger value) {
        return bytes(Numeric.toBytesPadded(value, 32));
    }

    public PackedEncoding bool(boolean value) {
        out.write(value ? 1 : 0);
        return this;
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }
}
