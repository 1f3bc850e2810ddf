package com.work.miner.chain;

import java.math.BigInteger;

/**
 * lighthouse 状态快照。仅由外部协调合约修改，本地只读且不跨挂起点缓存。
 */
public class LighthouseState {
    private final String address;
    /**
     * 当前轮次持有者的 provider 索引，0 表示无人持有。
     */
    private final long marker;
    private final long quota;
    private final long timeoutBlocks;
    /**
     * marker 最近一次被刷新的区块。
     */
    private final long keepAliveBlock;
    private final BigInteger stakeMinimum;
    /**
     * 查询账户的 provider 索引，0 表示未质押。
     */
    private final long providerIndex;
    private final BigInteger providerStake;

    public LighthouseState(String address, long marker, long quota, long timeoutBlocks, long keepAliveBlock,
                           BigInteger stakeMinimum, long providerIndex, BigInteger providerStake) {
        this.address = address;
        this.marker = marker;
        this.quota = quota;
        this.timeoutBlocks = timeoutBlocks;
        this.keepAliveBlock = keepAliveBlock;
        this.stakeMinimum = stakeMinimum == null ? BigInteger.ZERO : stakeMinimum;
        this.providerIndex = providerIndex;
        this.providerStake = providerStake == null ? BigInteger.ZERO : providerStake;
    }

    public String getAddress() {
        return address;
    }

    public long getMarker() {
        return marker;
    }

    public long getQuota() {
        return quota;
    }

    public long getTimeoutBlocks() {
        return timeoutBlocks;
    }

    public long getKeepAliveBlock() {
        return keepAliveBlock;
    }

    public BigInteger getStakeMinimum() {
        return stakeMinimum;
    }

    public long getProviderIndex() {
        return providerIndex;
    }

    public BigInteger getProviderStake() {
        return providerStake;
    }

    public boolean isProvider() {
        return providerIndex > 0;
    }

    public boolean isMarkerHeldBy(long index) {
        return marker != 0 && marker == index;
    }

    /**
     * 上一持有者超时后，任意 provider 可以接管的最早区块。
     */
    public long getTakeoverBlock() {
        return keepAliveBlock + timeoutBlocks + 1;
    }
}
