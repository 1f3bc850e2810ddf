package com.work.miner.service.nonce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次 reserve 得到的连续 nonce 区间 [first, first + count)。
 */
public class NonceReservation {
    private final String account;
    private final long epoch;
    private final long first;
    private final int count;

    public NonceReservation(String account, long epoch, long first, int count) {
        this.account = account;
        this.epoch = epoch;
        this.first = first;
        this.count = count;
    }

    public long nonceAt(int i) {
        if (i < 0 || i >= count) {
            throw new IndexOutOfBoundsException("index " + i + " outside reservation of " + count);
        }
        return first + i;
    }

    public List<Long> nonces() {
        List<Long> list = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            list.add(first + i);
        }
        return Collections.unmodifiableList(list);
    }

    public String getAccount() {
        return account;
    }

    public long getEpoch() {
        return epoch;
    }

    public long getFirst() {
        return first;
    }

    public int getCount() {
        return count;
    }

    @Override
    public String toString() {
        return "NonceReservation{" + account + " epoch=" + epoch + " [" + first + ", " + (first + count) + ")}";
    }
}
