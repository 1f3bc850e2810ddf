package com.work.miner.service.liquidation;

import com.work.miner.domain.SaleEvent;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 只追加的出售记录。
 */
public class SaleEventLog {

    private final List<SaleEvent> events = new ArrayList<>();

    public synchronized SaleEvent append(BigInteger amount, BigInteger proceeds, double slippage,
                                         BigInteger retained, Instant soldAt) {
        SaleEvent e = new SaleEvent(events.size() + 1L, amount, proceeds, slippage, retained, soldAt);
        events.add(e);
        return e;
    }

    public synchronized List<SaleEvent> all() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized BigInteger totalSold() {
        BigInteger sum = BigInteger.ZERO;
        for (SaleEvent e : events) {
            sum = sum.add(e.getAmount());
        }
        return sum;
    }

    public synchronized BigInteger totalProceeds() {
        BigInteger sum = BigInteger.ZERO;
        for (SaleEvent e : events) {
            sum = sum.add(e.getProceeds());
        }
        return sum;
    }
}
