package com.work.miner.service.round;

import com.work.miner.domain.Round;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 最近 N 个已关闭轮次（内存），以及会话累计值。
 */
public class RoundHistory {

    private final int maxSize;
    private final Deque<Round> rounds = new ArrayDeque<>();

    private long totalRounds;
    private long totalCreated;
    private long totalFinalized;
    private BigInteger totalGasCost = BigInteger.ZERO;
    private BigInteger totalMinted = BigInteger.ZERO;

    public RoundHistory(int maxSize) {
        this.maxSize = Math.max(1, maxSize);
    }

    public synchronized void add(Round round) {
        if (!round.isClosed()) {
            throw new IllegalArgumentException("round " + round.getIndex() + " is still open");
        }
        rounds.addLast(round);
        while (rounds.size() > maxSize) {
            rounds.removeFirst();
        }
        totalRounds++;
        totalCreated += round.getCreatedCount();
        totalFinalized += round.getFinalizedCount();
        totalGasCost = totalGasCost.add(round.getGasCost());
        totalMinted = totalMinted.add(round.getMinted());
    }

    /**
     * 最近 n 轮，新的在前。
     */
    public synchronized List<Round> recent(int n) {
        List<Round> list = new ArrayList<>();
        Iterator<Round> it = rounds.descendingIterator();
        while (it.hasNext() && list.size() < n) {
            list.add(it.next());
        }
        return list;
    }

    public synchronized Round last() {
        return rounds.peekLast();
    }

    public synchronized long getTotalRounds() {
        return totalRounds;
    }

    public synchronized long getTotalCreated() {
        return totalCreated;
    }

    public synchronized long getTotalFinalized() {
        return totalFinalized;
    }

    public synchronized BigInteger getTotalGasCost() {
        return totalGasCost;
    }

    public synchronized BigInteger getTotalMinted() {
        return totalMinted;
    }
}
