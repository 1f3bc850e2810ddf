package com.work.miner.domain;

/**
 * 收益评估结果：margin = (产出价值 - gas 成本) / gas 成本。
 */
public class Profitability {

    public enum Verdict {
        PROFITABLE,
        MARGINAL,
        UNPROFITABLE
    }

    private final Verdict verdict;
    private final double margin;

    private Profitability(Verdict verdict, double margin) {
        this.verdict = verdict;
        this.margin = margin;
    }

    public static Profitability profitable(double margin) {
        return new Profitability(Verdict.PROFITABLE, margin);
    }

    public static Profitability marginal(double margin) {
        return new Profitability(Verdict.MARGINAL, margin);
    }

    public static Profitability unprofitable(double margin) {
        return new Profitability(Verdict.UNPROFITABLE, margin);
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public double getMargin() {
        return margin;
    }

    public boolean isUnprofitable() {
        return verdict == Verdict.UNPROFITABLE;
    }

    @Override
    public String toString() {
        return verdict + "(" + String.format("%.4f", margin) + ")";
    }
}
