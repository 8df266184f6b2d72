package com.jay.mfses.model;

/** The five factor scores for one ticker, each an integer in [1, 20]. */
public record SubScores(int moat, int growth, int balance, int valuation, int sentiment) {

    public String breakdownString() {
        return String.format("M:%d G:%d B:%d V:%d S:%d", moat, growth, balance, valuation, sentiment);
    }
}
