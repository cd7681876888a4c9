package com.fintech.scanner.domain;

/**
 * Volatility score of a symbol over the trailing window, in percent.
 */
public record VolatilityScore(String symbol, double score) {

    /** Integer encoding of the score: round(score * 100). */
    public int moves() {
        return (int) Math.round(score * 100);
    }
}
