package com.fintech.scanner.domain;

/**
 * Outcome of ranking one minute. Immutable once created.
 *
 * @param symbol Winning symbol, or null when no symbol passed the liquidity floor
 * @param score Winner's volatility score (0 when no winner)
 * @param moves round(score * 100)
 * @param hasError True if any fetch failed during the minute
 * @param turnover Winner's 24h turnover in quote currency
 * @param fundingRate Winner's funding rate as a raw fraction
 */
public record PerformerResult(
    String symbol,
    double score,
    int moves,
    boolean hasError,
    double turnover,
    double fundingRate
) {

    /** Valid empty result: nothing qualified this minute. */
    public static PerformerResult noWinner(boolean hasError) {
        return new PerformerResult(null, 0.0, 0, hasError, 0.0, 0.0);
    }

    public static PerformerResult winner(VolatilityScore score, double turnover, boolean hasError) {
        return new PerformerResult(score.symbol(), score.score(), score.moves(), hasError, turnover, 0.0);
    }

    public boolean hasWinner() {
        return symbol != null;
    }

    /** True if this minute should be published: a winner exists and no fetch failed. */
    public boolean isPublishable() {
        return hasWinner() && !hasError;
    }

    /** Returns a copy carrying the winner's turnover and funding rate from a ticker snapshot. */
    public PerformerResult withMarketData(TickerSnapshot ticker) {
        return new PerformerResult(symbol, score, moves, hasError, ticker.turnover24h(), ticker.fundingRate());
    }
}
