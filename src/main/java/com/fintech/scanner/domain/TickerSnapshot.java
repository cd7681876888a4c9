package com.fintech.scanner.domain;

/**
 * One instrument entry from a tickers snapshot.
 *
 * @param symbol Instrument symbol (e.g., "BTCUSDT")
 * @param lastPrice Last traded price
 * @param turnover24h 24h traded volume in quote currency
 * @param fundingRate Current funding rate as a raw fraction (0.0001 = 0.01%)
 */
public record TickerSnapshot(
    String symbol,
    double lastPrice,
    double turnover24h,
    double fundingRate
) {
}
