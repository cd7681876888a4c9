package com.fintech.scanner.ingestion;

import com.fintech.scanner.domain.TickerSnapshot;

import java.util.List;

/**
 * Source of point-in-time ticker snapshots.
 */
public interface MarketDataClient {

    /**
     * Performs one request and returns every instrument quoted in the configured currency.
     *
     * @return Tickers whose symbol ends with the quote suffix, in response order
     * @throws TickerFetchException on any transport, HTTP or parse failure
     */
    List<TickerSnapshot> fetchTickers();
}
