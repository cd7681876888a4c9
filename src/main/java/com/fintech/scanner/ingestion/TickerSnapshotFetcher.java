package com.fintech.scanner.ingestion;

import com.fintech.scanner.aggregation.MinuteAccumulator;
import com.fintech.scanner.domain.PriceSample;
import com.fintech.scanner.domain.TickerSnapshot;
import com.fintech.scanner.storage.PriceHistoryStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Pulls one ticker snapshot and ingests it into the price history.
 *
 * Failures never propagate: the minute is marked as errored and the tick continues
 * as if it produced no data. There is no retry; the next tick is the retry.
 */
@Component
public class TickerSnapshotFetcher {

    private static final Logger log = LoggerFactory.getLogger(TickerSnapshotFetcher.class);

    private final MarketDataClient client;
    private final PriceHistoryStore historyStore;
    private final MinuteAccumulator accumulator;
    private final MeterRegistry meterRegistry;

    public TickerSnapshotFetcher(
            MarketDataClient client,
            PriceHistoryStore historyStore,
            MinuteAccumulator accumulator,
            MeterRegistry meterRegistry) {
        this.client = client;
        this.historyStore = historyStore;
        this.accumulator = accumulator;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Fetches and records one snapshot, stamping every sample with {@code now}.
     *
     * @return true if the snapshot was ingested, false if the fetch failed
     */
    public boolean fetchAndRecord(Instant now) {
        Timer.Sample sample = Timer.start(meterRegistry);
        List<TickerSnapshot> tickers;
        try {
            tickers = client.fetchTickers();
        } catch (TickerFetchException e) {
            recordFailure(e.getKind(), e);
            return false;
        } finally {
            sample.stop(meterRegistry.timer("scanner.fetch.latency"));
        }

        for (TickerSnapshot ticker : tickers) {
            historyStore.append(ticker.symbol(), new PriceSample(ticker.lastPrice(), now));
            historyStore.updateVolume(ticker.symbol(), ticker.turnover24h());
        }
        accumulator.recordSnapshot(tickers);

        log.trace("Recorded {} tickers at {}", tickers.size(), now);
        return true;
    }

    private void recordFailure(ErrorKind kind, TickerFetchException e) {
        accumulator.markError(kind);
        meterRegistry.counter("scanner.fetch.errors", "kind", kind.name()).increment();

        if (kind.isTransport()) {
            log.warn("Connection timeout or network error ({}): {}", kind, e.getMessage());
        } else {
            log.error("Error scanning tickers ({}): {}", kind, e.getMessage());
        }
    }
}
