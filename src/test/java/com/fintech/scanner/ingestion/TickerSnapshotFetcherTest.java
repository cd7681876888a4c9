package com.fintech.scanner.ingestion;

import com.fintech.scanner.aggregation.MinuteAccumulator;
import com.fintech.scanner.domain.PriceSample;
import com.fintech.scanner.domain.TickerSnapshot;
import com.fintech.scanner.storage.InMemoryPriceHistoryStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TickerSnapshotFetcher Tests")
class TickerSnapshotFetcherTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:05Z");

    @Mock
    private MarketDataClient client;

    private SimpleMeterRegistry meterRegistry;
    private InMemoryPriceHistoryStore store;
    private MinuteAccumulator accumulator;
    private TickerSnapshotFetcher fetcher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        store = new InMemoryPriceHistoryStore(meterRegistry);
        accumulator = new MinuteAccumulator();
        accumulator.reset(Instant.parse("2025-01-01T12:00:00Z"));
        fetcher = new TickerSnapshotFetcher(client, store, accumulator, meterRegistry);
    }

    @Test
    @DisplayName("Should append one sample per ticker and overwrite volumes")
    void testSuccessfulFetch() {
        when(client.fetchTickers()).thenReturn(List.of(
            new TickerSnapshot("BTCUSDT", 97000, 2.5e9, 0.0001),
            new TickerSnapshot("ETHUSDT", 3600, 1.2e9, 0.00008)));

        boolean ok = fetcher.fetchAndRecord(NOW);

        assertThat(ok).isTrue();
        assertThat(store.windowed("BTCUSDT", Duration.ofSeconds(60), NOW))
            .containsExactly(new PriceSample(97000, NOW));
        assertThat(store.latestVolume("ETHUSDT")).isEqualTo(1.2e9);
        assertThat(accumulator.snapshotOf("ETHUSDT")).isPresent();
        assertThat(accumulator.hasError()).isFalse();
        assertThat(meterRegistry.get("scanner.fetch.latency").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("A failed fetch marks the minute, records nothing and counts the error")
    void testFailedFetch() {
        when(client.fetchTickers()).thenThrow(new TickerFetchException(ErrorKind.TIMEOUT, "Read timed out"));

        boolean ok = fetcher.fetchAndRecord(NOW);

        assertThat(ok).isFalse();
        assertThat(store.sampleCount()).isZero();
        assertThat(accumulator.hasError()).isTrue();
        assertThat(accumulator.firstError()).contains(ErrorKind.TIMEOUT);
        assertThat(meterRegistry.get("scanner.fetch.errors").tag("kind", "TIMEOUT").counter().count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.get("scanner.fetch.latency").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("An empty snapshot is a success with no samples")
    void testEmptySnapshot() {
        when(client.fetchTickers()).thenReturn(List.of());

        assertThat(fetcher.fetchAndRecord(NOW)).isTrue();
        assertThat(store.symbols()).isEmpty();
        assertThat(accumulator.hasError()).isFalse();
    }
}
