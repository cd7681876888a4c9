package com.fintech.scanner.scanner;

import com.fintech.scanner.aggregation.MinuteAccumulator;
import com.fintech.scanner.aggregation.PerformerSelector;
import com.fintech.scanner.aggregation.VolatilityEstimator;
import com.fintech.scanner.config.ScannerProperties;
import com.fintech.scanner.domain.PerformerEvent;
import com.fintech.scanner.domain.TickerSnapshot;
import com.fintech.scanner.ingestion.ErrorKind;
import com.fintech.scanner.ingestion.MarketDataClient;
import com.fintech.scanner.ingestion.TickerFetchException;
import com.fintech.scanner.ingestion.TickerSnapshotFetcher;
import com.fintech.scanner.publish.PerformerEventListener;
import com.fintech.scanner.publish.PerformerResultPublisher;
import com.fintech.scanner.storage.InMemoryPriceHistoryStore;
import com.fintech.scanner.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("MinuteCycleScanner Tests")
class MinuteCycleScannerTest {

    private static final Instant MINUTE_1 = Instant.parse("2025-01-01T12:00:00Z");
    private static final Instant MINUTE_2 = MINUTE_1.plusSeconds(60);

    private ScannerProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private MarketDataClient client;
    private InMemoryPriceHistoryStore store;
    private MinuteAccumulator accumulator;
    private List<PerformerEvent> published;
    private MinuteCycleScanner scanner;

    /** Epoch seconds at which the fake exchange times out. */
    private final Set<Long> failingSeconds = new HashSet<>();

    @BeforeEach
    void setUp() {
        properties = new ScannerProperties();
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(MINUTE_1);
        client = mock(MarketDataClient.class);
        store = new InMemoryPriceHistoryStore(meterRegistry);
        accumulator = new MinuteAccumulator();
        published = new CopyOnWriteArrayList<>();

        List<PerformerEventListener> listeners = List.of(published::add);
        PerformerResultPublisher publisher = new PerformerResultPublisher(listeners, meterRegistry);
        TickerSnapshotFetcher fetcher = new TickerSnapshotFetcher(client, store, accumulator, meterRegistry);
        scanner = new MinuteCycleScanner(
            fetcher,
            client,
            store,
            new VolatilityEstimator(store, properties),
            new PerformerSelector(store, properties),
            accumulator,
            publisher,
            properties,
            clock,
            meterRegistry);

        when(client.fetchTickers()).thenAnswer(invocation -> marketAt(clock.instant()));
    }

    /**
     * AAA oscillates 100/101 with 20M turnover, BBB swings harder but is illiquid,
     * CCC is liquid and flat.
     */
    private List<TickerSnapshot> marketAt(Instant now) {
        long second = now.getEpochSecond();
        if (failingSeconds.contains(second)) {
            throw new TickerFetchException(ErrorKind.TIMEOUT, "Read timed out");
        }
        double aaa = second % 2 == 0 ? 100.0 : 101.0;
        double bbb = second % 2 == 0 ? 100.0 : 110.0;
        return List.of(
            new TickerSnapshot("AAAUSDT", aaa, 20_000_000, 0.0001),
            new TickerSnapshot("BBBUSDT", bbb, 5_000_000, 0.0005),
            new TickerSnapshot("CCCUSDT", 50.0, 30_000_000, -0.0002));
    }

    private void runSeconds(Instant minute, int fromSecond, int toSecond) {
        for (int s = fromSecond; s <= toSecond; s++) {
            clock.set(minute.plusSeconds(s));
            scanner.tick();
        }
    }

    private void runMinute(Instant minute) {
        runSeconds(minute, 0, 59);
    }

    private double suppressed(String reason) {
        return meterRegistry.counter("scanner.results.suppressed", "reason", reason).count();
    }

    @Test
    @DisplayName("A clean minute publishes the most volatile liquid symbol at second 59")
    void testCleanMinutePublishes() {
        runSeconds(MINUTE_1, 0, 58);
        assertThat(published).isEmpty();

        runSeconds(MINUTE_1, 59, 59);

        assertThat(published).hasSize(1);
        PerformerEvent event = published.get(0);
        // 58 samples alternating 100/101: 57 unit moves over an average of 100.5
        long expectedMoves = Math.round(57 / 100.5 * 100 * 100);
        assertThat(event.symbol()).isEqualTo("AAAUSDT");
        assertThat(event.moves()).isEqualTo((int) expectedMoves);
        assertThat(event.turnover()).isEqualByComparingTo(new BigDecimal("20.00"));
        assertThat(event.fundingRate()).isEqualByComparingTo(new BigDecimal("0.0100"));
        assertThat(event.minute()).isEqualTo(MINUTE_1);
        assertThat(event.publishedAt()).isEqualTo(MINUTE_1.plusSeconds(59));
        verify(client, times(58)).fetchTickers();
    }

    @Test
    @DisplayName("A single failed fetch suppresses the whole minute")
    void testErrorSuppressesMinute() {
        failingSeconds.add(MINUTE_1.plusSeconds(30).getEpochSecond());

        runMinute(MINUTE_1);

        assertThat(published).isEmpty();
        assertThat(accumulator.hasError()).isTrue();
        assertThat(suppressed("fetch_error")).isEqualTo(1.0);
        assertThat(meterRegistry.counter("scanner.fetch.errors", "kind", "TIMEOUT").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("The error flag does not leak into the next minute")
    void testErrorClearedByReset() {
        failingSeconds.add(MINUTE_1.plusSeconds(5).getEpochSecond());
        runMinute(MINUTE_1);

        runSeconds(MINUTE_2, 0, 0);
        assertThat(accumulator.hasError()).isFalse();
        assertThat(accumulator.scores()).isEmpty();
        assertThat(accumulator.minute()).isEqualTo(MINUTE_2);

        runSeconds(MINUTE_2, 1, 59);

        assertThat(published).extracting(PerformerEvent::minute).containsExactly(MINUTE_2);
    }

    @Test
    @DisplayName("Each minute publishes at most once")
    void testOnePublishPerMinute() {
        runMinute(MINUTE_1);
        runSeconds(MINUTE_1, 59, 59);
        runMinute(MINUTE_2);

        assertThat(published).extracting(PerformerEvent::minute).containsExactly(MINUTE_1, MINUTE_2);
    }

    @Test
    @DisplayName("A mid-minute start joins the current minute")
    void testMidMinuteStart() {
        runSeconds(MINUTE_1, 40, 59);

        assertThat(published).hasSize(1);
        assertThat(published.get(0).minute()).isEqualTo(MINUTE_1);
        assertThat(accumulator.ticksAccumulated()).isEqualTo(19);
    }

    @Test
    @DisplayName("A dropped reset tick does not carry the previous minute's error")
    void testMissedResetStillRolls() {
        failingSeconds.add(MINUTE_1.plusSeconds(10).getEpochSecond());
        runMinute(MINUTE_1);

        runSeconds(MINUTE_2, 1, 59);

        assertThat(published).extracting(PerformerEvent::minute).containsExactly(MINUTE_2);
    }

    @Test
    @DisplayName("No liquid mover means nothing is published")
    void testNoQualifyingSymbol() {
        properties.getSelection().setMinTurnover(1e12);
        MinuteCycleScanner strict = new MinuteCycleScanner(
            new TickerSnapshotFetcher(client, store, accumulator, meterRegistry),
            client, store,
            new VolatilityEstimator(store, properties),
            new PerformerSelector(store, properties),
            accumulator,
            new PerformerResultPublisher(List.<PerformerEventListener>of(published::add), meterRegistry),
            properties, clock, meterRegistry);

        for (int s = 0; s <= 59; s++) {
            clock.set(MINUTE_1.plusSeconds(s));
            strict.tick();
        }

        assertThat(published).isEmpty();
        assertThat(accumulator.isFinalized()).isTrue();
    }

    @Test
    @DisplayName("Should refuse a retention shorter than the scoring window")
    void testRetentionShorterThanWindowRejected() {
        properties.getVolatility().setRetention(Duration.ofSeconds(30));

        assertThatThrownBy(() -> new MinuteCycleScanner(
            new TickerSnapshotFetcher(client, store, accumulator, meterRegistry),
            client, store,
            new VolatilityEstimator(store, properties),
            new PerformerSelector(store, properties),
            accumulator,
            new PerformerResultPublisher(List.<PerformerEventListener>of(), meterRegistry),
            properties, clock, meterRegistry))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("retention");
    }

    @Test
    @DisplayName("A winner missing from the last snapshot is not published")
    void testWinnerMissingFromSnapshot() {
        runSeconds(MINUTE_1, 0, 57);
        when(client.fetchTickers()).thenReturn(List.of(new TickerSnapshot("CCCUSDT", 50.0, 30_000_000, 0.0)));

        runSeconds(MINUTE_1, 58, 59);

        assertThat(published).isEmpty();
        assertThat(suppressed("winner_missing")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Pruning keeps history bounded to the retention window")
    void testHistoryBounded() {
        runMinute(MINUTE_1);
        runMinute(MINUTE_2);
        runMinute(MINUTE_2.plusSeconds(60));

        Instant now = clock.instant();
        assertThat(store.windowed("AAAUSDT", properties.getVolatility().getRetention().plusSeconds(3600), now))
            .allSatisfy(sample -> assertThat(sample.observedAt())
                .isAfterOrEqualTo(now.minus(properties.getVolatility().getRetention()).minusSeconds(1)));
    }

    @Nested
    @DisplayName("Refresh on finalize")
    class RefreshOnFinalize {

        @BeforeEach
        void enableRefresh() {
            properties.getCycle().setRefreshOnFinalize(true);
        }

        @Test
        @DisplayName("Fetches fresh market data for the winner at second 59")
        void testRefreshUsesFreshSnapshot() {
            runSeconds(MINUTE_1, 0, 58);
            when(client.fetchTickers()).thenReturn(List.of(
                new TickerSnapshot("AAAUSDT", 100.0, 75_500_000, 0.0003)));

            runSeconds(MINUTE_1, 59, 59);

            assertThat(published).hasSize(1);
            assertThat(published.get(0).turnover()).isEqualByComparingTo(new BigDecimal("75.50"));
            assertThat(published.get(0).fundingRate()).isEqualByComparingTo(new BigDecimal("0.0300"));
            verify(client, times(59)).fetchTickers();
        }

        @Test
        @DisplayName("A failed finalize fetch marks the minute and suppresses the result")
        void testRefreshFailureSuppresses() {
            failingSeconds.add(MINUTE_1.plusSeconds(59).getEpochSecond());

            runMinute(MINUTE_1);

            assertThat(published).isEmpty();
            assertThat(accumulator.hasError()).isTrue();
            assertThat(suppressed("fetch_error")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Lifecycle and overlap")
    class Lifecycle {

        @Test
        @DisplayName("Scheduled ticks are ignored while idle")
        void testIdleIgnoresSchedule() {
            clock.set(MINUTE_1.plusSeconds(5));

            scanner.onSchedule();

            verify(client, never()).fetchTickers();
            assertThat(scanner.getState()).isEqualTo(ScannerState.IDLE);
        }

        @Test
        @DisplayName("Start and stop are idempotent")
        void testStartStop() {
            assertThat(scanner.start()).isTrue();
            assertThat(scanner.start()).isFalse();
            clock.set(MINUTE_1.plusSeconds(5));
            scanner.onSchedule();
            verify(client, times(1)).fetchTickers();

            assertThat(scanner.stop()).isTrue();
            assertThat(scanner.stop()).isFalse();
            assertThat(scanner.status().state()).isEqualTo(ScannerState.IDLE);
        }

        @Test
        @DisplayName("Auto-start follows configuration")
        void testAutoStart() {
            properties.getCycle().setAutoStart(false);
            scanner.onApplicationReady();
            assertThat(scanner.getState()).isEqualTo(ScannerState.IDLE);

            properties.getCycle().setAutoStart(true);
            scanner.onApplicationReady();
            assertThat(scanner.getState()).isEqualTo(ScannerState.RUNNING);
        }

        @Test
        @DisplayName("A tick arriving while another is in flight is dropped, not queued")
        void testDropIfBusy() throws InterruptedException {
            CountDownLatch fetchStarted = new CountDownLatch(1);
            CountDownLatch releaseFetch = new CountDownLatch(1);
            when(client.fetchTickers()).thenAnswer(invocation -> {
                fetchStarted.countDown();
                releaseFetch.await(5, TimeUnit.SECONDS);
                return List.of();
            });

            clock.set(MINUTE_1.plusSeconds(5));
            Thread slowTick = new Thread(scanner::tick);
            slowTick.start();
            assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();

            clock.set(MINUTE_1.plusSeconds(6));
            scanner.tick();

            releaseFetch.countDown();
            slowTick.join(5_000);

            assertThat(scanner.getTicksDropped()).isEqualTo(1);
            verify(client, times(1)).fetchTickers();

            // Guard is released once the slow tick completes
            clock.set(MINUTE_1.plusSeconds(7));
            scanner.tick();
            verify(client, times(2)).fetchTickers();
        }

        @Test
        @DisplayName("Status reflects the running minute")
        void testStatus() {
            runSeconds(MINUTE_1, 0, 10);

            ScannerStatus status = scanner.status();

            assertThat(status.currentMinute()).isEqualTo(MINUTE_1);
            assertThat(status.hasError()).isFalse();
            assertThat(status.scoredSymbols()).isEqualTo(3);
            assertThat(status.trackedSymbols()).isEqualTo(3);
            assertThat(status.storedSamples()).isEqualTo(30);
            assertThat(status.ticksDropped()).isZero();
            assertThat(status.lastPublished()).isNull();
        }
    }

    @Test
    @DisplayName("An unexpected failure inside a tick marks the minute and the loop survives")
    void testUnexpectedFailureMarksMinute() {
        runSeconds(MINUTE_1, 0, 3);
        when(client.fetchTickers()).thenThrow(new IllegalStateException("unexpected"));

        runSeconds(MINUTE_1, 4, 4);

        assertThat(accumulator.hasError()).isTrue();
        assertThat(accumulator.firstError()).contains(ErrorKind.GENERIC);

        // Re-stubbing with when() would trigger the throwing stub
        doReturn(marketAt(MINUTE_2.plusSeconds(1))).when(client).fetchTickers();
        runMinute(MINUTE_2);
        assertThat(accumulator.hasError()).isFalse();
    }
}
