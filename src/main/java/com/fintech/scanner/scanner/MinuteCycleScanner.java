package com.fintech.scanner.scanner;

import com.fintech.scanner.aggregation.MinuteAccumulator;
import com.fintech.scanner.aggregation.PerformerSelector;
import com.fintech.scanner.aggregation.VolatilityEstimator;
import com.fintech.scanner.config.ScannerProperties;
import com.fintech.scanner.domain.CyclePhase;
import com.fintech.scanner.domain.PerformerEvent;
import com.fintech.scanner.domain.PerformerResult;
import com.fintech.scanner.domain.TickerSnapshot;
import com.fintech.scanner.ingestion.ErrorKind;
import com.fintech.scanner.ingestion.MarketDataClient;
import com.fintech.scanner.ingestion.TickerFetchException;
import com.fintech.scanner.ingestion.TickerSnapshotFetcher;
import com.fintech.scanner.publish.PerformerResultPublisher;
import com.fintech.scanner.storage.PriceHistoryStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the minute cycle once per wall-clock second.
 *
 * <ul>
 *   <li>second 0: reset the minute (scores, error flag, snapshot cache)</li>
 *   <li>seconds 1-58: fetch, prune history, recompute volatility</li>
 *   <li>second 59: rank, enrich the winner and publish unless the minute had a fetch failure</li>
 * </ul>
 *
 * Overlap policy is drop-if-busy: a tick that starts while the previous one is still
 * running (e.g. a slow network call) is discarded and counted, never queued. The cron
 * trigger also computes its next fire time from the previous completion, so seconds that
 * elapse during a slow tick are skipped.
 *
 * The cycle position is not persisted. After a start it resynchronises from the wall
 * clock, so the first minute may be partial.
 */
@Component
public class MinuteCycleScanner {

    private static final Logger log = LoggerFactory.getLogger(MinuteCycleScanner.class);

    private final TickerSnapshotFetcher fetcher;
    private final MarketDataClient marketDataClient;
    private final PriceHistoryStore historyStore;
    private final VolatilityEstimator estimator;
    private final PerformerSelector selector;
    private final MinuteAccumulator accumulator;
    private final PerformerResultPublisher publisher;
    private final ScannerProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<ScannerState> state = new AtomicReference<>(ScannerState.IDLE);
    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
    private final AtomicLong ticksDropped = new AtomicLong(0);

    public MinuteCycleScanner(
            TickerSnapshotFetcher fetcher,
            MarketDataClient marketDataClient,
            PriceHistoryStore historyStore,
            VolatilityEstimator estimator,
            PerformerSelector selector,
            MinuteAccumulator accumulator,
            PerformerResultPublisher publisher,
            ScannerProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        Duration window = properties.getVolatility().getWindow();
        Duration retention = properties.getVolatility().getRetention();
        // Pruning must never reach into the scoring window
        if (retention.compareTo(window) < 0) {
            throw new IllegalStateException(
                "scanner.volatility.retention (" + retention + ") must not be shorter than window (" + window + ")");
        }

        this.fetcher = fetcher;
        this.marketDataClient = marketDataClient;
        this.historyStore = historyStore;
        this.estimator = estimator;
        this.selector = selector;
        this.accumulator = accumulator;
        this.publisher = publisher;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("scanner.ticks.dropped", ticksDropped);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getCycle().isAutoStart()) {
            start();
        } else {
            log.info("[Scanner] Auto-start disabled; waiting for explicit start");
        }
    }

    /**
     * @return true if the scanner transitioned from IDLE to RUNNING
     */
    public boolean start() {
        if (state.compareAndSet(ScannerState.IDLE, ScannerState.RUNNING)) {
            log.info("[Scanner] Symbol scanning started (cron='{}')", properties.getCycle().getCron());
            return true;
        }
        return false;
    }

    /**
     * @return true if the scanner transitioned from RUNNING to IDLE
     */
    public boolean stop() {
        if (state.compareAndSet(ScannerState.RUNNING, ScannerState.IDLE)) {
            log.info("[Scanner] Symbol scanning stopped");
            return true;
        }
        return false;
    }

    @Scheduled(cron = "${scanner.cycle.cron:* * * * * *}")
    public void onSchedule() {
        if (state.get() == ScannerState.RUNNING) {
            tick();
        }
    }

    /**
     * Runs the phase matching the current wall-clock second.
     * Drops the tick if another one is still in flight.
     */
    public void tick() {
        if (!tickInProgress.compareAndSet(false, true)) {
            ticksDropped.incrementAndGet();
            log.warn("[Scanner] Previous tick still running, dropping tick at {}", clock.instant());
            return;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        Instant now = clock.instant();
        CyclePhase phase = CyclePhase.forSecond(now.atZone(clock.getZone()).getSecond());
        try {
            switch (phase) {
                case RESET -> reset(now);
                case ACCUMULATE -> accumulate(now);
                case FINALIZE -> finalizeMinute(now);
            }
        } catch (RuntimeException e) {
            // Loop must survive; the minute is no longer trustworthy
            accumulator.markError(ErrorKind.GENERIC);
            log.error("[Scanner] Tick failed in phase {} at {}", phase, now, e);
        } finally {
            tickInProgress.set(false);
            sample.stop(meterRegistry.timer("scanner.tick.time", "phase", phase.name()));
        }
    }

    private void reset(Instant now) {
        Instant minute = now.truncatedTo(ChronoUnit.MINUTES);
        accumulator.reset(minute);
        log.info("[Scanner] Starting new minute {}", minute);
    }

    /**
     * Resets the accumulator if it still belongs to an earlier minute. Happens after a
     * mid-minute start or when the second-0 tick was dropped.
     */
    private void joinMinute(Instant now) {
        Instant minute = now.truncatedTo(ChronoUnit.MINUTES);
        if (!minute.equals(accumulator.minute())) {
            accumulator.reset(minute);
            log.info("[Scanner] Joined minute {} at second {}", minute, now.atZone(clock.getZone()).getSecond());
        }
    }

    private void accumulate(Instant now) {
        joinMinute(now);
        fetcher.fetchAndRecord(now);

        Duration retention = properties.getVolatility().getRetention();
        historyStore.prune(retention, now);

        accumulator.replaceScores(estimator.estimate(now));
    }

    private void finalizeMinute(Instant now) {
        joinMinute(now);
        if (!accumulator.markFinalized()) {
            log.debug("[Scanner] Minute {} already finalized", accumulator.minute());
            return;
        }

        Instant minute = now.truncatedTo(ChronoUnit.MINUTES);
        PerformerResult result = selector.select(accumulator.scores(), accumulator.hasError());

        if (!result.hasWinner()) {
            log.info("[Scanner] No symbol qualified for minute {} ({} scored)", minute, accumulator.scores().size());
            return;
        }
        if (!result.isPublishable()) {
            suppress("fetch_error");
            log.warn("[Scanner] Suppressing minute {}: fetch failed ({}), candidate was {}",
                minute, accumulator.firstError().orElse(ErrorKind.GENERIC), result.symbol());
            return;
        }

        Optional<TickerSnapshot> ticker = lookupWinner(result.symbol());
        if (ticker.isEmpty()) {
            return;
        }

        publisher.publish(PerformerEvent.from(result.withMarketData(ticker.get()), minute, now));
    }

    /**
     * Finds the winner's funding rate and turnover: from the last cached snapshot, or
     * from a fresh fetch when refresh-on-finalize is enabled.
     */
    private Optional<TickerSnapshot> lookupWinner(String symbol) {
        if (!properties.getCycle().isRefreshOnFinalize()) {
            Optional<TickerSnapshot> cached = accumulator.snapshotOf(symbol);
            if (cached.isEmpty()) {
                suppress("winner_missing");
                log.warn("[Scanner] Winner {} missing from cached snapshot, nothing published", symbol);
            }
            return cached;
        }

        try {
            Optional<TickerSnapshot> fresh = marketDataClient.fetchTickers().stream()
                .filter(t -> t.symbol().equals(symbol))
                .findFirst();
            if (fresh.isEmpty()) {
                suppress("winner_missing");
                log.warn("[Scanner] Winner {} missing from finalize snapshot, nothing published", symbol);
            }
            return fresh;
        } catch (TickerFetchException e) {
            accumulator.markError(e.getKind());
            suppress("fetch_error");
            log.error("[Scanner] Finalize lookup for {} failed ({}): {}", symbol, e.getKind(), e.getMessage());
            return Optional.empty();
        }
    }

    private void suppress(String reason) {
        meterRegistry.counter("scanner.results.suppressed", "reason", reason).increment();
    }

    public ScannerStatus status() {
        return new ScannerStatus(
            state.get(),
            accumulator.minute(),
            accumulator.hasError(),
            accumulator.scores().size(),
            historyStore.symbols().size(),
            historyStore.sampleCount(),
            ticksDropped.get(),
            publisher.lastPublished().orElse(null)
        );
    }

    public ScannerState getState() {
        return state.get();
    }

    public long getTicksDropped() {
        return ticksDropped.get();
    }
}
