package com.fintech.scanner.aggregation;

import com.fintech.scanner.domain.TickerSnapshot;
import com.fintech.scanner.ingestion.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-minute state of the scanner: live score map, sticky error flag and the last
 * successful ticker snapshot.
 *
 * Lifecycle: reset → accumulate (≤58 ticks) → finalize. After {@link #reset(Instant)}
 * every derived collection is empty and every flag false; they only fill up until the
 * minute is finalized.
 *
 * Written only by the minute cycle thread. Fields are volatile so status reads from
 * HTTP threads see a consistent reference.
 */
@Component
public class MinuteAccumulator {

    private static final Logger log = LoggerFactory.getLogger(MinuteAccumulator.class);

    private volatile Instant minute;
    private volatile Map<String, Double> scores = Map.of();
    private volatile Map<String, TickerSnapshot> lastSnapshot = Map.of();
    private volatile boolean hasError;
    private volatile ErrorKind firstError;
    private volatile boolean finalized;
    private volatile int ticksAccumulated;

    /**
     * Starts a new minute. History samples are not touched; they are pruned by age elsewhere.
     */
    public void reset(Instant minuteStart) {
        if (finalized || hasError || !scores.isEmpty()) {
            log.debug("Resetting minute {}: scores={}, hasError={}, finalized={}",
                minute, scores.size(), hasError, finalized);
        }
        this.minute = minuteStart;
        this.scores = Map.of();
        this.lastSnapshot = Map.of();
        this.hasError = false;
        this.firstError = null;
        this.finalized = false;
        this.ticksAccumulated = 0;
    }

    /** Replaces the score map wholesale; the previous map is discarded. */
    public void replaceScores(Map<String, Double> newScores) {
        this.scores = Map.copyOf(newScores);
        this.ticksAccumulated++;
    }

    /** Caches the latest successful snapshot for the finalize lookup. */
    public void recordSnapshot(List<TickerSnapshot> tickers) {
        this.lastSnapshot = tickers.stream()
            .collect(Collectors.toUnmodifiableMap(TickerSnapshot::symbol, Function.identity(), (a, b) -> b));
    }

    /** Sets the sticky error flag; only the next reset clears it. */
    public void markError(ErrorKind kind) {
        if (!hasError) {
            firstError = kind;
            log.debug("Minute {} marked as errored: {}", minute, kind);
        }
        hasError = true;
    }

    /**
     * Marks the minute as finalized.
     *
     * @return false if it had already been finalized
     */
    public boolean markFinalized() {
        if (finalized) {
            return false;
        }
        finalized = true;
        return true;
    }

    public Optional<TickerSnapshot> snapshotOf(String symbol) {
        return Optional.ofNullable(lastSnapshot.get(symbol));
    }

    public Map<String, Double> scores() {
        return scores;
    }

    public boolean hasError() {
        return hasError;
    }

    public Optional<ErrorKind> firstError() {
        return Optional.ofNullable(firstError);
    }

    public boolean isFinalized() {
        return finalized;
    }

    public Instant minute() {
        return minute;
    }

    public int ticksAccumulated() {
        return ticksAccumulated;
    }
}
