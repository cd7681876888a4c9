package com.fintech.scanner.storage;

import com.fintech.scanner.domain.PriceSample;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Keyed rolling log of price samples per symbol.
 * Abstracts the storage so the scanner only depends on windowed reads and age-based pruning.
 *
 * Implementations are written to by a single timeline (the minute cycle) and may be read
 * concurrently for monitoring.
 */
public interface PriceHistoryStore {

    /**
     * Appends a sample to the symbol's log, creating the log on first use.
     *
     * @param symbol The trading pair symbol
     * @param sample The price observation
     */
    void append(String symbol, PriceSample sample);

    /**
     * Overwrites the latest 24h turnover known for the symbol.
     *
     * @param symbol The trading pair symbol
     * @param volume 24h turnover in quote currency
     */
    void updateVolume(String symbol, double volume);

    /**
     * Returns the latest 24h turnover recorded for the symbol, or 0 if none.
     */
    double latestVolume(String symbol);

    /**
     * Retrieves the samples observed within the trailing window.
     * Results are ordered by observation time ascending.
     *
     * @param symbol The trading pair symbol
     * @param window Trailing duration
     * @param now Reference instant; samples with observedAt >= now - window qualify
     * @return Samples in the window, empty if none
     */
    List<PriceSample> windowed(String symbol, Duration window, Instant now);

    /**
     * Drops every sample older than {@code maxAge} relative to {@code now}.
     * Symbols left without samples are removed.
     *
     * @return Number of samples removed
     */
    long prune(Duration maxAge, Instant now);

    /** Returns the symbols that currently hold samples. */
    Set<String> symbols();

    /** Returns the total number of samples across all symbols. */
    long sampleCount();

    /** Removes all samples and volumes. */
    void clear();
}
