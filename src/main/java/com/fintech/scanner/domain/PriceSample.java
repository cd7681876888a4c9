package com.fintech.scanner.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable point-in-time price observation for one symbol.
 *
 * @param price Last traded price reported by the exchange
 * @param observedAt Instant of the tick that fetched the price
 */
public record PriceSample(
    double price,
    Instant observedAt
) {

    public PriceSample {
        Objects.requireNonNull(observedAt, "observedAt cannot be null");
    }

    /** Returns true if the sample was observed at or after {@code cutoff}. */
    public boolean isAtOrAfter(Instant cutoff) {
        return !observedAt.isBefore(cutoff);
    }
}
