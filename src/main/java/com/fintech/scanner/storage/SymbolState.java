package com.fintech.scanner.storage;

import com.fintech.scanner.domain.PriceSample;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Per-symbol price log plus last known 24h turnover. The sample deque is written only
 * by the scanner thread; turnover is volatile so status reads see the latest value.
 */
final class SymbolState {

    private final Deque<PriceSample> samples = new ArrayDeque<>();
    private volatile double latestVolume;

    void append(PriceSample sample) {
        samples.addLast(sample);
    }

    /**
     * Samples arrive in time order, so expired ones are always at the head.
     *
     * @return Number of samples removed
     */
    int dropBefore(Instant cutoff) {
        int removed = 0;
        while (!samples.isEmpty() && !samples.peekFirst().isAtOrAfter(cutoff)) {
            samples.pollFirst();
            removed++;
        }
        return removed;
    }

    List<PriceSample> samplesSince(Instant cutoff) {
        List<PriceSample> result = new ArrayList<>();
        for (PriceSample sample : samples) {
            if (sample.isAtOrAfter(cutoff)) {
                result.add(sample);
            }
        }
        return result;
    }

    boolean isEmpty() {
        return samples.isEmpty();
    }

    double latestVolume() {
        return latestVolume;
    }

    void latestVolume(double volume) {
        this.latestVolume = volume;
    }
}
