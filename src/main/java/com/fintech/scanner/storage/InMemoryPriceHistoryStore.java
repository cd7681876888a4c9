package com.fintech.scanner.storage;

import com.fintech.scanner.domain.PriceSample;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed implementation of PriceHistoryStore.
 *
 * Each symbol keeps an insertion-ordered deque. Because every sample of a tick shares one
 * timestamp and ticks never overlap, insertion order is time order: pruning only
 * trims deque heads, which keeps it linear in the number of samples removed plus symbols.
 *
 * A symbol whose last sample is pruned loses its volume too; it reappears on the next snapshot.
 */
@Repository
public class InMemoryPriceHistoryStore implements PriceHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPriceHistoryStore.class);

    private final Map<String, SymbolState> states = new ConcurrentHashMap<>();
    private final AtomicLong totalSamples = new AtomicLong(0);

    public InMemoryPriceHistoryStore(MeterRegistry meterRegistry) {
        meterRegistry.gaugeMapSize("scanner.history.symbols", List.of(), states);
        meterRegistry.gauge("scanner.history.samples", totalSamples);
    }

    @Override
    public void append(String symbol, PriceSample sample) {
        states.computeIfAbsent(symbol, k -> new SymbolState()).append(sample);
        totalSamples.incrementAndGet();
    }

    @Override
    public void updateVolume(String symbol, double volume) {
        states.computeIfAbsent(symbol, k -> new SymbolState()).latestVolume(volume);
    }

    @Override
    public double latestVolume(String symbol) {
        SymbolState state = states.get(symbol);
        return state == null ? 0.0 : state.latestVolume();
    }

    @Override
    public List<PriceSample> windowed(String symbol, Duration window, Instant now) {
        SymbolState state = states.get(symbol);
        if (state == null) {
            return List.of();
        }
        return state.samplesSince(now.minus(window));
    }

    @Override
    public long prune(Duration maxAge, Instant now) {
        Instant cutoff = now.minus(maxAge);
        long removed = 0;

        Iterator<Map.Entry<String, SymbolState>> it = states.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, SymbolState> entry = it.next();
            SymbolState state = entry.getValue();
            removed += state.dropBefore(cutoff);
            if (state.isEmpty()) {
                it.remove();
            }
        }

        totalSamples.addAndGet(-removed);
        if (removed > 0 && log.isTraceEnabled()) {
            log.trace("Pruned {} samples older than {}", removed, cutoff);
        }
        return removed;
    }

    @Override
    public Set<String> symbols() {
        return Set.copyOf(states.keySet());
    }

    @Override
    public long sampleCount() {
        return totalSamples.get();
    }

    @Override
    public void clear() {
        log.info("Clearing price history: symbols={}, samples={}", states.size(), totalSamples.get());
        states.clear();
        totalSamples.set(0);
    }
}
