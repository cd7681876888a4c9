package com.fintech.scanner.api;

import com.fintech.scanner.config.ScannerProperties;
import com.fintech.scanner.domain.PerformerEvent;
import com.fintech.scanner.publish.PerformerEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current result plus a rolling history of published minutes.
 * Updated only by consuming published events; read by HTTP threads.
 */
@Component
@ConditionalOnProperty(name = "scanner.delivery.history.enabled", havingValue = "true", matchIfMissing = true)
public class SymbolHistoryStore implements PerformerEventListener {

    private static final Logger log = LoggerFactory.getLogger(SymbolHistoryStore.class);

    private final Clock clock;
    private final Duration retention;
    private final AtomicReference<SymbolEntry> current = new AtomicReference<>();
    // Newest first
    private final Deque<SymbolEntry> history = new ConcurrentLinkedDeque<>();

    public SymbolHistoryStore(Clock clock, ScannerProperties properties) {
        this.clock = clock;
        this.retention = properties.getDelivery().getHistory().getRetention();
    }

    @Override
    public void onPerformer(PerformerEvent event) {
        Instant now = clock.instant();
        SymbolEntry entry = SymbolEntry.of(event, now);
        current.set(entry);
        history.addFirst(entry);
        int evicted = evictExpired(now);
        log.debug("History updated with {}: size={}, evicted={}", event.symbol(), history.size(), evicted);
    }

    public SymbolsResponse snapshot() {
        evictExpired(clock.instant());
        return new SymbolsResponse(current.get(), new ArrayList<>(history));
    }

    public List<SymbolEntry> history() {
        return List.copyOf(history);
    }

    /** Removes entries not newer than now - retention; they sit at the tail. */
    private int evictExpired(Instant now) {
        Instant cutoff = now.minus(retention);
        int evicted = 0;
        SymbolEntry oldest;
        while ((oldest = history.peekLast()) != null && !oldest.timestamp().isAfter(cutoff)) {
            if (history.removeLastOccurrence(oldest)) {
                evicted++;
            }
        }
        return evicted;
    }
}
