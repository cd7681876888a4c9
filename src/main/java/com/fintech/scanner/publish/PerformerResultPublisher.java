package com.fintech.scanner.publish;

import com.fintech.scanner.domain.PerformerEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single outbound channel of the scanner.
 *
 * Delivers each event synchronously to every registered listener. A failing listener is
 * logged and skipped so it can neither stall the minute cycle nor starve the others.
 */
@Component
public class PerformerResultPublisher {

    private static final Logger log = LoggerFactory.getLogger(PerformerResultPublisher.class);

    private final List<PerformerEventListener> listeners;
    private final Counter published;
    private final Counter listenerFailures;
    private final AtomicReference<PerformerEvent> lastPublished = new AtomicReference<>();

    @Autowired
    public PerformerResultPublisher(ObjectProvider<PerformerEventListener> listeners, MeterRegistry meterRegistry) {
        this(listeners.orderedStream().toList(), meterRegistry);
    }

    public PerformerResultPublisher(List<PerformerEventListener> listeners, MeterRegistry meterRegistry) {
        this.listeners = List.copyOf(listeners);
        this.published = meterRegistry.counter("scanner.results.published");
        this.listenerFailures = meterRegistry.counter("scanner.publish.listener.failures");
        log.info("Result publisher wired with {} listener(s): {}", this.listeners.size(),
            this.listeners.stream().map(l -> l.getClass().getSimpleName()).toList());
    }

    public void publish(PerformerEvent event) {
        lastPublished.set(event);
        published.increment();
        log.info("Best performer for minute {}: {} ({} moves, turnover={}M, funding={}%)",
            event.minute(), event.symbol(), event.moves(), event.turnover(), event.fundingRate());

        for (PerformerEventListener listener : listeners) {
            try {
                listener.onPerformer(event);
            } catch (RuntimeException e) {
                listenerFailures.increment();
                log.error("Listener {} failed on event for {}", listener.getClass().getSimpleName(), event.symbol(), e);
            }
        }
    }

    public Optional<PerformerEvent> lastPublished() {
        return Optional.ofNullable(lastPublished.get());
    }
}
