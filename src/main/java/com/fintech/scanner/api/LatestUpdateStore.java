package com.fintech.scanner.api;

import com.fintech.scanner.domain.PerformerEvent;
import com.fintech.scanner.publish.PerformerEventListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Latest published result for change-polling clients.
 *
 * Timestamps are wall-clock millis forced to increase strictly, so a client holding
 * the previous timestamp always sees the next update even if the clock stepped back.
 */
@Component
@ConditionalOnProperty(name = "scanner.delivery.polling.enabled", havingValue = "true", matchIfMissing = true)
public class LatestUpdateStore implements PerformerEventListener {

    private final Clock clock;
    private volatile UpdateResponse latest;

    public LatestUpdateStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void onPerformer(PerformerEvent event) {
        long now = clock.millis();
        long timestamp = latest == null ? now : Math.max(now, latest.timestamp() + 1);
        latest = UpdateResponse.of(event, timestamp);
    }

    /**
     * Returns the latest update if it is newer than {@code lastUpdate}.
     */
    public Optional<UpdateResponse> newerThan(long lastUpdate) {
        UpdateResponse snapshot = latest;
        if (snapshot != null && snapshot.timestamp() > lastUpdate) {
            return Optional.of(snapshot);
        }
        return Optional.empty();
    }
}
