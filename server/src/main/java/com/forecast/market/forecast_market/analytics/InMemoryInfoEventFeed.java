package com.forecast.market.forecast_market.analytics;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.forecast.market.forecast_market.entity.InfoEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * Feed backed by events pushed in by the host, e.g. a news ingestion job.
 * Events older than {@link #EVENT_RETENTION} are dropped.
 */
@Slf4j
public class InMemoryInfoEventFeed implements InfoEventFeed {
    static final Duration EVENT_RETENTION = Duration.ofDays(7);

    private final CopyOnWriteArrayList<InfoEvent> events = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryInfoEventFeed(Clock clock) {
        this.clock = clock;
    }

    public void publish(InfoEvent event) {
        trim();
        events.add(event);
        log.debug("Info event published: type={}, markets={}", event.type(), event.mappedMarketIds());
    }

    @Override
    public List<InfoEvent> eventsFor(String marketId) {
        trim();
        return events.stream()
                .filter(e -> e.mapsTo(marketId))
                .sorted(Comparator.comparingLong(InfoEvent::timestamp).reversed())
                .toList();
    }

    int size() {
        return events.size();
    }

    private void trim() {
        long cutoff = clock.millis() - EVENT_RETENTION.toMillis();
        events.removeIf(e -> e.timestamp() < cutoff);
    }
}
