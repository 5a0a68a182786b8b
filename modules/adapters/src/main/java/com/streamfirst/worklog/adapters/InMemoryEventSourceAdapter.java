package com.streamfirst.worklog.adapters;

import com.streamfirst.worklog.domain.RawEvent;
import com.streamfirst.worklog.domain.TimeWindow;
import com.streamfirst.worklog.ports.EventSourcePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of EventSourcePort for testing and development. Events are filtered by
 * scope and window on every fetch, the way a commit listing API would filter them server-side.
 */
@Slf4j
public class InMemoryEventSourceAdapter implements EventSourcePort {

    private final List<RawEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger fetchCount = new AtomicInteger();
    private volatile boolean available = true;

    public void add(RawEvent event) {
        events.add(event);
        log.debug("Added event {} in {}", event.getId(), event.getScope());
    }

    /**
     * Adds an event from its wire form. Timestamps must be ISO-8601 with an offset, such as
     * {@code 2024-03-04T09:00:00Z}; anything else is logged and skipped.
     *
     * @return whether the event was added
     */
    public boolean addRaw(String id, String actor, String scope, String timestamp, String text) {
        if (timestamp == null) {
            log.warn("Skipping event {} without a timestamp", id);
            return false;
        }
        Instant parsed;
        try {
            parsed = OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Skipping event {} with unparseable timestamp '{}'", id, timestamp);
            return false;
        }
        add(new RawEvent(id, actor, scope, parsed, text));
        return true;
    }

    @Override
    public List<RawEvent> fetchEvents(List<String> scopes, TimeWindow window) {
        fetchCount.incrementAndGet();
        if (!available) {
            throw new IllegalStateException("Event source is not available");
        }

        List<RawEvent> result = new ArrayList<>();
        for (RawEvent event : events) {
            if (scopes.contains(event.getScope()) && window.contains(event.getTimestamp())) {
                result.add(event);
            }
        }
        log.debug("Fetched {} events from {} scopes for {}", result.size(), scopes.size(), window);
        return result;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int getFetchCount() {
        return fetchCount.get();
    }

    public void clear() {
        events.clear();
    }
}
