package com.streamfirst.worklog.domain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)} used to ask collaborators for events or records.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        Objects.requireNonNull(start, "Window start cannot be null");
        Objects.requireNonNull(end, "Window end cannot be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    /**
     * The trailing window used by real-time polling.
     */
    public static TimeWindow lastHours(long hours, Clock clock) {
        Instant now = clock.instant();
        return new TimeWindow(now.minus(Duration.ofHours(hours)), now);
    }

    /**
     * Whole local days from {@code days} days ago up to the end of today, used for catch-up runs.
     */
    public static TimeWindow lastDays(int days, ZoneId zone, Clock clock) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        Instant start = today.minusDays(days).atStartOfDay(zone).toInstant();
        Instant end = today.plusDays(1).atStartOfDay(zone).toInstant();
        return new TimeWindow(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
