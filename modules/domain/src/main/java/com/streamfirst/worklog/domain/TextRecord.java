package com.streamfirst.worklog.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A free-text time entry read from the time-tracking system.
 *
 * @param id time entry identifier
 * @param description the user-typed description, may be empty
 * @param start when the entry started, may be null for imported records
 * @param durationHours booked hours
 */
public record TextRecord(String id, String description, Instant start, double durationHours) {

    public TextRecord {
        Objects.requireNonNull(id, "Text record id cannot be null");
        description = description == null ? "" : description;
    }

    public static TextRecord of(String id, String description) {
        return new TextRecord(id, description, null, 0.0);
    }
}
