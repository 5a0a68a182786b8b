package com.streamfirst.worklog.domain;

import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * A time entry as persisted by the external time-tracking system. Its identity is owned
 * by that system; the ledger only stores the id.
 *
 * @param id identifier assigned by the external system
 * @param start entry start
 * @param end entry end
 * @param description entry description
 * @param projectRef optional project the entry is booked against
 */
public record ExternalRecord(String id, ZonedDateTime start, ZonedDateTime end,
                             String description, Optional<String> projectRef) {

    public ExternalRecord {
        Objects.requireNonNull(id, "External record id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("External record id cannot be blank");
        }
        Objects.requireNonNull(start, "Start cannot be null");
        Objects.requireNonNull(end, "End cannot be null");
        projectRef = projectRef == null ? Optional.empty() : projectRef;
    }
}
