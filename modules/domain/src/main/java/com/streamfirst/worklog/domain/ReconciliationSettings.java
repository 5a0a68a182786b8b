package com.streamfirst.worklog.domain;

import java.util.Optional;

/**
 * Options for pushing sessions to the external time-tracking system.
 *
 * @param defaultProjectRef project new records are booked against, if any
 * @param rollbackSeenOnFailure un-mark the events of a session whose sync failed so the next
 *     run retries them; off by default, in which case those events are reported as dropped
 */
public record ReconciliationSettings(Optional<String> defaultProjectRef, boolean rollbackSeenOnFailure) {

    public ReconciliationSettings {
        defaultProjectRef = defaultProjectRef == null
                ? Optional.empty()
                : defaultProjectRef.filter(ref -> !ref.isBlank());
    }

    public static ReconciliationSettings defaults() {
        return new ReconciliationSettings(Optional.empty(), false);
    }
}
