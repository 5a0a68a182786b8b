package com.streamfirst.worklog.domain;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Point-in-time copy of the sync ledger, the unit that is loaded and persisted.
 *
 * @param seenEventIds ids of every event already processed
 * @param sessionIndex serialized session key to external record id
 */
public record LedgerSnapshot(Set<String> seenEventIds, Map<String, String> sessionIndex) {

    public LedgerSnapshot {
        Objects.requireNonNull(seenEventIds, "Seen event ids cannot be null");
        Objects.requireNonNull(sessionIndex, "Session index cannot be null");
        seenEventIds = Set.copyOf(seenEventIds);
        sessionIndex = Map.copyOf(sessionIndex);
    }

    public static LedgerSnapshot empty() {
        return new LedgerSnapshot(Set.of(), Map.of());
    }
}
