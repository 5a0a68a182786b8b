package com.streamfirst.worklog.domain;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * What the commit sync job watches and how often.
 *
 * @param scopes repositories to fetch events from
 * @param pollInterval delay between two polls
 * @param pollWindowHours how far back each poll looks
 * @param historyDays how far back the catch-up run looks
 */
public record TrackingSettings(List<String> scopes, Duration pollInterval, long pollWindowHours,
                               int historyDays) {

    public TrackingSettings {
        Objects.requireNonNull(pollInterval, "Poll interval cannot be null");
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive, got " + pollInterval);
        }
        if (pollWindowHours <= 0) {
            throw new IllegalArgumentException("Poll window must be positive, got " + pollWindowHours);
        }
        if (historyDays < 0) {
            throw new IllegalArgumentException("History days cannot be negative, got " + historyDays);
        }
    }
}
