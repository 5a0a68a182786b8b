package com.streamfirst.worklog.domain;

import lombok.NonNull;
import lombok.Value;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * A reconstructed contiguous period of activity for one actor in one scope.
 * Sessions are produced by the clusterer and only replaced, never mutated, by the merger.
 */
@Value
public class WorkSession {

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm");

    @NonNull String actor;
    @NonNull String scope;
    @NonNull ZonedDateTime start;
    @NonNull ZonedDateTime end;

    /** Member events ordered by timestamp */
    @NonNull List<RawEvent> memberEvents;

    /** Worked time in hours, already capped at the configured maximum */
    double durationHours;

    public WorkSession(@NonNull String actor, @NonNull String scope, @NonNull ZonedDateTime start,
                       @NonNull ZonedDateTime end, @NonNull List<RawEvent> memberEvents,
                       double durationHours) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Session end " + end + " is before start " + start);
        }
        if (memberEvents.isEmpty()) {
            throw new IllegalArgumentException("Session must contain at least one event");
        }
        this.actor = actor;
        this.scope = scope;
        this.start = start;
        this.end = end;
        this.memberEvents = List.copyOf(memberEvents);
        this.durationHours = durationHours;
    }

    public int eventCount() {
        return memberEvents.size();
    }

    public ActivityScope activityScope() {
        return new ActivityScope(actor, scope);
    }

    public SessionKey sessionKey() {
        return new SessionKey(start.toLocalDate(), actor, scope);
    }

    /**
     * Text used as the external record description, e.g. {@code "api: 3 commits (09:00–09:20)"}.
     */
    public String description() {
        return scope + ": " + eventCount() + " commits ("
                + CLOCK.format(start) + "–" + CLOCK.format(end) + ")";
    }

    @Override
    public String toString() {
        return "WorkSession{" + actor + "@" + scope + ", " + start + " -> " + end
                + ", events=" + eventCount() + ", hours=" + durationHours + '}';
    }
}
