package com.streamfirst.worklog.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A single timestamped activity unit fetched from the event source, usually a commit.
 * Events are immutable once fetched and identified by an id that is unique per source.
 */
@Value
@EqualsAndHashCode(of = "id")
public class RawEvent {

    /** Source-unique identifier, e.g. the commit SHA */
    @NonNull String id;

    /** Who produced the event */
    @NonNull String actor;

    /** Where the event happened, e.g. the repository name */
    @NonNull String scope;

    /** When the event happened */
    @NonNull Instant timestamp;

    /** Free-form message, e.g. the commit message */
    String text;

    public RawEvent(@NonNull String id, @NonNull String actor, @NonNull String scope,
                    @NonNull Instant timestamp, String text) {
        if (id.isBlank()) {
            throw new IllegalArgumentException("Event id cannot be blank");
        }
        this.id = id;
        this.actor = actor;
        this.scope = scope;
        this.timestamp = timestamp;
        this.text = text == null ? "" : text;
    }

    public ActivityScope activityScope() {
        return new ActivityScope(actor, scope);
    }

    @Override
    public String toString() {
        return "RawEvent{id='" + id + "', actor=" + actor + ", scope=" + scope
                + ", timestamp=" + timestamp + '}';
    }
}
