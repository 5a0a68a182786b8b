package com.streamfirst.worklog.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Identifies the external record a work session is folded into: one record per
 * day, actor and scope. The serialized form is what the ledger file stores.
 *
 * @param date the local date of the session start
 * @param actor the session actor
 * @param scope the session scope
 */
public record SessionKey(LocalDate date, String actor, String scope) {

    public SessionKey {
        Objects.requireNonNull(date, "Session date cannot be null");
        Objects.requireNonNull(actor, "Session actor cannot be null");
        Objects.requireNonNull(scope, "Session scope cannot be null");
    }

    /**
     * Returns the ledger key in the format {@code YYYY-MM-DD_actor_scope}.
     */
    public String serialize() {
        return date + "_" + actor + "_" + scope;
    }

    @Override
    public String toString() {
        return serialize();
    }
}
