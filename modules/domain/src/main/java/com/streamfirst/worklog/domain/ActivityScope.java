package com.streamfirst.worklog.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * The partition key for clustering: one actor working in one scope (e.g. a repository).
 *
 * @param actor the commit author
 * @param scope the repository name, typically "owner/repo"
 */
public record ActivityScope(String actor, String scope) implements Comparable<ActivityScope> {

    private static final Comparator<ActivityScope> ORDER =
            Comparator.comparing(ActivityScope::actor).thenComparing(ActivityScope::scope);

    public ActivityScope {
        Objects.requireNonNull(actor, "Actor cannot be null");
        Objects.requireNonNull(scope, "Scope cannot be null");
    }

    @Override
    public int compareTo(ActivityScope other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return actor + "@" + scope;
    }
}
