package com.streamfirst.worklog.domain;

import java.util.Objects;

/**
 * A work item that text records can be linked to.
 *
 * @param id the work item id
 * @param title the work item title, used for fuzzy matching
 * @param closed whether the item is resolved/closed/done; closed items never match fuzzily
 */
public record MatchCandidate(WorkItemId id, String title, boolean closed) {

    public MatchCandidate {
        Objects.requireNonNull(id, "Candidate id cannot be null");
        title = title == null ? "" : title;
    }

    public static MatchCandidate open(int id, String title) {
        return new MatchCandidate(new WorkItemId(id), title, false);
    }

    public static MatchCandidate closed(int id, String title) {
        return new MatchCandidate(new WorkItemId(id), title, true);
    }
}
