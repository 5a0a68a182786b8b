package com.streamfirst.worklog.domain;

import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of linking one text record to work items.
 */
@Value
public class MatchResult {

    /** Label describing how strong the evidence behind a match is. */
    public enum Strategy {
        STRICT("strict"),
        FUZZY("fuzzy");

        private final String label;

        Strategy(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static Strategy forConfidence(double confidence) {
            return confidence > 0.7 ? STRICT : FUZZY;
        }
    }

    public static final double HIGH_CONFIDENCE = 0.8;

    @NonNull TextRecord textRecord;
    @NonNull Set<Integer> matchedCandidateIds;
    double confidence;
    @NonNull Strategy strategy;

    public MatchResult(@NonNull TextRecord textRecord, @NonNull Set<Integer> matchedCandidateIds,
                       double confidence, @NonNull Strategy strategy) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1], got " + confidence);
        }
        this.textRecord = textRecord;
        this.matchedCandidateIds = Collections.unmodifiableSet(new TreeSet<>(matchedCandidateIds));
        this.confidence = confidence;
        this.strategy = strategy;
    }

    public boolean isMatched() {
        return !matchedCandidateIds.isEmpty();
    }

    public boolean isHighConfidence() {
        return confidence >= HIGH_CONFIDENCE;
    }
}
