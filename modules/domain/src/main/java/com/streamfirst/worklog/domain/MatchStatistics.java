package com.streamfirst.worklog.domain;

import java.util.Map;

/**
 * Aggregate view over a batch of match results.
 */
public record MatchStatistics(int totalEntries,
                              int matchedEntries,
                              int unmatchedEntries,
                              double matchRate,
                              int highConfidenceMatches,
                              double highConfidenceRate,
                              double averageConfidence,
                              Map<String, Integer> strategiesUsed) {

    public MatchStatistics {
        strategiesUsed = Map.copyOf(strategiesUsed);
    }
}
