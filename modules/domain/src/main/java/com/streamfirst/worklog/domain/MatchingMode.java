package com.streamfirst.worklog.domain;

/**
 * How far the matcher goes when looking for work item references.
 */
public enum MatchingMode {
    /** Only explicit id patterns */
    STRICT,
    /** Patterns, then title similarity */
    FUZZY,
    /** Patterns first, title similarity for records left unmatched */
    HYBRID;

    public boolean allowsFuzzyFallback() {
        return this != STRICT;
    }
}
