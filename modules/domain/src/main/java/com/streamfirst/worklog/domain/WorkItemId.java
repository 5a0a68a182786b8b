package com.streamfirst.worklog.domain;

import java.util.Optional;

/**
 * Identifier of a structured work item. Valid ids lie in {@code [1, 999999]}.
 *
 * @param value the numeric id
 */
public record WorkItemId(int value) implements Comparable<WorkItemId> {

    public static final int MIN = 1;
    public static final int MAX = 999_999;

    public WorkItemId {
        if (value < MIN) {
            throw new IllegalArgumentException("Work item ID must be positive, got " + value);
        }
        if (value > MAX) {
            throw new IllegalArgumentException("Work item ID seems invalid (too large): " + value);
        }
    }

    public static boolean isValid(long value) {
        return value >= MIN && value <= MAX;
    }

    /**
     * Parses a work item id, returning empty for non-numeric or out-of-range input.
     */
    public static Optional<WorkItemId> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            long parsed = Long.parseLong(value.trim());
            return isValid(parsed) ? Optional.of(new WorkItemId((int) parsed)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public String formatForDisplay() {
        return "#" + value;
    }

    @Override
    public int compareTo(WorkItemId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
