package com.streamfirst.worklog.domain;

import java.time.LocalDate;

/**
 * Worked hours summed per actor and day.
 */
public record DailyHours(LocalDate date, String actor, double hours) {
}
