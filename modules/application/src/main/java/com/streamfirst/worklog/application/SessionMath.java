package com.streamfirst.worklog.application;

import java.time.Duration;
import java.time.temporal.Temporal;

/** Time arithmetic shared by the clusterer and the merger. */
final class SessionMath {

  private static final double MILLIS_PER_HOUR = 3_600_000.0;
  private static final double MILLIS_PER_MINUTE = 60_000.0;

  private SessionMath() {}

  static double hoursBetween(Temporal from, Temporal to) {
    return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
  }

  static double minutesBetween(Temporal from, Temporal to) {
    return Duration.between(from, to).toMillis() / MILLIS_PER_MINUTE;
  }
}
