package com.streamfirst.worklog.application;

import com.streamfirst.worklog.domain.ActivityScope;
import com.streamfirst.worklog.domain.RawEvent;
import com.streamfirst.worklog.domain.SessionSettings;
import com.streamfirst.worklog.domain.WorkSession;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups raw events into work sessions using exponential-decay temporal weighting.
 *
 * <p>Within each (actor, scope) partition, events are ordered by time and every event after
 * the first gets the weight {@code w = exp(-gapHours / tau)}. A weight below the cluster
 * threshold opens a new session. With tau = 2.5h and threshold 0.1 the cut falls near a
 * 5.75h gap, but the cut is always derived from the weight so other settings behave
 * consistently.
 *
 * <p>The clusterer is pure: the same events always yield the same sessions, ordered by
 * actor, scope and start.
 */
@Slf4j
@RequiredArgsConstructor
public class EventClusterer {

  static final Duration SINGLE_EVENT_SPAN = Duration.ofMinutes(15);

  @NonNull private final SessionSettings settings;

  /**
   * Clusters events into session candidates.
   *
   * @param events events from any number of actors and scopes
   * @return sessions ordered by actor, scope and start; empty for empty input
   */
  public List<WorkSession> cluster(List<RawEvent> events) {
    if (events.isEmpty()) {
      return List.of();
    }

    Map<ActivityScope, List<RawEvent>> partitions =
        events.stream()
            .collect(Collectors.groupingBy(RawEvent::activityScope, TreeMap::new, Collectors.toList()));

    List<WorkSession> sessions = new ArrayList<>();
    partitions.forEach((scope, partition) -> sessions.addAll(clusterPartition(scope, partition)));

    log.debug(
        "Clustered {} events from {} partitions into {} sessions",
        events.size(),
        partitions.size(),
        sessions.size());
    return sessions;
  }

  /** Splits one actor/scope partition at every low-weight gap. */
  private List<WorkSession> clusterPartition(ActivityScope scope, List<RawEvent> partition) {
    List<RawEvent> ordered = new ArrayList<>(partition);
    ordered.sort(Comparator.comparing(RawEvent::getTimestamp));

    List<WorkSession> sessions = new ArrayList<>();
    List<RawEvent> current = new ArrayList<>();
    Instant previous = null;

    for (RawEvent event : ordered) {
      double weight = previous == null ? 1.0 : weight(previous, event.getTimestamp());
      if (weight < settings.clusterThreshold() && !current.isEmpty()) {
        sessions.add(toSession(scope, current));
        current = new ArrayList<>();
      }
      current.add(event);
      previous = event.getTimestamp();
    }
    sessions.add(toSession(scope, current));
    return sessions;
  }

  /** Proximity weight of an event given the timestamp of its predecessor. */
  double weight(Instant previous, Instant next) {
    double gapHours = SessionMath.hoursBetween(previous, next);
    return Math.exp(-gapHours / settings.tauHours());
  }

  private WorkSession toSession(ActivityScope scope, List<RawEvent> members) {
    ZonedDateTime start = members.get(0).getTimestamp().atZone(settings.zone());

    if (members.size() == 1) {
      return new WorkSession(
          scope.actor(),
          scope.scope(),
          start,
          start.plus(SINGLE_EVENT_SPAN),
          members,
          settings.singleEventHours());
    }

    ZonedDateTime end = members.get(members.size() - 1).getTimestamp().atZone(settings.zone());
    double hours = Math.min(SessionMath.hoursBetween(start, end), settings.maxSessionHours());
    return new WorkSession(scope.actor(), scope.scope(), start, end, members, hours);
  }
}
