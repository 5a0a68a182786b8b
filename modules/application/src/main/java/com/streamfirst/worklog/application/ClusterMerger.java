package com.streamfirst.worklog.application;

import com.streamfirst.worklog.domain.ActivityScope;
import com.streamfirst.worklog.domain.RawEvent;
import com.streamfirst.worklog.domain.SessionSettings;
import com.streamfirst.worklog.domain.WorkSession;
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
 * Fuses sessions of the same actor and scope that are separated by a short pause.
 *
 * <p>Each group is sorted by start and walked once from left to right; a session whose start
 * is at most {@code minClusterGapMinutes} after the running session's end is absorbed into
 * it. The result depends on that ordering and is not a global optimum.
 */
@Slf4j
@RequiredArgsConstructor
public class ClusterMerger {

  @NonNull private final SessionSettings settings;

  /**
   * Merges close sessions.
   *
   * @param sessions sessions from the clusterer
   * @return merged sessions ordered by actor, scope and start; the input unchanged when
   *     merging is disabled
   */
  public List<WorkSession> merge(List<WorkSession> sessions) {
    if (sessions.isEmpty() || settings.minClusterGapMinutes() <= 0) {
      return sessions;
    }

    Map<ActivityScope, List<WorkSession>> groups =
        sessions.stream()
            .collect(
                Collectors.groupingBy(WorkSession::activityScope, TreeMap::new, Collectors.toList()));

    List<WorkSession> merged = new ArrayList<>();
    for (List<WorkSession> group : groups.values()) {
      List<WorkSession> ordered = new ArrayList<>(group);
      ordered.sort(Comparator.comparing(WorkSession::getStart));

      WorkSession current = ordered.get(0);
      for (WorkSession next : ordered.subList(1, ordered.size())) {
        double gapMinutes = SessionMath.minutesBetween(current.getEnd(), next.getStart());
        if (gapMinutes <= settings.minClusterGapMinutes()) {
          current = fuse(current, next);
        } else {
          merged.add(current);
          current = next;
        }
      }
      merged.add(current);
    }

    if (merged.size() != sessions.size()) {
      log.debug("Merged {} sessions into {}", sessions.size(), merged.size());
    }
    return merged;
  }

  private WorkSession fuse(WorkSession current, WorkSession next) {
    List<RawEvent> members = new ArrayList<>(current.getMemberEvents());
    members.addAll(next.getMemberEvents());
    double hours =
        Math.min(
            SessionMath.hoursBetween(current.getStart(), next.getEnd()),
            settings.maxSessionHours());
    return new WorkSession(
        current.getActor(), current.getScope(), current.getStart(), next.getEnd(), members, hours);
  }
}
