package com.streamfirst.worklog.application;

import com.streamfirst.worklog.domain.DailyHours;
import com.streamfirst.worklog.domain.RawEvent;
import com.streamfirst.worklog.domain.SessionSettings;
import com.streamfirst.worklog.domain.WorkSession;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Turns commits into worked hours: clustering followed by the merge pass, plus the daily
 * aggregation and the console summary built on top of the resulting sessions.
 */
public class WorkSessionCalculator {

  private static final DateTimeFormatter START_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
  private static final DateTimeFormatter END_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
  private static final String RULE = "=".repeat(60);
  private static final String SEPARATOR = "-".repeat(60);

  private final EventClusterer clusterer;
  private final ClusterMerger merger;

  public WorkSessionCalculator(SessionSettings settings) {
    this(new EventClusterer(settings), new ClusterMerger(settings));
  }

  public WorkSessionCalculator(EventClusterer clusterer, ClusterMerger merger) {
    this.clusterer = clusterer;
    this.merger = merger;
  }

  /** Clusters the events and merges sessions separated by short pauses. */
  public List<WorkSession> calculateSessions(List<RawEvent> events) {
    return merger.merge(clusterer.cluster(events));
  }

  /**
   * Sums session durations per local start date and actor.
   *
   * @return one entry per (date, actor), ordered by date then actor
   */
  public List<DailyHours> calculateDailyHours(List<WorkSession> sessions) {
    Map<LocalDate, Map<String, Double>> byDate = new TreeMap<>();
    for (WorkSession session : sessions) {
      byDate
          .computeIfAbsent(session.getStart().toLocalDate(), d -> new TreeMap<>())
          .merge(session.getActor(), session.getDurationHours(), Double::sum);
    }

    List<DailyHours> daily = new ArrayList<>();
    byDate.forEach(
        (date, byActor) ->
            byActor.forEach((actor, hours) -> daily.add(new DailyHours(date, actor, hours))));
    return daily;
  }

  /** Renders sessions grouped by actor with a per-actor total. */
  public String formatForDisplay(List<WorkSession> sessions) {
    if (sessions.isEmpty()) {
      return "No work sessions detected";
    }

    Map<String, List<WorkSession>> byActor =
        sessions.stream()
            .sorted(Comparator.comparing(WorkSession::getActor).thenComparing(WorkSession::getStart))
            .collect(Collectors.groupingBy(WorkSession::getActor, LinkedHashMap::new, Collectors.toList()));

    StringBuilder out = new StringBuilder("Work Sessions Detected:\n").append(RULE);
    byActor.forEach(
        (actor, actorSessions) -> {
          out.append("\n\n").append(actor).append(":\n").append(SEPARATOR);
          double total = 0;
          for (WorkSession session : actorSessions) {
            out.append('\n')
                .append(
                    String.format(
                        Locale.ROOT,
                        "  %s - %s (%.2fh) | %s",
                        START_FORMAT.format(session.getStart()),
                        END_FORMAT.format(session.getEnd()),
                        session.getDurationHours(),
                        session.description()));
            total += session.getDurationHours();
          }
          out.append('\n').append(String.format(Locale.ROOT, "  Total: %.2f hours", total));
        });
    return out.toString();
  }
}
