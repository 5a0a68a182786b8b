package com.streamfirst.worklog.boot;

import com.streamfirst.worklog.domain.MatchingMode;
import com.streamfirst.worklog.domain.ReconciliationSettings;
import com.streamfirst.worklog.domain.SessionSettings;
import com.streamfirst.worklog.domain.TrackingSettings;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized configuration under the {@code worklog} prefix. Missing sections fall back to the
 * built-in defaults, so an empty configuration is valid.
 */
@ConfigurationProperties(prefix = "worklog")
public record WorklogProperties(
    Sessions sessions, Ledger ledger, Tracking tracking, Matching matching, Records records) {

  public WorklogProperties {
    sessions = sessions == null ? new Sessions(null, null, null, null, null) : sessions;
    ledger = ledger == null ? new Ledger(null, false) : ledger;
    tracking = tracking == null ? new Tracking(null, null, null, null, true) : tracking;
    matching = matching == null ? new Matching(null) : matching;
    records = records == null ? new Records(null) : records;
  }

  public record Sessions(
      Double tauHours,
      Double clusterThreshold,
      Double maxSessionHours,
      Integer minClusterGapMinutes,
      String timezone) {

    public SessionSettings toSettings() {
      return new SessionSettings(
          tauHours == null ? SessionSettings.DEFAULT_TAU_HOURS : tauHours,
          clusterThreshold == null ? SessionSettings.DEFAULT_CLUSTER_THRESHOLD : clusterThreshold,
          maxSessionHours == null ? SessionSettings.DEFAULT_MAX_SESSION_HOURS : maxSessionHours,
          minClusterGapMinutes == null
              ? SessionSettings.DEFAULT_MIN_CLUSTER_GAP_MINUTES
              : minClusterGapMinutes,
          timezone == null || timezone.isBlank() ? SessionSettings.DEFAULT_ZONE : ZoneId.of(timezone));
    }
  }

  /**
   * @param file where the ledger document lives
   * @param rollbackSeenOnFailure whether events of a session that could not be written are
   *     retried on the next run instead of being dropped
   */
  public record Ledger(Path file, boolean rollbackSeenOnFailure) {
    public Ledger {
      file = file == null ? Path.of("clockify_github_state.json") : file;
    }
  }

  public record Tracking(
      List<String> repositories,
      Duration pollInterval,
      Long pollWindowHours,
      Integer historyDays,
      boolean scheduleEnabled) {

    public TrackingSettings toSettings() {
      return new TrackingSettings(
          repositories,
          pollInterval == null ? Duration.ofSeconds(60) : pollInterval,
          pollWindowHours == null ? 24 : pollWindowHours,
          historyDays == null ? 7 : historyDays);
    }
  }

  public record Matching(MatchingMode mode) {
    public Matching {
      mode = mode == null ? MatchingMode.HYBRID : mode;
    }
  }

  /** @param defaultProject project id new time entries are booked against; blank for none */
  public record Records(String defaultProject) {}

  public SessionSettings sessionSettings() {
    return sessions.toSettings();
  }

  public TrackingSettings trackingSettings() {
    return tracking.toSettings();
  }

  public ReconciliationSettings reconciliationSettings() {
    Optional<String> project =
        Optional.ofNullable(records.defaultProject()).filter(p -> !p.isBlank());
    return new ReconciliationSettings(project, ledger.rollbackSeenOnFailure());
  }
}
