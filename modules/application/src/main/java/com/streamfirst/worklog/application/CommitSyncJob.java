package com.streamfirst.worklog.application;

import com.streamfirst.worklog.domain.RawEvent;
import com.streamfirst.worklog.domain.ReconciliationReport;
import com.streamfirst.worklog.domain.TimeWindow;
import com.streamfirst.worklog.domain.TrackingSettings;
import com.streamfirst.worklog.ports.EventSourcePort;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodic commit sync: fetches recent events from the configured scopes and hands them to
 * the reconciliation engine.
 *
 * <p>{@link #runOnce()} and {@link #runHistorical()} are synchronous and can be called
 * directly. {@link #start(ScheduledExecutorService)} schedules polling on an executor owned
 * by the caller and {@link #stop()} cancels it and flushes the ledger.
 */
@Slf4j
public class CommitSyncJob {

  private final EventSourcePort eventSource;
  private final ReconciliationEngine engine;
  private final SyncLedger ledger;
  private final TrackingSettings settings;
  private final ZoneId zone;
  private final Clock clock;

  private ScheduledFuture<?> scheduled;

  public CommitSyncJob(
      EventSourcePort eventSource,
      ReconciliationEngine engine,
      SyncLedger ledger,
      TrackingSettings settings,
      ZoneId zone,
      Clock clock) {
    this.eventSource = eventSource;
    this.engine = engine;
    this.ledger = ledger;
    this.settings = settings;
    this.zone = zone;
    this.clock = clock;
  }

  /** Syncs the trailing polling window. */
  public ReconciliationReport runOnce() {
    return syncWindow(TimeWindow.lastHours(settings.pollWindowHours(), clock));
  }

  /** Syncs the catch-up window covering the configured number of past days. */
  public ReconciliationReport runHistorical() {
    log.info("Fetching historical commits for the last {} days", settings.historyDays());
    return syncWindow(TimeWindow.lastDays(settings.historyDays(), zone, clock));
  }

  private ReconciliationReport syncWindow(TimeWindow window) {
    List<RawEvent> events = eventSource.fetchEvents(settings.scopes(), window);
    log.debug(
        "Fetched {} events from {} scopes between {} and {}",
        events.size(),
        settings.scopes().size(),
        window.start(),
        window.end());
    if (events.isEmpty()) {
      return ReconciliationReport.empty(0, false);
    }
    return engine.reconcile(events);
  }

  /**
   * Starts polling at the configured interval, beginning immediately.
   *
   * @param executor executor that runs the polls; its lifecycle stays with the caller
   */
  public synchronized void start(ScheduledExecutorService executor) {
    if (isRunning()) {
      log.warn("Commit sync already running");
      return;
    }
    long intervalMillis = settings.pollInterval().toMillis();
    scheduled =
        executor.scheduleWithFixedDelay(this::pollSafely, 0, intervalMillis, TimeUnit.MILLISECONDS);
    log.info(
        "Started commit sync for {} scopes every {}", settings.scopes().size(), settings.pollInterval());
  }

  /** Cancels polling and persists the ledger. */
  public synchronized void stop() {
    log.info("Stopping commit sync");
    if (scheduled != null) {
      scheduled.cancel(false);
      scheduled = null;
    }
    ledger.persist();
  }

  public synchronized boolean isRunning() {
    return scheduled != null && !scheduled.isDone();
  }

  /** One scheduled poll; failures are logged so the schedule keeps running. */
  void pollSafely() {
    try {
      ReconciliationReport report = runOnce();
      log.debug("Poll finished: {}", report);
    } catch (RuntimeException e) {
      log.error("Error in commit poll, will retry next interval", e);
    }
  }
}
