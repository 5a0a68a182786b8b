package com.streamfirst.worklog.application;

import com.streamfirst.worklog.domain.ExternalRecord;
import com.streamfirst.worklog.domain.RawEvent;
import com.streamfirst.worklog.domain.ReconciliationReport;
import com.streamfirst.worklog.domain.ReconciliationSettings;
import com.streamfirst.worklog.domain.Result;
import com.streamfirst.worklog.domain.SessionKey;
import com.streamfirst.worklog.domain.WorkSession;
import com.streamfirst.worklog.ports.ExternalRecordPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pushes work sessions to the external time-tracking system without creating duplicates
 * across runs.
 *
 * <p>Events are first filtered against the ledger and marked seen before clustering, so each
 * event is processed at most once. Each resulting session is then written to the record
 * already indexed under its session key, or to a new record when none is indexed or the
 * update fails. A session that cannot be written is logged and counted; its events stay
 * marked seen unless rollback is enabled, and are reported as dropped.
 *
 * <p>An update replaces the indexed record's range and description with the new session's
 * own; an earlier session on the same day is overwritten, not extended.
 */
@Slf4j
@RequiredArgsConstructor
public class ReconciliationEngine {

  private final WorkSessionCalculator calculator;
  private final SyncLedger ledger;
  private final ExternalRecordPort externalRecords;
  private final ReconciliationSettings settings;
  private final ReentrantLock passLock = new ReentrantLock();

  /** How a single session ended up externally. */
  enum Outcome {
    CREATED,
    UPDATED,
    CREATED_AFTER_FAILED_UPDATE,
    FAILED
  }

  /**
   * Reconciles a batch of fetched events. Passes are serialized, so a scheduled poll and an
   * on-demand run never interleave.
   *
   * @param events events as returned by the event source, possibly already seen
   * @return counts for the batch; {@link ReconciliationReport#processedCount()} is the number
   *     of sessions created or updated
   */
  public ReconciliationReport reconcile(List<RawEvent> events) {
    passLock.lock();
    try {
      return reconcileBatch(events);
    } finally {
      passLock.unlock();
    }
  }

  private ReconciliationReport reconcileBatch(List<RawEvent> events) {
    List<RawEvent> accepted = ledger.acceptNew(events);
    int duplicates = events.size() - accepted.size();

    if (accepted.isEmpty()) {
      log.info("No new events to process ({} already seen)", duplicates);
      return ReconciliationReport.empty(duplicates, ledger.persist());
    }

    log.info("Processing {} new events ({} already seen)", accepted.size(), duplicates);
    List<WorkSession> sessions = calculator.calculateSessions(accepted);

    ReconciliationReport.ReconciliationReportBuilder report =
        ReconciliationReport.builder()
            .acceptedEvents(accepted.size())
            .duplicateEvents(duplicates)
            .sessions(sessions.size());
    int created = 0;
    int updated = 0;
    int fallbacks = 0;
    int failed = 0;
    List<String> dropped = new ArrayList<>();

    for (WorkSession session : sessions) {
      Outcome outcome;
      try {
        outcome = syncSession(session);
      } catch (Exception e) {
        log.error("Unexpected error while syncing session {}", session.sessionKey(), e);
        outcome = Outcome.FAILED;
      }

      switch (outcome) {
        case CREATED -> created++;
        case UPDATED -> updated++;
        case CREATED_AFTER_FAILED_UPDATE -> {
          created++;
          fallbacks++;
        }
        case FAILED -> {
          failed++;
          dropped.addAll(handleFailedSession(session));
        }
      }
    }

    boolean persisted = ledger.persist();
    log.info(
        "Reconciled {} out of {} sessions: {} created, {} updated, {} failed",
        created + updated,
        sessions.size(),
        created,
        updated,
        failed);

    return report
        .created(created)
        .updated(updated)
        .updateFallbacks(fallbacks)
        .failed(failed)
        .droppedEventIds(List.copyOf(dropped))
        .ledgerPersisted(persisted)
        .build();
  }

  /** Updates the indexed record for the session's key, or creates one. */
  Outcome syncSession(WorkSession session) {
    SessionKey key = session.sessionKey();
    Optional<String> existingId = ledger.externalRecordId(key);
    boolean updateFailed = false;

    if (existingId.isPresent()) {
      Result<ExternalRecord> result =
          call(
              "update",
              key,
              () ->
                  externalRecords.updateRecord(
                      existingId.get(), session.getStart(), session.getEnd(), session.description()));
      if (hasId(result)) {
        log.info(
            "Updated session for {} @ {}: {}h ({} commits)",
            session.getActor(),
            session.getScope(),
            formatHours(session),
            session.eventCount());
        return Outcome.UPDATED;
      }
      log.warn(
          "Failed to update record {} for session {}, will create new: {}",
          existingId.get(),
          key,
          result.getErrorMessage().orElse("no id returned"));
      updateFailed = true;
    }

    Result<ExternalRecord> result =
        call(
            "create",
            key,
            () ->
                externalRecords.createRecord(
                    session.getStart(),
                    session.getEnd(),
                    session.description(),
                    settings.defaultProjectRef()));
    Optional<String> createdId = result.map(ExternalRecord::id).getData();
    if (createdId.isPresent()) {
      ledger.recordExternalId(key, createdId.get());
      log.info(
          "Created session for {} @ {}: {}h ({} commits)",
          session.getActor(),
          session.getScope(),
          formatHours(session),
          session.eventCount());
      return updateFailed ? Outcome.CREATED_AFTER_FAILED_UPDATE : Outcome.CREATED;
    }

    log.error(
        "Failed to create record for session {}: {}",
        key,
        result.getErrorMessage().orElse("no id returned"));
    return Outcome.FAILED;
  }

  private List<String> handleFailedSession(WorkSession session) {
    List<String> ids = session.getMemberEvents().stream().map(RawEvent::getId).toList();
    if (settings.rollbackSeenOnFailure()) {
      ledger.forget(ids);
      log.info("Rolled back {} events of session {} for retry", ids.size(), session.sessionKey());
      return List.of();
    }
    log.warn(
        "Dropped {} events after partial failure for session {}: {}",
        ids.size(),
        session.sessionKey(),
        ids);
    return ids;
  }

  /** Runs a port call, turning a thrown exception or a null response into a failure. */
  private Result<ExternalRecord> call(
      String operation, SessionKey key, Supplier<Result<ExternalRecord>> portCall) {
    try {
      Result<ExternalRecord> result = portCall.get();
      return result != null ? result : Result.failure("no response");
    } catch (RuntimeException e) {
      log.error("External {} call failed for session {}", operation, key, e);
      return Result.failure(String.valueOf(e.getMessage()));
    }
  }

  private static boolean hasId(Result<ExternalRecord> result) {
    return result.isSuccess() && result.getData().isPresent();
  }

  private static String formatHours(WorkSession session) {
    return String.format(Locale.ROOT, "%.2f", session.getDurationHours());
  }
}
