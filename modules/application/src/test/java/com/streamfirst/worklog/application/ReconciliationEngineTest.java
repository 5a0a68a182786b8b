package com.streamfirst.worklog.application;

import static com.streamfirst.worklog.application.TestEvents.UTC_SETTINGS;
import static com.streamfirst.worklog.application.TestEvents.at;
import static com.streamfirst.worklog.application.TestEvents.commit;
import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.worklog.domain.ExternalRecord;
import com.streamfirst.worklog.domain.RawEvent;
import com.streamfirst.worklog.domain.ReconciliationReport;
import com.streamfirst.worklog.domain.ReconciliationSettings;
import com.streamfirst.worklog.domain.Result;
import com.streamfirst.worklog.domain.SessionKey;
import com.streamfirst.worklog.ports.ExternalRecordPort;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReconciliationEngineTest {

  private static final SessionKey API_KEY = new SessionKey(LocalDate.of(2024, 3, 4), "alice", "acme/api");

  private MemoryLedgerStore store;
  private SyncLedger ledger;
  private RecordingExternalRecords external;
  private ReconciliationEngine engine;

  @BeforeEach
  void setUp() {
    store = new MemoryLedgerStore();
    ledger = new SyncLedger(store);
    external = new RecordingExternalRecords();
    engine = engine(new ReconciliationSettings(Optional.of("proj-1"), false), external);
  }

  private ReconciliationEngine engine(ReconciliationSettings settings, ExternalRecordPort port) {
    return new ReconciliationEngine(new WorkSessionCalculator(UTC_SETTINGS), ledger, port, settings);
  }

  @Test
  void createsRecordForNewSessionAndIndexesIt() {
    ReconciliationReport report = engine.reconcile(List.of(commit("a", 9, 0), commit("b", 9, 10)));

    assertThat(report.processedCount()).isEqualTo(1);
    assertThat(report.getCreated()).isEqualTo(1);
    assertThat(report.getAcceptedEvents()).isEqualTo(2);
    assertThat(report.getSessions()).isEqualTo(1);
    assertThat(report.isLedgerPersisted()).isTrue();

    ExternalRecord record = external.records.get("rec-1");
    assertThat(record.description()).isEqualTo("acme/api: 2 commits (09:00–09:10)");
    assertThat(record.start()).isEqualTo(at(9, 0));
    assertThat(record.end()).isEqualTo(at(9, 10));
    assertThat(record.projectRef()).contains("proj-1");

    assertThat(ledger.externalRecordId(API_KEY)).contains("rec-1");
    assertThat(store.saved.seenEventIds()).containsExactlyInAnyOrder("a", "b");
    assertThat(store.saved.sessionIndex()).containsEntry("2024-03-04_alice_acme/api", "rec-1");
  }

  @Test
  void rerunningTheSameEventsIsANoOp() {
    List<RawEvent> events = List.of(commit("a", 9, 0), commit("b", 9, 10));
    engine.reconcile(events);

    ReconciliationReport second = engine.reconcile(events);

    assertThat(second.processedCount()).isZero();
    assertThat(second.getDuplicateEvents()).isEqualTo(2);
    assertThat(second.getSessions()).isZero();
    assertThat(ledger.seenCount()).isEqualTo(2);
    assertThat(external.calls).hasSize(1);
  }

  @Test
  void duplicateIdsInsideOneBatchCountOnce() {
    ReconciliationReport report = engine.reconcile(List.of(commit("a", 9, 0), commit("a", 9, 0)));

    assertThat(report.getAcceptedEvents()).isEqualTo(1);
    assertThat(report.getDuplicateEvents()).isEqualTo(1);
    assertThat(external.records.get("rec-1").description()).isEqualTo("acme/api: 1 commits (09:00–09:15)");
  }

  @Test
  void laterSessionOnSameDayUpdatesIndexedRecord() {
    engine.reconcile(List.of(commit("a", 9, 0)));

    ReconciliationReport report = engine.reconcile(List.of(commit("c", 14, 0), commit("d", 14, 30)));

    assertThat(report.getUpdated()).isEqualTo(1);
    assertThat(report.getCreated()).isZero();
    assertThat(external.calls).containsExactly("create:acme/api: 1 commits (09:00–09:15)", "update:rec-1");
    assertThat(external.records).hasSize(1);
    assertThat(external.records.get("rec-1").start()).isEqualTo(at(14, 0));
  }

  @Test
  void failedUpdateFallsBackToCreate() {
    engine.reconcile(List.of(commit("a", 9, 0)));
    external.failUpdates = true;

    ReconciliationReport report = engine.reconcile(List.of(commit("c", 14, 0)));

    assertThat(report.getCreated()).isEqualTo(1);
    assertThat(report.getUpdateFallbacks()).isEqualTo(1);
    assertThat(report.processedCount()).isEqualTo(1);
    assertThat(external.records).hasSize(2);
    assertThat(ledger.externalRecordId(API_KEY)).contains("rec-2");
  }

  @Test
  void failedSessionKeepsEventsSeenAndReportsThemDropped() {
    external.failCreates = true;

    ReconciliationReport report = engine.reconcile(List.of(commit("a", 9, 0), commit("b", 9, 10)));

    assertThat(report.getFailed()).isEqualTo(1);
    assertThat(report.processedCount()).isZero();
    assertThat(report.getDroppedEventIds()).containsExactly("a", "b");
    assertThat(ledger.hasSeen("a")).isTrue();
    assertThat(ledger.externalRecordId(API_KEY)).isEmpty();

    external.failCreates = false;
    ReconciliationReport retry = engine.reconcile(List.of(commit("a", 9, 0), commit("b", 9, 10)));
    assertThat(retry.processedCount()).isZero();
    assertThat(retry.getDuplicateEvents()).isEqualTo(2);
  }

  @Test
  void rollbackOptionLetsFailedEventsBeRetried() {
    ReconciliationEngine rollingBack = engine(new ReconciliationSettings(Optional.empty(), true), external);
    external.failCreates = true;

    ReconciliationReport failed = rollingBack.reconcile(List.of(commit("a", 9, 0)));

    assertThat(failed.getFailed()).isEqualTo(1);
    assertThat(failed.getDroppedEventIds()).isEmpty();
    assertThat(ledger.hasSeen("a")).isFalse();

    external.failCreates = false;
    ReconciliationReport retried = rollingBack.reconcile(List.of(commit("a", 9, 0)));
    assertThat(retried.getCreated()).isEqualTo(1);
    assertThat(external.records.get("rec-1").projectRef()).isEmpty();
  }

  @Test
  void throwingPortFailsOnlyThatSession() {
    ExternalRecordPort flaky =
        new ExternalRecordPort() {
          @Override
          public Result<ExternalRecord> createRecord(
              ZonedDateTime start, ZonedDateTime end, String description, Optional<String> projectRef) {
            if (description.startsWith("acme/web")) {
              throw new IllegalStateException("502 Bad Gateway");
            }
            return external.createRecord(start, end, description, projectRef);
          }

          @Override
          public Result<ExternalRecord> updateRecord(
              String id, ZonedDateTime start, ZonedDateTime end, String description) {
            return external.updateRecord(id, start, end, description);
          }
        };

    ReconciliationReport report =
        engine(ReconciliationSettings.defaults(), flaky)
            .reconcile(
                List.of(
                    commit("a", "alice", "acme/api", 9, 0),
                    commit("w", "alice", "acme/web", 9, 0)));

    assertThat(report.getCreated()).isEqualTo(1);
    assertThat(report.getFailed()).isEqualTo(1);
    assertThat(report.getDroppedEventIds()).containsExactly("w");
  }

  @Test
  void persistenceFailureIsReportedNotThrown() {
    store.failSaves = true;

    ReconciliationReport report = engine.reconcile(List.of(commit("a", 9, 0)));

    assertThat(report.getCreated()).isEqualTo(1);
    assertThat(report.isLedgerPersisted()).isFalse();
    assertThat(ledger.externalRecordId(API_KEY)).contains("rec-1");
  }
}
