package com.streamfirst.worklog.application;

import static com.streamfirst.worklog.application.TestEvents.commit;
import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.worklog.domain.LedgerSnapshot;
import com.streamfirst.worklog.domain.RawEvent;
import com.streamfirst.worklog.domain.SessionKey;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class SyncLedgerTest {

  private static final SessionKey KEY = new SessionKey(LocalDate.of(2024, 3, 4), "alice", "acme/api");

  @Test
  void restoresPersistedSnapshot() {
    MemoryLedgerStore store =
        new MemoryLedgerStore(new LedgerSnapshot(Set.of("sha1"), Map.of(KEY.serialize(), "rec-9")));

    SyncLedger ledger = new SyncLedger(store);

    assertThat(ledger.hasSeen("sha1")).isTrue();
    assertThat(ledger.externalRecordId(KEY)).contains("rec-9");
  }

  @Test
  void acceptsEachIdOnce() {
    SyncLedger ledger = new SyncLedger(new MemoryLedgerStore(new LedgerSnapshot(Set.of("a"), Map.of())));

    List<RawEvent> accepted =
        ledger.acceptNew(List.of(commit("a", 9, 0), commit("b", 9, 5), commit("b", 9, 6), commit("c", 9, 7)));

    assertThat(accepted).extracting(RawEvent::getId).containsExactly("b", "c");
    assertThat(ledger.seenCount()).isEqualTo(3);
    assertThat(ledger.acceptNew(List.of(commit("b", 9, 5)))).isEmpty();
    assertThat(ledger.seenCount()).isEqualTo(3);
  }

  @Test
  void persistedSnapshotRoundTrips() {
    MemoryLedgerStore store = new MemoryLedgerStore();
    SyncLedger ledger = new SyncLedger(store);
    ledger.acceptNew(List.of(commit("a", 9, 0), commit("b", 9, 5)));
    ledger.recordExternalId(KEY, "rec-1");

    assertThat(ledger.persist()).isTrue();
    SyncLedger reloaded = new SyncLedger(store);

    assertThat(reloaded.snapshot()).isEqualTo(ledger.snapshot());
    assertThat(reloaded.indexedSessionCount()).isEqualTo(1);
  }

  @Test
  void failedPersistKeepsInMemoryState() {
    MemoryLedgerStore store = new MemoryLedgerStore();
    SyncLedger ledger = new SyncLedger(store);
    ledger.acceptNew(List.of(commit("a", 9, 0)));
    store.failSaves = true;

    assertThat(ledger.persist()).isFalse();
    assertThat(ledger.hasSeen("a")).isTrue();

    store.failSaves = false;
    assertThat(ledger.persist()).isTrue();
    assertThat(store.saved.seenEventIds()).containsExactly("a");
  }

  @Test
  void unreadableSnapshotStartsEmpty() {
    MemoryLedgerStore store = new MemoryLedgerStore(new LedgerSnapshot(Set.of("a"), Map.of()));
    store.failLoads = true;

    assertThat(new SyncLedger(store).seenCount()).isZero();
  }

  @Test
  void overwritesSessionIndexEntries() {
    SyncLedger ledger = new SyncLedger(new MemoryLedgerStore());
    ledger.recordExternalId(KEY, "rec-1");
    ledger.recordExternalId(KEY, "rec-2");

    assertThat(ledger.externalRecordId(KEY)).contains("rec-2");
    assertThat(ledger.indexedSessionCount()).isEqualTo(1);
  }

  @Test
  void concurrentAcceptsNeverHandOutAnIdTwice() throws Exception {
    SyncLedger ledger = new SyncLedger(new MemoryLedgerStore());
    List<RawEvent> events = new ArrayList<>();
    for (int i = 0; i < 500; i++) {
      events.add(commit("e" + i, 9, i % 60));
    }

    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<List<RawEvent>>> futures = new ArrayList<>();
      for (int t = 0; t < 4; t++) {
        futures.add(pool.submit(() -> ledger.acceptNew(events)));
      }
      int total = 0;
      for (Future<List<RawEvent>> future : futures) {
        total += future.get().size();
      }
      assertThat(total).isEqualTo(500);
      assertThat(ledger.seenCount()).isEqualTo(500);
    } finally {
      pool.shutdownNow();
    }
  }
}
