package com.streamfirst.worklog.application;

import com.streamfirst.worklog.domain.LedgerSnapshot;
import com.streamfirst.worklog.domain.RawEvent;
import com.streamfirst.worklog.domain.SessionKey;
import com.streamfirst.worklog.ports.LedgerStorePort;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Durable idempotency record for the commit sync: which events were already processed and
 * which external record each session key was written to.
 *
 * <p>Every read and write goes through a single lock, so a polling job and an on-demand
 * reconciliation can share one instance. Seen ids are only added during normal operation;
 * session index entries are added or overwritten.
 */
@Slf4j
public class SyncLedger {

  private final LedgerStorePort store;
  private final ReentrantLock lock = new ReentrantLock();
  private final Set<String> seenEventIds = new HashSet<>();
  private final Map<String, String> sessionIndex = new HashMap<>();

  /**
   * Creates a ledger backed by the store and restores its last snapshot. A snapshot that
   * cannot be read is logged and replaced by an empty ledger.
   */
  public SyncLedger(LedgerStorePort store) {
    this.store = store;
    restore();
  }

  private void restore() {
    LedgerSnapshot snapshot;
    try {
      snapshot = store.load();
    } catch (RuntimeException e) {
      log.error("Failed to load ledger, starting empty", e);
      snapshot = LedgerSnapshot.empty();
    }
    seenEventIds.addAll(snapshot.seenEventIds());
    sessionIndex.putAll(snapshot.sessionIndex());
    log.info(
        "Loaded {} seen events and {} indexed sessions",
        seenEventIds.size(),
        sessionIndex.size());
  }

  /**
   * Marks every not-yet-seen event as seen and returns those events. An id repeated inside
   * the batch is accepted once.
   *
   * @param events candidate events in arrival order
   * @return the events that were new, in arrival order
   */
  public List<RawEvent> acceptNew(Collection<RawEvent> events) {
    lock.lock();
    try {
      List<RawEvent> accepted = new ArrayList<>();
      for (RawEvent event : events) {
        if (seenEventIds.add(event.getId())) {
          accepted.add(event);
        }
      }
      return accepted;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes ids from the seen set so that a later run processes them again. Only used when
   * reconciliation is configured to roll back after a failed session.
   */
  public void forget(Collection<String> eventIds) {
    lock.lock();
    try {
      seenEventIds.removeAll(eventIds);
    } finally {
      lock.unlock();
    }
  }

  public boolean hasSeen(String eventId) {
    lock.lock();
    try {
      return seenEventIds.contains(eventId);
    } finally {
      lock.unlock();
    }
  }

  public Optional<String> externalRecordId(SessionKey key) {
    lock.lock();
    try {
      return Optional.ofNullable(sessionIndex.get(key.serialize()));
    } finally {
      lock.unlock();
    }
  }

  public void recordExternalId(SessionKey key, String externalRecordId) {
    lock.lock();
    try {
      String previous = sessionIndex.put(key.serialize(), externalRecordId);
      if (previous != null && !previous.equals(externalRecordId)) {
        log.debug("Session {} moved from record {} to {}", key, previous, externalRecordId);
      }
    } finally {
      lock.unlock();
    }
  }

  public int seenCount() {
    lock.lock();
    try {
      return seenEventIds.size();
    } finally {
      lock.unlock();
    }
  }

  public int indexedSessionCount() {
    lock.lock();
    try {
      return sessionIndex.size();
    } finally {
      lock.unlock();
    }
  }

  public LedgerSnapshot snapshot() {
    lock.lock();
    try {
      return new LedgerSnapshot(seenEventIds, sessionIndex);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Writes a full snapshot to the store. A failed write is logged; the in-memory state is
   * kept and the next successful write restores durability.
   *
   * @return true if the snapshot was written
   */
  public boolean persist() {
    lock.lock();
    try {
      store.save(new LedgerSnapshot(seenEventIds, sessionIndex));
      log.debug("Persisted ledger with {} seen events", seenEventIds.size());
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to persist ledger, keeping in-memory state", e);
      return false;
    } finally {
      lock.unlock();
    }
  }
}
