package com.streamfirst.worklog.ports;

import com.streamfirst.worklog.domain.LedgerSnapshot;

/**
 * Port for durable storage of the sync ledger. Writes are whole snapshots.
 */
public interface LedgerStorePort {

    /**
     * Loads the last persisted snapshot.
     *
     * @return the snapshot, or an empty snapshot when nothing has been persisted yet
     */
    LedgerSnapshot load();

    /**
     * Persists a full snapshot. Implementations must not leave a partially written
     * snapshot behind if the process dies mid-write.
     *
     * @param snapshot the ledger state to write
     * @throws com.streamfirst.worklog.domain.LedgerPersistenceException if the write fails
     */
    void save(LedgerSnapshot snapshot);
}
