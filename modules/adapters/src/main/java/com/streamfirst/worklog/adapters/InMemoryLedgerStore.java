package com.streamfirst.worklog.adapters;

import com.streamfirst.worklog.domain.LedgerSnapshot;
import com.streamfirst.worklog.ports.LedgerStorePort;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/** Ledger store that keeps the last snapshot in memory; state is lost with the process. */
public class InMemoryLedgerStore implements LedgerStorePort {

    private final AtomicReference<LedgerSnapshot> current = new AtomicReference<>(LedgerSnapshot.empty());
    private final AtomicInteger saveCount = new AtomicInteger();

    @Override
    public LedgerSnapshot load() {
        return current.get();
    }

    @Override
    public void save(LedgerSnapshot snapshot) {
        current.set(snapshot);
        saveCount.incrementAndGet();
    }

    public int getSaveCount() {
        return saveCount.get();
    }
}
