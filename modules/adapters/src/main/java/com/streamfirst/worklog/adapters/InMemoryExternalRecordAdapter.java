package com.streamfirst.worklog.adapters;

import com.streamfirst.worklog.domain.ExternalRecord;
import com.streamfirst.worklog.domain.Result;
import com.streamfirst.worklog.ports.ExternalRecordPort;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of ExternalRecordPort for testing and development. Behaves like a
 * time-tracking API: ids are assigned on create and updating an unknown id fails with 404.
 * Failures can be switched on to exercise retry and fallback paths.
 */
@Slf4j
public class InMemoryExternalRecordAdapter implements ExternalRecordPort {

    private final Map<String, ExternalRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong idCounter = new AtomicLong(1);
    private volatile boolean createsFailing;
    private volatile boolean updatesFailing;

    @Override
    public Result<ExternalRecord> createRecord(
            ZonedDateTime start, ZonedDateTime end, String description, Optional<String> projectRef) {
        if (createsFailing) {
            log.debug("Rejecting create of '{}'", description);
            return Result.failure("Time entry service unavailable", "503");
        }

        String id = "te-" + idCounter.getAndIncrement();
        ExternalRecord record = new ExternalRecord(id, start, end, description, projectRef);
        records.put(id, record);
        log.info("Created time entry {}: {}", id, description);
        return Result.success(record);
    }

    @Override
    public Result<ExternalRecord> updateRecord(
            String id, ZonedDateTime start, ZonedDateTime end, String description) {
        if (updatesFailing) {
            log.debug("Rejecting update of {}", id);
            return Result.failure("Time entry service unavailable", "503");
        }

        ExternalRecord existing = records.get(id);
        if (existing == null) {
            return Result.failure("Time entry not found: " + id, "404");
        }
        ExternalRecord updated = new ExternalRecord(id, start, end, description, existing.projectRef());
        records.put(id, updated);
        log.info("Updated time entry {}: {}", id, description);
        return Result.success(updated);
    }

    public Optional<ExternalRecord> getRecord(String id) {
        return Optional.ofNullable(records.get(id));
    }

    public List<ExternalRecord> getAllRecords() {
        return new ArrayList<>(records.values());
    }

    /** Simulates an entry deleted by a user directly in the time-tracking system. */
    public boolean deleteRecord(String id) {
        return records.remove(id) != null;
    }

    public void setCreatesFailing(boolean createsFailing) {
        this.createsFailing = createsFailing;
    }

    public void setUpdatesFailing(boolean updatesFailing) {
        this.updatesFailing = updatesFailing;
    }
}
