package com.streamfirst.worklog.ports;

import com.streamfirst.worklog.domain.ExternalRecord;
import com.streamfirst.worklog.domain.Result;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Port for the external time-tracking system that owns the persisted time entries.
 * Each call is a single synchronous attempt; timeouts and retries are the implementation's concern.
 */
public interface ExternalRecordPort {

    /**
     * Creates a time entry covering the given range.
     *
     * @param start entry start
     * @param end entry end
     * @param description entry description
     * @param projectRef project to book against, if any
     * @return the created record, or a failure when the system did not return an id
     */
    Result<ExternalRecord> createRecord(ZonedDateTime start, ZonedDateTime end,
                                        String description, Optional<String> projectRef);

    /**
     * Replaces the range and description of an existing time entry.
     *
     * @param id the external record id
     * @param start new entry start
     * @param end new entry end
     * @param description new description
     * @return the updated record, or a failure when the entry is gone or the call failed
     */
    Result<ExternalRecord> updateRecord(String id, ZonedDateTime start, ZonedDateTime end,
                                        String description);
}
