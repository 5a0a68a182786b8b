package com.streamfirst.worklog.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Counts produced by one reconciliation pass. Failures are reported here rather than thrown.
 */
@Value
@Builder
public class ReconciliationReport {

    /** Events that were new to the ledger and got clustered */
    int acceptedEvents;

    /** Events skipped because their id was already seen */
    int duplicateEvents;

    /** Sessions produced from the accepted events */
    int sessions;

    /** External records created */
    int created;

    /** External records updated in place */
    int updated;

    /** Updates that failed and fell back to creating a new record */
    int updateFallbacks;

    /** Sessions for which neither update nor create succeeded */
    int failed;

    /** Ids marked seen whose session failed to sync; they will not be retried */
    @NonNull @Builder.Default List<String> droppedEventIds = List.of();

    /** Whether the ledger snapshot was written after the batch */
    boolean ledgerPersisted;

    public static ReconciliationReport empty(int duplicateEvents, boolean ledgerPersisted) {
        return ReconciliationReport.builder()
                .duplicateEvents(duplicateEvents)
                .ledgerPersisted(ledgerPersisted)
                .build();
    }

    /**
     * Number of sessions that ended up created or updated externally.
     */
    public int processedCount() {
        return created + updated;
    }
}
