package com.streamfirst.worklog.adapters;

import com.streamfirst.worklog.domain.TextRecord;
import com.streamfirst.worklog.domain.TimeWindow;
import com.streamfirst.worklog.ports.TextRecordPort;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory source of time entries. Records without a start time are returned for every window.
 */
public class InMemoryTextRecordAdapter implements TextRecordPort {

    private final List<TextRecord> records = new CopyOnWriteArrayList<>();

    public void add(TextRecord record) {
        records.add(record);
    }

    @Override
    public List<TextRecord> fetchRecords(TimeWindow window) {
        return records.stream()
                .filter(r -> r.start() == null || window.contains(r.start()))
                .toList();
    }
}
