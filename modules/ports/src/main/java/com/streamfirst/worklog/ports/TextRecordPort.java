package com.streamfirst.worklog.ports;

import com.streamfirst.worklog.domain.TextRecord;
import com.streamfirst.worklog.domain.TimeWindow;

import java.util.List;

/**
 * Port for reading free-text time entries back from the time-tracking system.
 */
public interface TextRecordPort {

    List<TextRecord> fetchRecords(TimeWindow window);
}
