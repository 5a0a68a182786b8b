package com.streamfirst.worklog.ports;

import com.streamfirst.worklog.domain.RawEvent;
import com.streamfirst.worklog.domain.TimeWindow;

import java.util.List;

/**
 * Port for the raw activity feed, typically commits from a source-control host.
 * Pagination, rate limiting and authentication belong to the implementation.
 */
public interface EventSourcePort {

    /**
     * Fetches all events in the given scopes that happened inside the window.
     *
     * @param scopes repositories to read, e.g. "acme/api"
     * @param window the time window to read
     * @return events in no particular order; events with unparseable timestamps are omitted
     * @throws RuntimeException if the feed cannot be reached
     */
    List<RawEvent> fetchEvents(List<String> scopes, TimeWindow window);
}
