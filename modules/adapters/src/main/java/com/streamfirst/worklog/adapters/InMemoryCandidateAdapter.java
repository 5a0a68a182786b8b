package com.streamfirst.worklog.adapters;

import com.streamfirst.worklog.domain.MatchCandidate;
import com.streamfirst.worklog.domain.WorkItemId;
import com.streamfirst.worklog.ports.CandidatePort;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/** In-memory work item tracker for testing and development. */
@Slf4j
public class InMemoryCandidateAdapter implements CandidatePort {

    private final Map<WorkItemId, MatchCandidate> items = new ConcurrentSkipListMap<>();

    public void register(MatchCandidate candidate) {
        items.put(candidate.id(), candidate);
    }

    @Override
    public List<MatchCandidate> fetchCandidates(Collection<WorkItemId> ids) {
        List<MatchCandidate> found = new ArrayList<>();
        for (WorkItemId id : ids) {
            MatchCandidate candidate = items.get(id);
            if (candidate != null) {
                found.add(candidate);
            }
        }
        log.debug("Resolved {} of {} work items", found.size(), ids.size());
        return found;
    }

    @Override
    public List<MatchCandidate> fetchOpenCandidates() {
        return items.values().stream().filter(c -> !c.closed()).toList();
    }
}
