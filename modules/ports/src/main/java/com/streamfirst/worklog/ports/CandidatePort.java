package com.streamfirst.worklog.ports;

import com.streamfirst.worklog.domain.MatchCandidate;
import com.streamfirst.worklog.domain.WorkItemId;

import java.util.Collection;
import java.util.List;

/**
 * Port for the work item tracker that supplies match candidates.
 */
public interface CandidatePort {

    /**
     * Fetches the work items with the given ids. Unknown ids are silently absent from the result.
     *
     * @param ids work item ids
     * @return the candidates found
     */
    List<MatchCandidate> fetchCandidates(Collection<WorkItemId> ids);

    /**
     * Fetches the open work items considered for title-based matching.
     *
     * @return open candidates
     */
    List<MatchCandidate> fetchOpenCandidates();
}
