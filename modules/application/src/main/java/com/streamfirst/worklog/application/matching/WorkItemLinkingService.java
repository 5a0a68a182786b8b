package com.streamfirst.worklog.application.matching;

import com.streamfirst.worklog.domain.MatchCandidate;
import com.streamfirst.worklog.domain.MatchResult;
import com.streamfirst.worklog.domain.MatchStatistics;
import com.streamfirst.worklog.domain.TextRecord;
import com.streamfirst.worklog.domain.TimeWindow;
import com.streamfirst.worklog.domain.WorkItemId;
import com.streamfirst.worklog.ports.CandidatePort;
import com.streamfirst.worklog.ports.TextRecordPort;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads time records for a window, loads the work items they may refer to and links them.
 * Collaborator failures degrade the run instead of aborting it.
 */
@Slf4j
@RequiredArgsConstructor
public class WorkItemLinkingService {

  private final TextRecordPort textRecords;
  private final CandidatePort candidates;
  private final WorkItemMatcher matcher;

  /** Match results for a window together with their statistics. */
  public record LinkingOutcome(List<MatchResult> results, MatchStatistics statistics) {}

  public LinkingOutcome link(TimeWindow window) {
    List<TextRecord> records;
    try {
      records = textRecords.fetchRecords(window);
    } catch (RuntimeException e) {
      log.error("Failed to fetch time records for {}", window, e);
      records = List.of();
    }

    Map<Integer, MatchCandidate> candidatesById = loadCandidates(records);
    List<MatchResult> results = matcher.match(records, candidatesById);
    MatchStatistics statistics = matcher.statistics(results);

    log.info(
        "Linked {} of {} time records ({} high confidence)",
        statistics.matchedEntries(),
        statistics.totalEntries(),
        statistics.highConfidenceMatches());
    return new LinkingOutcome(results, statistics);
  }

  private Map<Integer, MatchCandidate> loadCandidates(List<TextRecord> records) {
    Set<WorkItemId> referenced = new TreeSet<>();
    for (TextRecord record : records) {
      matcher.extractIds(record.description()).ids().forEach(id -> referenced.add(new WorkItemId(id)));
    }

    Map<Integer, MatchCandidate> candidatesById = new LinkedHashMap<>();
    if (!referenced.isEmpty()) {
      try {
        candidates.fetchCandidates(referenced).forEach(c -> candidatesById.put(c.id().value(), c));
      } catch (RuntimeException e) {
        log.error("Failed to fetch {} referenced work items", referenced.size(), e);
      }
    }

    if (matcher.mode().allowsFuzzyFallback()) {
      try {
        candidates.fetchOpenCandidates().forEach(c -> candidatesById.putIfAbsent(c.id().value(), c));
      } catch (RuntimeException e) {
        log.warn("Failed to fetch open work items, fuzzy matching limited: {}", e.getMessage());
      }
    }
    log.debug("Loaded {} candidate work items", candidatesById.size());
    return candidatesById;
  }
}
