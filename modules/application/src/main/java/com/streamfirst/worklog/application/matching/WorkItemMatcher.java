package com.streamfirst.worklog.application.matching;

import com.streamfirst.worklog.domain.MatchCandidate;
import com.streamfirst.worklog.domain.MatchResult;
import com.streamfirst.worklog.domain.MatchStatistics;
import com.streamfirst.worklog.domain.MatchingMode;
import com.streamfirst.worklog.domain.TextRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * Links free-text time records to work items.
 *
 * <p>Ids are extracted by applying the patterns from most to least explicit. Each pattern
 * that finds a valid id contributes a confidence ({@code 1 - 0.1 * priority}, or 0.5 for
 * patterns needing validation); the result is the maximum, plus 0.1 when two or more
 * patterns hit. The bonus counts patterns, not distinct ids, so {@code "#1234"} also hit by
 * the bare-number pattern scores 1.0.
 *
 * <p>When no extracted id matches a candidate and the mode allows it, the record's text is
 * compared with the titles of open candidates; the best score of at least 0.7 wins with a
 * fixed confidence of 0.6.
 */
@Slf4j
public class WorkItemMatcher {

  public static final List<MatchingPattern> DEFAULT_PATTERNS =
      List.of(
          MatchingPattern.of("hash", "#(\\d{4,6})", 1),
          MatchingPattern.of("ado_dash", "ADO-(\\d{4,6})", 2),
          MatchingPattern.of("ado_underscore", "ADO_(\\d{4,6})", 2),
          MatchingPattern.of("wi_colon", "WI:(\\d{4,6})", 3),
          MatchingPattern.of("wi_underscore", "WI_(\\d{4,6})", 3),
          MatchingPattern.of("brackets", "\\[(\\d{4,6})\\]", 4),
          MatchingPattern.of("parentheses", "\\((\\d{4,6})\\)", 5),
          MatchingPattern.needingValidation("plain_number", "\\b(\\d{4,6})\\b", 10));

  static final double FUZZY_THRESHOLD = 0.7;
  static final double CONTAINMENT_SCORE = 0.8;
  static final double FUZZY_CONFIDENCE = 0.6;
  static final double MULTI_PATTERN_BONUS = 0.1;

  private final List<MatchingPattern> patterns;
  private final MatchingMode mode;

  public WorkItemMatcher() {
    this(DEFAULT_PATTERNS, MatchingMode.HYBRID);
  }

  public WorkItemMatcher(MatchingMode mode) {
    this(DEFAULT_PATTERNS, mode);
  }

  public WorkItemMatcher(List<MatchingPattern> patterns, MatchingMode mode) {
    List<MatchingPattern> ordered = new ArrayList<>(patterns.isEmpty() ? DEFAULT_PATTERNS : patterns);
    ordered.sort(Comparator.comparingInt(MatchingPattern::priority));
    this.patterns = List.copyOf(ordered);
    this.mode = mode;
  }

  /** Ids found in a text and the confidence that they are intended references. */
  public record Extraction(Set<Integer> ids, double confidence) {
    public Extraction {
      ids = Set.copyOf(ids);
    }

    static Extraction none() {
      return new Extraction(Set.of(), 0.0);
    }
  }

  /** Results split at the high-confidence line. */
  public record ConfidencePartition(List<MatchResult> high, List<MatchResult> low) {}

  public MatchingMode mode() {
    return mode;
  }

  /**
   * Extracts work item ids from free text.
   *
   * @param text text to scan, may be null
   * @return the distinct ids and the confidence; no ids and 0.0 for blank text
   */
  public Extraction extractIds(String text) {
    if (text == null || text.isBlank()) {
      return Extraction.none();
    }

    Set<Integer> ids = new TreeSet<>();
    double confidence = 0.0;
    int patternsMatched = 0;

    for (MatchingPattern pattern : patterns) {
      List<Integer> found = pattern.extract(text);
      if (!found.isEmpty()) {
        ids.addAll(found);
        patternsMatched++;
        confidence = Math.max(confidence, pattern.confidence());
      }
    }

    if (patternsMatched > 1) {
      confidence = Math.min(1.0, confidence + MULTI_PATTERN_BONUS);
    }
    return new Extraction(ids, confidence);
  }

  /**
   * Matches each record against the candidates.
   *
   * @param records records to link
   * @param candidatesById candidates keyed by id; iteration order decides ties in fuzzy matching
   * @return one result per record, in input order
   */
  public List<MatchResult> match(List<TextRecord> records, Map<Integer, MatchCandidate> candidatesById) {
    List<MatchResult> results = new ArrayList<>(records.size());

    for (TextRecord record : records) {
      Extraction extraction = extractIds(record.description());
      Set<Integer> matched = new TreeSet<>();
      for (Integer id : extraction.ids()) {
        if (candidatesById.containsKey(id)) {
          matched.add(id);
        }
      }
      double confidence = extraction.confidence();

      if (matched.isEmpty() && mode.allowsFuzzyFallback()) {
        Optional<MatchCandidate> fuzzy = fuzzyMatch(record.description(), candidatesById);
        if (fuzzy.isPresent()) {
          matched.add(fuzzy.get().id().value());
          confidence = FUZZY_CONFIDENCE;
          log.debug("Fuzzy matched record {} to work item {}", record.id(), fuzzy.get().id());
        }
      }

      results.add(
          new MatchResult(record, matched, confidence, MatchResult.Strategy.forConfidence(confidence)));
    }
    return results;
  }

  /** Best open candidate whose title resembles the text, if any scores at least 0.7. */
  Optional<MatchCandidate> fuzzyMatch(String text, Map<Integer, MatchCandidate> candidatesById) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }

    String description = text.toLowerCase(Locale.ROOT);
    MatchCandidate best = null;
    double bestScore = 0.0;

    for (MatchCandidate candidate : candidatesById.values()) {
      if (candidate.closed()) {
        continue;
      }
      String title = candidate.title().toLowerCase(Locale.ROOT);
      double score = SequenceSimilarity.ratio(description, title);
      if (description.contains(title) || title.contains(description)) {
        score = Math.max(score, CONTAINMENT_SCORE);
      }
      if (score > bestScore && score >= FUZZY_THRESHOLD) {
        bestScore = score;
        best = candidate;
      }
    }
    return Optional.ofNullable(best);
  }

  /** Aggregates counts, rates and the strategy breakdown of a batch of results. */
  public MatchStatistics statistics(List<MatchResult> results) {
    int total = results.size();
    int matched = 0;
    int highConfidence = 0;
    double confidenceSum = 0.0;
    Map<String, Integer> strategies = new TreeMap<>();

    for (MatchResult result : results) {
      if (result.isMatched()) {
        matched++;
      }
      if (result.isHighConfidence()) {
        highConfidence++;
      }
      confidenceSum += result.getConfidence();
      strategies.merge(result.getStrategy().label(), 1, Integer::sum);
    }

    return new MatchStatistics(
        total,
        matched,
        total - matched,
        total > 0 ? (double) matched / total : 0.0,
        highConfidence,
        total > 0 ? (double) highConfidence / total : 0.0,
        total > 0 ? confidenceSum / total : 0.0,
        strategies);
  }

  public ConfidencePartition partitionByConfidence(List<MatchResult> results) {
    List<MatchResult> high = new ArrayList<>();
    List<MatchResult> low = new ArrayList<>();
    for (MatchResult result : results) {
      (result.isHighConfidence() ? high : low).add(result);
    }
    return new ConfidencePartition(List.copyOf(high), List.copyOf(low));
  }

  public List<TextRecord> unmatched(List<MatchResult> results) {
    return results.stream().filter(r -> !r.isMatched()).map(MatchResult::getTextRecord).toList();
  }
}
