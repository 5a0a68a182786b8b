package com.streamfirst.worklog.application.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.streamfirst.worklog.domain.MatchCandidate;
import com.streamfirst.worklog.domain.MatchResult;
import com.streamfirst.worklog.domain.MatchStatistics;
import com.streamfirst.worklog.domain.MatchingMode;
import com.streamfirst.worklog.domain.TextRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WorkItemMatcherTest {

  private final WorkItemMatcher matcher = new WorkItemMatcher();

  private static Map<Integer, MatchCandidate> candidates(MatchCandidate... items) {
    Map<Integer, MatchCandidate> byId = new LinkedHashMap<>();
    for (MatchCandidate item : items) {
      byId.put(item.id().value(), item);
    }
    return byId;
  }

  @Test
  void hashReferenceAlsoHitByBareNumberPatternScoresFull() {
    WorkItemMatcher.Extraction extraction = matcher.extractIds("Fixed bug #1234");

    assertThat(extraction.ids()).containsExactly(1234);
    assertThat(extraction.confidence()).isCloseTo(1.0, within(1e-9));
  }

  @Test
  void confidenceFollowsPatternPriority() {
    assertThat(matcher.extractIds("ADO-5678 review").confidence()).isCloseTo(0.9, within(1e-9));
    assertThat(matcher.extractIds("ADO_5678 review").confidence()).isCloseTo(0.8, within(1e-9));
    assertThat(matcher.extractIds("[12345] sync").confidence()).isCloseTo(0.7, within(1e-9));
    assertThat(matcher.extractIds("worked on 123456").confidence()).isEqualTo(0.5);
  }

  @Test
  void patternsIgnoreCase() {
    WorkItemMatcher.Extraction extraction = matcher.extractIds("ado-4321 and wi:5555");

    assertThat(extraction.ids()).containsExactlyInAnyOrder(4321, 5555);
  }

  @Test
  void outOfRangeAndBlankTextYieldNothing() {
    assertThat(matcher.extractIds("#0000").ids()).isEmpty();
    assertThat(matcher.extractIds("#0000").confidence()).isZero();
    assertThat(matcher.extractIds("   ").ids()).isEmpty();
    assertThat(matcher.extractIds(null).confidence()).isZero();
    assertThat(matcher.extractIds("meeting 123").ids()).isEmpty();
  }

  @Test
  void extractedIdMatchesKnownCandidate() {
    List<MatchResult> results =
        matcher.match(
            List.of(TextRecord.of("t1", "Fixed bug #1234"), TextRecord.of("t2", "#9999 unknown")),
            candidates(MatchCandidate.open(1234, "Crash on login")));

    assertThat(results.get(0).getMatchedCandidateIds()).containsExactly(1234);
    assertThat(results.get(0).getStrategy()).isEqualTo(MatchResult.Strategy.STRICT);
    assertThat(results.get(0).isHighConfidence()).isTrue();
    assertThat(results.get(1).isMatched()).isFalse();
  }

  @Test
  void fuzzyFallbackUsesTitleContainment() {
    List<MatchResult> results =
        matcher.match(
            List.of(TextRecord.of("t1", "working on login flow redesign")),
            candidates(MatchCandidate.open(2001, "Payment retries"), MatchCandidate.open(2002, "Login flow redesign")));

    MatchResult result = results.get(0);
    assertThat(result.getMatchedCandidateIds()).containsExactly(2002);
    assertThat(result.getConfidence()).isEqualTo(0.6);
    assertThat(result.getStrategy()).isEqualTo(MatchResult.Strategy.FUZZY);
    assertThat(result.isHighConfidence()).isFalse();
  }

  @Test
  void fuzzyFallbackUsesSimilarityRatio() {
    assertThat(matcher.fuzzyMatch("abcd", candidates(MatchCandidate.open(3001, "bcde"))))
        .map(c -> c.id().value())
        .contains(3001);
    assertThat(
            matcher.fuzzyMatch(
                "implement payment retries",
                candidates(MatchCandidate.open(3002, "payment retry implementation"))))
        .isEmpty();
  }

  @Test
  void fuzzyFallbackHandlesLongTitles() {
    String typo = SequenceSimilarityTest.LONG_TITLE.replace("tokens are rotated", "tokenz are rotated");

    List<MatchResult> results =
        matcher.match(
            List.of(TextRecord.of("t1", typo)),
            candidates(MatchCandidate.open(4321, SequenceSimilarityTest.LONG_TITLE)));

    assertThat(results.get(0).getMatchedCandidateIds()).containsExactly(4321);
    assertThat(results.get(0).getConfidence()).isEqualTo(0.6);
  }

  @Test
  void closedCandidatesNeverMatchFuzzily() {
    assertThat(
            matcher.fuzzyMatch(
                "working on login flow redesign", candidates(MatchCandidate.closed(2002, "Login flow redesign"))))
        .isEmpty();
  }

  @Test
  void firstCandidateWinsTies() {
    assertThat(
            matcher.fuzzyMatch(
                "login flow",
                candidates(MatchCandidate.open(4001, "Login flow"), MatchCandidate.open(4002, "login flow"))))
        .map(c -> c.id().value())
        .contains(4001);
  }

  @Test
  void strictModeSkipsFuzzyFallback() {
    WorkItemMatcher strict = new WorkItemMatcher(MatchingMode.STRICT);

    List<MatchResult> results =
        strict.match(
            List.of(TextRecord.of("t1", "working on login flow redesign")),
            candidates(MatchCandidate.open(2002, "Login flow redesign")));

    assertThat(results.get(0).isMatched()).isFalse();
    assertThat(results.get(0).getConfidence()).isZero();
  }

  @Test
  void statisticsPartitionAndUnmatched() {
    List<MatchResult> results =
        matcher.match(
            List.of(
                TextRecord.of("t1", "Fixed bug #1234"),
                TextRecord.of("t2", "working on login flow redesign"),
                TextRecord.of("t3", "lunch")),
            candidates(MatchCandidate.open(1234, "Crash on login"), MatchCandidate.open(2002, "Login flow redesign")));

    MatchStatistics stats = matcher.statistics(results);
    assertThat(stats.totalEntries()).isEqualTo(3);
    assertThat(stats.matchedEntries()).isEqualTo(2);
    assertThat(stats.unmatchedEntries()).isEqualTo(1);
    assertThat(stats.matchRate()).isCloseTo(2.0 / 3, within(1e-9));
    assertThat(stats.highConfidenceMatches()).isEqualTo(1);
    assertThat(stats.averageConfidence()).isCloseTo(1.6 / 3, within(1e-9));
    assertThat(stats.strategiesUsed()).containsEntry("strict", 1).containsEntry("fuzzy", 2);

    WorkItemMatcher.ConfidencePartition partition = matcher.partitionByConfidence(results);
    assertThat(partition.high()).hasSize(1);
    assertThat(partition.low()).hasSize(2);

    assertThat(matcher.unmatched(results)).extracting(TextRecord::id).containsExactly("t3");
  }

  @Test
  void statisticsOfNothingAreZero() {
    MatchStatistics stats = matcher.statistics(List.of());

    assertThat(stats.totalEntries()).isZero();
    assertThat(stats.matchRate()).isZero();
    assertThat(stats.averageConfidence()).isZero();
    assertThat(stats.strategiesUsed()).isEmpty();
  }
}
