package com.streamfirst.worklog.application.matching;

import com.streamfirst.worklog.domain.WorkItemId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * One way of writing a work item reference in free text, e.g. {@code #1234} or {@code ADO-1234}.
 * The first capture group must hold the digits.
 *
 * @param name pattern family name
 * @param regex compiled, case-insensitive expression
 * @param priority lower is more explicit
 * @param requiresValidation whether a hit is weak evidence, like a bare number
 */
@Slf4j
public record MatchingPattern(String name, Pattern regex, int priority, boolean requiresValidation) {

  public MatchingPattern {
    Objects.requireNonNull(name, "Pattern name cannot be null");
    Objects.requireNonNull(regex, "Pattern regex cannot be null");
  }

  public static MatchingPattern of(String name, String regex, int priority) {
    return new MatchingPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), priority, false);
  }

  public static MatchingPattern needingValidation(String name, String regex, int priority) {
    return new MatchingPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), priority, true);
  }

  /**
   * Returns every in-range id this pattern finds in the text, in order of appearance.
   * Hits that are not numbers or fall outside the work item id range are skipped.
   */
  public List<Integer> extract(String text) {
    List<Integer> ids = new ArrayList<>();
    Matcher matcher = regex.matcher(text);
    while (matcher.find()) {
      try {
        long id = Long.parseLong(matcher.group(1));
        if (WorkItemId.isValid(id)) {
          ids.add((int) id);
        }
      } catch (NumberFormatException e) {
        log.debug("Pattern {} matched non-numeric text '{}'", name, matcher.group(1));
      }
    }
    return ids;
  }

  /** Confidence contributed when this pattern produces at least one id. */
  public double confidence() {
    return requiresValidation ? 0.5 : Math.max(0.0, 1.0 - priority * 0.1);
  }
}
