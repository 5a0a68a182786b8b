package com.streamfirst.worklog.application.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SequenceSimilarityTest {

  static final String LONG_TITLE =
      "Rework the authentication service so that refresh tokens are rotated on every use, "
          + "revoked tokens are rejected by all gateway nodes, and the audit log records each "
          + "issuance with the client id and the originating address";

  @Test
  void identicalAndEmptyStrings() {
    assertThat(SequenceSimilarity.ratio("", "")).isEqualTo(1.0);
    assertThat(SequenceSimilarity.ratio("login", "login")).isEqualTo(1.0);
    assertThat(SequenceSimilarity.ratio("login", "")).isEqualTo(0.0);
  }

  @Test
  void overlappingStrings() {
    assertThat(SequenceSimilarity.ratio("abcd", "bcde")).isEqualTo(0.75);
    assertThat(SequenceSimilarity.ratio("working on login flow", "login flow redesign")).isEqualTo(0.5);
    assertThat(SequenceSimilarity.ratio("fix login page styling", "fix login page style"))
        .isCloseTo(0.9047619, within(1e-6));
    assertThat(SequenceSimilarity.ratio("implement payment retries", "payment retry implementation"))
        .isCloseTo(0.5283019, within(1e-6));
  }

  @Test
  void popularCharactersOfLongStringsAreIgnored() {
    String a = "a".repeat(10) + "b".repeat(250);
    String b = "b".repeat(250) + "a".repeat(5);

    assertThat(SequenceSimilarity.ratio(a, b)).isEqualTo(0.0);
  }

  @Test
  void popularCharactersStillExtendAnchoredBlocks() {
    String typo = LONG_TITLE.replace("tokens are rotated", "tokenz are rotated");

    assertThat(LONG_TITLE).hasSizeGreaterThan(200);
    assertThat(SequenceSimilarity.matchingCharacters(typo, LONG_TITLE)).isEqualTo(218);
    assertThat(SequenceSimilarity.ratio(typo, LONG_TITLE)).isCloseTo(0.9954338, within(1e-6));
  }

  @Test
  void countsCharactersInMatchingBlocks() {
    assertThat(SequenceSimilarity.matchingCharacters("abxcd", "abcd")).isEqualTo(4);
  }
}
