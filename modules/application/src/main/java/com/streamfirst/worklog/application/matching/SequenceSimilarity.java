package com.streamfirst.worklog.application.matching;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp similarity: twice the number of characters in matching blocks divided by
 * the total length of both strings. Matching blocks are found by recursively taking the
 * longest common substring and repeating on the pieces to its left and right.
 *
 * <p>For a second string of 200 characters or more, characters occurring in more than 1% of
 * its positions are ignored as anchors ("autojunk"), which keeps long titles cheap. They are
 * still matched when they extend an anchored block on either side.
 */
final class SequenceSimilarity {

  private static final int AUTOJUNK_MIN_LENGTH = 200;

  private SequenceSimilarity() {}

  /** Returns a similarity in {@code [0, 1]}; two empty strings are identical. */
  static double ratio(String a, String b) {
    int total = a.length() + b.length();
    if (total == 0) {
      return 1.0;
    }
    return 2.0 * matchingCharacters(a, b) / total;
  }

  static int matchingCharacters(String a, String b) {
    Map<Character, List<Integer>> positions = indexPositions(b);
    int matched = 0;

    Deque<int[]> pending = new ArrayDeque<>();
    pending.push(new int[] {0, a.length(), 0, b.length()});
    while (!pending.isEmpty()) {
      int[] range = pending.pop();
      int aLo = range[0];
      int aHi = range[1];
      int bLo = range[2];
      int bHi = range[3];

      int[] block = longestMatch(a, b, positions, aLo, aHi, bLo, bHi);
      int i = block[0];
      int j = block[1];
      int size = block[2];
      if (size > 0) {
        matched += size;
        if (aLo < i && bLo < j) {
          pending.push(new int[] {aLo, i, bLo, j});
        }
        if (i + size < aHi && j + size < bHi) {
          pending.push(new int[] {i + size, aHi, j + size, bHi});
        }
      }
    }
    return matched;
  }

  private static Map<Character, List<Integer>> indexPositions(String b) {
    Map<Character, List<Integer>> positions = new HashMap<>();
    for (int j = 0; j < b.length(); j++) {
      positions.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
    }
    if (b.length() >= AUTOJUNK_MIN_LENGTH) {
      int popular = b.length() / 100 + 1;
      positions.values().removeIf(list -> list.size() > popular);
    }
    return positions;
  }

  /**
   * Longest block with {@code a[i..i+size) == b[j..j+size)} inside the given ranges; ties go to
   * the block that starts earliest in {@code a}, then earliest in {@code b}.
   */
  private static int[] longestMatch(
      String a,
      String b,
      Map<Character, List<Integer>> positions,
      int aLo,
      int aHi,
      int bLo,
      int bHi) {
    int bestI = aLo;
    int bestJ = bLo;
    int bestSize = 0;
    Map<Integer, Integer> lengthEndingAt = new HashMap<>();

    for (int i = aLo; i < aHi; i++) {
      Map<Integer, Integer> next = new HashMap<>();
      for (int j : positions.getOrDefault(a.charAt(i), List.of())) {
        if (j < bLo) {
          continue;
        }
        if (j >= bHi) {
          break;
        }
        int k = lengthEndingAt.getOrDefault(j - 1, 0) + 1;
        next.put(j, k);
        if (k > bestSize) {
          bestI = i - k + 1;
          bestJ = j - k + 1;
          bestSize = k;
        }
      }
      lengthEndingAt = next;
    }

    // Popular characters are not anchors but still count once adjacent to an anchor block.
    while (bestI > aLo && bestJ > bLo && a.charAt(bestI - 1) == b.charAt(bestJ - 1)) {
      bestI--;
      bestJ--;
      bestSize++;
    }
    while (bestI + bestSize < aHi
        && bestJ + bestSize < bHi
        && a.charAt(bestI + bestSize) == b.charAt(bestJ + bestSize)) {
      bestSize++;
    }
    return new int[] {bestI, bestJ, bestSize};
  }
}
