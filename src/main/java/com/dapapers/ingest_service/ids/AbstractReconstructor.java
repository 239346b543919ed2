package com.dapapers.ingest_service.ids;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rebuilds abstract text from an inverted index (word to list of positions), the format OpenAlex
 * uses for abstracts.
 */
public final class AbstractReconstructor {

  private AbstractReconstructor() {}

  /**
   * Places each word at each of its positions and joins the words with single spaces. The sort on
   * position is stable, so a position claimed by two words keeps map iteration order.
   *
   * @param invertedIndex word to positions; may be null
   * @return the abstract, or an empty string for a null or empty index
   */
  public static String reconstruct(Map<String, List<Integer>> invertedIndex) {
    if (invertedIndex == null || invertedIndex.isEmpty()) {
      return "";
    }
    List<PositionedWord> words = new ArrayList<>();
    invertedIndex.forEach(
        (word, positions) -> {
          if (word != null && positions != null) {
            for (Integer position : positions) {
              if (position != null) {
                words.add(new PositionedWord(position, word));
              }
            }
          }
        });
    words.sort(Comparator.comparingInt(PositionedWord::position));
    return words.stream().map(PositionedWord::word).collect(Collectors.joining(" "));
  }

  private record PositionedWord(int position, String word) {}
}
