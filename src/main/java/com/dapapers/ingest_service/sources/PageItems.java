package com.dapapers.ingest_service.sources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Binds the record array of a listing page element by element, so one record of the wrong shape
 * costs that record only.
 */
@Slf4j
public final class PageItems {

  private PageItems() {}

  /**
   * @param items records that bound
   * @param unreadable elements that did not bind
   */
  public record Bound<T>(List<T> items, int unreadable) {}

  public static <T> Bound<T> bind(
      ObjectMapper objectMapper, JsonNode array, Class<T> type, String sourceName) {
    List<T> items = new ArrayList<>();
    int unreadable = 0;
    if (array == null || !array.isArray()) {
      return new Bound<>(items, unreadable);
    }
    for (JsonNode element : array) {
      try {
        T item = objectMapper.treeToValue(element, type);
        if (item == null) {
          unreadable++;
        } else {
          items.add(item);
        }
      } catch (JsonProcessingException | IllegalArgumentException e) {
        unreadable++;
        log.warn("Skipping unreadable {} record: {}", sourceName, e.getMessage());
      }
    }
    return new Bound<>(items, unreadable);
  }

  /** Body of a listing page; a page that is not a JSON object is a parse failure. */
  public static JsonNode readPage(ObjectMapper objectMapper, String body, String sourceName) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new SourceParseException("Failed to parse " + sourceName + " page", e);
    }
    if (root == null || !root.isObject()) {
      throw new SourceParseException(sourceName + " page is not a JSON object");
    }
    return root;
  }
}
