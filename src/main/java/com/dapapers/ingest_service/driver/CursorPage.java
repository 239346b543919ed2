package com.dapapers.ingest_service.driver;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a cursor-paged upstream listing.
 *
 * @param items raw upstream items; null entries are dropped and counted as unreadable
 * @param nextCursor cursor of the following page; null or empty on the last page
 * @param total total matches reported by the upstream, 0 when unknown
 * @param unreadable records on the page that could not be read
 */
public record CursorPage<T>(List<T> items, String nextCursor, long total, int unreadable) {

  public CursorPage {
    List<T> present = new ArrayList<>();
    int missing = 0;
    if (items != null) {
      for (T item : items) {
        if (item == null) {
          missing++;
        } else {
          present.add(item);
        }
      }
    }
    items = List.copyOf(present);
    unreadable = Math.max(0, unreadable) + missing;
  }

  public CursorPage(List<T> items, String nextCursor, long total) {
    this(items, nextCursor, total, 0);
  }

  public boolean hasNext() {
    return nextCursor != null && !nextCursor.isBlank();
  }

  /** True when the upstream returned no records at all, readable or not. */
  public boolean isEmpty() {
    return items.isEmpty() && unreadable == 0;
  }
}
