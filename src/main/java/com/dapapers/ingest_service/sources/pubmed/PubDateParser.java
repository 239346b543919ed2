package com.dapapers.ingest_service.sources.pubmed;

import com.dapapers.ingest_service.sources.Texts;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Journal issue dates. PubMed gives a year, optionally a month ({@code Jan} or {@code 01}) and a
 * day; the finest parsable combination is used and missing parts default to 1. Free-text {@code
 * MedlineDate} values contribute their first year.
 */
final class PubDateParser {

  private static final Pattern YEAR = Pattern.compile("(\\d{4})");

  private PubDateParser() {}

  static LocalDate parse(PubmedArticleSet.PubDate pubDate) {
    if (pubDate == null) {
      return null;
    }
    Integer year = parseYear(pubDate.getYear());
    if (year == null) {
      year = parseYear(pubDate.getMedlineDate());
    }
    if (year == null) {
      return null;
    }
    Integer month = parseMonth(pubDate.getMonth());
    if (month == null) {
      return LocalDate.of(year, 1, 1);
    }
    Integer day = parseNumber(pubDate.getDay());
    YearMonth yearMonth = YearMonth.of(year, month);
    if (day != null && yearMonth.isValidDay(day)) {
      return yearMonth.atDay(day);
    }
    return yearMonth.atDay(1);
  }

  private static Integer parseYear(String value) {
    if (!Texts.hasText(value)) {
      return null;
    }
    Matcher m = YEAR.matcher(value);
    return m.find() ? Integer.valueOf(m.group(1)) : null;
  }

  static Integer parseMonth(String value) {
    if (!Texts.hasText(value)) {
      return null;
    }
    Integer numeric = parseNumber(value);
    if (numeric != null) {
      return numeric >= 1 && numeric <= 12 ? numeric : null;
    }
    String prefix = value.trim().toLowerCase(Locale.ROOT);
    for (Month month : Month.values()) {
      String shortName = month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT);
      if (prefix.startsWith(shortName)) {
        return month.getValue();
      }
    }
    return null;
  }

  private static Integer parseNumber(String value) {
    if (!Texts.hasText(value)) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
