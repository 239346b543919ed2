package com.dapapers.ingest_service.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One value of an upstream external-id map. Upstream sources encode some ids as JSON strings and
 * others as JSON numbers, so the kind is kept alongside the value.
 */
public record ExternalIdValue(Kind kind, String text, BigDecimal number) {

  public enum Kind {
    TEXT,
    NUMBER
  }

  public ExternalIdValue {
    Objects.requireNonNull(kind, "kind must not be null");
  }

  public static ExternalIdValue text(String value) {
    return new ExternalIdValue(Kind.TEXT, value, null);
  }

  public static ExternalIdValue number(BigDecimal value) {
    return new ExternalIdValue(Kind.NUMBER, null, value);
  }

  /**
   * Renders the value as an identifier string. Numbers are written without exponent or trailing
   * zeros, so {@code 2.15E8} becomes {@code 215000000}.
   */
  public String asString() {
    if (kind == Kind.NUMBER) {
      return number == null ? "" : number.stripTrailingZeros().toPlainString();
    }
    return text == null ? "" : text.trim();
  }

  public boolean isBlank() {
    return asString().isEmpty();
  }
}
