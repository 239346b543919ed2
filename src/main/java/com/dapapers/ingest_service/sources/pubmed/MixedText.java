package com.dapapers.ingest_service.sources.pubmed;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import java.io.IOException;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Reads an EFetch element whose text may carry inline markup ({@code <i>}, {@code <sup>},
 * {@code <sub>}...). The XML parser reports such an element as an object whose text runs and
 * child elements are separate fields; every text run is kept, in document order.
 */
final class MixedText {

  private MixedText() {}

  /**
   * Collects the element's text at the parser's current token. Top-level fields named in
   * {@code attributeNames} are handed to {@code onAttribute} instead of being treated as text.
   */
  static String read(
      JsonParser parser, Set<String> attributeNames, BiConsumer<String, String> onAttribute)
      throws IOException {
    JsonToken token = parser.currentToken();
    if (token == null || token == JsonToken.VALUE_NULL) {
      return null;
    }
    if (token.isScalarValue()) {
      return parser.getText();
    }
    StringBuilder text = new StringBuilder();
    if (token != JsonToken.START_OBJECT) {
      append(parser, token, text);
      return text.toString();
    }
    for (token = parser.nextToken(); token == JsonToken.FIELD_NAME; token = parser.nextToken()) {
      String name = parser.currentName();
      JsonToken value = parser.nextToken();
      if (attributeNames.contains(name) && value.isScalarValue()) {
        onAttribute.accept(name, parser.getText());
      } else {
        append(parser, value, text);
      }
    }
    return text.toString();
  }

  private static void append(JsonParser parser, JsonToken token, StringBuilder text)
      throws IOException {
    if (token == JsonToken.START_OBJECT) {
      for (JsonToken t = parser.nextToken(); t == JsonToken.FIELD_NAME; t = parser.nextToken()) {
        append(parser, parser.nextToken(), text);
      }
    } else if (token == JsonToken.START_ARRAY) {
      for (JsonToken t = parser.nextToken(); t != JsonToken.END_ARRAY; t = parser.nextToken()) {
        append(parser, t, text);
      }
    } else if (token != null && token.isScalarValue() && token != JsonToken.VALUE_NULL) {
      text.append(parser.getText());
    }
  }

  /** Flattens an element without attributes of interest, such as {@code ArticleTitle}. */
  static class Deserializer extends JsonDeserializer<String> {
    @Override
    public String deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      return read(parser, Set.of(), (name, value) -> {});
    }
  }
}
