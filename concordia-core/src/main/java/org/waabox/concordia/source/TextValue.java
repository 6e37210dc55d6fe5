package org.waabox.concordia.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A venue attribute that may arrive as plain text or as an object carrying
 * {@code name}, {@code value} or {@code code} (a country, for instance).
 *
 * @param text the resolved text, null when nothing usable was present
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record TextValue(String text) {

  /**
   * Reads either JSON shape. Objects resolve to their first non-blank
   * {@code name}, {@code value} or {@code code}.
   *
   * @param node the JSON node, may be null
   *
   * @return the value, never null
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static TextValue fromJson(final JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return new TextValue(null);
    }
    if (node.isObject()) {
      for (final String key : new String[] {"name", "value", "code"}) {
        final JsonNode candidate = node.get(key);
        if (candidate != null && !candidate.isNull()
            && !candidate.asText().isEmpty()) {
          return new TextValue(candidate.asText());
        }
      }
      return new TextValue(null);
    }
    final String text = node.asText();
    return new TextValue(text.isEmpty() ? null : text);
  }

  /**
   * Tells whether this value carries usable text.
   *
   * @return true if the text is neither null nor empty
   */
  public boolean isPresent() {
    return text != null && !text.isEmpty();
  }

  /**
   * Returns the text of a possibly null value.
   *
   * @param value the value, may be null
   *
   * @return the text, or null
   */
  public static String textOf(final TextValue value) {
    return value == null ? null : value.text();
  }
}
