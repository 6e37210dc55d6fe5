package org.waabox.concordia.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * An email address as the directory sends it: either a bare string or an
 * object wrapping it under {@code value}.
 *
 * @param value the raw address, never null, possibly blank
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record EmailAddress(String value) {

  /** Replaces a null value with the empty string. */
  public EmailAddress {
    value = value == null ? "" : value;
  }

  /**
   * Reads either JSON shape.
   *
   * @param node the JSON node, may be null
   *
   * @return the address, never null
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static EmailAddress fromJson(final JsonNode node) {
    if (node == null || node.isNull()) {
      return new EmailAddress("");
    }
    if (node.isObject()) {
      final JsonNode wrapped = node.get("value");
      return new EmailAddress(wrapped == null || wrapped.isNull()
          ? "" : wrapped.asText());
    }
    return new EmailAddress(node.asText());
  }
}
