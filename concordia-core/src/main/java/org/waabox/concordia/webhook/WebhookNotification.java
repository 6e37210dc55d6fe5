package org.waabox.concordia.webhook;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * An inbound change notification from the directory.
 *
 * <p>The payload is opaque; only its bytes matter, as the fallback
 * identity of a notification without an id. The array is copied on
 * construction and on access.
 *
 * @param id        the sender's notification id, may be null or blank
 * @param timestamp the sender's timestamp, may be null
 * @param payload   the raw body, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record WebhookNotification(String id, Instant timestamp,
    byte[] payload) {

  /** Copies the payload. */
  public WebhookNotification {
    Objects.requireNonNull(payload, "payload must not be null");
    payload = payload.clone();
  }

  /**
   * Returns a copy of the payload.
   *
   * @return the raw body, never null
   */
  @Override
  public byte[] payload() {
    return payload.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WebhookNotification that)) {
      return false;
    }
    return Objects.equals(id, that.id)
        && Objects.equals(timestamp, that.timestamp)
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(id, timestamp) + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "WebhookNotification{id=" + id + ", timestamp=" + timestamp
        + ", payload=" + payload.length + " bytes}";
  }
}
