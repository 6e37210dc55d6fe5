package org.waabox.concordia.client.http;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A session token and the instant it stops being accepted.
 *
 * @param token     the session token, never null
 * @param expiresAt the expiry instant, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Credentials(String token, Instant expiresAt) {

  public Credentials {
    Objects.requireNonNull(token, "token must not be null");
    Objects.requireNonNull(expiresAt, "expiresAt must not be null");
  }

  /**
   * Tells whether the credentials are still usable at the given instant,
   * leaving a safety margin before the expiry.
   *
   * @param now    the current instant, never null
   * @param margin the margin before the expiry, never null
   *
   * @return true if now is before expiresAt minus the margin
   */
  public boolean isUsableAt(final Instant now, final Duration margin) {
    return now.isBefore(expiresAt.minus(margin));
  }

  @Override
  public String toString() {
    return "Credentials[token=***, expiresAt=" + expiresAt + "]";
  }
}
