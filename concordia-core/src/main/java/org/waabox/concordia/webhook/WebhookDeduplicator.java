package org.waabox.concordia.webhook;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

import org.waabox.concordia.state.StateCache;

/**
 * Remembers which webhook notifications were already handled.
 *
 * <p>The ledger lives in the {@link StateCache} and is bounded; a
 * notification evicted from it would be handled again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WebhookDeduplicator {

  /** The ledger, never null. */
  private final StateCache state;

  /**
   * Creates a new deduplicator.
   *
   * @param theState the cache holding the ledger, never null
   */
  public WebhookDeduplicator(final StateCache theState) {
    state = Objects.requireNonNull(theState, "state must not be null");
  }

  /**
   * Returns the identity of a notification: its id, or the SHA-256 hex
   * digest of its payload when the id is missing or blank.
   *
   * @param notification the notification, never null
   *
   * @return the identity, never null
   */
  public String resolveId(final WebhookNotification notification) {
    Objects.requireNonNull(notification, "notification must not be null");
    final String id = notification.id();
    if (id != null && !id.isBlank()) {
      return id.trim();
    }
    try {
      final MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(sha256.digest(notification.payload()));
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Tells whether a notification was already handled.
   *
   * @param webhookId the identity, never null
   *
   * @return true if it is in the ledger
   */
  public boolean seen(final String webhookId) {
    return state.hasProcessedWebhook(webhookId);
  }

  /**
   * Records a notification as handled. The ledger is not saved.
   *
   * @param webhookId       the identity, never null
   * @param sourceTimestamp the sender's timestamp, null for now
   */
  public void markSeen(final String webhookId, final Instant sourceTimestamp) {
    state.markWebhookProcessed(webhookId, sourceTimestamp);
  }
}
