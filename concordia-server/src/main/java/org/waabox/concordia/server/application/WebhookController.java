package org.waabox.concordia.server.application;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.concordia.Concordia;
import org.waabox.concordia.webhook.WebhookNotification;
import org.waabox.concordia.webhook.WebhookOutcome;

/**
 * REST controller receiving Glue Up change notifications.
 *
 * <p>A notification runs a full member sync, unless one with the same id
 * (or, without an id, the same body) was handled before.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
public class WebhookController {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      WebhookController.class);

  /** The header carrying the notification id. */
  static final String ID_HEADER = "X-Webhook-Id";

  /** The header carrying the notification timestamp. */
  static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";

  /** The Concordia instance handling notifications, never null. */
  private final Concordia concordia;

  /**
   * Creates a new WebhookController.
   *
   * @param theConcordia the Concordia instance, never null
   */
  public WebhookController(final Concordia theConcordia) {
    concordia = Objects.requireNonNull(theConcordia,
        "concordia cannot be null");
  }

  /**
   * Handles a Glue Up notification.
   *
   * @param webhookId the notification id, may be null
   * @param timestamp the notification timestamp, ISO-8601 or epoch
   *        seconds, may be null
   * @param body the raw body, may be null
   *
   * @return what happened to the notification, never null
   */
  @PostMapping("/webhooks/glueup")
  public WebhookOutcome glueUp(
      @RequestHeader(name = ID_HEADER, required = false)
          final String webhookId,
      @RequestHeader(name = TIMESTAMP_HEADER, required = false)
          final String timestamp,
      @RequestBody(required = false) final byte[] body) {
    log.info("Webhook received (id={}, {} bytes)", webhookId,
        body == null ? 0 : body.length);
    return concordia.handleWebhook(new WebhookNotification(webhookId,
        parseTimestamp(timestamp), body == null ? new byte[0] : body));
  }

  static Instant parseTimestamp(final String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    final String trimmed = value.trim();
    try {
      return Instant.parse(trimmed);
    } catch (final DateTimeParseException e) {
      try {
        return Instant.ofEpochSecond(Long.parseLong(trimmed));
      } catch (final NumberFormatException notANumber) {
        log.warn("Ignoring unreadable webhook timestamp: {}", value);
        return null;
      }
    }
  }
}
