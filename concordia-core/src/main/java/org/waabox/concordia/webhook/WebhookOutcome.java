package org.waabox.concordia.webhook;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.waabox.concordia.report.SyncReport;

/**
 * What happened to an inbound notification.
 *
 * @param received   always true once the notification was accepted
 * @param skipped    true if it had been handled before
 * @param webhookId  the resolved identity, never null
 * @param syncReport the report of the sync it triggered, null if skipped
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record WebhookOutcome(
    @JsonProperty("received") boolean received,
    @JsonProperty("skipped") boolean skipped,
    @JsonProperty("webhook_id") String webhookId,
    @JsonProperty("sync_report")
    @JsonInclude(JsonInclude.Include.NON_NULL) SyncReport syncReport
) {

  /** Validates the identity. */
  public WebhookOutcome {
    Objects.requireNonNull(webhookId, "webhookId must not be null");
  }

  /**
   * Creates the outcome of a duplicate.
   *
   * @param webhookId the identity, never null
   *
   * @return the outcome, never null
   */
  public static WebhookOutcome duplicate(final String webhookId) {
    return new WebhookOutcome(true, true, webhookId, null);
  }

  /**
   * Creates the outcome of a handled notification.
   *
   * @param webhookId the identity, never null
   * @param report    the sync report, never null
   *
   * @return the outcome, never null
   */
  public static WebhookOutcome processed(final String webhookId,
      final SyncReport report) {
    return new WebhookOutcome(true, false, webhookId,
        Objects.requireNonNull(report, "report must not be null"));
  }
}
