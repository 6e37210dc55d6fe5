package org.waabox.concordia.state;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A processed webhook notification in the de-duplication ledger.
 *
 * @param processedAt when the notification was handled, never null
 * @param timestamp   the timestamp the sender attached to it, or the
 *                    processing time when it carried none, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookRecord(
    @JsonProperty("processed_at") Instant processedAt,
    @JsonProperty("timestamp") Instant timestamp
) {

  /** Validates the required fields. */
  public WebhookRecord {
    Objects.requireNonNull(processedAt, "processedAt must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
  }
}
