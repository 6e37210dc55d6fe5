package org.waabox.concordia.state;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Links a source event to the target event created for it.
 *
 * @param targetEventId the id of the event in the target registry, never
 *                      null
 * @param slug          the slug the target event was created with, never
 *                      null
 * @param lastSync      when the target event was last written, never null
 * @param checksum      the content checksum of the source event at that
 *                      time, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventMapping(
    @JsonProperty("circle_event_id") String targetEventId,
    @JsonProperty("slug") String slug,
    @JsonProperty("last_sync") Instant lastSync,
    @JsonProperty("checksum") String checksum
) {

  /** Validates the required fields. */
  public EventMapping {
    Objects.requireNonNull(targetEventId, "targetEventId must not be null");
    Objects.requireNonNull(slug, "slug must not be null");
    Objects.requireNonNull(lastSync, "lastSync must not be null");
    Objects.requireNonNull(checksum, "checksum must not be null");
  }

  /**
   * Returns a copy of this mapping refreshed after an update.
   *
   * <p>The target id and slug are kept.
   *
   * @param theChecksum the new checksum, never null
   * @param when        the update time, never null
   *
   * @return the refreshed mapping, never null
   */
  public EventMapping refreshed(final String theChecksum, final Instant when) {
    return new EventMapping(targetEventId, slug, when, theChecksum);
  }
}
