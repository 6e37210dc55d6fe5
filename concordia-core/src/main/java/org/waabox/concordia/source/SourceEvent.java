package org.waabox.concordia.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An event as listed by the directory.
 *
 * <p>Date-times are epoch milliseconds. Every field may be null.
 *
 * @param id            the directory event id
 * @param title         the title
 * @param subTitle      the subtitle
 * @param about         the rich HTML description
 * @param summary       the short description
 * @param description   the legacy description
 * @param startDateTime the start, in epoch milliseconds
 * @param endDateTime   the end, in epoch milliseconds
 * @param venueInfo     the venue
 * @param template      the presentation template
 * @param published     whether the event is published
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceEvent(
    String id,
    String title,
    String subTitle,
    String about,
    String summary,
    String description,
    Long startDateTime,
    Long endDateTime,
    VenueInfo venueInfo,
    EventTemplate template,
    Boolean published
) {

  /**
   * Tells whether this event carries a usable id.
   *
   * @return true if the id is neither null nor blank
   */
  public boolean hasId() {
    return id != null && !id.isBlank();
  }
}
