package org.waabox.concordia.target;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The body of an event create or update call.
 *
 * <p>Optional fields are null when absent and are left out of the wire
 * representation.
 *
 * @param name                  the title, never null
 * @param slug                  the URL slug, never null
 * @param body                  the HTML description, never null
 * @param startsAt              the ISO-8601 UTC start, may be null
 * @param endsAt                the ISO-8601 UTC end, may be null
 * @param location              the human readable location, never null
 * @param locationType          {@code in_person}, {@code virtual} or
 *                              {@code tbd}, never null
 * @param host                  the host label, never null
 * @param rsvpDisabled          whether RSVPs are disabled
 * @param sendEmailConfirmation whether confirmations are mailed
 * @param sendEmailReminder     whether reminders are mailed
 * @param userId                the owning member id, never null
 * @param spaceId               the space the event lives in, never null
 * @param coverImageUrl         the absolute cover image URL, may be null
 * @param timezone              the venue timezone, may be null
 * @param venueName             the venue name, may be null
 * @param venueAddress          the venue address, may be null
 * @param venueCity             the venue city, may be null
 * @param venueCountry          the venue country, may be null
 * @param venueLatitude         the venue latitude, may be null
 * @param venueLongitude        the venue longitude, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventPayload(
    @JsonProperty("name") String name,
    @JsonProperty("slug") String slug,
    @JsonProperty("body") String body,
    @JsonProperty("starts_at") String startsAt,
    @JsonProperty("ends_at") String endsAt,
    @JsonProperty("location") String location,
    @JsonProperty("location_type") String locationType,
    @JsonProperty("host") String host,
    @JsonProperty("rsvp_disabled") boolean rsvpDisabled,
    @JsonProperty("send_email_confirmation") boolean sendEmailConfirmation,
    @JsonProperty("send_email_reminder") boolean sendEmailReminder,
    @JsonProperty("user_id") String userId,
    @JsonProperty("space_id") String spaceId,
    @JsonProperty("cover_image_url") String coverImageUrl,
    @JsonProperty("timezone") String timezone,
    @JsonProperty("venue_name") String venueName,
    @JsonProperty("venue_address") String venueAddress,
    @JsonProperty("venue_city") String venueCity,
    @JsonProperty("venue_country") String venueCountry,
    @JsonProperty("venue_latitude") Double venueLatitude,
    @JsonProperty("venue_longitude") Double venueLongitude
) {

  /** Validates the required fields. */
  public EventPayload {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(slug, "slug must not be null");
    Objects.requireNonNull(body, "body must not be null");
    Objects.requireNonNull(location, "location must not be null");
    Objects.requireNonNull(locationType, "locationType must not be null");
    Objects.requireNonNull(host, "host must not be null");
    Objects.requireNonNull(userId, "userId must not be null");
    Objects.requireNonNull(spaceId, "spaceId must not be null");
  }

  /**
   * Returns a copy of this payload carrying the given slug.
   *
   * @param theSlug the slug, never null
   *
   * @return the copy, never null
   */
  public EventPayload withSlug(final String theSlug) {
    return new EventPayload(name, theSlug, body, startsAt, endsAt, location,
        locationType, host, rsvpDisabled, sendEmailConfirmation,
        sendEmailReminder, userId, spaceId, coverImageUrl, timezone,
        venueName, venueAddress, venueCity, venueCountry, venueLatitude,
        venueLongitude);
  }
}
