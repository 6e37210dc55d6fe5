package org.waabox.concordia.event;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.waabox.concordia.source.EventTemplate;
import org.waabox.concordia.source.GeoPoint;
import org.waabox.concordia.source.ImageRef;
import org.waabox.concordia.source.SourceEvent;
import org.waabox.concordia.source.TextValue;
import org.waabox.concordia.source.VenueInfo;
import org.waabox.concordia.target.EventPayload;

/**
 * Maps a directory event onto the target registry's event shape.
 *
 * <p>The mapping is deterministic: the same event, space, owner and
 * overrides always give the same payload.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EventTransformer {

  /** The title of an event without one. */
  public static final String UNTITLED = "Untitled Event";

  /** The size that replaces the image size placeholder. */
  static final String COVER_IMAGE_SIZE = "1200x630";

  /** The image size placeholder in template uris. */
  private static final String SIZE_PLACEHOLDER = "::size::";

  /** Venue name fragments that mark an online event. */
  private static final List<String> VIRTUAL_KEYWORDS = List.of("online",
      "virtual", "webinar", "zoom", "teams", "meet");

  /**
   * Transforms an event.
   *
   * @param event     the directory event, never null
   * @param spaceId   the space the event goes in, never null
   * @param ownerId   the member that owns the event, never null
   * @param overrides the configured overrides, never null
   *
   * @return the payload, never null
   */
  public EventPayload transform(final SourceEvent event, final String spaceId,
      final String ownerId, final FieldOverrides overrides) {
    Objects.requireNonNull(event, "event must not be null");
    Objects.requireNonNull(spaceId, "spaceId must not be null");
    Objects.requireNonNull(ownerId, "ownerId must not be null");
    Objects.requireNonNull(overrides, "overrides must not be null");

    final String title = isEmpty(event.title()) ? UNTITLED : event.title();
    final String id = event.id() == null ? "" : event.id();
    final VenueInfo venue = event.venueInfo();

    final LocationType locationType = overrides.locationType() != null
        ? overrides.locationType() : detectLocationType(venue);

    final GeoPoint map = venue == null ? null : venue.map();
    final boolean hasCoordinates = map != null && map.latitude() != null
        && map.longitude() != null;

    return new EventPayload(
        title,
        Slugs.eventSlug(title, id),
        body(event),
        formatDateTime(event.startDateTime()),
        formatDateTime(event.endDateTime()),
        location(venue),
        locationType.wireName(),
        overrides.resolvedHost(),
        overrides.resolvedRsvpDisabled(),
        overrides.resolvedSendEmailConfirmation(),
        overrides.resolvedSendEmailReminder(),
        ownerId,
        spaceId,
        coverImageUrl(event.template()),
        venue == null || isEmpty(venue.timezone()) ? null : venue.timezone(),
        venue == null ? null : TextValue.textOf(venue.name()),
        venue == null ? null : TextValue.textOf(venue.address()),
        venue == null ? null : TextValue.textOf(venue.city()),
        venue == null ? null : TextValue.textOf(venue.country()),
        hasCoordinates ? map.latitude() : null,
        hasCoordinates ? map.longitude() : null);
  }

  /**
   * Builds the HTML body: about, else summary, else description, prefixed
   * by the subtitle in bold when there is one.
   */
  static String body(final SourceEvent event) {
    String body = "";
    if (!isEmpty(event.about())) {
      body = event.about();
    } else if (!isEmpty(event.summary())) {
      body = event.summary();
    } else if (!isEmpty(event.description())) {
      body = event.description();
    }
    if (!isEmpty(event.subTitle())) {
      body = "<p><strong>" + event.subTitle() + "</strong></p>\n" + body;
    }
    return body;
  }

  /**
   * Formats epoch milliseconds as an ISO-8601 UTC date-time.
   *
   * @param epochMillis the instant, may be null
   *
   * @return the date-time, or null for null and zero
   */
  static String formatDateTime(final Long epochMillis) {
    if (epochMillis == null || epochMillis == 0L) {
      return null;
    }
    return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(
        OffsetDateTime.ofInstant(Instant.ofEpochMilli(epochMillis),
            ZoneOffset.UTC));
  }

  /** Joins venue name, address, city and country, skipping blanks. */
  static String location(final VenueInfo venue) {
    if (venue == null) {
      return "";
    }
    final List<String> parts = new ArrayList<>();
    for (final TextValue part : new TextValue[] {venue.name(),
        venue.address(), venue.city(), venue.country()}) {
      if (part != null && part.isPresent()) {
        parts.add(part.text());
      }
    }
    return String.join(", ", parts);
  }

  /** Classifies a venue by its name, then by its address. */
  static LocationType detectLocationType(final VenueInfo venue) {
    if (venue == null) {
      return LocationType.TBD;
    }
    final String name = venue.name() == null || venue.name().text() == null
        ? "" : venue.name().text().toLowerCase(Locale.ROOT);
    for (final String keyword : VIRTUAL_KEYWORDS) {
      if (name.contains(keyword)) {
        return LocationType.VIRTUAL;
      }
    }
    final boolean hasAddress = (venue.address() != null
        && venue.address().isPresent())
        || (venue.city() != null && venue.city().isPresent());
    return hasAddress ? LocationType.IN_PERSON : LocationType.TBD;
  }

  /**
   * Picks the banner, else the header image. Relative uris can not be
   * resolved and give no cover image.
   */
  static String coverImageUrl(final EventTemplate template) {
    if (template == null || template.images() == null) {
      return null;
    }
    final Map<String, ImageRef> images = template.images();
    for (final String role : new String[] {"banner", "headerImage"}) {
      final ImageRef image = images.get(role);
      if (image != null && !isEmpty(image.uri())) {
        final String uri = image.uri().replace(SIZE_PLACEHOLDER,
            COVER_IMAGE_SIZE);
        return uri.startsWith("/") ? null : uri;
      }
    }
    return null;
  }

  private static boolean isEmpty(final String value) {
    return value == null || value.isEmpty();
  }
}
