package org.waabox.concordia.event;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import org.waabox.concordia.source.EventTemplate;
import org.waabox.concordia.source.ImageRef;
import org.waabox.concordia.source.SourceEvent;
import org.waabox.concordia.source.TextValue;
import org.waabox.concordia.source.VenueInfo;

/**
 * Fingerprints the content of a source event.
 *
 * <p>The fingerprint is the MD5 hex digest of a key-sorted JSON object made
 * of the title, subtitle, about, summary, start and end date-times, venue
 * name, address, city, country and timezone, and the template images. Any
 * other field can change without changing the fingerprint.
 *
 * <p>Thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EventChecksum {

  /** Writes the canonical JSON form. */
  private static final ObjectMapper CANONICAL = JsonMapper.builder()
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .build();

  private EventChecksum() {
  }

  /**
   * Computes the fingerprint of an event.
   *
   * @param event the event, never null
   *
   * @return the lowercase hex MD5 digest, never null
   */
  public static String compute(final SourceEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    final VenueInfo venue = event.venueInfo();

    final Map<String, Object> fields = new TreeMap<>();
    fields.put("title", event.title());
    fields.put("subTitle", event.subTitle());
    fields.put("about", event.about());
    fields.put("summary", event.summary());
    fields.put("startDateTime", event.startDateTime());
    fields.put("endDateTime", event.endDateTime());
    fields.put("venue_name", venue == null ? null
        : TextValue.textOf(venue.name()));
    fields.put("venue_address", venue == null ? null
        : TextValue.textOf(venue.address()));
    fields.put("venue_city", venue == null ? null
        : TextValue.textOf(venue.city()));
    fields.put("venue_country", venue == null ? null
        : TextValue.textOf(venue.country()));
    fields.put("venue_timezone", venue == null ? null : venue.timezone());
    fields.put("template_images", images(event.template()));

    try {
      final byte[] canonical = CANONICAL.writeValueAsBytes(fields);
      return HexFormat.of().formatHex(md5().digest(canonical));
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException(
          "Could not fingerprint event " + event.id(), e);
    }
  }

  private static Map<String, Object> images(final EventTemplate template) {
    final Map<String, Object> images = new TreeMap<>();
    if (template == null || template.images() == null) {
      return images;
    }
    for (final Map.Entry<String, ImageRef> entry
        : template.images().entrySet()) {
      final ImageRef image = entry.getValue();
      final Map<String, Object> ref = new TreeMap<>();
      if (image != null) {
        ref.put("uri", image.uri());
      }
      images.put(entry.getKey(), ref);
    }
    return images;
  }

  private static MessageDigest md5() {
    try {
      return MessageDigest.getInstance("MD5");
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
  }
}
