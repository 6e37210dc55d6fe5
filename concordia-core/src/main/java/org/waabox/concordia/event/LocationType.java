package org.waabox.concordia.event;

import java.util.Locale;
import java.util.Objects;

/**
 * How attendees reach an event.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum LocationType {

  IN_PERSON("in_person"),
  VIRTUAL("virtual"),
  TBD("tbd");

  /** The wire name. */
  private final String wireName;

  LocationType(final String theWireName) {
    wireName = theWireName;
  }

  /**
   * Returns the name the target registry expects.
   *
   * @return the wire name, never null
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a location type from its wire name.
   *
   * @param name the wire name, case insensitive, never null
   *
   * @return the location type, never null
   *
   * @throws IllegalArgumentException if the name is unknown
   */
  public static LocationType fromWireName(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    final String lower = name.trim().toLowerCase(Locale.ROOT);
    for (final LocationType type : values()) {
      if (type.wireName.equals(lower)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown location type: " + name);
  }
}
