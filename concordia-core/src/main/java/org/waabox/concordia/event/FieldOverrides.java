package org.waabox.concordia.event;

/**
 * Configured values that replace, or complete, what is derived from a
 * source event. A null component means "use the default".
 *
 * @param host                  the host label; defaults to
 *                              {@value #DEFAULT_HOST}
 * @param locationType          forces the location type
 * @param rsvpDisabled          defaults to false
 * @param sendEmailConfirmation defaults to true
 * @param sendEmailReminder     defaults to true
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FieldOverrides(
    String host,
    LocationType locationType,
    Boolean rsvpDisabled,
    Boolean sendEmailConfirmation,
    Boolean sendEmailReminder
) {

  /** The host label used when none is configured. */
  public static final String DEFAULT_HOST = "GlueUp Events";

  /**
   * Returns overrides that keep every default.
   *
   * @return the overrides, never null
   */
  public static FieldOverrides none() {
    return new FieldOverrides(null, null, null, null, null);
  }

  String resolvedHost() {
    return host == null || host.isEmpty() ? DEFAULT_HOST : host;
  }

  boolean resolvedRsvpDisabled() {
    return rsvpDisabled != null && rsvpDisabled;
  }

  boolean resolvedSendEmailConfirmation() {
    return sendEmailConfirmation == null || sendEmailConfirmation;
  }

  boolean resolvedSendEmailReminder() {
    return sendEmailReminder == null || sendEmailReminder;
  }
}
