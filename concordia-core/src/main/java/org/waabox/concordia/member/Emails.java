package org.waabox.concordia.member;

import java.util.Locale;

/**
 * Email helpers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Emails {

  private Emails() {
  }

  /**
   * Normalizes an email for use as a key: trimmed and lowercased.
   *
   * @param email the raw email, may be null
   *
   * @return the normalized email, empty for null, never null
   */
  public static String normalize(final String email) {
    return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
  }
}
