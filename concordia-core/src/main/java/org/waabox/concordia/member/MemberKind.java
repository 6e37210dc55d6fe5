package org.waabox.concordia.member;

/**
 * Where a member came from in the directory.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum MemberKind {

  /** Holder of an individual membership. */
  INDIVIDUAL("individual"),

  /** Administrator of a corporate membership. */
  CORPORATE_ADMIN("corporate_admin"),

  /** Non-admin contact of a corporate membership. */
  CORPORATE_CONTACT("corporate_contact");

  /** The name used in reports. */
  private final String wireName;

  MemberKind(final String theWireName) {
    wireName = theWireName;
  }

  /**
   * Returns the name used in reports.
   *
   * @return the wire name, never null
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Tells whether members of this kind belong to a company.
   *
   * @return true for both corporate kinds
   */
  public boolean isCorporate() {
    return this != INDIVIDUAL;
  }
}
