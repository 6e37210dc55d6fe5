package org.waabox.concordia.report;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an operation ended.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Outcome {

  /** The target registry accepted the call. */
  SUCCESS("success"),

  /** The call failed; the detail carries the error. */
  ERROR("error"),

  /** The call was only planned. */
  DRY_RUN("dry_run");

  /** The wire name. */
  private final String wireName;

  Outcome(final String theWireName) {
    wireName = theWireName;
  }

  /**
   * Returns the name used in reports.
   *
   * @return the wire name, never null
   */
  @JsonValue
  public String wireName() {
    return wireName;
  }
}
