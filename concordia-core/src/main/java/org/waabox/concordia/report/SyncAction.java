package org.waabox.concordia.report;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The kinds of operation a run performs against the target registry.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SyncAction {

  INVITE_MEMBER("invite_member"),
  ADD_TO_SPACE("add_to_space"),
  REMOVE_FROM_SPACE("remove_from_space"),
  CREATE_EVENT("create_event"),
  UPDATE_EVENT("update_event"),
  DELETE_EVENT("delete_event");

  /** The wire name. */
  private final String wireName;

  SyncAction(final String theWireName) {
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
