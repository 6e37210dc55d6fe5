package org.waabox.concordia.member;

import java.util.List;
import java.util.Objects;

import org.waabox.concordia.report.ActionDetail;

/**
 * The space changes made, or planned, for one member.
 *
 * @param adds    the number of space additions
 * @param removes the number of space removals
 * @param errors  the number of failed calls
 * @param details one detail per addition or removal, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ReconcileResult(int adds, int removes, int errors,
    List<ActionDetail> details) {

  /** Copies the details. */
  public ReconcileResult {
    Objects.requireNonNull(details, "details must not be null");
    details = List.copyOf(details);
  }

  /**
   * Tells whether the member was already where they belong.
   *
   * @return true if nothing was added, removed or attempted
   */
  public boolean isUnchanged() {
    return adds == 0 && removes == 0 && errors == 0;
  }
}
