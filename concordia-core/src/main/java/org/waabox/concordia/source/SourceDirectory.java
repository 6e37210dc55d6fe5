package org.waabox.concordia.source;

import java.util.List;

/**
 * The membership directory Concordia reads from.
 *
 * <p>Implementations page through the directory and return complete lists.
 * Failures surface as unchecked exceptions.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SourceDirectory {

  /**
   * Lists every individual membership.
   *
   * @return the records, never null
   */
  List<IndividualMembershipRecord> listAllIndividualMembers();

  /**
   * Lists every corporate membership.
   *
   * @return the records, never null
   */
  List<CorporateMembershipRecord> listAllCorporateMemberships();

  /**
   * Lists events.
   *
   * @param publishedOnly only return published events
   * @param futureOnly    only return events that have not ended yet
   *
   * @return the events, never null
   */
  List<SourceEvent> listEvents(boolean publishedOnly, boolean futureOnly);
}
