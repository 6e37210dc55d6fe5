package org.waabox.concordia;

import java.util.ArrayList;
import java.util.List;

import org.waabox.concordia.source.Contact;
import org.waabox.concordia.source.CorporateMembershipRecord;
import org.waabox.concordia.source.EmailAddress;
import org.waabox.concordia.source.IndividualMembershipRecord;
import org.waabox.concordia.source.Membership;
import org.waabox.concordia.source.MembershipType;
import org.waabox.concordia.source.SourceDirectory;
import org.waabox.concordia.source.SourceEvent;

/**
 * An in-memory {@link SourceDirectory}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FakeSourceDirectory implements SourceDirectory {

  private final List<IndividualMembershipRecord> individuals =
      new ArrayList<>();

  private final List<CorporateMembershipRecord> corporates =
      new ArrayList<>();

  private final List<SourceEvent> events = new ArrayList<>();

  private RuntimeException failure;

  public FakeSourceDirectory individual(final String email,
      final String plan) {
    individuals.add(individualRecord(email, plan));
    return this;
  }

  public FakeSourceDirectory corporate(final CorporateMembershipRecord record) {
    corporates.add(record);
    return this;
  }

  public FakeSourceDirectory event(final SourceEvent event) {
    events.add(event);
    return this;
  }

  public List<SourceEvent> events() {
    return events;
  }

  public FakeSourceDirectory failWith(final RuntimeException e) {
    failure = e;
    return this;
  }

  public static IndividualMembershipRecord individualRecord(
      final String email, final String plan) {
    return new IndividualMembershipRecord(
        new Membership(null, "active", new MembershipType(plan, null)),
        contact(email, "Ana", "Lopez"));
  }

  public static Contact contact(final String email, final String given,
      final String family) {
    return new Contact(new EmailAddress(email), given, family);
  }

  @Override
  public List<IndividualMembershipRecord> listAllIndividualMembers() {
    if (failure != null) {
      throw failure;
    }
    return List.copyOf(individuals);
  }

  @Override
  public List<CorporateMembershipRecord> listAllCorporateMemberships() {
    return List.copyOf(corporates);
  }

  @Override
  public List<SourceEvent> listEvents(final boolean publishedOnly,
      final boolean futureOnly) {
    if (failure != null) {
      throw failure;
    }
    return List.copyOf(events);
  }
}
