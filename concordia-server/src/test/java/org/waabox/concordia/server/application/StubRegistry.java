package org.waabox.concordia.server.application;

import java.util.ArrayList;
import java.util.List;

import org.waabox.concordia.ConcordiaException;
import org.waabox.concordia.target.CreatedEvent;
import org.waabox.concordia.target.EventPayload;
import org.waabox.concordia.target.Page;
import org.waabox.concordia.target.Space;
import org.waabox.concordia.target.TargetMember;
import org.waabox.concordia.target.TargetRegistry;

/**
 * A {@link TargetRegistry} with fixed spaces and no members, recording
 * invitations.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class StubRegistry implements TargetRegistry {

  private final List<Space> spaces;

  private final List<String> invited = new ArrayList<>();

  StubRegistry(final Space... theSpaces) {
    spaces = List.of(theSpaces);
  }

  List<String> invited() {
    return invited;
  }

  @Override
  public List<Space> listSpaces() {
    return spaces;
  }

  @Override
  public Page<TargetMember> listSpaceMembers(final String spaceId,
      final int page) {
    return new Page<>(List.of(), false);
  }

  @Override
  public void addMemberToSpace(final String email, final String spaceId) {
  }

  @Override
  public void removeMemberFromSpace(final String email, final String spaceId) {
  }

  @Override
  public void inviteMember(final String email, final String name,
      final List<String> spaceIds, final List<String> tags) {
    invited.add(email);
  }

  @Override
  public List<TargetMember> listAllMembers() {
    return List.of();
  }

  @Override
  public CreatedEvent createEvent(final EventPayload payload,
      final String spaceId) {
    throw new UnsupportedOperationException("events are not used here");
  }

  @Override
  public void updateEvent(final String eventId, final EventPayload payload) {
    throw new UnsupportedOperationException("events are not used here");
  }

  @Override
  public void deleteEvent(final String eventId, final String spaceId) {
    throw new UnsupportedOperationException("events are not used here");
  }

  @Override
  public String resolveOwnerIdentity() {
    throw new ConcordiaException("No event owner configured");
  }
}
