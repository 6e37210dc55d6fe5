package org.waabox.concordia.target;

import java.util.List;

/**
 * The community platform Concordia writes to.
 *
 * <p>Every method may fail with an unchecked exception; callers isolate
 * failures per operation.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface TargetRegistry {

  /**
   * Lists every space, following all pages.
   *
   * @return the spaces, never null
   */
  List<Space> listSpaces();

  /**
   * Lists one page of the members of a space.
   *
   * @param spaceId the space id, never null
   * @param page    the 1-based page number
   *
   * @return the page, never null
   */
  Page<TargetMember> listSpaceMembers(String spaceId, int page);

  /**
   * Adds a member to a space.
   *
   * @param email   the member email, never null
   * @param spaceId the space id, never null
   */
  void addMemberToSpace(String email, String spaceId);

  /**
   * Removes a member from a space.
   *
   * @param email   the member email, never null
   * @param spaceId the space id, never null
   */
  void removeMemberFromSpace(String email, String spaceId);

  /**
   * Invites a member to the community.
   *
   * <p>Inviting an existing member must be harmless.
   *
   * @param email    the member email, never null
   * @param name     the display name, may be null or blank
   * @param spaceIds the spaces to join, never null
   * @param tags     the member tags, never null
   */
  void inviteMember(String email, String name, List<String> spaceIds,
      List<String> tags);

  /**
   * Lists every community member, following all pages.
   *
   * @return the members, never null
   */
  List<TargetMember> listAllMembers();

  /**
   * Creates an event.
   *
   * @param payload the event, never null
   * @param spaceId the space the event belongs to, never null
   *
   * @return the created event, never null
   */
  CreatedEvent createEvent(EventPayload payload, String spaceId);

  /**
   * Replaces an existing event.
   *
   * @param eventId the target event id, never null
   * @param payload the event, never null
   */
  void updateEvent(String eventId, EventPayload payload);

  /**
   * Deletes an event.
   *
   * @param eventId the target event id, never null
   * @param spaceId the space the event belongs to, never null
   */
  void deleteEvent(String eventId, String spaceId);

  /**
   * Resolves the member that owns the events Concordia creates.
   *
   * @return the owner's member id, never null
   */
  String resolveOwnerIdentity();
}
