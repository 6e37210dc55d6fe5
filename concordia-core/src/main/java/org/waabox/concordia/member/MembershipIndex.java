package org.waabox.concordia.member;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A point-in-time view of which spaces every target member is in.
 *
 * <p>Keys are normalized emails. Immutable; built once per run by
 * {@link MembershipIndexBuilder}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MembershipIndex {

  /** Normalized email to space ids. */
  private final Map<String, Set<String>> spacesByEmail;

  /**
   * Creates a new index.
   *
   * @param theSpacesByEmail normalized email to space ids, never null
   */
  public MembershipIndex(final Map<String, Set<String>> theSpacesByEmail) {
    Objects.requireNonNull(theSpacesByEmail,
        "spacesByEmail must not be null");
    final Map<String, Set<String>> copy = new HashMap<>();
    theSpacesByEmail.forEach((email, spaces) ->
        copy.put(email, Set.copyOf(spaces)));
    spacesByEmail = Map.copyOf(copy);
  }

  /**
   * Returns the spaces a member is currently in.
   *
   * @param email the email, normalized by this method, may be null
   *
   * @return the space ids, empty when the member is in no space
   */
  public Set<String> spacesOf(final String email) {
    return spacesByEmail.getOrDefault(Emails.normalize(email), Set.of());
  }

  /**
   * Tells whether a member is in at least one space.
   *
   * @param email the email, normalized by this method, may be null
   *
   * @return true if the member was found in a space
   */
  public boolean contains(final String email) {
    return spacesByEmail.containsKey(Emails.normalize(email));
  }

  /**
   * Returns the number of distinct members indexed.
   *
   * @return the member count
   */
  public int size() {
    return spacesByEmail.size();
  }
}
