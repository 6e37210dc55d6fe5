package org.waabox.concordia.member;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.target.Page;
import org.waabox.concordia.target.Space;
import org.waabox.concordia.target.TargetMember;
import org.waabox.concordia.target.TargetRegistry;

/**
 * Builds a {@link MembershipIndex} by listing the members of every space.
 *
 * <p>A space whose listing fails contributes no entries; the failure is
 * logged and the remaining spaces are still indexed. Members of such a
 * space look absent from it for the rest of the run.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MembershipIndexBuilder {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(MembershipIndexBuilder.class);

  /** The registry to list members from, never null. */
  private final TargetRegistry registry;

  /**
   * Creates a new builder.
   *
   * @param theRegistry the registry to list members from, never null
   */
  public MembershipIndexBuilder(final TargetRegistry theRegistry) {
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
  }

  /**
   * Indexes the members of the given spaces.
   *
   * @param spaces the spaces, never null; spaces without an id are ignored
   *
   * @return the index, never null
   */
  public MembershipIndex build(final List<Space> spaces) {
    Objects.requireNonNull(spaces, "spaces must not be null");
    log.info("Building membership index for {} spaces", spaces.size());

    final Map<String, Set<String>> index = new HashMap<>();
    for (final Space space : spaces) {
      final String spaceId = space.id();
      if (spaceId == null || spaceId.isEmpty()) {
        continue;
      }
      try {
        final Map<String, Set<String>> spaceEntries = new HashMap<>();
        indexSpace(spaceId, spaceEntries);
        spaceEntries.forEach((email, ids) ->
            index.computeIfAbsent(email, k -> new HashSet<>()).addAll(ids));
      } catch (final RuntimeException e) {
        log.warn("Failed to list members for space {}: {}", spaceId,
            e.getMessage());
      }
    }
    log.info("Membership index built with {} unique members", index.size());
    return new MembershipIndex(index);
  }

  private void indexSpace(final String spaceId,
      final Map<String, Set<String>> entries) {
    int pageNumber = 1;
    Page<TargetMember> page;
    do {
      page = registry.listSpaceMembers(spaceId, pageNumber);
      for (final TargetMember member : page.records()) {
        final String email = Emails.normalize(member.email());
        if (!email.isEmpty()) {
          entries.computeIfAbsent(email, k -> new HashSet<>()).add(spaceId);
        }
      }
      pageNumber++;
    } while (page.hasMore());
  }
}
