package org.waabox.concordia.member;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.report.ActionDetail;
import org.waabox.concordia.report.SyncAction;
import org.waabox.concordia.target.TargetRegistry;

/**
 * Moves a member from the spaces they are in to the spaces they should be
 * in, with the fewest calls.
 *
 * <p>The current spaces come from the {@link MembershipIndex}; additions
 * and removals are each applied in ascending space id order. A failed call
 * is recorded as an error detail and does not stop the remaining ones.
 *
 * <p>The index is not updated, so reconciling twice against the same index
 * repeats the same calls. Against a fresh index the second pass is empty.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SpaceReconciler {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SpaceReconciler.class);

  /** The registry to apply changes to, never null. */
  private final TargetRegistry registry;

  /**
   * Creates a new reconciler.
   *
   * @param theRegistry the registry to apply changes to, never null
   */
  public SpaceReconciler(final TargetRegistry theRegistry) {
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
  }

  /**
   * Reconciles the spaces of one member.
   *
   * @param email   the member email, never null
   * @param desired the spaces the member should be in, never null
   * @param index   the current memberships, never null
   * @param dryRun  only plan the changes
   *
   * @return what was done or planned, never null
   */
  public ReconcileResult reconcile(final String email,
      final Collection<String> desired, final MembershipIndex index,
      final boolean dryRun) {
    Objects.requireNonNull(email, "email must not be null");
    Objects.requireNonNull(desired, "desired must not be null");
    Objects.requireNonNull(index, "index must not be null");

    final Set<String> current = index.spacesOf(email);

    final Set<String> toAdd = new TreeSet<>(desired);
    toAdd.removeAll(current);
    final Set<String> toRemove = new TreeSet<>(current);
    toRemove.removeAll(desired);

    int adds = 0;
    int removes = 0;
    int errors = 0;
    final List<ActionDetail> details = new ArrayList<>();

    for (final String spaceId : toAdd) {
      if (dryRun) {
        adds++;
        details.add(ActionDetail.dryRun(SyncAction.ADD_TO_SPACE, email,
            spaceId, null));
        continue;
      }
      try {
        registry.addMemberToSpace(email, spaceId);
        adds++;
        details.add(ActionDetail.success(SyncAction.ADD_TO_SPACE, email,
            spaceId, null));
      } catch (final RuntimeException e) {
        log.error("Failed to add {} to space {}", email, spaceId, e);
        errors++;
        details.add(ActionDetail.failure(SyncAction.ADD_TO_SPACE, email,
            spaceId, e, null));
      }
    }

    for (final String spaceId : toRemove) {
      if (dryRun) {
        removes++;
        details.add(ActionDetail.dryRun(SyncAction.REMOVE_FROM_SPACE, email,
            spaceId, null));
        continue;
      }
      try {
        registry.removeMemberFromSpace(email, spaceId);
        removes++;
        details.add(ActionDetail.success(SyncAction.REMOVE_FROM_SPACE, email,
            spaceId, null));
      } catch (final RuntimeException e) {
        log.error("Failed to remove {} from space {}", email, spaceId, e);
        errors++;
        details.add(ActionDetail.failure(SyncAction.REMOVE_FROM_SPACE, email,
            spaceId, e, null));
      }
    }

    return new ReconcileResult(adds, removes, errors, details);
  }
}
