package org.waabox.concordia.member;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.report.ActionDetail;
import org.waabox.concordia.report.SyncAction;
import org.waabox.concordia.report.SyncReport;
import org.waabox.concordia.source.SourceDirectory;
import org.waabox.concordia.state.StateCache;
import org.waabox.concordia.target.Space;
import org.waabox.concordia.target.TargetRegistry;

/**
 * Converges target space memberships toward the directory.
 *
 * <p>A run lists the target spaces, builds the {@link MembershipIndex} once,
 * reads and normalizes the directory, and then handles each distinct member
 * in turn:
 * <ol>
 *   <li>Resolves the member's identity from the {@link StateCache}. A
 *       member missing from the cache but present in the index is cached
 *       as {@link StateCache#KNOWN}.</li>
 *   <li>Invites members with no identity, caches them as
 *       {@link StateCache#PENDING} and saves the cache right away.</li>
 *   <li>Reconciles the member's spaces through the
 *       {@link SpaceReconciler}.</li>
 * </ol>
 *
 * <p>Failures of a single invite or space change are counted and the run
 * goes on. Failures to list spaces or read the directory abort the run.
 * A save failure is logged and never aborts the run.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MemberSync {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(MemberSync.class);

  /** The directory to read members from, never null. */
  private final SourceDirectory source;

  /** The registry to write to, never null. */
  private final TargetRegistry target;

  /** The identity cache, never null. */
  private final StateCache state;

  /** Plan to spaces, never null. */
  private final SpaceMapping mapping;

  /** Normalizes directory records, never null. */
  private final MemberNormalizer normalizer;

  /** Builds the per-run index, never null. */
  private final MembershipIndexBuilder indexBuilder;

  /** Applies space changes, never null. */
  private final SpaceReconciler reconciler;

  /**
   * Creates a new member sync.
   *
   * @param theSource  the directory, never null
   * @param theTarget  the registry, never null
   * @param theState   the state cache, never null
   * @param theMapping plan to spaces, never null
   */
  public MemberSync(final SourceDirectory theSource,
      final TargetRegistry theTarget, final StateCache theState,
      final SpaceMapping theMapping) {
    source = Objects.requireNonNull(theSource, "source must not be null");
    target = Objects.requireNonNull(theTarget, "target must not be null");
    state = Objects.requireNonNull(theState, "state must not be null");
    mapping = Objects.requireNonNull(theMapping, "mapping must not be null");
    normalizer = new MemberNormalizer();
    indexBuilder = new MembershipIndexBuilder(theTarget);
    reconciler = new SpaceReconciler(theTarget);
  }

  /**
   * Runs a member sync.
   *
   * @param dryRun only plan invites and space changes
   *
   * @return the report, never null
   */
  public SyncReport run(final boolean dryRun) {
    log.info("Starting member sync (dryRun={})", dryRun);

    final MembershipIndex index;
    final List<Member> members;
    try {
      final List<Space> spaces = target.listSpaces();
      index = indexBuilder.build(spaces);
      members = normalizer.normalize(source.listAllIndividualMembers(),
          source.listAllCorporateMemberships());
    } catch (final RuntimeException e) {
      log.error("Member sync could not start", e);
      return SyncReport.aborted(describe(e));
    }

    final SyncReport report = new SyncReport();
    final Set<String> seen = new HashSet<>();

    for (final Member member : members) {
      report.countMemberType(member.kind().wireName());
      if (!seen.add(member.email())) {
        report.incrementDuplicatesSkipped();
        log.debug("Skipping duplicate email in batch: {}", member.email());
        continue;
      }
      syncMember(member, index, dryRun, report);
    }

    if (!state.save()) {
      log.error("Final state save failed; some changes may not be"
          + " persisted");
    }
    log.info("Member sync complete: {}", report);
    return report;
  }

  private void syncMember(final Member member, final MembershipIndex index,
      final boolean dryRun, final SyncReport report) {
    final String email = member.email();
    final List<String> desired = mapping.decideSpaces(member.planSlug());

    Optional<String> identity = state.memberId(email);
    if (identity.isPresent()) {
      report.incrementCacheHits();
    } else if (index.contains(email)) {
      log.info("Found {} in a space but not in cache, caching it", email);
      state.setMemberId(email, StateCache.KNOWN);
      identity = Optional.of(StateCache.KNOWN);
      report.incrementCacheHits();
    } else {
      report.incrementCacheMisses();
    }

    if (identity.isEmpty()) {
      invite(member, desired, index, dryRun, report);
      return;
    }

    final ReconcileResult result = reconciler.reconcile(email, desired, index,
        dryRun);
    apply(result, report);
    if (result.isUnchanged()) {
      report.incrementSkipped();
    }
  }

  private void invite(final Member member, final List<String> desired,
      final MembershipIndex index, final boolean dryRun,
      final SyncReport report) {
    final String email = member.email();
    final Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("name", member.displayName());
    attributes.put("membership_type", member.planSlug());
    attributes.put("member_type", member.kind().wireName());
    attributes.put("spaces", desired);
    if (member.corporateName() != null) {
      attributes.put("corporate_name", member.corporateName());
    }

    if (dryRun) {
      report.incrementInvited();
      report.addDetail(ActionDetail.dryRun(SyncAction.INVITE_MEMBER, email,
          null, attributes));
      apply(reconciler.reconcile(email, desired, index, true), report);
      return;
    }

    try {
      target.inviteMember(email, member.displayName(), desired, List.of());
    } catch (final RuntimeException e) {
      log.error("Failed to invite {}", email, e);
      report.incrementErrors();
      report.addDetail(ActionDetail.failure(SyncAction.INVITE_MEMBER, email,
          null, e, attributes));
      return;
    }
    report.incrementInvited();
    report.addDetail(ActionDetail.success(SyncAction.INVITE_MEMBER, email,
        null, attributes));

    state.setMemberId(email, StateCache.PENDING);
    if (!state.save()) {
      log.warn("State save failed after inviting {}; continuing sync", email);
    }
    apply(reconciler.reconcile(email, desired, index, false), report);
  }

  private static void apply(final ReconcileResult result,
      final SyncReport report) {
    report.addSpaceAdds(result.adds());
    report.addSpaceRemoves(result.removes());
    report.addErrors(result.errors());
    report.addDetails(result.details());
  }

  static String describe(final Throwable e) {
    return e.getMessage() != null ? e.getMessage()
        : e.getClass().getSimpleName();
  }
}
