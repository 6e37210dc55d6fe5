package org.waabox.concordia.member;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.state.StateCache;
import org.waabox.concordia.target.TargetMember;
import org.waabox.concordia.target.TargetRegistry;

/**
 * Compares the identity cache with the target registry's member list and
 * optionally seeds the cache with the members it lacks.
 *
 * <p>Cached entries the registry does not know are only reported, never
 * removed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CacheValidator {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CacheValidator.class);

  /** The registry to compare with, never null. */
  private final TargetRegistry target;

  /** The cache to validate, never null. */
  private final StateCache state;

  /**
   * Creates a new validator.
   *
   * @param theTarget the registry to compare with, never null
   * @param theState  the cache to validate, never null
   */
  public CacheValidator(final TargetRegistry theTarget,
      final StateCache theState) {
    target = Objects.requireNonNull(theTarget, "target must not be null");
    state = Objects.requireNonNull(theState, "state must not be null");
  }

  /**
   * Validates the cache.
   *
   * @param repair cache the registry members the cache lacks, then save
   *
   * @return the report, never null
   */
  public CacheValidationReport validate(final boolean repair) {
    log.info("Validating cache against the target registry (repair={})",
        repair);

    final Map<String, String> targetIds = new LinkedHashMap<>();
    try {
      final List<TargetMember> members = target.listAllMembers();
      for (final TargetMember member : members) {
        final String email = Emails.normalize(member.email());
        if (!email.isEmpty()) {
          targetIds.put(email, member.id());
        }
      }
      log.info("Fetched {} members from the target registry",
          targetIds.size());
    } catch (final RuntimeException e) {
      log.error("Failed to fetch target members", e);
      return CacheValidationReport.failed(MemberSync.describe(e));
    }

    final CacheValidationReport report = new CacheValidationReport();
    final Map<String, String> cached = state.memberIds();

    cached.forEach((email, cachedId) -> {
      if (targetIds.containsKey(Emails.normalize(email))) {
        report.countValid();
      } else {
        report.addMissingInTarget(new ValidationIssue(
            ValidationIssue.MISSING_IN_TARGET, email, cachedId, null));
      }
    });

    targetIds.forEach((email, targetId) -> {
      if (cached.containsKey(email)) {
        return;
      }
      report.addMissingInCache(new ValidationIssue(
          ValidationIssue.MISSING_IN_CACHE, email, null, targetId));
      if (repair && targetId != null) {
        state.setMemberId(email, targetId);
        report.countRepaired();
      }
    });

    if (repair && report.repaired() > 0) {
      if (state.save()) {
        log.info("Cache repaired: {} entries added", report.repaired());
      } else {
        log.error("Failed to save repaired cache");
      }
    }

    log.info("Validation complete: {} valid, {} missing in target, {}"
        + " missing in cache, {} repaired", report.valid(),
        report.missingInTarget(), report.missingInCache(),
        report.repaired());
    return report;
  }
}
