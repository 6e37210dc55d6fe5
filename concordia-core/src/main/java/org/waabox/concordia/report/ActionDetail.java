package org.waabox.concordia.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One operation of a run, planned or performed.
 *
 * @param action     what was done, never null
 * @param subject    who or what it was done for: a member email or a
 *                   source event id, never null
 * @param target     the space or target event involved, may be null
 * @param outcome    how it ended, never null
 * @param error      the failure message, null unless the outcome is
 *                   {@link Outcome#ERROR}
 * @param attributes extra facts worth reporting, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ActionDetail(
    SyncAction action,
    String subject,
    String target,
    Outcome outcome,
    String error,
    Map<String, Object> attributes
) {

  /** Validates and copies. Attributes keep their insertion order. */
  public ActionDetail {
    Objects.requireNonNull(action, "action must not be null");
    Objects.requireNonNull(subject, "subject must not be null");
    Objects.requireNonNull(outcome, "outcome must not be null");
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /**
   * Creates a detail for a planned operation.
   *
   * @param action     the action, never null
   * @param subject    the subject, never null
   * @param target     the target, may be null
   * @param attributes extra facts, may be null
   *
   * @return the detail, never null
   */
  public static ActionDetail dryRun(final SyncAction action,
      final String subject, final String target,
      final Map<String, Object> attributes) {
    return new ActionDetail(action, subject, target, Outcome.DRY_RUN, null,
        attributes);
  }

  /**
   * Creates a detail for a performed operation.
   *
   * @param action     the action, never null
   * @param subject    the subject, never null
   * @param target     the target, may be null
   * @param attributes extra facts, may be null
   *
   * @return the detail, never null
   */
  public static ActionDetail success(final SyncAction action,
      final String subject, final String target,
      final Map<String, Object> attributes) {
    return new ActionDetail(action, subject, target, Outcome.SUCCESS, null,
        attributes);
  }

  /**
   * Creates a detail for a failed operation.
   *
   * @param action     the action, never null
   * @param subject    the subject, never null
   * @param target     the target, may be null
   * @param cause      the failure, never null
   * @param attributes extra facts, may be null
   *
   * @return the detail, never null
   */
  public static ActionDetail failure(final SyncAction action,
      final String subject, final String target, final Throwable cause,
      final Map<String, Object> attributes) {
    Objects.requireNonNull(cause, "cause must not be null");
    final String message = cause.getMessage() != null
        ? cause.getMessage() : cause.getClass().getSimpleName();
    return new ActionDetail(action, subject, target, Outcome.ERROR, message,
        attributes);
  }
}
