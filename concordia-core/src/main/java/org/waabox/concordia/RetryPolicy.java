package org.waabox.concordia;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how remote registry calls are retried.
 *
 * <p>The wait before retry {@code n} (1-based) is the initial backoff
 * doubled {@code n - 1} times and capped at the maximum backoff. A policy
 * created through {@link #of(int, Duration)} keeps the same wait between
 * every attempt.
 *
 * <p>The default policy makes 5 attempts, waiting 1 second after the first
 * failure and never more than 20 seconds.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of attempts. */
  private static final int DEFAULT_MAX_ATTEMPTS = 5;

  /** The default wait after the first failure. */
  private static final Duration DEFAULT_INITIAL_BACKOFF =
      Duration.ofSeconds(1);

  /** The default upper bound for a single wait. */
  private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(20);

  /** The total number of attempts, including the first one. */
  private final int maxAttempts;

  /** The wait after the first failed attempt. */
  private final Duration initialBackoff;

  /** The upper bound for a single wait. */
  private final Duration maxBackoff;

  /**
   * Creates a new retry policy.
   *
   * @param maxAttempts    the total number of attempts, greater than zero
   * @param initialBackoff the wait after the first failure, never null
   * @param maxBackoff     the upper bound for a wait, never null
   */
  private RetryPolicy(final int maxAttempts, final Duration initialBackoff,
      final Duration maxBackoff) {
    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
  }

  /**
   * Creates a retry policy with a fixed wait between attempts.
   *
   * @param maxAttempts the total number of attempts, must be greater
   *                    than zero
   * @param backoff     the wait between attempts, never null
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxAttempts is less than or equal
   *                                  to zero
   * @throws NullPointerException if backoff is null
   */
  public static RetryPolicy of(final int maxAttempts, final Duration backoff) {
    return exponential(maxAttempts, backoff, backoff);
  }

  /**
   * Creates a retry policy whose wait doubles after every failure.
   *
   * @param maxAttempts    the total number of attempts, must be greater
   *                       than zero
   * @param initialBackoff the wait after the first failure, never null
   * @param maxBackoff     the upper bound for a single wait, never null
   *                       and not shorter than initialBackoff
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxAttempts is not positive,
   *                                  initialBackoff is negative or
   *                                  maxBackoff is shorter than it
   */
  public static RetryPolicy exponential(final int maxAttempts,
      final Duration initialBackoff, final Duration maxBackoff) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
    Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    if (initialBackoff.isNegative()) {
      throw new IllegalArgumentException(
          "initialBackoff must not be negative, got: " + initialBackoff);
    }
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException(
          "maxBackoff must not be shorter than initialBackoff");
    }
    return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff);
  }

  /**
   * Creates the default policy: 5 attempts, 1 second initial wait doubled
   * up to 20 seconds.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF,
        DEFAULT_MAX_BACKOFF);
  }

  /**
   * Returns the total number of attempts.
   *
   * @return the number of attempts, always greater than zero
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the wait after the first failed attempt.
   *
   * @return the initial backoff, never null
   */
  public Duration initialBackoff() {
    return initialBackoff;
  }

  /**
   * Returns the upper bound for a single wait.
   *
   * @return the maximum backoff, never null
   */
  public Duration maxBackoff() {
    return maxBackoff;
  }

  /**
   * Computes the wait that follows the given failed attempt.
   *
   * @param failedAttempt the 1-based number of the attempt that failed
   *
   * @return the wait before the next attempt, never null
   *
   * @throws IllegalArgumentException if failedAttempt is not positive
   */
  public Duration backoffAfter(final int failedAttempt) {
    if (failedAttempt <= 0) {
      throw new IllegalArgumentException(
          "failedAttempt must be greater than 0, got: " + failedAttempt);
    }
    Duration wait = initialBackoff;
    for (int i = 1; i < failedAttempt; i++) {
      wait = wait.multipliedBy(2);
      if (wait.compareTo(maxBackoff) >= 0) {
        return maxBackoff;
      }
    }
    return wait.compareTo(maxBackoff) > 0 ? maxBackoff : wait;
  }
}
