package org.waabox.concordia;

/**
 * Raised when a run cannot start because Concordia is misconfigured.
 *
 * <p>Typical causes are a missing default event space, an owner that can
 * not be resolved in the target registry, or a facade built without a
 * source directory. It is thrown before any side effect takes place.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConcordiaException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ConcordiaException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ConcordiaException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
