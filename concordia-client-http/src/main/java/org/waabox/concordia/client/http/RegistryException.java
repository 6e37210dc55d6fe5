package org.waabox.concordia.client.http;

/**
 * Raised when a remote registry call fails.
 *
 * <p>Carries the HTTP status and body when the server answered with an
 * error status. Failures that never got a response have a status of
 * {@link #NO_STATUS}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RegistryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The status of a failure without an HTTP response. */
  public static final int NO_STATUS = -1;

  /** The HTTP status, or NO_STATUS. */
  private final int status;

  /** The response body, may be null. */
  private final String body;

  /**
   * Creates an exception for an error response.
   *
   * @param theStatus the HTTP status
   * @param theBody   the response body, may be null
   */
  public RegistryException(final int theStatus, final String theBody) {
    super("HTTP " + theStatus + ": " + theBody);
    status = theStatus;
    body = theBody;
  }

  /**
   * Creates an exception for a failure without an error response.
   *
   * @param message the detail message
   * @param cause   the cause, may be null
   */
  public RegistryException(final String message, final Throwable cause) {
    super(message, cause);
    status = NO_STATUS;
    body = null;
  }

  /**
   * Creates an exception with a status and a custom message.
   *
   * @param message   the detail message
   * @param theStatus the HTTP status, or NO_STATUS
   * @param theBody   the response body, may be null
   */
  protected RegistryException(final String message, final int theStatus,
      final String theBody) {
    super(message);
    status = theStatus;
    body = theBody;
  }

  /**
   * Returns the HTTP status.
   *
   * @return the status, or {@link #NO_STATUS}
   */
  public int status() {
    return status;
  }

  /**
   * Returns the response body.
   *
   * @return the body, may be null
   */
  public String body() {
    return body;
  }
}
