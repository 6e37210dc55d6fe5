package org.waabox.concordia.client.http;

/**
 * Raised when a session can not be opened against a registry.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class AuthenticationException extends RegistryException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception for a rejected authentication.
   *
   * @param message   the detail message
   * @param theStatus the HTTP status, or NO_STATUS
   * @param theBody   the response body, may be null
   */
  public AuthenticationException(final String message, final int theStatus,
      final String theBody) {
    super(message, theStatus, theBody);
  }

  /**
   * Creates an exception for an authentication that failed to complete.
   *
   * @param message the detail message
   * @param cause   the cause
   */
  public AuthenticationException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
