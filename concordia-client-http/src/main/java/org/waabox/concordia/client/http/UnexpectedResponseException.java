package org.waabox.concordia.client.http;

/**
 * Raised when a successful response does not have the expected shape, for
 * example when the envelope field holding the records is missing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class UnexpectedResponseException extends RegistryException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message what was expected
   * @param theBody the response body, may be null
   */
  public UnexpectedResponseException(final String message,
      final String theBody) {
    super(message, NO_STATUS, theBody);
  }
}
