package org.waabox.concordia.client.http;

/**
 * Supplies the credentials to send with each request.
 *
 * <p>Implementations must be thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CredentialProvider {

  /**
   * Returns credentials that are valid now, opening a session if needed.
   *
   * @return the credentials, never null
   *
   * @throws AuthenticationException if a session can not be opened
   */
  Credentials currentCredentials();
}
