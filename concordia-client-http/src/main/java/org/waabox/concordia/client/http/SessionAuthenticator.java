package org.waabox.concordia.client.http;

/**
 * Opens a new session against a registry.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface SessionAuthenticator {

  /**
   * Opens a session.
   *
   * @return the session credentials, never null
   *
   * @throws AuthenticationException if the registry rejects the request
   */
  Credentials authenticate();
}
