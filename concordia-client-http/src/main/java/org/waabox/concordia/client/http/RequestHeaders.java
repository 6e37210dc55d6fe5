package org.waabox.concordia.client.http;

import java.util.Map;

/**
 * Computes the headers of a request.
 *
 * <p>Invoked once per attempt, so signatures and tokens are fresh on every
 * retry.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RequestHeaders {

  /**
   * Returns the headers for a request.
   *
   * @param method the HTTP method, in upper case
   *
   * @return the headers, never null
   */
  Map<String, String> forMethod(String method);
}
