package org.waabox.concordia.client.http.glueup;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.client.http.CredentialProvider;
import org.waabox.concordia.client.http.Credentials;
import org.waabox.concordia.client.http.SessionAuthenticator;

/**
 * Caches a Glue Up session and renews it shortly before it expires.
 *
 * <p>Valid credentials are returned without locking. When they are missing
 * or about to expire, one thread takes the lock, checks again and opens a
 * new session; threads waiting on the lock then reuse it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GlueUpCredentialProvider implements CredentialProvider {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(GlueUpCredentialProvider.class);

  /** How long before the expiry a session is renewed. */
  public static final Duration REFRESH_MARGIN = Duration.ofSeconds(60);

  private final SessionAuthenticator authenticator;
  private final Clock clock;
  private final ReentrantLock refreshLock = new ReentrantLock();

  /** The current session, null until the first authentication. */
  private volatile Credentials current;

  /**
   * Creates a new provider.
   *
   * @param theAuthenticator opens sessions, never null
   * @param theClock         the clock, never null
   */
  public GlueUpCredentialProvider(final SessionAuthenticator theAuthenticator,
      final Clock theClock) {
    authenticator = Objects.requireNonNull(theAuthenticator,
        "authenticator must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  @Override
  public Credentials currentCredentials() {
    final Credentials cached = current;
    if (cached != null && cached.isUsableAt(clock.instant(), REFRESH_MARGIN)) {
      return cached;
    }
    refreshLock.lock();
    try {
      final Credentials again = current;
      if (again != null && again.isUsableAt(clock.instant(), REFRESH_MARGIN)) {
        log.debug("Session renewed by another thread");
        return again;
      }
      log.info("Session missing or about to expire, authenticating");
      final Credentials fresh = authenticator.authenticate();
      current = fresh;
      return fresh;
    } finally {
      refreshLock.unlock();
    }
  }
}
