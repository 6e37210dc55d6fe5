package org.waabox.concordia.client.http.glueup;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.waabox.concordia.client.http.AuthenticationException;
import org.waabox.concordia.client.http.Credentials;
import org.waabox.concordia.client.http.SessionAuthenticator;

/**
 * Tests for {@link GlueUpCredentialProvider}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class GlueUpCredentialProviderTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void whenCalledConcurrently_givenNoSession_shouldAuthenticateOnce()
      throws Exception {
    final AtomicInteger logins = new AtomicInteger();
    final GlueUpCredentialProvider provider = new GlueUpCredentialProvider(
        () -> {
          logins.incrementAndGet();
          try {
            Thread.sleep(50);
          } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return new Credentials("tok", NOW.plusSeconds(3600));
        }, Clock.fixed(NOW, ZoneOffset.UTC));

    final int threads = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<Credentials>> results = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        results.add(executor.submit(() -> {
          start.await();
          return provider.currentCredentials();
        }));
      }
      start.countDown();
      for (final Future<Credentials> result : results) {
        assertEquals("tok", result.get(5, TimeUnit.SECONDS).token());
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, logins.get());
  }

  @Test
  void whenSessionIsAboutToExpire_shouldRenewIt() {
    final SessionAuthenticator authenticator =
        createMock(SessionAuthenticator.class);
    expect(authenticator.authenticate())
        .andReturn(new Credentials("tok-1", NOW.plusSeconds(30)));
    expect(authenticator.authenticate())
        .andReturn(new Credentials("tok-2", NOW.plusSeconds(3600)));
    replay(authenticator);

    final GlueUpCredentialProvider provider = new GlueUpCredentialProvider(
        authenticator, Clock.fixed(NOW, ZoneOffset.UTC));

    assertEquals("tok-1", provider.currentCredentials().token());
    assertEquals("tok-2", provider.currentCredentials().token());
    assertEquals("tok-2", provider.currentCredentials().token());
    verify(authenticator);
  }

  @Test
  void whenSessionIsFresh_shouldReuseIt() {
    final SessionAuthenticator authenticator =
        createMock(SessionAuthenticator.class);
    expect(authenticator.authenticate())
        .andReturn(new Credentials("tok", NOW.plusSeconds(3600))).once();
    replay(authenticator);

    final GlueUpCredentialProvider provider = new GlueUpCredentialProvider(
        authenticator, Clock.fixed(NOW, ZoneOffset.UTC));

    assertSame(provider.currentCredentials(), provider.currentCredentials());
    verify(authenticator);
  }

  @Test
  void whenLoginIsRejected_shouldPropagateAndRetryOnNextCall() {
    final SessionAuthenticator authenticator =
        createMock(SessionAuthenticator.class);
    expect(authenticator.authenticate())
        .andThrow(new AuthenticationException("rejected", 401, "{}"));
    expect(authenticator.authenticate())
        .andReturn(new Credentials("tok", NOW.plusSeconds(3600)));
    replay(authenticator);

    final GlueUpCredentialProvider provider = new GlueUpCredentialProvider(
        authenticator, Clock.fixed(NOW, ZoneOffset.UTC));

    assertThrows(AuthenticationException.class,
        provider::currentCredentials);
    assertEquals("tok", provider.currentCredentials().token());
    verify(authenticator);
  }
}
