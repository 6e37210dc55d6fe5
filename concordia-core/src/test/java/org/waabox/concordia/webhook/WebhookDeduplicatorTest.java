package org.waabox.concordia.webhook;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.waabox.concordia.state.InMemoryStateStore;
import org.waabox.concordia.state.StateCache;

/**
 * Tests for {@link WebhookDeduplicator}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class WebhookDeduplicatorTest {

  private final WebhookDeduplicator deduplicator = new WebhookDeduplicator(
      new StateCache(new InMemoryStateStore()));

  private static WebhookNotification notification(final String id,
      final String body) {
    return new WebhookNotification(id, null,
        body.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void whenResolvingId_givenExplicitId_shouldTrimIt() {
    assertEquals("evt-1", deduplicator.resolveId(notification(" evt-1 ",
        "{}")));
  }

  @Test
  void whenResolvingId_givenNoId_shouldHashThePayload() {
    final String first = deduplicator.resolveId(notification(null, "{\"a\":1}"));
    final String again = deduplicator.resolveId(notification("  ",
        "{\"a\":1}"));
    final String other = deduplicator.resolveId(notification(null,
        "{\"a\":2}"));

    assertEquals(64, first.length());
    assertEquals(first, again);
    assertNotEquals(first, other);
  }

  @Test
  void whenMarkingSeen_shouldRememberTheId() {
    assertFalse(deduplicator.seen("evt-1"));

    deduplicator.markSeen("evt-1", Instant.parse("2026-03-01T10:00:00Z"));

    assertTrue(deduplicator.seen("evt-1"));
  }
}
