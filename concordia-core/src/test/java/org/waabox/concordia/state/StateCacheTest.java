package org.waabox.concordia.state;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link StateCache}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class StateCacheTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void whenLoading_givenEmptyStore_shouldStartWithEmptySections() {
    final StateCache cache = new StateCache(new InMemoryStateStore());

    cache.load();

    assertEquals(new CacheStats(0, 0, 0, 0), cache.stats());
  }

  @Test
  void whenLoading_givenCorruptDocument_shouldStartEmpty() {
    final InMemoryStateStore store = new InMemoryStateStore();
    store.write("{ not json".getBytes(StandardCharsets.UTF_8));

    final StateCache cache = new StateCache(store);
    cache.load();

    assertEquals(new CacheStats(0, 0, 0, 0), cache.stats());
  }

  @Test
  void whenLoading_givenStoreThatFails_shouldStartEmpty() {
    final StateStore store = createMock(StateStore.class);
    expect(store.read()).andThrow(new IllegalStateException("disk gone"));
    replay(store);

    final StateCache cache = new StateCache(store);
    cache.load();

    assertEquals(new CacheStats(0, 0, 0, 0), cache.stats());
    verify(store);
  }

  @Test
  void whenLoading_givenDocumentWithMissingSections_shouldDefaultThem() {
    final InMemoryStateStore store = new InMemoryStateStore();
    store.write("{\"email_to_member_id\": {\"a@x.com\": \"42\"}}"
        .getBytes(StandardCharsets.UTF_8));

    final StateCache cache = new StateCache(store);
    cache.load();

    assertEquals(Optional.of("42"), cache.memberId("a@x.com"));
    assertEquals(new CacheStats(1, 0, 0, 0), cache.stats());
    assertTrue(cache.eventMappings().isEmpty());
  }

  @Test
  void whenLoading_givenLegacyFloatTimestamps_shouldReadThem() {
    final InMemoryStateStore store = new InMemoryStateStore();
    store.write(("{\"events\": {\"7\": {\"circle_event_id\": \"c7\","
        + " \"slug\": \"launch-7\", \"last_sync\": 1700000000.5,"
        + " \"checksum\": \"abc\"}}, \"webhook_events\": {\"w1\":"
        + " {\"processed_at\": 1700000001.25, \"timestamp\": 1700000000}}}")
        .getBytes(StandardCharsets.UTF_8));

    final StateCache cache = new StateCache(store);
    cache.load();

    final EventMapping mapping = cache.eventMapping("7").orElseThrow();
    assertEquals("c7", mapping.targetEventId());
    assertEquals(Instant.ofEpochSecond(1700000000L, 500_000_000L),
        mapping.lastSync());
    assertTrue(cache.hasProcessedWebhook("w1"));
  }

  @Test
  void whenSavingAndLoading_givenAllSections_shouldRestoreThem() {
    final InMemoryStateStore store = new InMemoryStateStore();
    final StateCache cache = new StateCache(store, fixedClock());

    cache.setMemberId("a@x.com", "m-1");
    cache.setMemberId("b@x.com", StateCache.PENDING);
    cache.setMemberSpaces("m-1", List.of("s1", "s2"));
    cache.putEventMapping("42", new EventMapping("c-42", "launch-42", NOW,
        "sum"));
    cache.markWebhookProcessed("hook-1", null);

    assertTrue(cache.save());

    final StateCache reloaded = new StateCache(store);
    reloaded.load();

    assertEquals(Optional.of("m-1"), reloaded.memberId("a@x.com"));
    assertEquals(Optional.of(StateCache.PENDING),
        reloaded.memberId("b@x.com"));
    assertEquals(List.of("s1", "s2"), reloaded.memberSpaces("m-1"));
    assertEquals(new EventMapping("c-42", "launch-42", NOW, "sum"),
        reloaded.eventMapping("42").orElseThrow());
    assertTrue(reloaded.hasProcessedWebhook("hook-1"));
    assertEquals(new CacheStats(2, 1, 1, 1), reloaded.stats());
  }

  @Test
  void whenSaving_givenDocument_shouldWriteSortedSnakeCaseSections() {
    final InMemoryStateStore store = new InMemoryStateStore();
    final StateCache cache = new StateCache(store, fixedClock());
    cache.setMemberId("z@x.com", "1");
    cache.setMemberId("a@x.com", "2");
    cache.save();

    final String json = new String(store.read().orElseThrow(),
        StandardCharsets.UTF_8);

    assertTrue(json.indexOf("\"email_to_member_id\"")
        < json.indexOf("\"events\""));
    assertTrue(json.indexOf("\"events\"")
        < json.indexOf("\"member_spaces\""));
    assertTrue(json.indexOf("\"member_spaces\"")
        < json.indexOf("\"webhook_events\""));
    assertTrue(json.indexOf("a@x.com") < json.indexOf("z@x.com"));
    assertTrue(json.contains("\n"), "document should be pretty printed");
  }

  @Test
  void whenSaving_givenStoreThatFails_shouldReturnFalse() {
    final StateStore store = createMock(StateStore.class);
    store.write(anyObject(byte[].class));
    expectLastCall().andThrow(new IllegalStateException("read only"));
    replay(store);

    final StateCache cache = new StateCache(store);

    assertFalse(cache.save());
    verify(store);
  }

  @Test
  void whenMarkingWebhooks_givenMoreThanCap_shouldEvictOldestProcessed() {
    final MutableClock clock = new MutableClock(NOW);
    final StateCache cache = new StateCache(new InMemoryStateStore(), clock);

    for (int i = 0; i <= StateCache.MAX_WEBHOOK_RECORDS; i++) {
      clock.advanceSeconds(1);
      cache.markWebhookProcessed("hook-" + i, null);
    }

    assertEquals(StateCache.MAX_WEBHOOK_RECORDS, cache.stats().webhooks());
    assertFalse(cache.hasProcessedWebhook("hook-0"));
    assertTrue(cache.hasProcessedWebhook("hook-1"));
    assertTrue(cache.hasProcessedWebhook(
        "hook-" + StateCache.MAX_WEBHOOK_RECORDS));
  }

  @Test
  void whenMarkingWebhook_givenNoTimestamp_shouldUseProcessingTime() {
    final InMemoryStateStore store = new InMemoryStateStore();
    final StateCache cache = new StateCache(store, fixedClock());

    cache.markWebhookProcessed("hook", null);
    cache.save();

    final String json = new String(store.read().orElseThrow(),
        StandardCharsets.UTF_8);
    assertTrue(json.contains("\"processed_at\""));
    assertTrue(json.contains("\"timestamp\""));
  }

  @Test
  void whenRemovingEventMapping_shouldForgetIt() {
    final StateCache cache = new StateCache(new InMemoryStateStore());
    cache.putEventMapping("1", new EventMapping("c", "s", NOW, "x"));

    cache.removeEventMapping("1");

    assertTrue(cache.eventMapping("1").isEmpty());
  }

  private static Clock fixedClock() {
    return Clock.fixed(NOW, ZoneOffset.UTC);
  }

  /** A clock that only moves when told to. */
  static final class MutableClock extends Clock {

    private Instant current;

    MutableClock(final Instant start) {
      current = start;
    }

    void advanceSeconds(final long seconds) {
      current = current.plusSeconds(seconds);
    }

    @Override
    public java.time.ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final java.time.ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return current;
    }
  }
}
