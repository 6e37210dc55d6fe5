package org.waabox.concordia.state;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The reconciliation state shared by member sync, event sync and webhook
 * handling.
 *
 * <p>Holds four sections: the member identity cache (normalized email to a
 * target marker), the member spaces cache, the event mapping table and the
 * webhook ledger. The whole document is read from the {@link StateStore}
 * by {@link #load()} and written back by {@link #save()}.
 *
 * <p>Neither operation fails the caller. A missing or unreadable document
 * loads as the empty shape and a failed write makes {@link #save()} return
 * false; both are logged.
 *
 * <p>The webhook ledger keeps at most {@link #MAX_WEBHOOK_RECORDS} entries;
 * the entries with the oldest processing time are evicted first.
 *
 * <p>All methods are synchronized on this instance.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StateCache {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(StateCache.class);

  /** The maximum number of webhook ledger entries kept. */
  public static final int MAX_WEBHOOK_RECORDS = 1000;

  /** Identity marker for a member invited during a run. */
  public static final String PENDING = "pending";

  /** Identity marker for a member found in a space but not id-resolved. */
  public static final String KNOWN = "known";

  /** The backing store, never null. */
  private final StateStore store;

  /** The document codec, never null. */
  private final StateCodec codec;

  /** The clock for ledger processing times, never null. */
  private final Clock clock;

  /** The current document, never null. */
  private StateDocument document;

  /**
   * Creates a new state cache with an empty document.
   *
   * @param theStore the backing store, never null
   * @param theClock the clock for ledger processing times, never null
   */
  public StateCache(final StateStore theStore, final Clock theClock) {
    store = Objects.requireNonNull(theStore, "store must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    codec = new StateCodec();
    document = new StateDocument();
  }

  /**
   * Creates a new state cache using the system UTC clock.
   *
   * @param theStore the backing store, never null
   */
  public StateCache(final StateStore theStore) {
    this(theStore, Clock.systemUTC());
  }

  /**
   * Replaces the in-memory state with the stored document.
   *
   * <p>Loading an unchanged store twice yields the same state. When the
   * store has no document, or the document can not be read, the state is
   * reset to the empty shape.
   */
  public synchronized void load() {
    final Optional<byte[]> stored;
    try {
      stored = store.read();
    } catch (final RuntimeException e) {
      log.warn("Could not read state, starting empty: {}", e.getMessage());
      document = new StateDocument();
      return;
    }
    if (stored.isEmpty()) {
      log.info("No stored state found, starting empty");
      document = new StateDocument();
      return;
    }
    try {
      document = codec.decode(stored.get());
      log.info("Loaded state: {}", stats());
    } catch (final RuntimeException e) {
      log.warn("Stored state is corrupt, starting empty: {}",
          e.getMessage());
      document = new StateDocument();
    }
  }

  /**
   * Writes the full state to the store.
   *
   * @return true if the state was written, false if the write failed
   */
  public synchronized boolean save() {
    try {
      store.write(codec.encode(document));
      return true;
    } catch (final RuntimeException e) {
      log.error("Failed to save state", e);
      return false;
    }
  }

  /**
   * Looks up the target marker cached for a member.
   *
   * @param email the normalized email, never null
   *
   * @return a target member id, {@link #PENDING} or {@link #KNOWN}; empty
   *         when the member is not cached
   */
  public synchronized Optional<String> memberId(final String email) {
    Objects.requireNonNull(email, "email must not be null");
    return Optional.ofNullable(document.memberIds().get(email));
  }

  /**
   * Caches the target marker for a member.
   *
   * @param email    the normalized email, never null
   * @param memberId the target id or marker, never null
   */
  public synchronized void setMemberId(final String email,
      final String memberId) {
    Objects.requireNonNull(email, "email must not be null");
    Objects.requireNonNull(memberId, "memberId must not be null");
    document.memberIds().put(email, memberId);
  }

  /**
   * Returns a copy of the member identity section.
   *
   * @return normalized email to marker, never null
   */
  public synchronized Map<String, String> memberIds() {
    return Collections.unmodifiableMap(
        new LinkedHashMap<>(document.memberIds()));
  }

  /**
   * Returns the spaces cached for a target member.
   *
   * @param memberId the target member id, never null
   *
   * @return the space ids, empty when none are cached, never null
   */
  public synchronized List<String> memberSpaces(final String memberId) {
    Objects.requireNonNull(memberId, "memberId must not be null");
    final List<String> spaces = document.memberSpaces().get(memberId);
    return spaces == null ? List.of() : List.copyOf(spaces);
  }

  /**
   * Caches the spaces of a target member.
   *
   * @param memberId the target member id, never null
   * @param spaceIds the space ids, never null
   */
  public synchronized void setMemberSpaces(final String memberId,
      final List<String> spaceIds) {
    Objects.requireNonNull(memberId, "memberId must not be null");
    Objects.requireNonNull(spaceIds, "spaceIds must not be null");
    document.memberSpaces().put(memberId, new ArrayList<>(spaceIds));
  }

  /**
   * Looks up the mapping of a source event.
   *
   * @param sourceEventId the source event id, never null
   *
   * @return the mapping, or empty when the event was never created
   */
  public synchronized Optional<EventMapping> eventMapping(
      final String sourceEventId) {
    Objects.requireNonNull(sourceEventId, "sourceEventId must not be null");
    return Optional.ofNullable(document.events().get(sourceEventId));
  }

  /**
   * Stores or replaces the mapping of a source event.
   *
   * @param sourceEventId the source event id, never null
   * @param mapping       the mapping, never null
   */
  public synchronized void putEventMapping(final String sourceEventId,
      final EventMapping mapping) {
    Objects.requireNonNull(sourceEventId, "sourceEventId must not be null");
    Objects.requireNonNull(mapping, "mapping must not be null");
    document.events().put(sourceEventId, mapping);
  }

  /**
   * Removes the mapping of a source event, if any.
   *
   * @param sourceEventId the source event id, never null
   */
  public synchronized void removeEventMapping(final String sourceEventId) {
    Objects.requireNonNull(sourceEventId, "sourceEventId must not be null");
    document.events().remove(sourceEventId);
  }

  /**
   * Returns a copy of the event mapping section.
   *
   * @return source event id to mapping, never null
   */
  public synchronized Map<String, EventMapping> eventMappings() {
    return Collections.unmodifiableMap(
        new LinkedHashMap<>(document.events()));
  }

  /**
   * Checks whether a webhook notification was already processed.
   *
   * @param webhookId the webhook id, never null
   *
   * @return true if the id is in the ledger
   */
  public synchronized boolean hasProcessedWebhook(final String webhookId) {
    Objects.requireNonNull(webhookId, "webhookId must not be null");
    return document.webhooks().containsKey(webhookId);
  }

  /**
   * Records a webhook notification as processed.
   *
   * <p>When the ledger grows past {@link #MAX_WEBHOOK_RECORDS} the entries
   * with the oldest processing time are evicted.
   *
   * @param webhookId the webhook id, never null
   * @param timestamp the sender timestamp, null to use the current time
   */
  public synchronized void markWebhookProcessed(final String webhookId,
      final Instant timestamp) {
    Objects.requireNonNull(webhookId, "webhookId must not be null");
    final Instant now = clock.instant();
    final Map<String, WebhookRecord> webhooks = document.webhooks();
    webhooks.remove(webhookId);
    webhooks.put(webhookId,
        new WebhookRecord(now, timestamp == null ? now : timestamp));

    final int excess = webhooks.size() - MAX_WEBHOOK_RECORDS;
    if (excess > 0) {
      final List<String> oldest = webhooks.entrySet().stream()
          .sorted(Comparator.comparing(
              (Map.Entry<String, WebhookRecord> e) -> e.getValue()
                  .processedAt()))
          .limit(excess)
          .map(Map.Entry::getKey)
          .toList();
      oldest.forEach(webhooks::remove);
      log.debug("Evicted {} webhook ledger entries", oldest.size());
    }
  }

  /**
   * Returns the entry count of every section.
   *
   * @return the statistics, never null
   */
  public synchronized CacheStats stats() {
    return new CacheStats(document.memberIds().size(),
        document.memberSpaces().size(), document.events().size(),
        document.webhooks().size());
  }
}
