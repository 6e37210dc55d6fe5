package org.waabox.concordia;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.event.EventSync;
import org.waabox.concordia.event.EventSyncSettings;
import org.waabox.concordia.member.CacheValidationReport;
import org.waabox.concordia.member.CacheValidator;
import org.waabox.concordia.member.MemberSync;
import org.waabox.concordia.member.SpaceMapping;
import org.waabox.concordia.metrics.ConcordiaMetrics;
import org.waabox.concordia.metrics.NoopConcordiaMetrics;
import org.waabox.concordia.report.SyncReport;
import org.waabox.concordia.source.SourceDirectory;
import org.waabox.concordia.state.CacheStats;
import org.waabox.concordia.state.InMemoryStateStore;
import org.waabox.concordia.state.StateCache;
import org.waabox.concordia.state.StateStore;
import org.waabox.concordia.target.Space;
import org.waabox.concordia.target.TargetRegistry;
import org.waabox.concordia.webhook.WebhookDeduplicator;
import org.waabox.concordia.webhook.WebhookNotification;
import org.waabox.concordia.webhook.WebhookOutcome;

/**
 * The main entry point for Concordia.
 *
 * <p>Concordia keeps the spaces and events of a community platform (the
 * target registry) in line with a membership directory (the source). It
 * owns the {@link StateCache} that makes runs idempotent and exposes every
 * operation the trigger surfaces need: member sync, event sync, webhook
 * handling, cache validation and statistics.
 *
 * <p>Runs are serialized: at most one member sync, event sync, webhook or
 * cache validation executes at a time in this instance. Several processes
 * sharing the same {@link StateStore} are not coordinated; the last save
 * wins.
 *
 * <p>Instances are created through the fluent {@link Builder} starting with
 * {@link #builder()}.
 *
 * <p>Usage example:
 * <pre>{@code
 * Concordia concordia = Concordia.builder()
 *     .sourceDirectory(glueUp)
 *     .targetRegistry(circle)
 *     .stateStore(new FileSystemStateStore(Path.of(".cache/state.json")))
 *     .spaceMapping(new SpaceMapping(List.of("general"), plans))
 *     .eventSyncSettings(EventSyncSettings.builder()
 *         .defaultSpaceId("events").build())
 *     .build();
 *
 * concordia.start();
 * SyncReport report = concordia.syncMembers(true);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Concordia {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Concordia.class);

  /** The registry spaces and events are written to. */
  private final TargetRegistry targetRegistry;

  /** The reconciliation state. */
  private final StateCache state;

  /** The metrics reporter. */
  private final ConcordiaMetrics metrics;

  /** Runs member syncs. */
  private final MemberSync memberSync;

  /** Runs event syncs. */
  private final EventSync eventSync;

  /** Compares the cache with the registry. */
  private final CacheValidator cacheValidator;

  /** Guards against reprocessed notifications. */
  private final WebhookDeduplicator deduplicator;

  /** Serializes runs. */
  private final ReentrantLock runLock = new ReentrantLock();

  /** Whether this instance has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether this instance has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private Concordia(final Builder builder, final StateCache theState,
      final ConcordiaMetrics theMetrics) {
    targetRegistry = builder.targetRegistry;
    state = theState;
    metrics = theMetrics;
    memberSync = new MemberSync(builder.sourceDirectory,
        builder.targetRegistry, theState, builder.spaceMapping);
    eventSync = new EventSync(builder.sourceDirectory, builder.targetRegistry,
        theState, builder.eventSyncSettings, builder.clock);
    cacheValidator = new CacheValidator(builder.targetRegistry, theState);
    deduplicator = new WebhookDeduplicator(theState);
  }

  /**
   * Creates a new builder for constructing a Concordia instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads the stored state.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Concordia has already been started");
    }
    state.load();
    log.info("Concordia started");
  }

  /**
   * Saves the state one last time. Calling it again has no effect.
   */
  public void stop() {
    if (!started.get() || !stopped.compareAndSet(false, true)) {
      return;
    }
    runLock.lock();
    try {
      if (!state.save()) {
        metrics.stateSaveFailed();
      }
    } finally {
      runLock.unlock();
    }
    log.info("Concordia stopped");
  }

  /**
   * Converges target space memberships toward the directory.
   *
   * @param dryRun only plan invites and space changes
   *
   * @return the run's report, never null
   */
  public SyncReport syncMembers(final boolean dryRun) {
    return exclusively(() -> {
      final long start = System.currentTimeMillis();
      final SyncReport report = memberSync.run(dryRun);
      metrics.memberSyncCompleted(report,
          System.currentTimeMillis() - start);
      return report;
    });
  }

  /**
   * Mirrors directory events into the target registry.
   *
   * @param dryRun        only plan the writes
   * @param ownerOverride the member owning created events, null to let
   *                      the target registry resolve it
   *
   * @return the run's report, never null
   *
   * @throws ConcordiaException if no default event space is configured or
   *                            the owner can not be resolved
   */
  public SyncReport syncEvents(final boolean dryRun,
      final String ownerOverride) {
    return exclusively(() -> {
      final long start = System.currentTimeMillis();
      final SyncReport report = eventSync.run(dryRun, ownerOverride);
      metrics.eventSyncCompleted(report, System.currentTimeMillis() - start);
      return report;
    });
  }

  /**
   * Handles an inbound directory notification.
   *
   * <p>A notification seen before is skipped without running anything.
   * Otherwise a full member sync runs, after which the notification is
   * recorded and the state saved.
   *
   * @param notification the notification, never null
   *
   * @return what happened, never null
   */
  public WebhookOutcome handleWebhook(final WebhookNotification notification) {
    Objects.requireNonNull(notification, "notification must not be null");
    return exclusively(() -> {
      final String webhookId = deduplicator.resolveId(notification);
      if (deduplicator.seen(webhookId)) {
        log.info("Webhook {} already processed, skipping", webhookId);
        metrics.webhookSkipped(webhookId);
        return WebhookOutcome.duplicate(webhookId);
      }
      log.info("Webhook {} received, running member sync", webhookId);
      final long start = System.currentTimeMillis();
      final SyncReport report = memberSync.run(false);
      metrics.memberSyncCompleted(report, System.currentTimeMillis() - start);

      deduplicator.markSeen(webhookId, notification.timestamp());
      if (!state.save()) {
        metrics.stateSaveFailed();
      }
      return WebhookOutcome.processed(webhookId, report);
    });
  }

  /**
   * Compares the identity cache with the target registry.
   *
   * @param repair cache the registry members missing from the cache
   *
   * @return the validation report, never null
   */
  public CacheValidationReport validateCache(final boolean repair) {
    return exclusively(() -> cacheValidator.validate(repair));
  }

  /**
   * Returns the entry count of every state section.
   *
   * @return the statistics, never null
   */
  public CacheStats cacheStats() {
    ensureStarted();
    return state.stats();
  }

  /**
   * Lists the spaces of the target registry.
   *
   * @return the spaces, never null
   */
  public List<Space> listSpaces() {
    return targetRegistry.listSpaces();
  }

  private <T> T exclusively(final Supplier<T> run) {
    ensureStarted();
    runLock.lock();
    try {
      return run.get();
    } finally {
      runLock.unlock();
    }
  }

  private void ensureStarted() {
    if (!started.get()) {
      throw new IllegalStateException("Concordia has not been started");
    }
  }

  /**
   * A builder for {@link Concordia}.
   *
   * <p>The source directory and the target registry are required. Every
   * other setting has a default.
   */
  public static final class Builder {

    /** The required source directory. */
    private SourceDirectory sourceDirectory;

    /** The required target registry. */
    private TargetRegistry targetRegistry;

    /** The optional state store. */
    private StateStore stateStore;

    /** The plan to spaces mapping. */
    private SpaceMapping spaceMapping = SpaceMapping.empty();

    /** The event sync settings. */
    private EventSyncSettings eventSyncSettings = EventSyncSettings.defaults();

    /** The optional metrics reporter. */
    private ConcordiaMetrics metrics;

    /** The clock stamping state entries. */
    private Clock clock = Clock.systemUTC();

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the membership directory to read from.
     *
     * @param theSourceDirectory the directory, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theSourceDirectory is null
     */
    public Builder sourceDirectory(final SourceDirectory theSourceDirectory) {
      Objects.requireNonNull(theSourceDirectory,
          "sourceDirectory must not be null");
      this.sourceDirectory = theSourceDirectory;
      return this;
    }

    /**
     * Sets the community platform to write to.
     *
     * @param theTargetRegistry the registry, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theTargetRegistry is null
     */
    public Builder targetRegistry(final TargetRegistry theTargetRegistry) {
      Objects.requireNonNull(theTargetRegistry,
          "targetRegistry must not be null");
      this.targetRegistry = theTargetRegistry;
      return this;
    }

    /**
     * Sets where the state is persisted.
     *
     * <p>If not set, an {@link InMemoryStateStore} is used and the state
     * is lost on restart.
     *
     * @param theStateStore the store, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theStateStore is null
     */
    public Builder stateStore(final StateStore theStateStore) {
      Objects.requireNonNull(theStateStore, "stateStore must not be null");
      this.stateStore = theStateStore;
      return this;
    }

    /**
     * Sets which spaces each plan maps to.
     *
     * <p>If not set, members are assigned no spaces.
     *
     * @param theSpaceMapping the mapping, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theSpaceMapping is null
     */
    public Builder spaceMapping(final SpaceMapping theSpaceMapping) {
      Objects.requireNonNull(theSpaceMapping, "spaceMapping must not be null");
      this.spaceMapping = theSpaceMapping;
      return this;
    }

    /**
     * Sets the event sync settings.
     *
     * <p>If not set, {@link EventSyncSettings#defaults()} is used, which
     * has no default space: event syncs fail until one is configured.
     *
     * @param theSettings the settings, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theSettings is null
     */
    public Builder eventSyncSettings(final EventSyncSettings theSettings) {
      Objects.requireNonNull(theSettings,
          "eventSyncSettings must not be null");
      this.eventSyncSettings = theSettings;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * <p>If not set, {@link NoopConcordiaMetrics} is used.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public Builder metrics(final ConcordiaMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Sets the clock stamping event mappings and webhook entries.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theClock is null
     */
    public Builder clock(final Clock theClock) {
      Objects.requireNonNull(theClock, "clock must not be null");
      this.clock = theClock;
      return this;
    }

    /**
     * Builds the Concordia instance with the configured settings.
     *
     * @return a new Concordia instance, never null
     *
     * @throws ConcordiaException if the source directory or the target
     *                            registry is missing
     */
    public Concordia build() {
      if (sourceDirectory == null) {
        throw new ConcordiaException("A source directory is required");
      }
      if (targetRegistry == null) {
        throw new ConcordiaException("A target registry is required");
      }
      final StateStore resolvedStore;
      if (stateStore != null) {
        resolvedStore = stateStore;
      } else {
        log.warn("No state store configured, state will not survive a"
            + " restart");
        resolvedStore = new InMemoryStateStore();
      }
      final ConcordiaMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopConcordiaMetrics();
      return new Concordia(this, new StateCache(resolvedStore, clock),
          resolvedMetrics);
    }
  }
}
