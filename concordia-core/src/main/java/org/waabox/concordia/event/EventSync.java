package org.waabox.concordia.event;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.ConcordiaException;
import org.waabox.concordia.report.ActionDetail;
import org.waabox.concordia.report.SyncAction;
import org.waabox.concordia.report.SyncReport;
import org.waabox.concordia.source.SourceDirectory;
import org.waabox.concordia.source.SourceEvent;
import org.waabox.concordia.state.EventMapping;
import org.waabox.concordia.state.StateCache;
import org.waabox.concordia.target.CreatedEvent;
import org.waabox.concordia.target.EventPayload;
import org.waabox.concordia.target.TargetRegistry;

/**
 * Mirrors directory events into the target registry.
 *
 * <p>Each directory event is fingerprinted with {@link EventChecksum} and
 * compared with its {@link EventMapping}:
 * <ul>
 *   <li>no mapping: the event is created and its mapping stored;</li>
 *   <li>same checksum: nothing happens, the event is not even
 *       transformed;</li>
 *   <li>different checksum: the target event is updated in place, keeping
 *       its id and slug.</li>
 * </ul>
 * With deletion enabled, mapped events the directory no longer lists are
 * deleted from the target afterwards.
 *
 * <p>The state is saved after every successful write, so an interrupted
 * run keeps what it did. A failure on one event is counted and the run
 * moves on.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EventSync {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(EventSync.class);

  private final SourceDirectory source;
  private final TargetRegistry target;
  private final StateCache state;
  private final EventSyncSettings settings;
  private final EventTransformer transformer;
  private final Clock clock;

  /**
   * Creates a new event sync.
   *
   * @param theSource   the directory, never null
   * @param theTarget   the registry, never null
   * @param theState    the state cache, never null
   * @param theSettings the settings, never null
   * @param theClock    the clock stamping mappings, never null
   */
  public EventSync(final SourceDirectory theSource,
      final TargetRegistry theTarget, final StateCache theState,
      final EventSyncSettings theSettings, final Clock theClock) {
    source = Objects.requireNonNull(theSource, "source must not be null");
    target = Objects.requireNonNull(theTarget, "target must not be null");
    state = Objects.requireNonNull(theState, "state must not be null");
    settings = Objects.requireNonNull(theSettings, "settings must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    transformer = new EventTransformer();
  }

  /**
   * Runs an event sync.
   *
   * @param dryRun        only plan the writes
   * @param ownerOverride the owning member id, null to ask the registry
   *
   * @return the report; an aborted one when the directory could not be
   *         read, never null
   *
   * @throws ConcordiaException if no default space is configured or the
   *                            owner can not be resolved
   */
  public SyncReport run(final boolean dryRun, final String ownerOverride) {
    final String spaceId = settings.defaultSpaceId();
    if (spaceId == null) {
      throw new ConcordiaException(
          "No default space configured for events");
    }
    final String ownerId = resolveOwner(ownerOverride);

    log.info("Fetching events (publishedOnly={}, futureOnly={})",
        settings.publishedOnly(), settings.futureOnly());
    final List<SourceEvent> events;
    try {
      events = source.listEvents(settings.publishedOnly(),
          settings.futureOnly());
      log.info("Fetched {} events", events.size());
    } catch (final RuntimeException e) {
      log.error("Failed to fetch events", e);
      return SyncReport.aborted(e.getMessage() != null ? e.getMessage()
          : e.getClass().getSimpleName());
    }

    final SyncReport report = new SyncReport();
    final Set<String> seen = new HashSet<>();

    for (final SourceEvent event : events) {
      if (!event.hasId()) {
        log.warn("Event missing id, skipping: {}", event.title());
        report.incrementSkipped();
        continue;
      }
      seen.add(event.id());
      syncEvent(event, spaceId, ownerId, dryRun, report);
    }

    if (settings.deleteRemoved()) {
      deleteRemoved(seen, spaceId, dryRun, report);
    }

    log.info("Event sync complete: {} created, {} updated, {} deleted, {}"
        + " skipped, {} errors", report.created(), report.updated(),
        report.deleted(), report.skipped(), report.errors());
    return report;
  }

  private String resolveOwner(final String ownerOverride) {
    if (ownerOverride != null && !ownerOverride.isBlank()) {
      return ownerOverride;
    }
    try {
      return target.resolveOwnerIdentity();
    } catch (final ConcordiaException e) {
      throw e;
    } catch (final RuntimeException e) {
      throw new ConcordiaException("Could not resolve the event owner", e);
    }
  }

  private void syncEvent(final SourceEvent event, final String spaceId,
      final String ownerId, final boolean dryRun, final SyncReport report) {
    final String id = event.id();
    final Optional<EventMapping> mapping = state.eventMapping(id);

    final String checksum;
    final EventPayload payload;
    try {
      checksum = EventChecksum.compute(event);
      if (mapping.isPresent() && mapping.get().checksum().equals(checksum)) {
        log.debug("Event {} unchanged, skipping", id);
        report.incrementSkipped();
        return;
      }
      if (mapping.isEmpty() ? !settings.createNew()
          : !settings.updateExisting()) {
        report.incrementSkipped();
        return;
      }
      payload = transformer.transform(event, spaceId, ownerId,
          settings.fieldOverrides());
    } catch (final RuntimeException e) {
      log.error("Failed to transform event {}", id, e);
      report.incrementErrors();
      return;
    }

    if (mapping.isEmpty()) {
      create(id, payload, checksum, spaceId, dryRun, report);
    } else {
      update(id, mapping.get(), payload, checksum, dryRun, report);
    }
  }

  private void create(final String id, final EventPayload payload,
      final String checksum, final String spaceId, final boolean dryRun,
      final SyncReport report) {
    final Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("title", payload.name());
    attributes.put("slug", payload.slug());
    attributes.put("starts_at", payload.startsAt());
    attributes.put("ends_at", payload.endsAt());
    attributes.put("location", payload.location());
    attributes.put("location_type", payload.locationType());
    attributes.put("timezone", payload.timezone());
    attributes.put("has_cover_image", payload.coverImageUrl() != null);

    if (dryRun) {
      report.incrementCreated();
      report.addDetail(ActionDetail.dryRun(SyncAction.CREATE_EVENT, id, null,
          attributes));
      return;
    }
    try {
      final CreatedEvent created = target.createEvent(payload, spaceId);
      final String slug = created.slug() != null ? created.slug()
          : payload.slug();
      state.putEventMapping(id, new EventMapping(created.id(), slug,
          clock.instant(), checksum));
      state.save();

      report.incrementCreated();
      attributes.put("slug", slug);
      report.addDetail(ActionDetail.success(SyncAction.CREATE_EVENT, id,
          created.id(), attributes));
      log.info("Created event: {} (id {}) at {} - {}", payload.name(),
          created.id(), payload.location(), payload.locationType());
    } catch (final RuntimeException e) {
      log.error("Failed to create event {}", id, e);
      report.incrementErrors();
      report.addDetail(ActionDetail.failure(SyncAction.CREATE_EVENT, id, null,
          e, Map.of("title", payload.name())));
    }
  }

  private void update(final String id, final EventMapping mapping,
      final EventPayload changed, final String checksum, final boolean dryRun,
      final SyncReport report) {
    final String targetId = mapping.targetEventId();
    // The slug assigned at creation survives title edits.
    final EventPayload payload = changed.withSlug(mapping.slug());
    final Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("title", payload.name());
    attributes.put("slug", mapping.slug());

    if (dryRun) {
      report.incrementUpdated();
      report.addDetail(ActionDetail.dryRun(SyncAction.UPDATE_EVENT, id,
          targetId, attributes));
      return;
    }
    try {
      target.updateEvent(targetId, payload);
      state.putEventMapping(id, mapping.refreshed(checksum, clock.instant()));
      state.save();

      report.incrementUpdated();
      report.addDetail(ActionDetail.success(SyncAction.UPDATE_EVENT, id,
          targetId, attributes));
      log.info("Updated event: {} (id {})", payload.name(), targetId);
    } catch (final RuntimeException e) {
      log.error("Failed to update event {}", id, e);
      report.incrementErrors();
      report.addDetail(ActionDetail.failure(SyncAction.UPDATE_EVENT, id,
          targetId, e, attributes));
    }
  }

  private void deleteRemoved(final Set<String> seen, final String spaceId,
      final boolean dryRun, final SyncReport report) {
    for (final Map.Entry<String, EventMapping> entry
        : state.eventMappings().entrySet()) {
      final String id = entry.getKey();
      if (seen.contains(id)) {
        continue;
      }
      final String targetId = entry.getValue().targetEventId();
      if (dryRun) {
        report.incrementDeleted();
        report.addDetail(ActionDetail.dryRun(SyncAction.DELETE_EVENT, id,
            targetId, null));
        continue;
      }
      try {
        target.deleteEvent(targetId, spaceId);
        state.removeEventMapping(id);
        state.save();

        report.incrementDeleted();
        report.addDetail(ActionDetail.success(SyncAction.DELETE_EVENT, id,
            targetId, null));
        log.info("Deleted event: source id {}, target id {}", id, targetId);
      } catch (final RuntimeException e) {
        log.error("Failed to delete event {}", id, e);
        report.incrementErrors();
        report.addDetail(ActionDetail.failure(SyncAction.DELETE_EVENT, id,
            targetId, e, null));
      }
    }
  }
}
