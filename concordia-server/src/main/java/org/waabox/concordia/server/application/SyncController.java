package org.waabox.concordia.server.application;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.concordia.Concordia;
import org.waabox.concordia.report.SyncReport;

/**
 * REST controller that triggers member and event syncs on demand.
 *
 * <p>Both endpoints default to a dry run: nothing is written to Circle
 * unless the body carries {@code "dry_run": false}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
@RequestMapping("/sync")
public class SyncController {

  /**
   * The body of a member sync request.
   *
   * @param dryRun only report what would change, defaults to true
   */
  public record MemberSyncRequest(@JsonProperty("dry_run") Boolean dryRun) {
  }

  /**
   * The body of an event sync request.
   *
   * @param dryRun only report what would change, defaults to true
   * @param ownerId the Circle member owning created events, may be null
   */
  public record EventSyncRequest(@JsonProperty("dry_run") Boolean dryRun,
      @JsonProperty("owner_id") String ownerId) {
  }

  /** The Concordia instance running the syncs, never null. */
  private final Concordia concordia;

  /**
   * Creates a new SyncController.
   *
   * @param theConcordia the Concordia instance, never null
   */
  public SyncController(final Concordia theConcordia) {
    concordia = Objects.requireNonNull(theConcordia,
        "concordia cannot be null");
  }

  /**
   * Runs a member sync.
   *
   * @param request the request, may be null
   *
   * @return the sync report, never null
   */
  @PostMapping("/members")
  public SyncReport members(
      @RequestBody(required = false) final MemberSyncRequest request) {
    return concordia.syncMembers(request == null
        || isDryRun(request.dryRun()));
  }

  /**
   * Runs an event sync.
   *
   * @param request the request, may be null
   *
   * @return the sync report, never null
   */
  @PostMapping("/events")
  public SyncReport events(
      @RequestBody(required = false) final EventSyncRequest request) {
    if (request == null) {
      return concordia.syncEvents(true, null);
    }
    final String ownerId = request.ownerId() == null
        || request.ownerId().isBlank() ? null : request.ownerId();
    return concordia.syncEvents(isDryRun(request.dryRun()), ownerId);
  }

  private static boolean isDryRun(final Boolean dryRun) {
    return dryRun == null || dryRun;
  }
}
