package org.waabox.concordia.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The outcome of one member sync or event sync run.
 *
 * <p>Counters and details are accumulated while the run progresses. A
 * report is returned to the caller and never persisted.
 *
 * <p>A run that could not start returns an {@link #aborted(String)}
 * report, which only carries the error.
 *
 * <p>Instances are not thread-safe; a report belongs to a single run.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonPropertyOrder({"created", "invited", "updated", "deleted", "skipped",
    "errors", "duplicates_skipped", "cache_hits", "cache_misses",
    "space_adds", "space_removes", "member_types", "error", "details"})
public final class SyncReport {

  private int created;
  private int invited;
  private int updated;
  private int deleted;
  private int skipped;
  private int errors;
  private int duplicatesSkipped;
  private int cacheHits;
  private int cacheMisses;
  private int spaceAdds;
  private int spaceRemoves;

  /** Members seen per kind, in first-seen order. */
  private final Map<String, Integer> memberTypes = new LinkedHashMap<>();

  /** The operations of the run, in execution order. */
  private final List<ActionDetail> details = new ArrayList<>();

  /** Why the run did not start, null for a completed run. */
  private final String error;

  /** Creates an empty report for a run that is starting. */
  public SyncReport() {
    this(null);
  }

  private SyncReport(final String theError) {
    error = theError;
  }

  /**
   * Creates the report of a run that could not start.
   *
   * @param reason why the run was aborted, never null
   *
   * @return the report, never null
   */
  public static SyncReport aborted(final String reason) {
    Objects.requireNonNull(reason, "reason must not be null");
    return new SyncReport(reason);
  }

  /**
   * Tells whether the run was aborted before doing any work.
   *
   * @return true for an aborted report
   */
  @JsonIgnore
  public boolean isAborted() {
    return error != null;
  }

  /** Counts a created event. */
  public void incrementCreated() {
    created++;
  }

  /** Counts an invited member. */
  public void incrementInvited() {
    invited++;
  }

  /** Counts an updated event. */
  public void incrementUpdated() {
    updated++;
  }

  /** Counts a deleted event. */
  public void incrementDeleted() {
    deleted++;
  }

  /** Counts an entity that needed no change. */
  public void incrementSkipped() {
    skipped++;
  }

  /** Counts a failed operation. */
  public void incrementErrors() {
    errors++;
  }

  /**
   * Adds failed operations.
   *
   * @param count the number of failures
   */
  public void addErrors(final int count) {
    errors += count;
  }

  /** Counts a member repeated within the same batch. */
  public void incrementDuplicatesSkipped() {
    duplicatesSkipped++;
  }

  /** Counts a member whose identity was cached. */
  public void incrementCacheHits() {
    cacheHits++;
  }

  /** Counts a member whose identity was not cached. */
  public void incrementCacheMisses() {
    cacheMisses++;
  }

  /**
   * Adds space additions.
   *
   * @param count the number of additions
   */
  public void addSpaceAdds(final int count) {
    spaceAdds += count;
  }

  /**
   * Adds space removals.
   *
   * @param count the number of removals
   */
  public void addSpaceRemoves(final int count) {
    spaceRemoves += count;
  }

  /**
   * Counts a member of the given kind.
   *
   * @param kind the kind's wire name, never null
   */
  public void countMemberType(final String kind) {
    Objects.requireNonNull(kind, "kind must not be null");
    memberTypes.merge(kind, 1, Integer::sum);
  }

  /**
   * Appends an operation.
   *
   * @param detail the operation, never null
   */
  public void addDetail(final ActionDetail detail) {
    details.add(Objects.requireNonNull(detail, "detail must not be null"));
  }

  /**
   * Appends operations.
   *
   * @param theDetails the operations, never null
   */
  public void addDetails(final List<ActionDetail> theDetails) {
    Objects.requireNonNull(theDetails, "details must not be null");
    theDetails.forEach(this::addDetail);
  }

  @JsonProperty("created")
  public int created() {
    return created;
  }

  @JsonProperty("invited")
  public int invited() {
    return invited;
  }

  @JsonProperty("updated")
  public int updated() {
    return updated;
  }

  @JsonProperty("deleted")
  public int deleted() {
    return deleted;
  }

  @JsonProperty("skipped")
  public int skipped() {
    return skipped;
  }

  @JsonProperty("errors")
  public int errors() {
    return errors;
  }

  @JsonProperty("duplicates_skipped")
  public int duplicatesSkipped() {
    return duplicatesSkipped;
  }

  @JsonProperty("cache_hits")
  public int cacheHits() {
    return cacheHits;
  }

  @JsonProperty("cache_misses")
  public int cacheMisses() {
    return cacheMisses;
  }

  @JsonProperty("space_adds")
  public int spaceAdds() {
    return spaceAdds;
  }

  @JsonProperty("space_removes")
  public int spaceRemoves() {
    return spaceRemoves;
  }

  /**
   * Returns the member counts per kind.
   *
   * @return kind to count, never null
   */
  @JsonProperty("member_types")
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public Map<String, Integer> memberTypes() {
    return Collections.unmodifiableMap(memberTypes);
  }

  /**
   * Returns the abort reason.
   *
   * @return the reason, or null for a completed run
   */
  @JsonProperty("error")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String error() {
    return error;
  }

  /**
   * Returns the operations of the run.
   *
   * @return the details in execution order, never null
   */
  @JsonProperty("details")
  public List<ActionDetail> details() {
    return Collections.unmodifiableList(details);
  }

  @Override
  public String toString() {
    if (isAborted()) {
      return "SyncReport{aborted: " + error + "}";
    }
    return "SyncReport{created=" + created + ", invited=" + invited
        + ", updated=" + updated + ", deleted=" + deleted
        + ", skipped=" + skipped + ", errors=" + errors
        + ", duplicatesSkipped=" + duplicatesSkipped
        + ", cacheHits=" + cacheHits + ", cacheMisses=" + cacheMisses
        + ", spaceAdds=" + spaceAdds + ", spaceRemoves=" + spaceRemoves
        + ", memberTypes=" + memberTypes + "}";
  }
}
