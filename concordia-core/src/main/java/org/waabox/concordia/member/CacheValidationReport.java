package org.waabox.concordia.member;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The result of comparing the identity cache with the target registry.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonPropertyOrder({"valid", "missing_in_circle", "missing_in_cache",
    "repaired", "error", "details"})
public final class CacheValidationReport {

  private int valid;
  private int missingInTarget;
  private int missingInCache;
  private int repaired;

  /** The disagreements found, in discovery order. */
  private final List<ValidationIssue> details = new ArrayList<>();

  /** Why validation could not run, null when it did. */
  private final String error;

  CacheValidationReport() {
    this(null);
  }

  private CacheValidationReport(final String theError) {
    error = theError;
  }

  /**
   * Creates the report of a validation that could not run.
   *
   * @param reason the failure, never null
   *
   * @return the report, never null
   */
  static CacheValidationReport failed(final String reason) {
    return new CacheValidationReport(
        Objects.requireNonNull(reason, "reason must not be null"));
  }

  void countValid() {
    valid++;
  }

  void addMissingInTarget(final ValidationIssue issue) {
    missingInTarget++;
    details.add(issue);
  }

  void addMissingInCache(final ValidationIssue issue) {
    missingInCache++;
    details.add(issue);
  }

  void countRepaired() {
    repaired++;
  }

  /**
   * Tells whether validation could not run.
   *
   * @return true if the registry could not be read
   */
  @JsonIgnore
  public boolean isFailed() {
    return error != null;
  }

  @JsonProperty("valid")
  public int valid() {
    return valid;
  }

  @JsonProperty("missing_in_circle")
  public int missingInTarget() {
    return missingInTarget;
  }

  @JsonProperty("missing_in_cache")
  public int missingInCache() {
    return missingInCache;
  }

  @JsonProperty("repaired")
  public int repaired() {
    return repaired;
  }

  @JsonProperty("error")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String error() {
    return error;
  }

  @JsonProperty("details")
  public List<ValidationIssue> details() {
    return Collections.unmodifiableList(details);
  }
}
