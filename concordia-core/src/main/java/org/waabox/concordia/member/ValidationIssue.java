package org.waabox.concordia.member;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A disagreement between the identity cache and the target registry.
 *
 * @param issue    {@code missing_in_circle} or {@code missing_in_cache}
 * @param email    the normalized email, never null
 * @param cachedId the cached marker, set for {@code missing_in_circle}
 * @param targetId the registry id, set for {@code missing_in_cache}
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(
    @JsonProperty("issue") String issue,
    @JsonProperty("email") String email,
    @JsonProperty("cached_id") String cachedId,
    @JsonProperty("circle_id") String targetId
) {

  /** Issue name of a cached member the registry does not have. */
  public static final String MISSING_IN_TARGET = "missing_in_circle";

  /** Issue name of a registry member the cache does not have. */
  public static final String MISSING_IN_CACHE = "missing_in_cache";
}
