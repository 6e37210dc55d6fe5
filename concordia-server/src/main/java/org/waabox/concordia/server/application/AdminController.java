package org.waabox.concordia.server.application;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.concordia.Concordia;
import org.waabox.concordia.member.CacheValidationReport;
import org.waabox.concordia.state.CacheStats;
import org.waabox.concordia.target.Space;

/**
 * REST controller for health, space discovery and cache maintenance.
 *
 * <ul>
 *   <li>{@code GET /health} - liveness</li>
 *   <li>{@code GET /spaces} - the Circle spaces, to write the space
 *       mapping</li>
 *   <li>{@code GET /cache/stats} - entry counts of the state</li>
 *   <li>{@code POST /cache/validate} - compares the identity cache with
 *       Circle, optionally repairing it</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
public class AdminController {

  /** The Concordia instance, never null. */
  private final Concordia concordia;

  /**
   * Creates a new AdminController.
   *
   * @param theConcordia the Concordia instance, never null
   */
  public AdminController(final Concordia theConcordia) {
    concordia = Objects.requireNonNull(theConcordia,
        "concordia cannot be null");
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    return Map.of("ok", true);
  }

  @GetMapping("/spaces")
  public List<Space> spaces() {
    return concordia.listSpaces();
  }

  @GetMapping("/cache/stats")
  public CacheStats cacheStats() {
    return concordia.cacheStats();
  }

  /**
   * Validates the identity cache.
   *
   * @param repair cache the Circle members missing from the cache
   *
   * @return the validation report, never null
   */
  @PostMapping("/cache/validate")
  public CacheValidationReport validateCache(
      @RequestParam(name = "repair", defaultValue = "false")
          final boolean repair) {
    return concordia.validateCache(repair);
  }
}
