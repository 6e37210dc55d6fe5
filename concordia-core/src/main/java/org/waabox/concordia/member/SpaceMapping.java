package org.waabox.concordia.member;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which spaces a member belongs in, from their plan.
 *
 * <p>Every member gets the default spaces; members of a mapped plan also
 * get that plan's spaces.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SpaceMapping {

  /** The spaces every member belongs in. */
  private final List<String> defaultSpaces;

  /** Plan slug to extra spaces. */
  private final Map<String, List<String>> plansToSpaces;

  /**
   * Creates a new mapping.
   *
   * @param theDefaultSpaces the spaces every member belongs in, never null
   * @param thePlansToSpaces plan slug to extra spaces, never null
   */
  public SpaceMapping(final List<String> theDefaultSpaces,
      final Map<String, List<String>> thePlansToSpaces) {
    Objects.requireNonNull(theDefaultSpaces, "defaultSpaces must not be null");
    Objects.requireNonNull(thePlansToSpaces, "plansToSpaces must not be null");
    defaultSpaces = List.copyOf(theDefaultSpaces);
    final Map<String, List<String>> plans = new LinkedHashMap<>();
    thePlansToSpaces.forEach((plan, spaces) ->
        plans.put(plan, spaces == null ? List.of() : List.copyOf(spaces)));
    plansToSpaces = Map.copyOf(plans);
  }

  /**
   * Creates a mapping that assigns no spaces at all.
   *
   * @return the empty mapping, never null
   */
  public static SpaceMapping empty() {
    return new SpaceMapping(List.of(), Map.of());
  }

  /**
   * Computes the desired spaces of a plan: the defaults followed by the
   * plan's spaces, without duplicates, in first-seen order.
   *
   * @param planSlug the plan slug, never null
   *
   * @return the space ids, never null
   */
  public List<String> decideSpaces(final String planSlug) {
    Objects.requireNonNull(planSlug, "planSlug must not be null");
    final Set<String> spaces = new LinkedHashSet<>(defaultSpaces);
    spaces.addAll(plansToSpaces.getOrDefault(planSlug, List.of()));
    return List.copyOf(spaces);
  }

  /**
   * Returns the default spaces.
   *
   * @return the space ids, never null
   */
  public List<String> defaultSpaces() {
    return defaultSpaces;
  }

  /**
   * Returns the plan specific spaces.
   *
   * @return plan slug to space ids, never null
   */
  public Map<String, List<String>> plansToSpaces() {
    return plansToSpaces;
  }
}
