package org.waabox.concordia.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Slugs}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SlugsTest {

  @Test
  void whenSlugifying_givenPunctuationAndSpaces_shouldCollapseThem() {
    assertEquals("annual-gala-2026-42",
        Slugs.slugify("  Annual Gala: 2026!! -- 42 "));
  }

  @Test
  void whenSlugifying_givenSameTitleDifferentIds_shouldDiffer() {
    assertNotEquals(Slugs.slugify("Launch-1"), Slugs.slugify("Launch-2"));
  }

  @Test
  void whenBuildingEventSlug_givenSameLongTitleDifferentIds_shouldKeepIds() {
    final String title = "A".repeat(120);

    final String first = Slugs.eventSlug(title, "1");
    final String second = Slugs.eventSlug(title, "2");

    assertNotEquals(first, second);
    assertEquals(Slugs.MAX_LENGTH, first.length());
    assertTrue(first.endsWith("a-1"));
    assertTrue(second.endsWith("a-2"));
  }

  @Test
  void whenBuildingEventSlug_givenCutLandingOnSeparator_shouldDropTrailingHyphen() {
    final String title = "a".repeat(96) + " bcd";

    final String slug = Slugs.eventSlug(title, "12");

    assertEquals("a".repeat(96) + "-12", slug);
  }

  @Test
  void whenBuildingEventSlug_givenShortTitle_shouldJoinTitleAndId() {
    assertEquals("launch-42", Slugs.eventSlug("Launch", "42"));
    assertEquals("42", Slugs.eventSlug("!!", "42"));
  }

  @Test
  void whenSlugifying_givenAccentedLetters_shouldKeepThem() {
    assertEquals("café-día-7", Slugs.slugify("Café Día 7"));
  }

  @Test
  void whenSlugifying_givenLongText_shouldCapLength() {
    final String slug = Slugs.slugify("word ".repeat(60));

    assertTrue(slug.length() <= Slugs.MAX_LENGTH);
  }
}
