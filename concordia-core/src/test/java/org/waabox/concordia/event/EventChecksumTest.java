package org.waabox.concordia.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.waabox.concordia.source.EventTemplate;
import org.waabox.concordia.source.ImageRef;
import org.waabox.concordia.source.SourceEvent;

/**
 * Tests for {@link EventChecksum}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class EventChecksumTest {

  private static SourceEvent event(final String title, final Boolean published,
      final String description) {
    return new SourceEvent("42", title, null, null, null, description,
        1700000000000L, 1700003600000L, null,
        new EventTemplate(Map.of("banner", new ImageRef("https://i/b.png"))),
        published);
  }

  @Test
  void whenComputing_shouldReturnHexMd5() {
    final String checksum = EventChecksum.compute(event("Launch", true, null));

    assertEquals(32, checksum.length());
    assertEquals(checksum, EventChecksum.compute(event("Launch", true, null)));
  }

  @Test
  void whenComputing_givenTitleChange_shouldDiffer() {
    assertNotEquals(EventChecksum.compute(event("Launch", true, null)),
        EventChecksum.compute(event("Launch v2", true, null)));
  }

  @Test
  void whenComputing_givenUntrackedFieldChange_shouldNotDiffer() {
    assertEquals(EventChecksum.compute(event("Launch", true, "one")),
        EventChecksum.compute(event("Launch", false, "two")));
  }
}
