package org.waabox.concordia.state.fs;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.concordia.state.CacheStats;
import org.waabox.concordia.state.StateCache;

/**
 * Tests for {@link FileSystemStateStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FileSystemStateStoreTest {

  @Test
  void whenReading_givenNoFile_shouldReturnEmpty(@TempDir final Path dir) {
    final FileSystemStateStore store = new FileSystemStateStore(
        dir.resolve("state.json"));

    assertTrue(store.read().isEmpty());
  }

  @Test
  void whenCreating_givenMissingParents_shouldCreateThem(
      @TempDir final Path dir) {
    final Path file = dir.resolve("nested/cache/state.json");

    new FileSystemStateStore(file);

    assertTrue(Files.isDirectory(file.getParent()));
  }

  @Test
  void whenWritingTwice_shouldKeepTheLastDocumentOnly(
      @TempDir final Path dir) {
    final Path file = dir.resolve("state.json");
    final FileSystemStateStore store = new FileSystemStateStore(file);

    store.write("first".getBytes(StandardCharsets.UTF_8));
    store.write("second".getBytes(StandardCharsets.UTF_8));

    final Optional<byte[]> read = store.read();
    assertTrue(read.isPresent());
    assertArrayEquals("second".getBytes(StandardCharsets.UTF_8), read.get());
    assertFalse(Files.exists(dir.resolve("state.json.tmp")));
  }

  @Test
  void whenRestarting_givenSavedCache_shouldRestoreIt(
      @TempDir final Path dir) {
    final Path file = dir.resolve("state.json");
    final StateCache cache = new StateCache(new FileSystemStateStore(file));
    cache.load();
    cache.setMemberId("a@x.com", "m-1");
    cache.setMemberSpaces("m-1", List.of("g1"));
    assertTrue(cache.save());

    final StateCache restored = new StateCache(new FileSystemStateStore(file));
    restored.load();

    assertEquals(new CacheStats(1, 1, 0, 0), restored.stats());
    assertEquals(Optional.of("m-1"), restored.memberId("a@x.com"));
  }
}
