package org.waabox.concordia.state.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concordia.state.StateStore;

/**
 * A {@link StateStore} that keeps the state document in a local file.
 *
 * <p>Writes use an atomic pattern: the document is written to a sibling
 * temporary file and then renamed over the target. If the process dies
 * mid-write, the previous document remains intact.
 *
 * <p>Storage layout:
 * <pre>
 * {stateFile}          the current document
 * {stateFile}.tmp      only present during a write
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemStateStore implements StateStore {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileSystemStateStore.class);

  /** The suffix of the temporary file used while writing. */
  private static final String TEMP_SUFFIX = ".tmp";

  /** The document location, never null. */
  private final Path stateFile;

  /**
   * Creates a new FileSystemStateStore for the given file.
   *
   * <p>Missing parent directories are created.
   *
   * @param theStateFile the document location, never null
   *
   * @throws NullPointerException if theStateFile is null
   * @throws UncheckedIOException if the parent directory cannot be created
   */
  public FileSystemStateStore(final Path theStateFile) {
    Objects.requireNonNull(theStateFile, "stateFile must not be null");
    stateFile = theStateFile.toAbsolutePath();

    try {
      Files.createDirectories(stateFile.getParent());
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create state directory: " + stateFile.getParent(), e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if the file exists but cannot be read
   */
  @Override
  public Optional<byte[]> read() {
    if (!Files.exists(stateFile)) {
      log.debug("No state file at {}", stateFile);
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readAllBytes(stateFile));
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to read state file: " + stateFile, e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if writing to the filesystem fails
   */
  @Override
  public void write(final byte[] document) {
    Objects.requireNonNull(document, "document must not be null");

    final Path tempFile = stateFile.resolveSibling(
        stateFile.getFileName() + TEMP_SUFFIX);
    try {
      Files.write(tempFile, document);
      Files.move(tempFile, stateFile,
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to write state file: " + stateFile, e);
    }
  }

  /**
   * Returns the document location.
   *
   * @return the absolute path of the state file, never null
   */
  public Path stateFile() {
    return stateFile;
  }
}
