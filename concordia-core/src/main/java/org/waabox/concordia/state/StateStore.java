package org.waabox.concordia.state;

import java.util.Optional;

/**
 * A persistent store for the reconciliation state document.
 *
 * <p>Implementations decide where the document lives (local filesystem,
 * S3, memory). The document is always read and written as a whole: a
 * write replaces whatever was stored before.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface StateStore {

  /**
   * Reads the stored state document.
   *
   * @return the raw document bytes, or empty if nothing has been stored
   *         yet
   */
  Optional<byte[]> read();

  /**
   * Replaces the stored state document.
   *
   * @param document the raw document bytes, never null
   */
  void write(byte[] document);
}
