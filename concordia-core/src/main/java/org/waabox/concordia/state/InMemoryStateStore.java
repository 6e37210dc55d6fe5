package org.waabox.concordia.state;

import java.util.Objects;
import java.util.Optional;

/**
 * A {@link StateStore} that keeps the document on the heap.
 *
 * <p>State does not survive a restart. Useful for tests and dry-run only
 * deployments.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryStateStore implements StateStore {

  /** The last written document, null until the first write. */
  private volatile byte[] document;

  /** {@inheritDoc} */
  @Override
  public Optional<byte[]> read() {
    final byte[] current = document;
    return current == null ? Optional.empty() : Optional.of(current.clone());
  }

  /** {@inheritDoc} */
  @Override
  public void write(final byte[] theDocument) {
    Objects.requireNonNull(theDocument, "document must not be null");
    document = theDocument.clone();
  }
}
