package org.waabox.concordia.target;

import java.util.List;
import java.util.Objects;

/**
 * One page of a paginated listing.
 *
 * @param <T>     the record type
 * @param records the records of this page, never null
 * @param hasMore whether a further page exists
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Page<T>(List<T> records, boolean hasMore) {

  /** Copies the records. */
  public Page {
    Objects.requireNonNull(records, "records must not be null");
    records = List.copyOf(records);
  }
}
