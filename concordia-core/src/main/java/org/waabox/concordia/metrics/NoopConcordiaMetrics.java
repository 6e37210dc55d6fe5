package org.waabox.concordia.metrics;

import org.waabox.concordia.report.SyncReport;

/**
 * A no-operation implementation of {@link ConcordiaMetrics}.
 *
 * <p>All methods in this class are intentionally empty.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopConcordiaMetrics implements ConcordiaMetrics {

  /** {@inheritDoc} */
  @Override
  public void memberSyncCompleted(final SyncReport report,
      final long durationMs) {
  }

  /** {@inheritDoc} */
  @Override
  public void eventSyncCompleted(final SyncReport report,
      final long durationMs) {
  }

  /** {@inheritDoc} */
  @Override
  public void webhookSkipped(final String webhookId) {
  }

  /** {@inheritDoc} */
  @Override
  public void stateSaveFailed() {
  }
}
