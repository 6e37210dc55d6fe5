package org.waabox.concordia.metrics;

import org.waabox.concordia.report.SyncReport;

/**
 * An abstraction for recording operational metrics of Concordia runs.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopConcordiaMetrics} when metrics
 * collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ConcordiaMetrics {

  /**
   * Records a finished member sync.
   *
   * @param report     the run's report, never null
   * @param durationMs the wall-clock duration in milliseconds
   */
  void memberSyncCompleted(SyncReport report, long durationMs);

  /**
   * Records a finished event sync.
   *
   * @param report     the run's report, never null
   * @param durationMs the wall-clock duration in milliseconds
   */
  void eventSyncCompleted(SyncReport report, long durationMs);

  /**
   * Records a webhook notification ignored as a duplicate.
   *
   * @param webhookId the notification identity, never null
   */
  void webhookSkipped(String webhookId);

  /**
   * Records a failed state save.
   */
  void stateSaveFailed();
}
