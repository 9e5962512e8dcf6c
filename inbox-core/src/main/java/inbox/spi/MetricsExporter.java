package inbox.spi;

import inbox.reconnect.ConnectionState;

/**
 * Observability hook for exporting inbox counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. See
 * {@code inbox.micrometer.MicrometerMetricsExporter} for the Micrometer bridge.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of updates handled successfully (including updates with no
   * handler, which are settled as processed).
   */
  void incrementProcessed();

  /**
   * Increments the count of updates settled as permanent failures.
   */
  void incrementFailed();

  /**
   * Increments the count of updates skipped because they were already settled.
   */
  void incrementDuplicate();

  /**
   * Increments the count of updates that had no registered handler.
   */
  void incrementUnroutable();

  /**
   * Increments the count of drains that stopped on a transient failure.
   */
  void incrementStalled();

  /**
   * Increments the count of handler calls that exceeded the timeout.
   */
  default void incrementHandlerTimeout() {
  }

  /**
   * Increments the count of recoveries triggered by the reconnection manager.
   */
  default void incrementRecoveries() {
  }

  /**
   * Records ledger entries removed by a retention sweep.
   *
   * @param count number of deleted entries (always non-negative)
   */
  default void recordPruned(long count) {
  }

  /**
   * Records the current cursor position.
   *
   * @param updateId the highest settled update id
   */
  void recordCursor(long updateId);

  /**
   * Records the current connectivity state.
   *
   * @param state the new state
   */
  default void recordConnectionState(ConnectionState state) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementProcessed() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void incrementDuplicate() {
    }

    @Override
    public void incrementUnroutable() {
    }

    @Override
    public void incrementStalled() {
    }

    @Override
    public void recordCursor(long updateId) {
    }
  }
}
