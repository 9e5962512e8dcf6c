package inbox.purge;

import inbox.offset.OffsetStore;
import inbox.spi.MetricsExporter;
import inbox.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that removes ledger entries older than the retention window.
 *
 * <p>Each cycle calls {@link OffsetStore#prune(Duration, int)}, which deletes in
 * batches until a batch comes back short. The cursor is never touched, so ids older
 * than the window stay protected by the cursor comparison even after their ledger
 * entries are gone.
 *
 * <p>A failed cycle is logged and retried on the next tick.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetentionSweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetentionSweeper.class.getName());

  private final OffsetStore offsetStore;
  private final Duration retention;
  private final Duration interval;
  private final int batchSize;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private RetentionSweeper(Builder builder) {
    this.offsetStore = Objects.requireNonNull(builder.offsetStore, "offsetStore");

    if (builder.retention == null || builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.interval == null || builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }

    this.retention = builder.retention;
    this.interval = builder.interval;
    this.batchSize = builder.batchSize;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled sweep. The first sweep runs one interval after this call.
   * Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RetentionSweeper has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    long intervalMillis = interval.toMillis();
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("inbox-retention-"));
    sweepTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single sweep. Never throws.
   *
   * @return number of deleted ledger entries, or {@code -1} if the sweep failed or the
   *     sweeper is closed
   */
  public long runOnce() {
    if (closed) {
      return -1;
    }
    try {
      long deleted = offsetStore.prune(retention, batchSize);
      metrics.recordPruned(deleted);
      if (deleted > 0) {
        logger.log(Level.INFO, "Pruned {0} ledger entries older than {1}",
            new Object[]{deleted, retention});
      }
      return deleted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Ledger retention sweep failed", t);
      return -1;
    }
  }

  /** Cancels the sweep schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RetentionSweeper}. */
  public static final class Builder {
    private OffsetStore offsetStore;
    private Duration retention = Duration.ofDays(7);
    private Duration interval = Duration.ofDays(1);
    private int batchSize = OffsetStore.DEFAULT_PRUNE_BATCH_SIZE;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the store whose ledger is swept.
     *
     * <p><b>Required.</b>
     *
     * @param offsetStore the offset store
     * @return this builder
     */
    public Builder offsetStore(OffsetStore offsetStore) {
      this.offsetStore = offsetStore;
      return this;
    }

    /**
     * Sets how long ledger entries are kept.
     *
     * <p>Optional. Defaults to {@code 7 days}. Must be &ge; 0.
     *
     * @param retention the retention window
     * @return this builder
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the delay between sweeps.
     *
     * <p>Optional. Defaults to {@code 1 day}. Must be &gt; 0.
     *
     * @param interval sweep interval
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Sets the maximum rows deleted per transaction.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     *
     * @param batchSize max rows per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the metrics exporter. Optional.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the sweeper. Call {@link RetentionSweeper#start()} to begin.
     *
     * @return a new {@link RetentionSweeper}
     * @throws NullPointerException     if {@code offsetStore} is null
     * @throws IllegalArgumentException if {@code retention} is negative, or
     *                                  {@code interval} or {@code batchSize} is not positive
     */
    public RetentionSweeper build() {
      return new RetentionSweeper(this);
    }
  }
}
