package inbox.reconnect;

import inbox.backlog.BacklogProcessor;
import inbox.backlog.DrainResult;
import inbox.registry.HandlerRegistry;
import inbox.spi.ConnectivityProbe;
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
 * Watches connectivity to the message source and drains the backlog once after every
 * outage.
 *
 * <p>State machine, starting in {@link ConnectionState#CONNECTED}:
 * <ul>
 *   <li>probe fails or throws: {@code DISCONNECTED}</li>
 *   <li>probe succeeds while {@code DISCONNECTED}: {@code RECOVERING}, one drain, then
 *       {@code CONNECTED}</li>
 *   <li>probe succeeds while {@code CONNECTED}: nothing happens</li>
 * </ul>
 *
 * <p>Permanent failures during the recovery drain do not block the transition back to
 * {@code CONNECTED}. A drain that throws puts the manager back into
 * {@code DISCONNECTED} so the next successful probe retries recovery.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ReconnectionManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ReconnectionManager.class.getName());

  private final BacklogProcessor processor;
  private final ConnectivityProbe probe;
  private final HandlerRegistry handlerRegistry;
  private final Duration checkInterval;
  private final MetricsExporter metrics;

  private final Object lifecycleLock = new Object();
  private volatile ConnectionState state = ConnectionState.CONNECTED;
  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> checkTask;
  private volatile boolean closed;

  private ReconnectionManager(Builder builder) {
    this.processor = Objects.requireNonNull(builder.processor, "processor");
    this.probe = Objects.requireNonNull(builder.probe, "probe");

    if (builder.checkInterval == null || builder.checkInterval.isNegative()
        || builder.checkInterval.isZero()) {
      throw new IllegalArgumentException("checkInterval must be > 0");
    }

    this.handlerRegistry = builder.handlerRegistry;
    this.checkInterval = builder.checkInterval;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Probes connectivity once and, if connectivity just came back, drains the backlog.
   *
   * <p>Never throws: probe and drain failures are logged and reflected in
   * {@link #state()}.
   *
   * @param handlers handler lookup used by the recovery drain
   * @return the probe result
   */
  public synchronized boolean checkConnectionAndRecover(HandlerRegistry handlers) {
    Objects.requireNonNull(handlers, "handlers");
    boolean reachable = probe();
    if (!reachable) {
      if (state != ConnectionState.DISCONNECTED) {
        logger.log(Level.WARNING, "Message source unreachable, marking as disconnected");
        transition(ConnectionState.DISCONNECTED);
      }
      return false;
    }
    if (state == ConnectionState.CONNECTED) {
      return true;
    }

    logger.log(Level.INFO, "Connectivity restored, draining backlog");
    transition(ConnectionState.RECOVERING);
    metrics.incrementRecoveries();
    try {
      DrainResult result = processor.processBacklog(handlers);
      logger.log(Level.INFO, "Recovery drain finished: processed={0}, failed={1}, stalled={2}",
          new Object[]{result.processed(), result.failed(), result.stalled()});
      transition(ConnectionState.CONNECTED);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Recovery drain failed; will retry on next check", e);
      transition(ConnectionState.DISCONNECTED);
    }
    return true;
  }

  private boolean probe() {
    try {
      return probe.isReachable();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (Exception e) {
      logger.log(Level.FINE, "Connectivity probe failed", e);
      return false;
    }
  }

  private void transition(ConnectionState next) {
    ConnectionState previous = state;
    state = next;
    metrics.recordConnectionState(next);
    if (previous != next) {
      logger.log(Level.FINE, "Connection state {0} -> {1}", new Object[]{previous, next});
    }
  }

  /**
   * Returns the current connectivity state.
   */
  public ConnectionState state() {
    return state;
  }

  /**
   * Starts the periodic check using the handler registry given to the builder.
   * Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if closed, or if no handler registry was configured
   */
  public void start() {
    synchronized (lifecycleLock) {
      if (closed) {
        throw new IllegalStateException("ReconnectionManager has been closed");
      }
      if (handlerRegistry == null) {
        throw new IllegalStateException("handlerRegistry is required for scheduled checks");
      }
      if (checkTask != null) {
        return;
      }
      long intervalMillis = checkInterval.toMillis();
      scheduler = Executors.newSingleThreadScheduledExecutor(
          new DaemonThreadFactory("inbox-reconnect-"));
      checkTask = scheduler.scheduleWithFixedDelay(
          this::runScheduledCheck, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }
  }

  private void runScheduledCheck() {
    if (closed) {
      return;
    }
    try {
      checkConnectionAndRecover(handlerRegistry);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Connectivity check failed", t);
    }
  }

  /**
   * Cancels the periodic check and shuts down the scheduler thread, interrupting a
   * recovery drain that is still running.
   */
  @Override
  public void close() {
    ScheduledExecutorService toShutdown;
    synchronized (lifecycleLock) {
      closed = true;
      if (checkTask != null) {
        checkTask.cancel(false);
        checkTask = null;
      }
      toShutdown = scheduler;
      scheduler = null;
    }
    if (toShutdown != null) {
      toShutdown.shutdownNow();
      try {
        toShutdown.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link ReconnectionManager}. */
  public static final class Builder {
    private BacklogProcessor processor;
    private ConnectivityProbe probe;
    private HandlerRegistry handlerRegistry;
    private Duration checkInterval = Duration.ofMinutes(5);
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the processor used for recovery drains.
     *
     * <p><b>Required.</b>
     */
    public Builder processor(BacklogProcessor processor) {
      this.processor = processor;
      return this;
    }

    /**
     * Sets the connectivity probe.
     *
     * <p><b>Required.</b>
     */
    public Builder probe(ConnectivityProbe probe) {
      this.probe = probe;
      return this;
    }

    /**
     * Sets the handlers used by scheduled checks. Required only for {@link #start()}.
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Sets the delay between scheduled checks.
     *
     * <p>Optional. Defaults to {@code 5 minutes}. Must be &gt; 0.
     */
    public Builder checkInterval(Duration checkInterval) {
      this.checkInterval = checkInterval;
      return this;
    }

    /**
     * Sets the metrics exporter. Optional.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the manager. Call {@link ReconnectionManager#start()} to begin checking.
     *
     * @throws NullPointerException     if {@code processor} or {@code probe} is null
     * @throws IllegalArgumentException if {@code checkInterval} is not positive
     */
    public ReconnectionManager build() {
      return new ReconnectionManager(this);
    }
  }
}
