package inbox;

import inbox.backlog.BacklogProcessor;
import inbox.backlog.DrainResult;
import inbox.offset.OffsetStore;
import inbox.purge.RetentionSweeper;
import inbox.reconnect.ReconnectionManager;
import inbox.registry.HandlerRegistry;
import inbox.spi.ConnectionProvider;
import inbox.spi.ConnectivityProbe;
import inbox.spi.InboxStore;
import inbox.spi.MetricsExporter;
import inbox.spi.UpdateSource;
import inbox.util.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires an {@link OffsetStore}, {@link BacklogProcessor},
 * {@link ReconnectionManager} and {@link RetentionSweeper} into a single
 * {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Inbox inbox = Inbox.builder()
 *     .connectionProvider(connProvider)
 *     .inboxStore(store)
 *     .updateSource(source)
 *     .connectivityProbe(probe)
 *     .handlerRegistry(registry)
 *     .build()) {
 *   inbox.start();
 *   // ...
 * }
 * }</pre>
 *
 * <p>{@link #start()} drains the backlog once, prunes the ledger once, then starts the
 * connectivity and retention schedules. Without a {@link ConnectivityProbe} no
 * connectivity schedule is started; drains then only happen through {@link #drainNow()}.
 */
public final class Inbox implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Inbox.class.getName());

  private final OffsetStore offsetStore;
  private final BacklogProcessor processor;
  private final ReconnectionManager reconnectionManager;
  private final RetentionSweeper sweeper;
  private final HandlerRegistry handlerRegistry;
  private final MetricsExporter metrics;
  private final boolean drainOnStart;
  private final AtomicBoolean started = new AtomicBoolean();

  private Inbox(Builder builder) {
    Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    Objects.requireNonNull(builder.inboxStore, "inboxStore");
    Objects.requireNonNull(builder.updateSource, "updateSource");
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainOnStart = builder.drainOnStart;

    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.offsetStore = new OffsetStore(builder.connectionProvider, builder.inboxStore, clock);
    this.processor = BacklogProcessor.builder()
        .offsetStore(offsetStore)
        .updateSource(builder.updateSource)
        .batchSize(builder.batchSize)
        .interMessageDelay(builder.interMessageDelay)
        .handlerTimeout(builder.handlerTimeout)
        .metrics(metrics)
        .sleeper(builder.sleeper)
        .clock(clock)
        .build();
    try {
      this.sweeper = RetentionSweeper.builder()
          .offsetStore(offsetStore)
          .retention(builder.retention)
          .interval(builder.retentionInterval)
          .batchSize(builder.retentionBatchSize)
          .metrics(metrics)
          .build();
      this.reconnectionManager = builder.connectivityProbe == null ? null
          : ReconnectionManager.builder()
              .processor(processor)
              .probe(builder.connectivityProbe)
              .handlerRegistry(handlerRegistry)
              .checkInterval(builder.connectivityCheckInterval)
              .metrics(metrics)
              .build();
    } catch (RuntimeException e) {
      processor.close();
      throw e;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Drains the backlog (if enabled), prunes the ledger once and starts the schedules.
   * Subsequent calls are no-ops.
   *
   * <p>A failing startup drain or prune is logged; the schedules start anyway so the
   * next connectivity check or sweep can make progress.
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    if (drainOnStart) {
      try {
        drainNow();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Startup backlog drain failed", e);
      }
    }
    sweeper.runOnce();
    if (reconnectionManager != null) {
      reconnectionManager.start();
    }
    sweeper.start();
    logger.log(Level.INFO, "Inbox started at cursor {0}", processorCursor());
  }

  private Object processorCursor() {
    try {
      return offsetStore.getLastOffset();
    } catch (RuntimeException e) {
      return "unknown";
    }
  }

  /**
   * Runs an on-demand drain with the configured handler registry.
   *
   * @return counts for this drain
   * @throws inbox.spi.StorageException if the cursor or ledger cannot be accessed
   */
  public DrainResult drainNow() {
    return processor.processBacklog(handlerRegistry);
  }

  public OffsetStore offsetStore() {
    return offsetStore;
  }

  public BacklogProcessor processor() {
    return processor;
  }

  /**
   * Returns the reconnection manager, or {@code null} if no probe was configured.
   */
  public ReconnectionManager reconnectionManager() {
    return reconnectionManager;
  }

  public RetentionSweeper retentionSweeper() {
    return sweeper;
  }

  /**
   * Shuts down components in order: retention sweeper, reconnection manager, processor.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      sweeper.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (reconnectionManager != null) {
      try {
        reconnectionManager.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    try {
      processor.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Inbox}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private InboxStore inboxStore;
    private UpdateSource updateSource;
    private ConnectivityProbe connectivityProbe;
    private HandlerRegistry handlerRegistry;
    private MetricsExporter metrics;
    private int batchSize = 100;
    private Duration interMessageDelay = Duration.ofMillis(100);
    private Duration handlerTimeout = Duration.ofSeconds(30);
    private Duration connectivityCheckInterval = Duration.ofMinutes(5);
    private Duration retention = Duration.ofDays(7);
    private Duration retentionInterval = Duration.ofDays(1);
    private int retentionBatchSize = OffsetStore.DEFAULT_PRUNE_BATCH_SIZE;
    private boolean drainOnStart = true;
    private Sleeper sleeper;
    private Clock clock;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /** <b>Required.</b> Source of JDBC connections for the cursor and ledger. */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> Dialect-specific persistence, see {@code JdbcInboxStores}. */
    public Builder inboxStore(InboxStore inboxStore) {
      this.inboxStore = inboxStore;
      return this;
    }

    /** <b>Required.</b> Message source client. */
    public Builder updateSource(UpdateSource updateSource) {
      this.updateSource = updateSource;
      return this;
    }

    /** <b>Required.</b> Handlers by update kind. */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /** Optional. Enables the periodic connectivity check. */
    public Builder connectivityProbe(ConnectivityProbe connectivityProbe) {
      this.connectivityProbe = connectivityProbe;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder interMessageDelay(Duration interMessageDelay) {
      this.interMessageDelay = interMessageDelay;
      return this;
    }

    public Builder handlerTimeout(Duration handlerTimeout) {
      this.handlerTimeout = handlerTimeout;
      return this;
    }

    public Builder connectivityCheckInterval(Duration connectivityCheckInterval) {
      this.connectivityCheckInterval = connectivityCheckInterval;
      return this;
    }

    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    public Builder retentionInterval(Duration retentionInterval) {
      this.retentionInterval = retentionInterval;
      return this;
    }

    public Builder retentionBatchSize(int retentionBatchSize) {
      this.retentionBatchSize = retentionBatchSize;
      return this;
    }

    /** Whether {@link Inbox#start()} drains the backlog. Defaults to {@code true}. */
    public Builder drainOnStart(boolean drainOnStart) {
      this.drainOnStart = drainOnStart;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the inbox. Call {@link Inbox#start()} to begin.
     *
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a numeric or duration setting is invalid
     * @throws IllegalStateException    if this builder was already used
     */
    public Inbox build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new Inbox(this);
    }
  }
}
