package inbox.backlog;

import inbox.HandleResult;
import inbox.PermanentDeliveryException;
import inbox.Update;
import inbox.UpdateHandler;
import inbox.model.LedgerEntry;
import inbox.offset.OffsetStore;
import inbox.registry.HandlerRegistry;
import inbox.spi.MetricsExporter;
import inbox.spi.UpdateSource;
import inbox.util.DaemonThreadFactory;
import inbox.util.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains the backlog of updates that accumulated past the stored cursor, strictly in
 * ascending update id order.
 *
 * <p>For each update the processor consults the ledger, dispatches to the handler
 * registered for the update's kind, and commits the ledger entry together with the
 * cursor as soon as the update's fate is settled:
 * <ul>
 *   <li><b>already settled</b>: skipped, counted as a duplicate</li>
 *   <li><b>no handler</b>: settled as processed so it cannot block the cursor</li>
 *   <li><b>success</b>: settled as processed</li>
 *   <li><b>permanent failure</b>: settled as failed, never retried</li>
 *   <li><b>transient failure</b>: nothing is written and the drain stops; the next
 *       drain resumes at exactly this update</li>
 * </ul>
 *
 * <p>Handlers run one at a time on a worker pool so each call can be time-boxed; a
 * handler that exceeds {@link Builder#handlerTimeout} is interrupted and treated as a
 * transient failure. A fixed pause follows every settled update to respect source
 * rate limits.
 *
 * <p>Concurrent {@link #processBacklog} calls are serialized: a second caller waits for
 * the in-flight drain and then drains whatever is left.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see OffsetStore
 * @see HandlerRegistry
 */
public final class BacklogProcessor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BacklogProcessor.class.getName());

  private final OffsetStore offsetStore;
  private final UpdateSource updateSource;
  private final int batchSize;
  private final Duration interMessageDelay;
  private final Duration handlerTimeout;
  private final MetricsExporter metrics;
  private final Sleeper sleeper;
  private final Clock clock;
  private final ExecutorService handlerPool;
  private final ReentrantLock drainLock = new ReentrantLock();
  // Guarded by drainLock. A timed-out call that ignored its interrupt.
  private HandlerCall lingeringCall;
  private volatile boolean closed;

  private BacklogProcessor(Builder builder) {
    this.offsetStore = Objects.requireNonNull(builder.offsetStore, "offsetStore");
    this.updateSource = Objects.requireNonNull(builder.updateSource, "updateSource");

    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interMessageDelay == null || builder.interMessageDelay.isNegative()) {
      throw new IllegalArgumentException("interMessageDelay must be >= 0");
    }
    if (builder.handlerTimeout == null || builder.handlerTimeout.isNegative()
        || builder.handlerTimeout.isZero()) {
      throw new IllegalArgumentException("handlerTimeout must be > 0");
    }

    this.batchSize = builder.batchSize;
    this.interMessageDelay = builder.interMessageDelay;
    this.handlerTimeout = builder.handlerTimeout;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD_SLEEP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.handlerPool = Executors.newCachedThreadPool(new DaemonThreadFactory("inbox-handler-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Drains pending updates, starting right after the stored cursor.
   *
   * <p>Returns when a page comes back shorter than the batch size, when a handler
   * reports a transient failure, when the source cannot be reached, or when the calling
   * thread is interrupted. Everything settled before that point stays committed.
   *
   * @param handlers handler lookup by update kind
   * @return counts for this call
   * @throws inbox.spi.StorageException if the cursor or ledger cannot be read or written
   * @throws IllegalStateException      if the processor has been closed
   */
  public DrainResult processBacklog(HandlerRegistry handlers) {
    Objects.requireNonNull(handlers, "handlers");
    if (closed) {
      throw new IllegalStateException("BacklogProcessor has been closed");
    }
    try {
      drainLock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new DrainResult(0, 0, 0, true, offsetStore.getLastOffset());
    }
    try {
      return drain(handlers);
    } finally {
      drainLock.unlock();
    }
  }

  /**
   * Returns {@code true} while a drain is running.
   */
  public boolean isDraining() {
    return drainLock.isLocked();
  }

  private DrainResult drain(HandlerRegistry handlers) {
    long cursor = offsetStore.getLastOffset();
    long nextOffset = cursor + 1;
    int processed = 0;
    int failed = 0;
    int duplicates = 0;
    boolean stalled = false;
    logger.log(Level.FINE, "Draining backlog from offset {0}", nextOffset);

    pages:
    while (true) {
      if (closed || Thread.currentThread().isInterrupted()) {
        stalled = true;
        break;
      }
      List<Update> page = fetchPage(nextOffset);
      if (page == null) {
        stalled = true;
        break;
      }
      if (page.isEmpty()) {
        break;
      }
      long pageStart = nextOffset;
      logger.log(Level.FINE, "Fetched {0} updates, ids {1} - {2}", new Object[]{
          page.size(), page.get(0).updateId(), page.get(page.size() - 1).updateId()});

      for (Update update : page) {
        long updateId = update.updateId();
        if (updateId <= cursor || offsetStore.isProcessed(updateId)) {
          duplicates++;
          metrics.incrementDuplicate();
          logger.log(Level.FINE, "Skipping already settled updateId={0}", updateId);
          if (updateId > cursor && offsetStore.updateOffset(updateId)) {
            cursor = updateId;
            metrics.recordCursor(cursor);
          }
          nextOffset = Math.max(nextOffset, updateId + 1);
          continue;
        }

        Outcome outcome = dispatch(update, handlers);
        if (outcome == Outcome.TRANSIENT) {
          stalled = true;
          metrics.incrementStalled();
          logger.log(Level.WARNING, "Backlog drain stalled at updateId={0}; cursor stays at {1}",
              new Object[]{updateId, cursor});
          break pages;
        }

        offsetStore.commit(LedgerEntry.of(update, clock.instant()));
        cursor = updateId;
        nextOffset = updateId + 1;
        metrics.recordCursor(cursor);
        if (outcome == Outcome.PERMANENT) {
          failed++;
          metrics.incrementFailed();
        } else {
          processed++;
          metrics.incrementProcessed();
        }

        if (!pause()) {
          stalled = true;
          break pages;
        }
      }

      if (page.size() < batchSize) {
        break;
      }
      if (nextOffset == pageStart) {
        logger.log(Level.WARNING, "Source returned a full page without progress at offset {0}",
            nextOffset);
        break;
      }
    }

    Level level = (processed > 0 || failed > 0 || stalled) ? Level.INFO : Level.FINE;
    logger.log(level, "Backlog drain finished: processed={0}, failed={1}, duplicates={2}, "
        + "stalled={3}, cursor={4}", new Object[]{processed, failed, duplicates, stalled, cursor});
    return new DrainResult(processed, failed, duplicates, stalled, cursor);
  }

  /**
   * Fetches one page. Returns {@code null} on failure, to distinguish from an empty page.
   */
  private List<Update> fetchPage(long offset) {
    try {
      List<Update> page = updateSource.fetch(offset, batchSize);
      return page == null ? List.of() : page;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to fetch updates from offset " + offset, e);
      return null;
    }
  }

  private Outcome dispatch(Update update, HandlerRegistry handlers) {
    if (lingeringCall != null) {
      if (lingeringCall.isRunning()) {
        logger.log(Level.WARNING, "Handler for updateId={0} is still running after its timeout; "
            + "holding back updateId={1}", new Object[]{lingeringCall.updateId(), update.updateId()});
        return Outcome.TRANSIENT;
      }
      lingeringCall = null;
    }

    UpdateHandler handler = handlers.handlerFor(update.kind());
    if (handler == null) {
      metrics.incrementUnroutable();
      logger.log(Level.WARNING, "No handler for kind={0}; settling updateId={1} as processed",
          new Object[]{update.kind(), update.updateId()});
      return Outcome.SUCCESS;
    }

    HandlerCall call = new HandlerCall(handler, update);
    Future<HandleResult> future;
    try {
      future = handlerPool.submit(call);
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Handler pool rejected updateId=" + update.updateId(), e);
      return Outcome.TRANSIENT;
    }

    try {
      return classify(update, future.get(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS));
    } catch (TimeoutException e) {
      abandon(call, future);
      metrics.incrementHandlerTimeout();
      logger.log(Level.WARNING, "Handler for updateId={0} timed out after {1}",
          new Object[]{update.updateId(), handlerTimeout});
      return Outcome.TRANSIENT;
    } catch (InterruptedException e) {
      abandon(call, future);
      Thread.currentThread().interrupt();
      return Outcome.TRANSIENT;
    } catch (ExecutionException e) {
      return classifyFailure(update, e.getCause());
    }
  }

  /**
   * Cancels a call the drain stopped waiting for. If the handler keeps running despite
   * the interrupt, later dispatches stall until it returns.
   */
  private void abandon(HandlerCall call, Future<HandleResult> future) {
    call.abandonIfQueued();
    future.cancel(true);
    if (call.isRunning()) {
      lingeringCall = call;
    }
  }

  private Outcome classify(Update update, HandleResult result) {
    if (result instanceof HandleResult.Success) {
      return Outcome.SUCCESS;
    }
    if (result instanceof HandleResult.PermanentFailure permanent) {
      logger.log(Level.SEVERE, "Update {0} rejected permanently: {1}",
          new Object[]{update.updateId(), permanent.reason()});
      return Outcome.PERMANENT;
    }
    if (result instanceof HandleResult.TransientFailure transientFailure) {
      logger.log(Level.WARNING, "Update {0} failed transiently: {1}",
          new Object[]{update.updateId(), transientFailure.reason()});
      return Outcome.TRANSIENT;
    }
    logger.log(Level.WARNING, "Handler returned no result for updateId={0}", update.updateId());
    return Outcome.TRANSIENT;
  }

  private Outcome classifyFailure(Update update, Throwable failure) {
    if (failure instanceof PermanentDeliveryException) {
      logger.log(Level.SEVERE, "Update " + update.updateId() + " rejected permanently", failure);
      return Outcome.PERMANENT;
    }
    logger.log(Level.WARNING, "Update " + update.updateId() + " failed transiently", failure);
    return Outcome.TRANSIENT;
  }

  /**
   * Returns {@code false} if the drain should stop.
   */
  private boolean pause() {
    if (closed) {
      return false;
    }
    try {
      sleeper.sleep(interMessageDelay);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Stops accepting drains and shuts the handler pool down. A drain in progress stops
   * after the update it is working on.
   */
  @Override
  public void close() {
    closed = true;
    handlerPool.shutdownNow();
    try {
      if (!handlerPool.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warning("Handler threads did not stop within 5 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private enum Outcome {
    SUCCESS,
    PERMANENT,
    TRANSIENT
  }

  /**
   * Handler invocation that tracks whether its thread is still inside the handler.
   * {@link Future#isDone()} turns true on cancel even while the handler runs on.
   */
  private static final class HandlerCall implements Callable<HandleResult> {
    private static final int QUEUED = 0;
    private static final int RUNNING = 1;
    private static final int FINISHED = 2;

    private final UpdateHandler handler;
    private final Update update;
    private final AtomicInteger state = new AtomicInteger(QUEUED);

    HandlerCall(UpdateHandler handler, Update update) {
      this.handler = handler;
      this.update = update;
    }

    @Override
    public HandleResult call() throws Exception {
      if (!state.compareAndSet(QUEUED, RUNNING)) {
        return null;
      }
      try {
        return handler.handle(update);
      } finally {
        state.set(FINISHED);
      }
    }

    void abandonIfQueued() {
      state.compareAndSet(QUEUED, FINISHED);
    }

    boolean isRunning() {
      return state.get() == RUNNING;
    }

    long updateId() {
      return update.updateId();
    }
  }

  /** Builder for {@link BacklogProcessor}. */
  public static final class Builder {
    private OffsetStore offsetStore;
    private UpdateSource updateSource;
    private int batchSize = 100;
    private Duration interMessageDelay = Duration.ofMillis(100);
    private Duration handlerTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;
    private Sleeper sleeper;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the cursor and ledger store.
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
     * Sets the message source client that pages through pending updates.
     *
     * <p><b>Required.</b>
     *
     * @param updateSource the update source
     * @return this builder
     */
    public Builder updateSource(UpdateSource updateSource) {
      this.updateSource = updateSource;
      return this;
    }

    /**
     * Sets the page size requested from the source.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param batchSize updates per page
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the pause after each settled update.
     *
     * <p>Optional. Defaults to {@code 100ms}. Must be &ge; 0.
     *
     * @param interMessageDelay pause between dispatches
     * @return this builder
     */
    public Builder interMessageDelay(Duration interMessageDelay) {
      this.interMessageDelay = interMessageDelay;
      return this;
    }

    /**
     * Sets the hard limit for a single handler call.
     *
     * <p>Optional. Defaults to {@code 30s}. Must be &gt; 0.
     *
     * @param handlerTimeout handler time box
     * @return this builder
     */
    public Builder handlerTimeout(Duration handlerTimeout) {
      this.handlerTimeout = handlerTimeout;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how the processor pauses between dispatches.
     *
     * <p>Optional. Defaults to {@link Sleeper#THREAD_SLEEP}.
     *
     * @param sleeper the pause implementation
     * @return this builder
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets the clock used for ledger timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the processor.
     *
     * @return a new {@link BacklogProcessor}
     * @throws NullPointerException     if {@code offsetStore} or {@code updateSource} is null
     * @throws IllegalArgumentException if {@code batchSize <= 0}, {@code interMessageDelay}
     *                                  is negative, or {@code handlerTimeout} is not positive
     */
    public BacklogProcessor build() {
      return new BacklogProcessor(this);
    }
  }
}
