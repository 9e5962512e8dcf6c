package inbox.backlog;

import inbox.HandleResult;
import inbox.PermanentDeliveryException;
import inbox.TransientDeliveryException;
import inbox.Update;
import inbox.model.LedgerEntry;
import inbox.offset.OffsetStore;
import inbox.registry.DefaultHandlerRegistry;
import inbox.spi.StorageException;
import inbox.testing.InMemoryInboxStore;
import inbox.testing.RecordingMetrics;
import inbox.testing.ScriptedUpdateSource;
import inbox.testing.TestConnections;
import inbox.util.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BacklogProcessorTest {

  private InMemoryInboxStore store;
  private OffsetStore offsetStore;
  private RecordingMetrics metrics;
  private final List<Long> handled = new CopyOnWriteArrayList<>();
  private final List<String> events = new CopyOnWriteArrayList<>();
  private final Sleeper recordingSleeper = duration -> events.add("sleep");
  private BacklogProcessor processor;

  @BeforeEach
  void setUp() {
    store = new InMemoryInboxStore();
    offsetStore = new OffsetStore(TestConnections.stubProvider(), store);
    metrics = new RecordingMetrics();
  }

  @AfterEach
  void tearDown() {
    if (processor != null) {
      processor.close();
    }
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRejectsNullOffsetStore() {
    assertThrows(NullPointerException.class, () ->
        BacklogProcessor.builder().updateSource(new ScriptedUpdateSource()).build());
  }

  @Test
  void builderRejectsNullUpdateSource() {
    assertThrows(NullPointerException.class, () ->
        BacklogProcessor.builder().offsetStore(offsetStore).build());
  }

  @Test
  void builderRejectsZeroBatchSize() {
    assertThrows(IllegalArgumentException.class, () ->
        BacklogProcessor.builder()
            .offsetStore(offsetStore)
            .updateSource(new ScriptedUpdateSource())
            .batchSize(0)
            .build());
  }

  @Test
  void builderRejectsNegativeDelay() {
    assertThrows(IllegalArgumentException.class, () ->
        BacklogProcessor.builder()
            .offsetStore(offsetStore)
            .updateSource(new ScriptedUpdateSource())
            .interMessageDelay(Duration.ofMillis(-1))
            .build());
  }

  @Test
  void builderRejectsZeroHandlerTimeout() {
    assertThrows(IllegalArgumentException.class, () ->
        BacklogProcessor.builder()
            .offsetStore(offsetStore)
            .updateSource(new ScriptedUpdateSource())
            .handlerTimeout(Duration.ZERO)
            .build());
  }

  // ── Ordering, completeness, idempotence ─────────────────────────

  @Test
  void emptyBacklogReturnsEmptyResult() {
    processor = newProcessor(new ScriptedUpdateSource(), 100);

    DrainResult result = processor.processBacklog(recordingRegistry());

    assertEquals(0, result.processed());
    assertEquals(0, result.failed());
    assertFalse(result.stalled());
    assertTrue(result.isEmpty());
    assertEquals(0L, result.cursor());
  }

  @Test
  void drainsPendingUpdatesInOrderFromCursor() {
    store.setCursor(4);
    ScriptedUpdateSource source = new ScriptedUpdateSource(
        msg(3), msg(4), msg(5), msg(6), msg(7), msg(8));
    processor = newProcessor(source, 100);

    DrainResult result = processor.processBacklog(recordingRegistry());

    assertEquals(List.of(5L, 6L, 7L, 8L), handled);
    assertEquals(4, result.processed());
    assertEquals(0, result.failed());
    assertEquals(8L, result.cursor());
    assertEquals(8L, offsetStore.getLastOffset());
    assertEquals(List.of(5L, 6L, 7L, 8L), store.ledgerIds());
    assertEquals(5L, source.fetchOffsets().get(0));
    assertEquals(4, metrics.processed.get());
    assertEquals(8L, metrics.cursor.get());
  }

  @Test
  void secondDrainWithoutNewUpdatesDoesNothing() {
    ScriptedUpdateSource source = new ScriptedUpdateSource(msg(1), msg(2));
    processor = newProcessor(source, 100);
    processor.processBacklog(recordingRegistry());

    DrainResult second = processor.processBacklog(recordingRegistry());

    assertEquals(0, second.processed());
    assertEquals(0, second.failed());
    assertEquals(List.of(1L, 2L), handled);
    assertEquals(2L, second.cursor());
  }

  // ── Dedup ───────────────────────────────────────────────────────

  @Test
  void skipsUpdatesAlreadyInLedger() {
    store.setCursor(4);
    store.putLedgerEntry(new LedgerEntry(6, null, null, Instant.now(), "message"));
    processor = newProcessor(new ScriptedUpdateSource(msg(5), msg(6), msg(7)), 100);

    DrainResult result = processor.processBacklog(recordingRegistry());

    assertEquals(List.of(5L, 7L), handled);
    assertEquals(2, result.processed());
    assertEquals(1, result.duplicates());
    assertEquals(7L, result.cursor());
    assertEquals(1, metrics.duplicates.get());
  }

  @Test
  void redeliveredUpdateIsHandledOnce() {
    ScriptedUpdateSource source = new ScriptedUpdateSource()
        .enqueuePage(msg(5), msg(6))
        .enqueuePage(msg(6), msg(7));
    store.setCursor(4);
    processor = newProcessor(source, 2);

    DrainResult result = processor.processBacklog(recordingRegistry());

    assertEquals(List.of(5L, 6L, 7L), handled);
    assertEquals(3, result.processed());
    assertEquals(1, result.duplicates());
    assertEquals(7L, result.cursor());
  }

  // ── Failure classes ─────────────────────────────────────────────

  @Test
  void transientFailureStallsAndNextDrainResumesAtFailedUpdate() {
    store.setCursor(4);
    ScriptedUpdateSource source = new ScriptedUpdateSource(msg(5), msg(6), msg(7), msg(8));
    AtomicInteger attemptsOn7 = new AtomicInteger();
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("message", update -> {
          if (update.updateId() == 7 && attemptsOn7.incrementAndGet() == 1) {
            return HandleResult.transientFailure("rate limited");
          }
          handled.add(update.updateId());
          return HandleResult.success();
        });
    processor = newProcessor(source, 100);

    DrainResult first = processor.processBacklog(registry);

    assertTrue(first.stalled());
    assertEquals(2, first.processed());
    assertEquals(0, first.failed());
    assertEquals(6L, first.cursor());
    assertFalse(offsetStore.isProcessed(7));
    assertEquals(1, metrics.stalled.get());

    DrainResult second = processor.processBacklog(registry);

    assertFalse(second.stalled());
    assertEquals(2, second.processed());
    assertEquals(8L, second.cursor());
    assertEquals(7L, source.fetchOffsets().get(1));
    assertEquals(List.of(5L, 6L, 7L, 8L), handled);
  }

  @Test
  void unexpectedExceptionIsTransient() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("message", update -> {
          throw new IllegalStateException("downstream unavailable");
        });
    processor = newProcessor(new ScriptedUpdateSource(msg(1), msg(2)), 100);

    DrainResult result = processor.processBacklog(registry);

    assertTrue(result.stalled());
    assertEquals(0, result.processed());
    assertEquals(0L, result.cursor());
    assertTrue(store.ledgerIds().isEmpty());
  }

  @Test
  void transientDeliveryExceptionIsTransient() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("message", update -> {
          throw new TransientDeliveryException("retry later");
        });
    processor = newProcessor(new ScriptedUpdateSource(msg(1)), 100);

    DrainResult result = processor.processBacklog(registry);

    assertTrue(result.stalled());
    assertEquals(0L, offsetStore.getLastOffset());
  }

  @Test
  void nullResultIsTransient() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("message", update -> null);
    processor = newProcessor(new ScriptedUpdateSource(msg(1)), 100);

    DrainResult result = processor.processBacklog(registry);

    assertTrue(result.stalled());
    assertFalse(offsetStore.isProcessed(1));
  }

  @Test
  void permanentFailureIsRecordedAndSkipped() {
    store.setCursor(4);
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("message", update -> {
          if (update.updateId() == 6) {
            return HandleResult.permanentFailure("malformed payload");
          }
          handled.add(update.updateId());
          return HandleResult.success();
        });
    processor = newProcessor(new ScriptedUpdateSource(msg(5), msg(6), msg(7), msg(8)), 100);

    DrainResult result = processor.processBacklog(registry);

    assertFalse(result.stalled());
    assertEquals(3, result.processed());
    assertEquals(1, result.failed());
    assertEquals(8L, result.cursor());
    assertTrue(offsetStore.isProcessed(6));
    assertEquals(List.of(5L, 7L, 8L), handled);
    assertEquals(1, metrics.failed.get());

    DrainResult again = processor.processBacklog(registry);
    assertEquals(0, again.failed());
    assertEquals(0, again.processed());
  }

  @Test
  void permanentDeliveryExceptionIsPermanent() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("message", update -> {
          throw new PermanentDeliveryException("unknown chat");
        });
    processor = newProcessor(new ScriptedUpdateSource(msg(1), msg(2)), 100);

    DrainResult result = processor.processBacklog(registry);

    assertEquals(2, result.failed());
    assertEquals(2L, result.cursor());
  }

  @Test
  void updateWithoutHandlerIsSettledAsProcessed() {
    processor = newProcessor(new ScriptedUpdateSource(
        msg(1), Update.of(2, "poll", "{}"), msg(3)), 100);

    DrainResult result = processor.processBacklog(recordingRegistry());

    assertEquals(3, result.processed());
    assertEquals(3L, result.cursor());
    assertEquals(List.of(1L, 3L), handled);
    assertTrue(offsetStore.isProcessed(2));
    assertEquals(1, metrics.unroutable.get());
  }

  @Test
  void slowHandlerTimesOutAsTransient() {
    CountDownLatch interrupted = new CountDownLatch(1);
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("message", update -> {
          try {
            Thread.sleep(10_000);
          } catch (InterruptedException e) {
            interrupted.countDown();
            throw e;
          }
          return HandleResult.success();
        });
    processor = BacklogProcessor.builder()
        .offsetStore(offsetStore)
        .updateSource(new ScriptedUpdateSource(msg(1)))
        .handlerTimeout(Duration.ofMillis(100))
        .metrics(metrics)
        .sleeper(recordingSleeper)
        .build();

    DrainResult result = processor.processBacklog(registry);

    assertTrue(result.stalled());
    assertEquals(0L, result.cursor());
    assertEquals(1, metrics.timeouts.get());
    assertDoesNotThrow(() -> assertTrue(interrupted.await(5, TimeUnit.SECONDS)));
  }

  @Test
  void handlerIgnoringInterruptBlocksLaterDispatchesUntilItReturns() throws Exception {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    AtomicInteger calls = new AtomicInteger();
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch stuckCallReturned = new CountDownLatch(1);
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("message", update -> {
          int now = inFlight.incrementAndGet();
          maxInFlight.accumulateAndGet(now, Math::max);
          try {
            if (calls.incrementAndGet() == 1) {
              // busy-wait that never checks the interrupt flag
              long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
              while (release.getCount() > 0 && System.nanoTime() < deadline) {
                Thread.onSpinWait();
              }
              stuckCallReturned.countDown();
            }
            handled.add(update.updateId());
            return HandleResult.success();
          } finally {
            inFlight.decrementAndGet();
          }
        });
    processor = BacklogProcessor.builder()
        .offsetStore(offsetStore)
        .updateSource(new ScriptedUpdateSource(msg(1), msg(2)))
        .handlerTimeout(Duration.ofMillis(100))
        .metrics(metrics)
        .sleeper(recordingSleeper)
        .build();

    DrainResult first = processor.processBacklog(registry);
    DrainResult second = processor.processBacklog(registry);

    assertTrue(first.stalled());
    assertTrue(second.stalled());
    assertEquals(0L, second.cursor());
    assertEquals(1, calls.get());

    release.countDown();
    assertTrue(stuckCallReturned.await(5, TimeUnit.SECONDS));

    // the stuck call may still be unwinding; drains stall until it has
    DrainResult third = processor.processBacklog(registry);
    for (int i = 0; i < 100 && third.stalled(); i++) {
      Thread.sleep(20);
      third = processor.processBacklog(registry);
    }

    assertEquals(2, third.processed());
    assertEquals(2L, third.cursor());
    assertEquals(1, maxInFlight.get());
    assertEquals(List.of(1L, 1L, 2L), handled);
  }

  // ── Volume & pacing ─────────────────────────────────────────────

  @Test
  void drainsLargeBacklogInPagesWithPauses() {
    ScriptedUpdateSource source = new ScriptedUpdateSource().recordEventsTo(events);
    for (long id = 1; id <= 150; id++) {
      source.add(msg(id));
    }
    processor = newProcessor(source, 100);

    DrainResult result = processor.processBacklog(recordingRegistry());

    assertEquals(150, result.processed());
    assertEquals(150L, result.cursor());
    assertEquals(List.of(1L, 101L), source.fetchOffsets());
    assertEquals(150, events.stream().filter("sleep"::equals).count());
    int secondFetch = events.indexOf("fetch:101");
    assertTrue(secondFetch > 0);
    assertEquals("sleep", events.get(secondFetch - 1));
  }

  @Test
  void pausesForConfiguredDelay() {
    List<Duration> pauses = new CopyOnWriteArrayList<>();
    processor = BacklogProcessor.builder()
        .offsetStore(offsetStore)
        .updateSource(new ScriptedUpdateSource(msg(1), msg(2)))
        .interMessageDelay(Duration.ofMillis(250))
        .sleeper(pauses::add)
        .build();

    processor.processBacklog(recordingRegistry());

    assertEquals(List.of(Duration.ofMillis(250), Duration.ofMillis(250)), pauses);
  }

  // ── Source, store and thread failures ───────────────────────────

  @Test
  void fetchFailureEndsDrainWithoutThrowing() {
    ScriptedUpdateSource source = new ScriptedUpdateSource(msg(1))
        .failNextFetch(new IOException("network down"));
    processor = newProcessor(source, 100);

    DrainResult result = processor.processBacklog(recordingRegistry());

    assertTrue(result.stalled());
    assertEquals(0, result.processed());

    DrainResult retry = processor.processBacklog(recordingRegistry());
    assertEquals(1, retry.processed());
  }

  @Test
  void storageFailurePropagates() {
    store.failAll(true);
    processor = newProcessor(new ScriptedUpdateSource(msg(1)), 100);

    assertThrows(StorageException.class, () -> processor.processBacklog(recordingRegistry()));
    assertFalse(processor.isDraining());
  }

  @Test
  void interruptDuringPauseStopsAfterCommittedUpdate() {
    processor = BacklogProcessor.builder()
        .offsetStore(offsetStore)
        .updateSource(new ScriptedUpdateSource(msg(1), msg(2), msg(3)))
        .sleeper(duration -> {
          throw new InterruptedException();
        })
        .build();

    DrainResult result = processor.processBacklog(recordingRegistry());

    assertTrue(Thread.interrupted());
    assertTrue(result.stalled());
    assertEquals(1, result.processed());
    assertEquals(1L, offsetStore.getLastOffset());
  }

  @Test
  void concurrentDrainWaitsForRunningDrain() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger calls = new AtomicInteger();
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("message", update -> {
          calls.incrementAndGet();
          entered.countDown();
          release.await(5, TimeUnit.SECONDS);
          return HandleResult.success();
        });
    processor = newProcessor(new ScriptedUpdateSource(msg(1)), 100);

    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<DrainResult> first = pool.submit(() -> processor.processBacklog(registry));
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      assertTrue(processor.isDraining());

      Future<DrainResult> second = pool.submit(() -> processor.processBacklog(registry));
      Thread.sleep(100);
      assertFalse(second.isDone());

      release.countDown();
      assertEquals(1, first.get(5, TimeUnit.SECONDS).processed());
      assertEquals(0, second.get(5, TimeUnit.SECONDS).processed());
      assertEquals(1, calls.get());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void closedProcessorRejectsDrains() {
    processor = newProcessor(new ScriptedUpdateSource(), 100);
    processor.close();

    assertThrows(IllegalStateException.class, () -> processor.processBacklog(recordingRegistry()));
  }

  // ── Helpers ─────────────────────────────────────────────────────

  private BacklogProcessor newProcessor(ScriptedUpdateSource source, int batchSize) {
    return BacklogProcessor.builder()
        .offsetStore(offsetStore)
        .updateSource(source)
        .batchSize(batchSize)
        .metrics(metrics)
        .sleeper(recordingSleeper)
        .build();
  }

  private DefaultHandlerRegistry recordingRegistry() {
    return new DefaultHandlerRegistry()
        .register("message", update -> {
          handled.add(update.updateId());
          events.add("handle:" + update.updateId());
          return HandleResult.success();
        });
  }

  private static Update msg(long id) {
    return Update.of(id, 100L, id, "message", "{\"text\":\"hi " + id + "\"}");
  }
}
