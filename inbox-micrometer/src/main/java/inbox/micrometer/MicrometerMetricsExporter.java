package inbox.micrometer;

import inbox.reconnect.ConnectionState;
import inbox.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code inbox.updates.processed}: updates handled (including unroutable ones)</li>
 *   <li>{@code inbox.updates.failed}: updates settled as permanent failures</li>
 *   <li>{@code inbox.updates.duplicate}: updates skipped as already settled</li>
 *   <li>{@code inbox.updates.unroutable}: updates with no registered handler</li>
 *   <li>{@code inbox.drain.stalled}: drains stopped by a transient failure</li>
 *   <li>{@code inbox.handler.timeout}: handler calls that exceeded the timeout</li>
 *   <li>{@code inbox.recoveries}: backlog drains triggered by reconnection</li>
 *   <li>{@code inbox.ledger.pruned}: ledger entries removed by retention</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code inbox.cursor}: highest settled update id</li>
 *   <li>{@code inbox.connection.state}: 1 connected, 0 disconnected, 2 recovering</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter processed;
  private final Counter failed;
  private final Counter duplicate;
  private final Counter unroutable;
  private final Counter stalled;
  private final Counter handlerTimeout;
  private final Counter recoveries;
  private final Counter pruned;
  private final Gauge cursorGauge;
  private final Gauge connectionStateGauge;

  private final AtomicLong cursor = new AtomicLong();
  private final AtomicInteger connectionState = new AtomicInteger(stateValue(ConnectionState.CONNECTED));
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "inbox"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "inbox");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several inboxes in one
   * registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "support.inbox"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.processed = counter(namePrefix + ".updates.processed", "Updates handled successfully");
    this.failed = counter(namePrefix + ".updates.failed", "Updates settled as permanent failures");
    this.duplicate = counter(namePrefix + ".updates.duplicate", "Updates skipped as already settled");
    this.unroutable = counter(namePrefix + ".updates.unroutable", "Updates with no registered handler");
    this.stalled = counter(namePrefix + ".drain.stalled", "Drains stopped by a transient failure");
    this.handlerTimeout = counter(namePrefix + ".handler.timeout", "Handler calls that timed out");
    this.recoveries = counter(namePrefix + ".recoveries", "Backlog drains after reconnection");
    this.pruned = counter(namePrefix + ".ledger.pruned", "Ledger entries removed by retention");

    this.cursorGauge = Gauge.builder(namePrefix + ".cursor", cursor, AtomicLong::get)
        .description("Highest settled update id")
        .register(registry);
    this.connectionStateGauge = Gauge.builder(namePrefix + ".connection.state",
            connectionState, AtomicInteger::get)
        .description("1 connected, 0 disconnected, 2 recovering")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementProcessed() {
    if (closed) return;
    processed.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementDuplicate() {
    if (closed) return;
    duplicate.increment();
  }

  @Override
  public void incrementUnroutable() {
    if (closed) return;
    unroutable.increment();
  }

  @Override
  public void incrementStalled() {
    if (closed) return;
    stalled.increment();
  }

  @Override
  public void incrementHandlerTimeout() {
    if (closed) return;
    handlerTimeout.increment();
  }

  @Override
  public void incrementRecoveries() {
    if (closed) return;
    recoveries.increment();
  }

  @Override
  public void recordPruned(long count) {
    if (closed || count <= 0) return;
    pruned.increment(count);
  }

  @Override
  public void recordCursor(long updateId) {
    if (closed) return;
    cursor.set(updateId);
  }

  @Override
  public void recordConnectionState(ConnectionState state) {
    if (closed) return;
    connectionState.set(stateValue(state));
  }

  static int stateValue(ConnectionState state) {
    switch (state) {
      case CONNECTED:
        return 1;
      case RECOVERING:
        return 2;
      default:
        return 0;
    }
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link inbox.Inbox#close()} calls this so stale gauges do not linger.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(processed, failed, duplicate, unroutable, stalled,
        handlerTimeout, recoveries, pruned, cursorGauge, connectionStateGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
