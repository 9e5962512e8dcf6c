package inbox.demo;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import inbox.HandleResult;
import inbox.Inbox;
import inbox.StandardUpdateKind;
import inbox.Update;
import inbox.backlog.DrainResult;
import inbox.jdbc.DataSourceConnectionProvider;
import inbox.jdbc.SchemaInitializer;
import inbox.jdbc.store.AbstractJdbcInboxStore;
import inbox.jdbc.store.JdbcInboxStores;
import inbox.model.Cursor;
import inbox.registry.DefaultHandlerRegistry;
import inbox.spi.UpdateSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Demo of an inbox draining a backlog from a flaky source, without Spring.
 *
 * <p>The cursor lives in an H2 file database, so running the demo twice shows the
 * second run resuming where the first one stopped.
 *
 * Run with: mvn -pl samples/inbox-demo exec:java
 */
public final class InboxDemo {

  public static void main(String[] args) throws Exception {
    // 1. H2 file database behind a HikariCP pool
    Path dbDir = Files.createDirectories(Path.of("target", "inbox-demo"));
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:file:" + dbDir.toAbsolutePath().resolve("inbox") + ";MODE=MySQL");
    config.setMaximumPoolSize(4);
    config.setPoolName("inbox-demo");

    try (HikariDataSource dataSource = new HikariDataSource(config)) {
      AbstractJdbcInboxStore store = JdbcInboxStores.detect(dataSource);
      SchemaInitializer.initialize(dataSource, store);

      // 2. A source holding 12 queued updates that goes offline every few fetches
      SimulatedSource source = new SimulatedSource(12);

      // 3. Handlers; update 5 is rejected permanently, update 9 fails once
      AtomicInteger flakyAttempts = new AtomicInteger();
      DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
          .register(StandardUpdateKind.MESSAGE, update -> {
            if (update.updateId() == 5) {
              return HandleResult.permanentFailure("unsupported sticker");
            }
            if (update.updateId() == 9 && flakyAttempts.getAndIncrement() == 0) {
              return HandleResult.transientFailure("reply API busy");
            }
            System.out.println("[Handler] message " + update.updateId() + ": " + update.payload());
            return HandleResult.success();
          })
          .register(StandardUpdateKind.CALLBACK_QUERY, update -> {
            System.out.println("[Handler] callback " + update.updateId());
            return HandleResult.success();
          });

      System.out.println("=== Inbox Demo ===\n");

      try (Inbox inbox = Inbox.builder()
          .connectionProvider(new DataSourceConnectionProvider(dataSource))
          .inboxStore(store)
          .updateSource(source)
          .connectivityProbe(source::isOnline)
          .handlerRegistry(registry)
          .batchSize(5)
          .interMessageDelay(Duration.ofMillis(50))
          .drainOnStart(false)
          .build()) {
        Cursor before = inbox.offsetStore().cursor();
        System.out.println("Cursor at startup: " + before.lastUpdateId() + "\n");
        inbox.start();

        // 4. Drain until the backlog is empty, simulating reconnects in between
        for (int round = 1; round <= 6; round++) {
          boolean online = inbox.reconnectionManager().checkConnectionAndRecover(registry);
          if (online) {
            DrainResult result = inbox.drainNow();
            System.out.println("Round " + round + ": " + result + "\n");
          } else {
            System.out.println("Round " + round + ": source offline, "
                + inbox.reconnectionManager().state() + "\n");
          }
          source.toggle();
        }

        System.out.println("=== Final state ===");
        System.out.println("Cursor: " + inbox.offsetStore().getLastOffset());
        System.out.println("Update 5 settled: " + inbox.offsetStore().isProcessed(5));
      }
    }
    System.out.println("\nDemo complete. Run again to see the cursor survive the restart.");
  }

  /**
   * In-memory source that alternates between reachable and unreachable.
   */
  static final class SimulatedSource implements UpdateSource {
    private final List<Update> queued = new ArrayList<>();
    private final AtomicBoolean online = new AtomicBoolean(true);

    SimulatedSource(int count) {
      for (long id = 1; id <= count; id++) {
        queued.add(id % 4 == 0
            ? Update.of(id, "callback_query", "{\"data\":\"vote:" + id + "\"}")
            : Update.of(id, 100L, id, "message", "{\"text\":\"note " + id + "\"}"));
      }
    }

    boolean isOnline() {
      return online.get();
    }

    void toggle() {
      online.set(!online.get());
    }

    @Override
    public List<Update> fetch(long offset, int limit) throws IOException {
      if (!online.get()) {
        throw new IOException("source unreachable");
      }
      List<Update> page = new ArrayList<>();
      for (Update update : queued) {
        if (update.updateId() >= offset && page.size() < limit) {
          page.add(update);
        }
      }
      return page;
    }
  }
}
