package inbox.jdbc;

import inbox.jdbc.store.AbstractJdbcInboxStore;
import inbox.jdbc.store.JdbcInboxStores;
import inbox.model.LedgerEntry;
import inbox.offset.OffsetStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store behavior against real databases. Subclasses provide the DataSource and store.
 */
abstract class AbstractInboxStoreIntegrationTest {

  private OffsetStore offsetStore;

  abstract DataSource dataSource();

  abstract AbstractJdbcInboxStore store();

  @BeforeEach
  void resetTables() throws Exception {
    SchemaInitializer.initialize(dataSource(), store());
    try (Connection conn = dataSource().getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM " + store().cursorTable());
      stmt.execute("DELETE FROM " + store().ledgerTable());
    }
    offsetStore = new OffsetStore(new DataSourceConnectionProvider(dataSource()), store());
  }

  @Test
  void detectMatchesDialect() {
    assertEquals(store().name(), JdbcInboxStores.detect(dataSource()).name());
  }

  @Test
  void cursorAdvancesMonotonically() {
    assertEquals(0L, offsetStore.getLastOffset());

    assertTrue(offsetStore.updateOffset(10));
    assertFalse(offsetStore.updateOffset(4));

    assertEquals(10L, offsetStore.getLastOffset());
  }

  @Test
  void duplicateLedgerInsertIsNoOpInsideTransaction() {
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    assertTrue(offsetStore.commit(new LedgerEntry(5, 1L, 2L, now, "message")));
    assertFalse(offsetStore.commit(new LedgerEntry(5, 1L, 2L, now, "message")));
    assertTrue(offsetStore.commit(new LedgerEntry(6, null, null, now, "inline_query")));

    assertTrue(offsetStore.isProcessed(5));
    assertEquals(6L, offsetStore.getLastOffset());
  }

  @Test
  void pruneDeletesInBatches() {
    Instant old = Instant.now().minus(Duration.ofDays(8));
    for (long id = 1; id <= 7; id++) {
      offsetStore.markProcessed(id, null, null, "message");
    }
    for (long id = 11; id <= 17; id++) {
      offsetStore.commit(new LedgerEntry(id, null, null, old, "message"));
    }

    assertEquals(7L, offsetStore.prune(Duration.ofDays(7), 3));

    assertTrue(offsetStore.isProcessed(1));
    assertFalse(offsetStore.isProcessed(11));
    assertEquals(17L, offsetStore.getLastOffset());
  }
}
