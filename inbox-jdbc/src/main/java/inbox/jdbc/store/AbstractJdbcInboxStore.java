package inbox.jdbc.store;

import inbox.jdbc.JdbcTemplate;
import inbox.jdbc.TableNames;
import inbox.model.Cursor;
import inbox.model.LedgerEntry;
import inbox.spi.InboxStore;
import inbox.spi.StorageException;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Base JDBC inbox store with standard SQL implementations.
 *
 * <p>The cursor table holds a single row with {@code id = 1}. Subclasses override the
 * idempotent inserts and the batched delete where the database has better syntax.
 * Register custom implementations via
 * {@code META-INF/services/inbox.jdbc.store.AbstractJdbcInboxStore}.
 *
 * @see JdbcInboxStores
 */
public abstract class AbstractJdbcInboxStore implements InboxStore {
  protected static final int CURSOR_ROW_ID = 1;

  private static final JdbcTemplate.RowMapper<Cursor> CURSOR_ROW_MAPPER = rs -> new Cursor(
      rs.getLong("last_update_id"),
      toInstant(rs.getTimestamp("last_processed_time")),
      toInstant(rs.getTimestamp("created_at")));

  private final String cursorTable;
  private final String ledgerTable;

  protected AbstractJdbcInboxStore() {
    this(TableNames.DEFAULT_CURSOR_TABLE, TableNames.DEFAULT_LEDGER_TABLE);
  }

  protected AbstractJdbcInboxStore(String cursorTable, String ledgerTable) {
    this.cursorTable = TableNames.validate(cursorTable);
    this.ledgerTable = TableNames.validate(ledgerTable);
  }

  /**
   * Unique identifier for this inbox store (e.g., "mysql", "postgresql", "h2"). Also
   * names the schema script under {@code schema/}.
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this inbox store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect that uses the given tables.
   */
  public abstract AbstractJdbcInboxStore withTables(String cursorTable, String ledgerTable);

  public String cursorTable() {
    return cursorTable;
  }

  public String ledgerTable() {
    return ledgerTable;
  }

  @Override
  public Cursor readCursor(Connection conn) {
    String sql = "SELECT last_update_id, last_processed_time, created_at FROM " + cursorTable +
        " WHERE id=?";
    List<Cursor> rows = JdbcTemplate.query(conn, sql, CURSOR_ROW_MAPPER, CURSOR_ROW_ID);
    return rows.isEmpty() ? Cursor.INITIAL : rows.get(0);
  }

  /**
   * Check-then-insert; a concurrent insert that wins the race surfaces as a constraint
   * violation, which is ignored.
   */
  @Override
  public void ensureCursor(Connection conn, Instant now) {
    String exists = "SELECT 1 FROM " + cursorTable + " WHERE id=?";
    if (!JdbcTemplate.query(conn, exists, rs -> 1, CURSOR_ROW_ID).isEmpty()) {
      return;
    }
    String sql = "INSERT INTO " + cursorTable +
        " (id, last_update_id, last_processed_time, created_at) VALUES (?,0,NULL,?)";
    try {
      JdbcTemplate.update(conn, sql, CURSOR_ROW_ID, Timestamp.from(now));
    } catch (StorageException e) {
      if (!JdbcTemplate.isConstraintViolation(e)) {
        throw e;
      }
    }
  }

  @Override
  public boolean advanceCursor(Connection conn, long updateId, Instant now) {
    String sql = "UPDATE " + cursorTable +
        " SET last_update_id=?, last_processed_time=? WHERE id=? AND last_update_id<?";
    return JdbcTemplate.update(conn, sql,
        updateId, Timestamp.from(now), CURSOR_ROW_ID, updateId) > 0;
  }

  @Override
  public boolean isProcessed(Connection conn, long updateId) {
    String sql = "SELECT 1 FROM " + ledgerTable + " WHERE update_id=?";
    return !JdbcTemplate.query(conn, sql, rs -> 1, updateId).isEmpty();
  }

  @Override
  public boolean insertLedgerEntry(Connection conn, LedgerEntry entry) {
    if (isProcessed(conn, entry.updateId())) {
      return false;
    }
    try {
      return JdbcTemplate.update(conn, insertLedgerSql(""), ledgerParams(entry)) > 0;
    } catch (StorageException e) {
      if (JdbcTemplate.isConstraintViolation(e)) {
        return false;
      }
      throw e;
    }
  }

  /**
   * Deletes a batch with a limited subquery, which works for H2 and PostgreSQL. MySQL
   * overrides with {@code DELETE ... ORDER BY ... LIMIT}.
   */
  @Override
  public int purgeLedger(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + ledgerTable + " WHERE update_id IN (" +
        "SELECT update_id FROM " + ledgerTable +
        " WHERE processed_time < ? ORDER BY processed_time LIMIT ?)";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }

  /**
   * Builds the ledger INSERT. {@code suffix} is appended verbatim, e.g. an
   * {@code ON CONFLICT} clause.
   */
  protected String insertLedgerSql(String suffix) {
    return "INSERT INTO " + ledgerTable +
        " (update_id, message_id, chat_id, processed_time, message_type) VALUES (?,?,?,?,?)" +
        suffix;
  }

  protected static Object[] ledgerParams(LedgerEntry entry) {
    return new Object[]{entry.updateId(), entry.messageId(), entry.chatId(),
        Timestamp.from(entry.processedTime()), entry.messageType()};
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }
}
