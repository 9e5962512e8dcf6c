package inbox.jdbc.store;

import inbox.jdbc.JdbcTemplate;
import inbox.model.LedgerEntry;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL inbox store.
 *
 * <p>Uses {@code ON CONFLICT DO NOTHING}: a failed statement would abort the whole
 * PostgreSQL transaction, so duplicate inserts must never raise.
 */
public final class PostgresInboxStore extends AbstractJdbcInboxStore {

  public PostgresInboxStore() {
    super();
  }

  public PostgresInboxStore(String cursorTable, String ledgerTable) {
    super(cursorTable, ledgerTable);
  }

  @Override
  public AbstractJdbcInboxStore withTables(String cursorTable, String ledgerTable) {
    return new PostgresInboxStore(cursorTable, ledgerTable);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void ensureCursor(Connection conn, Instant now) {
    String sql = "INSERT INTO " + cursorTable() +
        " (id, last_update_id, last_processed_time, created_at) VALUES (?,0,NULL,?)" +
        " ON CONFLICT (id) DO NOTHING";
    JdbcTemplate.update(conn, sql, CURSOR_ROW_ID, Timestamp.from(now));
  }

  @Override
  public boolean insertLedgerEntry(Connection conn, LedgerEntry entry) {
    return JdbcTemplate.update(conn, insertLedgerSql(" ON CONFLICT (update_id) DO NOTHING"),
        ledgerParams(entry)) > 0;
  }
}
