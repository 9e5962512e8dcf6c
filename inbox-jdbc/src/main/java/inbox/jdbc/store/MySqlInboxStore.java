package inbox.jdbc.store;

import inbox.jdbc.JdbcTemplate;
import inbox.model.LedgerEntry;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * MySQL inbox store. Also compatible with TiDB.
 *
 * <p>Uses {@code INSERT IGNORE} for idempotent inserts and
 * {@code DELETE ... ORDER BY ... LIMIT}, since MySQL rejects {@code LIMIT} inside an
 * {@code IN} subquery.
 */
public final class MySqlInboxStore extends AbstractJdbcInboxStore {

  public MySqlInboxStore() {
    super();
  }

  public MySqlInboxStore(String cursorTable, String ledgerTable) {
    super(cursorTable, ledgerTable);
  }

  @Override
  public AbstractJdbcInboxStore withTables(String cursorTable, String ledgerTable) {
    return new MySqlInboxStore(cursorTable, ledgerTable);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public void ensureCursor(Connection conn, Instant now) {
    String sql = "INSERT IGNORE INTO " + cursorTable() +
        " (id, last_update_id, last_processed_time, created_at) VALUES (?,0,NULL,?)";
    JdbcTemplate.update(conn, sql, CURSOR_ROW_ID, Timestamp.from(now));
  }

  @Override
  public boolean insertLedgerEntry(Connection conn, LedgerEntry entry) {
    String sql = "INSERT IGNORE INTO " + ledgerTable() +
        " (update_id, message_id, chat_id, processed_time, message_type) VALUES (?,?,?,?,?)";
    return JdbcTemplate.update(conn, sql, ledgerParams(entry)) > 0;
  }

  @Override
  public int purgeLedger(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + ledgerTable() +
        " WHERE processed_time < ? ORDER BY processed_time LIMIT ?";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }
}
