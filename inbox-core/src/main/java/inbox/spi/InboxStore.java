package inbox.spi;

import inbox.model.Cursor;
import inbox.model.LedgerEntry;

import java.sql.Connection;
import java.time.Instant;

/**
 * Persistence contract for the cursor and the dedup ledger.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries; {@link inbox.offset.OffsetStore} wraps each operation in its
 * own short transaction. Implementations live in the {@code inbox-jdbc} module and
 * report failures as {@link StorageException}.
 *
 * <p>The JDBC implementations extend {@code inbox.jdbc.store.AbstractJdbcInboxStore}.
 */
public interface InboxStore {

  /**
   * Reads the cursor row.
   *
   * @param conn the JDBC connection
   * @return the stored cursor, or {@link Cursor#INITIAL} if the row does not exist
   */
  Cursor readCursor(Connection conn);

  /**
   * Creates the cursor row with value 0 if it does not exist yet.
   *
   * @param conn the JDBC connection
   * @param now  creation timestamp
   */
  void ensureCursor(Connection conn, Instant now);

  /**
   * Moves the cursor forward. Must not write anything when {@code updateId} is less
   * than or equal to the stored value.
   *
   * @param conn     the JDBC connection
   * @param updateId the new cursor value
   * @param now      processing timestamp
   * @return {@code true} if the cursor moved
   */
  boolean advanceCursor(Connection conn, long updateId, Instant now);

  /**
   * Checks ledger membership.
   *
   * @param conn     the JDBC connection
   * @param updateId the update id
   * @return {@code true} if a ledger entry exists
   */
  boolean isProcessed(Connection conn, long updateId);

  /**
   * Inserts a ledger entry. A second insert for the same id is a no-op, never an error.
   *
   * @param conn  the JDBC connection
   * @param entry the entry to insert
   * @return {@code true} if a row was inserted, {@code false} if it already existed
   */
  boolean insertLedgerEntry(Connection conn, LedgerEntry entry);

  /**
   * Deletes ledger entries processed before {@code before}, up to {@code limit} rows.
   *
   * @param conn   the JDBC connection
   * @param before exclusive upper bound on {@code processedTime}
   * @param limit  maximum rows to delete in this call
   * @return the number of deleted rows
   */
  int purgeLedger(Connection conn, Instant before, int limit);
}
