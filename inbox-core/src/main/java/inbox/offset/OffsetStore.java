package inbox.offset;

import inbox.model.Cursor;
import inbox.model.LedgerEntry;
import inbox.spi.ConnectionProvider;
import inbox.spi.InboxStore;
import inbox.spi.StorageException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable cursor and dedup ledger.
 *
 * <p>Every operation runs in its own short transaction on a fresh connection from the
 * {@link ConnectionProvider}. Mutating operations additionally serialize through a
 * single writer lock, so concurrent drains, sweeps and manual calls never interleave a
 * partial cursor update with a partial ledger update. {@link #commit(LedgerEntry)}
 * writes the ledger entry and the cursor for the same update in one transaction.
 *
 * <p>Failures surface as {@link StorageException} after the transaction has been
 * rolled back.
 *
 * <p>This class is thread-safe.
 *
 * @see InboxStore
 */
public final class OffsetStore {
  private static final Logger logger = Logger.getLogger(OffsetStore.class.getName());

  /** Ledger rows deleted per transaction by {@link #prune(Duration)}. */
  public static final int DEFAULT_PRUNE_BATCH_SIZE = 500;

  private final ConnectionProvider connectionProvider;
  private final InboxStore store;
  private final Clock clock;
  private final ReentrantLock writeLock = new ReentrantLock();
  private volatile boolean cursorCreated;

  public OffsetStore(ConnectionProvider connectionProvider, InboxStore store) {
    this(connectionProvider, store, Clock.systemUTC());
  }

  public OffsetStore(ConnectionProvider connectionProvider, InboxStore store, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the highest settled update id, or 0 if nothing was ever committed.
   *
   * @throws StorageException on I/O failure
   */
  public long getLastOffset() {
    return cursor().lastUpdateId();
  }

  /**
   * Returns the full cursor row.
   *
   * @throws StorageException on I/O failure
   */
  public Cursor cursor() {
    return withConnection("read cursor", store::readCursor);
  }

  /**
   * Moves the cursor to {@code newId}. Values less than or equal to the stored cursor
   * are ignored; the cursor never moves backwards.
   *
   * @param newId the new cursor value
   * @return {@code true} if the cursor moved
   * @throws StorageException on I/O failure
   */
  public boolean updateOffset(long newId) {
    boolean moved = inTransaction("update cursor to " + newId, conn -> {
      Instant now = clock.instant();
      ensureCursor(conn, now);
      return store.advanceCursor(conn, newId, now);
    });
    cursorCreated = true;
    return moved;
  }

  /**
   * Checks whether an update is recorded in the ledger.
   *
   * @throws StorageException on I/O failure
   */
  public boolean isProcessed(long updateId) {
    return withConnection("check ledger for updateId=" + updateId,
        conn -> store.isProcessed(conn, updateId));
  }

  /**
   * Records an update in the ledger. Recording the same id twice is a no-op.
   *
   * @return {@code true} if a new entry was written
   * @throws StorageException on I/O failure
   */
  public boolean markProcessed(long updateId, Long messageId, Long chatId, String messageType) {
    LedgerEntry entry = new LedgerEntry(updateId, messageId, chatId, clock.instant(), messageType);
    return inTransaction("mark updateId=" + updateId + " processed",
        conn -> store.insertLedgerEntry(conn, entry));
  }

  /**
   * Records the ledger entry and advances the cursor to its update id in a single
   * transaction. Either both writes are visible afterwards or neither is.
   *
   * @param entry the settled update
   * @return {@code true} if a new ledger entry was written
   * @throws StorageException on I/O failure
   */
  public boolean commit(LedgerEntry entry) {
    Objects.requireNonNull(entry, "entry");
    boolean inserted = inTransaction("commit updateId=" + entry.updateId(), conn -> {
      ensureCursor(conn, entry.processedTime());
      boolean added = store.insertLedgerEntry(conn, entry);
      store.advanceCursor(conn, entry.updateId(), entry.processedTime());
      return added;
    });
    cursorCreated = true;
    return inserted;
  }

  /**
   * Deletes ledger entries processed more than {@code olderThan} ago, in batches of
   * {@link #DEFAULT_PRUNE_BATCH_SIZE}. The cursor is never touched.
   *
   * @param olderThan retention window
   * @return total number of deleted entries
   * @throws StorageException on I/O failure; batches deleted before the failure stay deleted
   */
  public long prune(Duration olderThan) {
    return prune(olderThan, DEFAULT_PRUNE_BATCH_SIZE);
  }

  /**
   * Same as {@link #prune(Duration)} with an explicit batch size.
   */
  public long prune(Duration olderThan, int batchSize) {
    Objects.requireNonNull(olderThan, "olderThan");
    if (olderThan.isNegative()) {
      throw new IllegalArgumentException("olderThan must be >= 0");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    Instant cutoff = clock.instant().minus(olderThan);
    long total = 0;
    int deleted;
    do {
      deleted = inTransaction("prune ledger before " + cutoff,
          conn -> store.purgeLedger(conn, cutoff, batchSize));
      total += deleted;
    } while (deleted >= batchSize);
    logger.log(Level.FINE, "Pruned {0} ledger entries older than {1}", new Object[]{total, cutoff});
    return total;
  }

  private void ensureCursor(Connection conn, Instant now) {
    if (!cursorCreated) {
      store.ensureCursor(conn, now);
    }
  }

  private <T> T withConnection(String action, SqlWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return work.execute(conn);
    } catch (SQLException e) {
      throw new StorageException("Failed to " + action, e);
    }
  }

  private <T> T inTransaction(String action, SqlWork<T> work) {
    writeLock.lock();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      T result;
      try {
        result = work.execute(conn);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        restoreAutoCommit(conn, e);
        throw e;
      }
      conn.setAutoCommit(true);
      return result;
    } catch (SQLException e) {
      throw new StorageException("Failed to " + action, e);
    } finally {
      writeLock.unlock();
    }
  }

  private static void rollback(Connection conn, Exception failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private static void restoreAutoCommit(Connection conn, Exception failure) {
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  @FunctionalInterface
  private interface SqlWork<T> {
    T execute(Connection conn) throws SQLException;
  }
}
