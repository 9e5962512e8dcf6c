package inbox.jdbc;

import inbox.jdbc.store.AbstractJdbcInboxStore;
import inbox.spi.StorageException;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the cursor and ledger tables from the bundled {@code schema/<store>.sql}
 * scripts. Every statement is {@code IF NOT EXISTS}, so running it twice is harmless.
 */
public final class SchemaInitializer {
  private static final Logger logger = Logger.getLogger(SchemaInitializer.class.getName());

  private SchemaInitializer() {}

  /**
   * Runs the schema script for the given store against the data source.
   *
   * @throws StorageException     if a statement fails
   * @throws UncheckedIOException if no script is bundled for the store's dialect
   */
  public static void initialize(DataSource dataSource, AbstractJdbcInboxStore store) {
    Objects.requireNonNull(dataSource, "dataSource");
    List<String> statements = statements(store);
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement()) {
      conn.setAutoCommit(true);
      for (String sql : statements) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to initialize inbox schema", e);
    }
    logger.log(Level.INFO, "Initialized inbox schema ({0}): {1}, {2}",
        new Object[]{store.name(), store.cursorTable(), store.ledgerTable()});
  }

  /**
   * Returns the schema statements for the store, with its table names substituted.
   */
  public static List<String> statements(AbstractJdbcInboxStore store) {
    Objects.requireNonNull(store, "store");
    String script = load("/schema/" + store.name() + ".sql")
        .replace("${cursor_table}", store.cursorTable())
        .replace("${ledger_table}", store.ledgerTable());
    List<String> statements = new ArrayList<>();
    for (String stmt : script.split(";")) {
      String trimmed = stmt.trim();
      if (!trimmed.isEmpty()) {
        statements.add(trimmed);
      }
    }
    return statements;
  }

  private static String load(String path) {
    try (InputStream is = SchemaInitializer.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IOException("Resource not found: " + path);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
