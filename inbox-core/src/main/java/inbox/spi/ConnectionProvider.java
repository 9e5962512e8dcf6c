package inbox.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for cursor and ledger access.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * <p>See {@code inbox.jdbc.DataSourceConnectionProvider} for the DataSource-backed one.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
