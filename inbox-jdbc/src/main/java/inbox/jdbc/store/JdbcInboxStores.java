package inbox.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC inbox stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/inbox.jdbc.store.AbstractJdbcInboxStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcInboxStore store = JdbcInboxStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcInboxStore store = JdbcInboxStores.detect("jdbc:mysql://localhost/bot");
 *
 * // Get by name, with custom tables
 * AbstractJdbcInboxStore store = JdbcInboxStores.get("postgresql")
 *     .withTables("bot_cursor", "bot_ledger");
 * }</pre>
 */
public final class JdbcInboxStores {

  private static final List<AbstractJdbcInboxStore> STORES;
  private static final Map<String, AbstractJdbcInboxStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcInboxStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcInboxStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcInboxStores() {
  }

  /**
   * Returns all registered inbox stores.
   */
  public static List<AbstractJdbcInboxStore> all() {
    return STORES;
  }

  /**
   * Gets an inbox store by name.
   *
   * @param name store name (case-insensitive)
   * @return the inbox store, using the default table names
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcInboxStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcInboxStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown inbox store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the inbox store from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcInboxStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect inbox store from DataSource", e);
    }
    return detect(url);
  }

  /**
   * Auto-detects the inbox store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcInboxStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String normalized = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcInboxStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (normalized.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No inbox store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
