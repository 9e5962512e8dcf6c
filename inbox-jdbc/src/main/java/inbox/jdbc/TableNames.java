package inbox.jdbc;

import java.util.Objects;

/**
 * Shared table name validation for JDBC inbox components.
 */
public final class TableNames {
  public static final String DEFAULT_CURSOR_TABLE = "inbox_cursor";
  public static final String DEFAULT_LEDGER_TABLE = "inbox_ledger";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * Returns the name unchanged if it is a plain SQL identifier.
   *
   * @throws IllegalArgumentException if the name could be used for SQL injection
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
