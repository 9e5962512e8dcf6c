package inbox.jdbc.store;

import java.util.List;

/**
 * H2 inbox store. Primarily for tests and embedded deployments.
 *
 * <p>Uses the check-then-insert and subquery delete from {@link AbstractJdbcInboxStore}.
 */
public final class H2InboxStore extends AbstractJdbcInboxStore {

  public H2InboxStore() {
    super();
  }

  public H2InboxStore(String cursorTable, String ledgerTable) {
    super(cursorTable, ledgerTable);
  }

  @Override
  public AbstractJdbcInboxStore withTables(String cursorTable, String ledgerTable) {
    return new H2InboxStore(cursorTable, ledgerTable);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
