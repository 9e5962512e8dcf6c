package inbox.jdbc;

import inbox.jdbc.store.AbstractJdbcInboxStore;
import inbox.jdbc.store.PostgresInboxStore;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class PostgresInboxStoreIntegrationTest extends AbstractInboxStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("inbox_test");

  private static final PostgresInboxStore STORE = new PostgresInboxStore();
  private static SimpleDataSource dataSource;

  @BeforeAll
  static void connect() {
    dataSource = new SimpleDataSource(
        postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcInboxStore store() {
    return STORE;
  }
}
