package inbox.jdbc;

import inbox.jdbc.store.AbstractJdbcInboxStore;
import inbox.jdbc.store.MySqlInboxStore;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlInboxStoreIntegrationTest extends AbstractInboxStoreIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("inbox_test");

  private static final MySqlInboxStore STORE = new MySqlInboxStore();
  private static SimpleDataSource dataSource;

  @BeforeAll
  static void connect() {
    dataSource = new SimpleDataSource(
        mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
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
