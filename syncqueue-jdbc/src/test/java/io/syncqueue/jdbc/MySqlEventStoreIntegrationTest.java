package io.syncqueue.jdbc;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class MySqlEventStoreIntegrationTest extends AbstractEventStoreIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("syncqueue_test");

  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    Schemas.apply(dataSource, "mysql");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  String storeName() {
    return "mysql";
  }

  @Test
  void detectsMySqlFromUrl() {
    assertInstanceOf(MySqlEventStore.class, JdbcEventStores.detect(dataSource));
  }
}
