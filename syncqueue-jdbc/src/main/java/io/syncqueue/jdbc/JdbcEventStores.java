package io.syncqueue.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Factory for JDBC event stores with auto-detection from the JDBC URL.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcEventStore store = JdbcEventStores.detect(dataSource);
 *
 * // By name, with a custom table
 * AbstractJdbcEventStore store = JdbcEventStores.create("postgresql",
 *     new DataSourceConnectionProvider(dataSource), "sync_events",
 *     Duration.ofMinutes(5), Clock.systemUTC());
 * }</pre>
 */
public final class JdbcEventStores {

  private enum Kind {
    H2("h2", List.of("jdbc:h2:")),
    MYSQL("mysql", List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:")),
    POSTGRESQL("postgresql", List.of("jdbc:postgresql:"));

    private final String storeName;
    private final List<String> prefixes;

    Kind(String storeName, List<String> prefixes) {
      this.storeName = storeName;
      this.prefixes = prefixes;
    }
  }

  private JdbcEventStores() {
  }

  /**
   * Returns the names of all supported stores.
   */
  public static List<String> names() {
    return Arrays.stream(Kind.values()).map(k -> k.storeName).toList();
  }

  /**
   * Auto-detects the store from a DataSource, using the default table and lock timeout.
   *
   * @throws IllegalStateException if the URL cannot be read
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcEventStore detect(DataSource dataSource) {
    return detect(dataSource, TableNames.DEFAULT_TABLE, AbstractJdbcEventStore.DEFAULT_LOCK_TIMEOUT);
  }

  public static AbstractJdbcEventStore detect(DataSource dataSource, String tableName, Duration lockTimeout) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event store from DataSource", e);
    }
    return create(storeNameFor(url), new DataSourceConnectionProvider(dataSource),
        tableName, lockTimeout, Clock.systemUTC());
  }

  /**
   * Resolves a store name from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static String storeNameFor(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (Kind kind : Kind.values()) {
      for (String prefix : kind.prefixes) {
        if (lower.startsWith(prefix)) {
          return kind.storeName;
        }
      }
    }
    throw new IllegalArgumentException("No event store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Creates a store by name.
   *
   * @param name store name (case-insensitive), one of {@link #names()}
   * @throws IllegalArgumentException if the name is unknown
   */
  public static AbstractJdbcEventStore create(String name, ConnectionProvider connectionProvider,
      String tableName, Duration lockTimeout, Clock clock) {
    Kind kind = byName(name);
    return switch (kind) {
      case H2 -> new H2EventStore(connectionProvider, tableName, lockTimeout, clock);
      case MYSQL -> new MySqlEventStore(connectionProvider, tableName, lockTimeout, clock);
      case POSTGRESQL -> new PostgresEventStore(connectionProvider, tableName, lockTimeout, clock);
    };
  }

  private static Kind byName(String name) {
    if (name != null) {
      for (Kind kind : Kind.values()) {
        if (kind.storeName.equalsIgnoreCase(name)) {
          return kind;
        }
      }
    }
    throw new IllegalArgumentException("Unknown event store: " + name + ". Available: " + names());
  }

  private static List<String> allPrefixes() {
    return Arrays.stream(Kind.values())
        .flatMap(k -> k.prefixes.stream())
        .toList();
  }
}
