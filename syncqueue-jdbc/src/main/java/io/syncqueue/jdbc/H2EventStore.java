package io.syncqueue.jdbc;

import java.time.Clock;
import java.time.Duration;

/**
 * H2 event store. Primarily for testing and embedded use.
 *
 * <p>Uses the default subquery-based two-phase claim from {@link AbstractJdbcEventStore}.
 */
public final class H2EventStore extends AbstractJdbcEventStore {

  public H2EventStore(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  public H2EventStore(ConnectionProvider connectionProvider, String tableName,
      Duration lockTimeout, Clock clock) {
    super(connectionProvider, tableName, lockTimeout, clock);
  }

  @Override
  public String name() {
    return "h2";
  }
}
