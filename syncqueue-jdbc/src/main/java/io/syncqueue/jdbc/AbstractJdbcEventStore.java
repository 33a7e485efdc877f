package io.syncqueue.jdbc;

import io.syncqueue.model.EventStatus;
import io.syncqueue.model.Priority;
import io.syncqueue.model.QueueStatistics;
import io.syncqueue.model.SyncEvent;
import io.syncqueue.spi.EventStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC event store with standard SQL implementations.
 *
 * <p>Every operation borrows its own connection from the {@link ConnectionProvider} and
 * runs in auto-commit mode. Status writes carry a
 * {@code status NOT IN ('completed','dead_letter')} guard, so terminal rows never change.
 *
 * <p>Claiming marks rows {@code processing} and stamps {@code locked_by}/{@code locked_at}
 * with a token unique to the fetch. A {@code processing} row whose claim is older than the
 * lock timeout is claimable again. Subclasses override {@link #claim} to provide
 * database-specific claim strategies; the default is a two-phase UPDATE-then-SELECT that
 * works on H2.
 *
 * @see JdbcEventStores
 */
public abstract class AbstractJdbcEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcEventStore.class.getName());

  public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMinutes(5);
  static final int PURGE_BATCH_SIZE = 500;
  static final int MAX_ERROR_LENGTH = 4000;

  protected static final String COLUMNS =
      "id, table_name, payload, priority, status, retry_count, last_error, " +
      "scheduled_at, created_at, updated_at";

  protected static final String NOT_TERMINAL =
      "status NOT IN ('" + EventStatus.COMPLETED.wireName() + "','" + EventStatus.DEAD_LETTER.wireName() + "')";

  /** Rows a claim may take: due pending rows, or processing rows whose claim expired. */
  protected static final String CLAIMABLE =
      "priority=? AND retry_count<=? AND (" +
      "(status='" + EventStatus.PENDING.wireName() + "' AND scheduled_at<=?)" +
      " OR (status='" + EventStatus.PROCESSING.wireName() + "' AND locked_at<?))";

  protected static final String CLAIM_ORDER = " ORDER BY scheduled_at, created_at";

  protected static final JdbcTemplate.RowMapper<SyncEvent> EVENT_ROW_MAPPER = rs -> new SyncEvent(
      rs.getString("id"),
      rs.getString("table_name"),
      rs.getString("payload"),
      Priority.fromWireName(rs.getString("priority")),
      EventStatus.fromWireName(rs.getString("status")),
      rs.getInt("retry_count"),
      rs.getString("last_error"),
      toInstant(rs.getTimestamp("scheduled_at")),
      toInstant(rs.getTimestamp("created_at")),
      toInstant(rs.getTimestamp("updated_at")));

  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final Duration lockTimeout;
  private final Clock clock;
  private final String ownerId = "syncqueue-" + UUID.randomUUID();
  private final AtomicLong claimSequence = new AtomicLong();

  protected AbstractJdbcEventStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_TABLE, DEFAULT_LOCK_TIMEOUT, Clock.systemUTC());
  }

  protected AbstractJdbcEventStore(ConnectionProvider connectionProvider, String tableName,
      Duration lockTimeout, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
    Objects.requireNonNull(lockTimeout, "lockTimeout");
    if (lockTimeout.isNegative() || lockTimeout.isZero()) {
      throw new IllegalArgumentException("lockTimeout must be > 0");
    }
    this.lockTimeout = lockTimeout;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Unique identifier for this event store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  protected String tableName() {
    return tableName;
  }

  protected Duration lockTimeout() {
    return lockTimeout;
  }

  protected Instant now() {
    // Truncate to millis so stored values match queries (DB may drop nanos)
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  // ── Producer side ───────────────────────────────────────────────

  /**
   * Inserts a new event. The stored status, retry count and schedule are taken from the
   * given event; missing timestamps default to now.
   */
  public void enqueue(SyncEvent event) {
    Objects.requireNonNull(event, "event");
    Instant now = now();
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ", locked_by, locked_at)" +
        " VALUES (?,?,?,?,?,?,?,?,?,?,NULL,NULL)";
    execute(conn -> JdbcTemplate.update(conn, sql,
        event.id(), event.tableName(), event.payloadJson(),
        event.priority(), event.status(), event.retryCount(),
        truncateError(event.lastError()),
        orNow(event.scheduledAt(), now), orNow(event.createdAt(), now),
        orNow(event.updatedAt(), now)));
  }

  /**
   * Loads a single event, regardless of status.
   */
  public Optional<SyncEvent> findById(String eventId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
    return execute(conn -> JdbcTemplate.queryForOptional(conn, sql, EVENT_ROW_MAPPER, eventId));
  }

  // ── EventStore ──────────────────────────────────────────────────

  @Override
  public List<SyncEvent> fetchPendingByPriority(Priority priority, int batchSize, int maxRetryCount) {
    Objects.requireNonNull(priority, "priority");
    if (batchSize <= 0) {
      return List.of();
    }
    Instant now = now();
    Instant lockExpiry = now.minus(lockTimeout);
    String claimToken = ownerId + "-" + claimSequence.incrementAndGet();
    return execute(conn -> claim(conn, claimToken, priority, batchSize, maxRetryCount, now, lockExpiry));
  }

  /**
   * Atomically claims up to {@code limit} rows and returns them in schedule order.
   *
   * <p>Default implementation: UPDATE with a limited subquery, then SELECT by token.
   * The claim predicate is repeated on the outer UPDATE so a row taken by a concurrent
   * claimer between the two evaluations is not taken twice.
   */
  protected List<SyncEvent> claim(Connection conn, String claimToken, Priority priority,
      int limit, int maxRetryCount, Instant now, Instant lockExpiry) {
    String claimSql = "UPDATE " + tableName + " SET status='" + EventStatus.PROCESSING.wireName() + "'" +
        ", locked_by=?, locked_at=?, updated_at=?" +
        " WHERE id IN (SELECT id FROM " + tableName + " WHERE " + CLAIMABLE + CLAIM_ORDER + " LIMIT ?)" +
        " AND " + CLAIMABLE;
    int updated = JdbcTemplate.update(conn, claimSql,
        claimToken, now, now,
        priority, maxRetryCount, now, lockExpiry, limit,
        priority, maxRetryCount, now, lockExpiry);
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, claimToken);
  }

  /**
   * Selects rows claimed under the given token. Shared by two-phase claim strategies.
   */
  protected List<SyncEvent> selectClaimed(Connection conn, String claimToken) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE locked_by=?" + CLAIM_ORDER;
    return JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, claimToken);
  }

  @Override
  public void updateStatus(String eventId, EventStatus status, String errorMessage) {
    Objects.requireNonNull(status, "status");
    Instant now = now();
    String sql;
    if (status == EventStatus.PROCESSING) {
      sql = "UPDATE " + tableName + " SET status=?, last_error=COALESCE(?, last_error), updated_at=?" +
          ", locked_at=? WHERE id=? AND " + NOT_TERMINAL;
      execute(conn -> JdbcTemplate.update(conn, sql,
          status, truncateError(errorMessage), now, now, eventId));
    } else {
      sql = "UPDATE " + tableName + " SET status=?, last_error=COALESCE(?, last_error), updated_at=?" +
          ", locked_by=NULL, locked_at=NULL WHERE id=? AND " + NOT_TERMINAL;
      execute(conn -> JdbcTemplate.update(conn, sql,
          status, truncateError(errorMessage), now, eventId));
    }
  }

  @Override
  public void scheduleRetry(String eventId, String errorMessage, Instant scheduledAt) {
    Objects.requireNonNull(scheduledAt, "scheduledAt");
    String sql = "UPDATE " + tableName + " SET status='" + EventStatus.PENDING.wireName() + "'" +
        ", retry_count=retry_count+1, scheduled_at=?, last_error=?, updated_at=?" +
        ", locked_by=NULL, locked_at=NULL WHERE id=? AND " + NOT_TERMINAL;
    Instant now = now();
    execute(conn -> JdbcTemplate.update(conn, sql,
        scheduledAt, truncateError(errorMessage), now, eventId));
  }

  @Override
  public void moveToDeadLetter(String eventId, String finalError) {
    String sql = "UPDATE " + tableName + " SET status='" + EventStatus.DEAD_LETTER.wireName() + "'" +
        ", last_error=?, updated_at=?, locked_by=NULL, locked_at=NULL WHERE id=? AND " + NOT_TERMINAL;
    Instant now = now();
    execute(conn -> JdbcTemplate.update(conn, sql, truncateError(finalError), now, eventId));
  }

  @Override
  public int cleanupOldEvents(int retentionDays) {
    return purge(EventStatus.COMPLETED, retentionDays);
  }

  @Override
  public int cleanupDeadLetter(int retentionDays) {
    return purge(EventStatus.DEAD_LETTER, retentionDays);
  }

  private int purge(EventStatus status, int retentionDays) {
    if (retentionDays < 0) {
      throw new IllegalArgumentException("retentionDays must be >= 0");
    }
    Instant cutoff = now().minus(Duration.ofDays(retentionDays));
    int total = 0;
    int deleted;
    do {
      deleted = execute(conn -> purgeBatch(conn, status, cutoff, PURGE_BATCH_SIZE));
      total += deleted;
    } while (deleted >= PURGE_BATCH_SIZE);
    if (total > 0) {
      logger.log(Level.FINE, "Deleted {0} {1} events updated before {2}",
          new Object[]{total, status, cutoff});
    }
    return total;
  }

  /**
   * Deletes up to {@code limit} rows in {@code status} last updated strictly before
   * {@code cutoff}.
   *
   * <p>Default implementation uses a subquery to limit the batch, which works for H2 and
   * PostgreSQL. MySQL overrides with {@code DELETE ... ORDER BY ... LIMIT}.
   */
  protected int purgeBatch(Connection conn, EventStatus status, Instant cutoff, int limit) {
    String sql = "DELETE FROM " + tableName + " WHERE id IN (" +
        "SELECT id FROM " + tableName + " WHERE status=? AND updated_at<?" +
        " ORDER BY updated_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, status, cutoff, limit);
  }

  @Override
  public QueueStatistics getQueueStatistics() {
    return execute(conn -> {
      Map<EventStatus, Long> byStatus = new EnumMap<>(EventStatus.class);
      JdbcTemplate.queryForCounts(conn,
          "SELECT status, COUNT(*) AS n FROM " + tableName + " GROUP BY status", "status")
          .forEach((wire, n) -> putKnown(byStatus, wire, n, EventStatus::fromWireName));
      Map<Priority, Long> pending = new EnumMap<>(Priority.class);
      JdbcTemplate.queryForCounts(conn,
          "SELECT priority, COUNT(*) AS n FROM " + tableName + " WHERE status=? GROUP BY priority",
          "priority", EventStatus.PENDING)
          .forEach((wire, n) -> putKnown(pending, wire, n, Priority::fromWireName));
      Optional<Instant> oldest = JdbcTemplate.queryForOptional(conn,
          "SELECT MIN(scheduled_at) AS oldest FROM " + tableName + " WHERE status=?",
          rs -> toInstant(rs.getTimestamp("oldest")), EventStatus.PENDING);
      return new QueueStatistics(byStatus, pending, oldest.orElse(null));
    });
  }

  @Override
  public int resetFailedEvents(Priority priorityFilter, int maxAgeHours) {
    Instant now = now();
    Instant since = now.minus(Duration.ofHours(maxAgeHours));
    String base = "UPDATE " + tableName + " SET status='" + EventStatus.PENDING.wireName() + "'" +
        ", retry_count=0, scheduled_at=?, updated_at=?, locked_by=NULL, locked_at=NULL" +
        " WHERE status='" + EventStatus.FAILED.wireName() + "' AND updated_at>=?";
    if (priorityFilter == null) {
      return execute(conn -> JdbcTemplate.update(conn, base, now, now, since));
    }
    return execute(conn -> JdbcTemplate.update(conn, base + " AND priority=?",
        now, now, since, priorityFilter));
  }

  @Override
  public void verifyConnectivity() {
    try (Connection conn = connectionProvider.getConnection()) {
      if (!conn.isValid(5)) {
        throw new EventStoreException("Connection to " + name() + " database is not valid");
      }
    } catch (SQLException e) {
      throw new EventStoreException("Failed to connect to " + name() + " database", e);
    }
  }

  // ── Helpers ─────────────────────────────────────────────────────

  @FunctionalInterface
  protected interface ConnectionCallback<T> {
    T doInConnection(Connection conn);
  }

  protected <T> T execute(ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.doInConnection(conn);
    } catch (SQLException e) {
      throw new EventStoreException("Failed to obtain connection", e);
    }
  }

  static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  /** Sorts rows returned in no particular order (e.g. by {@code RETURNING}). */
  protected static List<SyncEvent> inScheduleOrder(List<SyncEvent> events) {
    return events.stream()
        .sorted(Comparator.comparing(SyncEvent::scheduledAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(SyncEvent::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
        .toList();
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }

  private static Instant orNow(Instant instant, Instant now) {
    return instant != null ? instant : now;
  }

  private static <E extends Enum<E>> void putKnown(Map<E, Long> target, String wireName, long count,
      Function<String, E> parser) {
    try {
      target.merge(parser.apply(wireName), count, Long::sum);
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Ignoring {0} rows with unknown value {1}", new Object[]{count, wireName});
    }
  }
}
