package io.syncqueue.purge;

import io.syncqueue.config.QueueConfig;
import io.syncqueue.scheduler.TickScheduler;
import io.syncqueue.spi.EventStore;
import io.syncqueue.stats.ErrorRecorder;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes old terminal events: completed rows past
 * {@code completedRetentionDays}, and dead-lettered rows past the dead-letter retention
 * when dead-lettering is enabled.
 *
 * <p>The two steps run independently: a failure in one is logged and recorded and does not
 * prevent the other. Batching of the deletes is left to the {@link EventStore}.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see CleanupSweeper.Builder
 */
public final class CleanupSweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CleanupSweeper.class.getName());

  static final String COMPLETED_ERROR_TYPE = "cleanup_completed";
  static final String DEAD_LETTER_ERROR_TYPE = "cleanup_dead_letter";

  private final EventStore store;
  private final int completedRetentionDays;
  private final QueueConfig.DeadLetter deadLetter;
  private final ErrorRecorder errors;
  private final TickScheduler scheduler;

  private CleanupSweeper(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.errors = Objects.requireNonNull(builder.errors, "errors");
    if (builder.completedRetentionDays < 0) {
      throw new IllegalArgumentException("completedRetentionDays must be >= 0");
    }
    this.completedRetentionDays = builder.completedRetentionDays;
    this.deadLetter = builder.deadLetter != null ? builder.deadLetter : new QueueConfig.DeadLetter(true, 7);
    this.scheduler = TickScheduler.builder()
        .name("syncqueue-cleanup")
        .task(this::runOnce)
        .intervalMs(builder.intervalMs)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts the scheduled sweep. Subsequent calls are no-ops while running. */
  public void start() {
    scheduler.start();
  }

  /** Cancels the scheduled sweep. It can be started again. */
  public void stop() {
    scheduler.stop();
  }

  public boolean isRunning() {
    return scheduler.isRunning();
  }

  /**
   * Executes a single sweep. May be invoked directly for testing or one-off cleanups.
   *
   * @return rows deleted by each step
   */
  public CleanupResult runOnce() {
    int completed = 0;
    int dead = 0;
    try {
      completed = store.cleanupOldEvents(completedRetentionDays);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to clean up completed events", e);
      errors.record(COMPLETED_ERROR_TYPE, e);
    }
    if (deadLetter.enabled()) {
      try {
        dead = store.cleanupDeadLetter(deadLetter.retentionDays());
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to clean up dead-letter events", e);
        errors.record(DEAD_LETTER_ERROR_TYPE, e);
      }
    }
    if (completed > 0 || dead > 0) {
      logger.log(Level.INFO, "Cleanup removed {0} completed and {1} dead-letter events",
          new Object[]{completed, dead});
    }
    return new CleanupResult(completed, dead);
  }

  @Override
  public void close() {
    scheduler.close();
  }

  /** Builder for {@link CleanupSweeper}. */
  public static final class Builder {
    private EventStore store;
    private int completedRetentionDays = 7;
    private QueueConfig.DeadLetter deadLetter;
    private long intervalMs = 3_600_000L;
    private ErrorRecorder errors;

    private Builder() {}

    /**
     * Sets the store to clean.
     *
     * <p><b>Required.</b>
     */
    public Builder store(EventStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the retention for completed events.
     *
     * <p>Optional. Defaults to {@code 7} days.
     */
    public Builder completedRetentionDays(int completedRetentionDays) {
      this.completedRetentionDays = completedRetentionDays;
      return this;
    }

    /**
     * Sets the dead-letter settings. The dead-letter step is skipped when disabled.
     *
     * <p>Optional. Defaults to enabled with {@code 7} days retention.
     */
    public Builder deadLetter(QueueConfig.DeadLetter deadLetter) {
      this.deadLetter = deadLetter;
      return this;
    }

    /**
     * Sets the delay between sweeps.
     *
     * <p>Optional. Defaults to one hour.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets where failed steps are recorded.
     *
     * <p><b>Required.</b>
     */
    public Builder errors(ErrorRecorder errors) {
      this.errors = errors;
      return this;
    }

    public CleanupSweeper build() {
      return new CleanupSweeper(this);
    }
  }
}
