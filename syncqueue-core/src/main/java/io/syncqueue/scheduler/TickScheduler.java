package io.syncqueue.scheduler;

import io.syncqueue.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-delay driver that runs a task on a single named daemon thread.
 *
 * <p>Runs never overlap. A run that throws is logged and reported to the error handler,
 * and the loop continues with the next run.
 *
 * <p>{@link #start()} is idempotent: however many times it is called, at most one loop is
 * scheduled. {@link #stop()} cancels the loop and a later {@link #start()} schedules a
 * fresh one. {@link #close()} is terminal. Lifecycle methods are synchronized.
 *
 * @see TickScheduler.Builder
 */
public final class TickScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TickScheduler.class.getName());

  private final String name;
  private final Runnable task;
  private final long intervalMs;
  private final long initialDelayMs;
  private final Consumer<Throwable> errorHandler;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> loop;
  private volatile boolean closed;

  private TickScheduler(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.task = Objects.requireNonNull(builder.task, "task");
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.initialDelayMs != null && builder.initialDelayMs < 0L) {
      throw new IllegalArgumentException("initialDelayMs must be >= 0");
    }
    this.intervalMs = builder.intervalMs;
    this.initialDelayMs = builder.initialDelayMs != null ? builder.initialDelayMs : builder.intervalMs;
    this.errorHandler = builder.errorHandler != null ? builder.errorHandler : t -> { };
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the loop. Subsequent calls are no-ops while a loop is scheduled.
   *
   * @throws IllegalStateException if the scheduler has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("TickScheduler " + name + " has been closed");
    }
    if (loop != null) {
      return;
    }
    if (scheduler == null) {
      scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory(name + "-"));
    }
    loop = scheduler.scheduleWithFixedDelay(this::runOnce, initialDelayMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Cancels the loop without interrupting a run in progress. The scheduler can be
   * started again.
   */
  public synchronized void stop() {
    if (loop != null) {
      loop.cancel(false);
      loop = null;
    }
  }

  public boolean isRunning() {
    return loop != null;
  }

  /**
   * Executes the task once, containing any failure. Called by the loop, but may also be
   * invoked directly for testing.
   */
  public void runOnce() {
    if (closed) {
      return;
    }
    try {
      task.run();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, name + " run failed", t);
      try {
        errorHandler.accept(t);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, name + " error handler failed", e);
      }
    }
  }

  /** Cancels the loop and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    stop();
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link TickScheduler}. */
  public static final class Builder {
    private String name = "syncqueue-tick";
    private Runnable task;
    private long intervalMs = 2000;
    private Long initialDelayMs;
    private Consumer<Throwable> errorHandler;

    private Builder() {}

    /**
     * Sets the loop name, used as the thread name prefix and in log messages.
     *
     * <p>Optional. Defaults to {@code "syncqueue-tick"}.
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Sets the task executed on every run.
     *
     * <p><b>Required.</b>
     */
    public Builder task(Runnable task) {
      this.task = task;
      return this;
    }

    /**
     * Sets the delay between the end of one run and the start of the next.
     *
     * <p>Optional. Defaults to {@code 2000} ms. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets the delay before the first run.
     *
     * <p>Optional. Defaults to the interval.
     */
    public Builder initialDelayMs(long initialDelayMs) {
      this.initialDelayMs = initialDelayMs;
      return this;
    }

    /**
     * Sets a callback for failed runs, invoked after the failure is logged.
     *
     * <p>Optional.
     */
    public Builder errorHandler(Consumer<Throwable> errorHandler) {
      this.errorHandler = errorHandler;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code task} is null
     * @throws IllegalArgumentException if {@code intervalMs <= 0}
     */
    public TickScheduler build() {
      return new TickScheduler(this);
    }
  }
}
