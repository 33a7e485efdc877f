package io.syncqueue.config;

import io.syncqueue.model.Priority;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable engine configuration: the priority table plus global dispatch, batching,
 * rate-limit, dead-letter and cleanup knobs.
 *
 * <p>Start from {@link #defaults()} and override through {@link #toBuilder()}. Overrides
 * are shallow: {@link Builder#priorities(Map)} replaces the whole table, while
 * {@link Builder#priority(Priority, PriorityPolicy)} replaces a single level.
 *
 * <pre>{@code
 * QueueConfig config = QueueConfig.defaults().toBuilder()
 *     .maxConcurrentWorkers(10)
 *     .rateLimit(new QueueConfig.RateLimit(true, 50, 100))
 *     .build();
 * }</pre>
 */
public final class QueueConfig {

  private static final QueueConfig DEFAULTS = builder().build();

  private final int batchSize;
  private final long tickIntervalMs;
  private final int maxConcurrentWorkers;
  private final Map<Priority, PriorityPolicy> priorities;
  private final DeadLetter deadLetter;
  private final Batching batching;
  private final RateLimit rateLimit;
  private final long cleanupIntervalMs;
  private final int completedRetentionDays;

  private QueueConfig(Builder builder) {
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.tickIntervalMs <= 0L) {
      throw new IllegalArgumentException("tickIntervalMs must be > 0");
    }
    if (builder.maxConcurrentWorkers <= 0) {
      throw new IllegalArgumentException("maxConcurrentWorkers must be > 0");
    }
    if (builder.cleanupIntervalMs <= 0L) {
      throw new IllegalArgumentException("cleanupIntervalMs must be > 0");
    }
    if (builder.completedRetentionDays < 0) {
      throw new IllegalArgumentException("completedRetentionDays must be >= 0");
    }
    for (Priority p : Priority.values()) {
      if (!builder.priorities.containsKey(p)) {
        throw new IllegalArgumentException("Missing policy for priority: " + p.wireName());
      }
    }
    this.batchSize = builder.batchSize;
    this.tickIntervalMs = builder.tickIntervalMs;
    this.maxConcurrentWorkers = builder.maxConcurrentWorkers;
    this.priorities = Collections.unmodifiableMap(new EnumMap<>(builder.priorities));
    this.deadLetter = Objects.requireNonNull(builder.deadLetter, "deadLetter");
    this.batching = Objects.requireNonNull(builder.batching, "batching");
    this.rateLimit = Objects.requireNonNull(builder.rateLimit, "rateLimit");
    this.cleanupIntervalMs = builder.cleanupIntervalMs;
    this.completedRetentionDays = builder.completedRetentionDays;
  }

  public static QueueConfig defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-populated with this configuration's values.
   */
  public Builder toBuilder() {
    Builder b = new Builder();
    b.batchSize = batchSize;
    b.tickIntervalMs = tickIntervalMs;
    b.maxConcurrentWorkers = maxConcurrentWorkers;
    b.priorities = new EnumMap<>(priorities);
    b.deadLetter = deadLetter;
    b.batching = batching;
    b.rateLimit = rateLimit;
    b.cleanupIntervalMs = cleanupIntervalMs;
    b.completedRetentionDays = completedRetentionDays;
    return b;
  }

  public int batchSize() {
    return batchSize;
  }

  public long tickIntervalMs() {
    return tickIntervalMs;
  }

  public int maxConcurrentWorkers() {
    return maxConcurrentWorkers;
  }

  public Map<Priority, PriorityPolicy> priorities() {
    return priorities;
  }

  public PriorityPolicy policy(Priority priority) {
    return priorities.get(Objects.requireNonNull(priority, "priority"));
  }

  public DeadLetter deadLetter() {
    return deadLetter;
  }

  public Batching batching() {
    return batching;
  }

  public RateLimit rateLimit() {
    return rateLimit;
  }

  public long cleanupIntervalMs() {
    return cleanupIntervalMs;
  }

  public int completedRetentionDays() {
    return completedRetentionDays;
  }

  @Override
  public String toString() {
    return "QueueConfig{batchSize=" + batchSize
        + ", tickIntervalMs=" + tickIntervalMs
        + ", maxConcurrentWorkers=" + maxConcurrentWorkers
        + ", priorities=" + priorities
        + ", deadLetter=" + deadLetter
        + ", batching=" + batching
        + ", rateLimit=" + rateLimit
        + ", cleanupIntervalMs=" + cleanupIntervalMs
        + ", completedRetentionDays=" + completedRetentionDays + "}";
  }

  /**
   * Dead-letter routing. When disabled, exhausted events are parked as
   * {@code failed} instead and dead-letter cleanup is skipped.
   */
  public record DeadLetter(boolean enabled, int retentionDays) {
    public DeadLetter {
      if (retentionDays < 0) {
        throw new IllegalArgumentException("retentionDays must be >= 0, got: " + retentionDays);
      }
    }
  }

  /**
   * Batch execution. When disabled, a fetched page runs one event at a time.
   */
  public record Batching(boolean enabled, int maxBatchSize) {
    public Batching {
      if (maxBatchSize <= 0) {
        throw new IllegalArgumentException("maxBatchSize must be > 0, got: " + maxBatchSize);
      }
    }
  }

  /**
   * Token-bucket parameters gating each priority fetch.
   */
  public record RateLimit(boolean enabled, double maxPerSecond, int burstCapacity) {
    public RateLimit {
      if (maxPerSecond <= 0) {
        throw new IllegalArgumentException("maxPerSecond must be > 0, got: " + maxPerSecond);
      }
      if (burstCapacity <= 0) {
        throw new IllegalArgumentException("burstCapacity must be > 0, got: " + burstCapacity);
      }
    }
  }

  /** Builder for {@link QueueConfig}. */
  public static final class Builder {
    private int batchSize = 20;
    private long tickIntervalMs = 2000;
    private int maxConcurrentWorkers = 5;
    private Map<Priority, PriorityPolicy> priorities = defaultPriorities();
    private DeadLetter deadLetter = new DeadLetter(true, 7);
    private Batching batching = new Batching(true, 50);
    private RateLimit rateLimit = new RateLimit(true, 100, 200);
    private long cleanupIntervalMs = 60L * 60 * 1000;
    private int completedRetentionDays = 7;

    private Builder() {}

    /**
     * Maximum events fetched per priority per tick.
     *
     * <p>Optional. Defaults to {@code 20}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Interval between dispatch ticks in milliseconds.
     *
     * <p>Optional. Defaults to {@code 2000}. Must be &gt; 0.
     */
    public Builder tickIntervalMs(long tickIntervalMs) {
      this.tickIntervalMs = tickIntervalMs;
      return this;
    }

    /**
     * Global cap on concurrently running workers, shared across ticks and manual runs.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &gt; 0.
     */
    public Builder maxConcurrentWorkers(int maxConcurrentWorkers) {
      this.maxConcurrentWorkers = maxConcurrentWorkers;
      return this;
    }

    /**
     * Replaces the whole priority table. Every {@link Priority} must be present.
     */
    public Builder priorities(Map<Priority, PriorityPolicy> priorities) {
      Objects.requireNonNull(priorities, "priorities");
      this.priorities = new EnumMap<>(Priority.class);
      this.priorities.putAll(priorities);
      return this;
    }

    /**
     * Replaces the policy of a single priority level.
     */
    public Builder priority(Priority priority, PriorityPolicy policy) {
      this.priorities.put(Objects.requireNonNull(priority, "priority"),
          Objects.requireNonNull(policy, "policy"));
      return this;
    }

    /**
     * Optional. Defaults to enabled with 7 days retention.
     */
    public Builder deadLetter(DeadLetter deadLetter) {
      this.deadLetter = deadLetter;
      return this;
    }

    /**
     * Optional. Defaults to enabled with at most 50 events per batch.
     */
    public Builder batching(Batching batching) {
      this.batching = batching;
      return this;
    }

    /**
     * Optional. Defaults to enabled, 100 per second, burst capacity 200.
     */
    public Builder rateLimit(RateLimit rateLimit) {
      this.rateLimit = rateLimit;
      return this;
    }

    /**
     * Interval between cleanup sweeps in milliseconds.
     *
     * <p>Optional. Defaults to one hour. Must be &gt; 0.
     */
    public Builder cleanupIntervalMs(long cleanupIntervalMs) {
      this.cleanupIntervalMs = cleanupIntervalMs;
      return this;
    }

    /**
     * Retention of completed events in days.
     *
     * <p>Optional. Defaults to {@code 7}. Must be &ge; 0.
     */
    public Builder completedRetentionDays(int completedRetentionDays) {
      this.completedRetentionDays = completedRetentionDays;
      return this;
    }

    /**
     * @throws IllegalArgumentException if any value is out of range or a priority
     *     has no policy
     */
    public QueueConfig build() {
      return new QueueConfig(this);
    }

    private static Map<Priority, PriorityPolicy> defaultPriorities() {
      Map<Priority, PriorityPolicy> map = new EnumMap<>(Priority.class);
      map.put(Priority.CRITICAL, new PriorityPolicy(5, 1000, 30_000));
      map.put(Priority.HIGH, new PriorityPolicy(4, 2000, 20_000));
      map.put(Priority.NORMAL, new PriorityPolicy(3, 5000, 15_000));
      map.put(Priority.LOW, new PriorityPolicy(2, 10_000, 10_000));
      return map;
    }
  }
}
