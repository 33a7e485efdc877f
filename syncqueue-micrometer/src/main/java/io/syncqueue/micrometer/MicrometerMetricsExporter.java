package io.syncqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.syncqueue.model.Priority;
import io.syncqueue.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Per-priority meters carry a {@code priority} tag with the priority's wire name.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code syncqueue.events.processed} (tagged): events completed</li>
 *   <li>{@code syncqueue.events.retried} (tagged): events rescheduled after a failure</li>
 *   <li>{@code syncqueue.events.dead_lettered} (tagged): events that exhausted their retries</li>
 *   <li>{@code syncqueue.errors}: recorded errors of any kind</li>
 *   <li>{@code syncqueue.batches}: processed batches</li>
 *   <li>{@code syncqueue.rate_limited}: priority fetches skipped by the rate limiter</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code syncqueue.workers.active}: workers currently running</li>
 *   <li>{@code syncqueue.processing.time} (tagged): time spent on successful events</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Map<Priority, Counter> processed = new EnumMap<>(Priority.class);
  private final Map<Priority, Counter> retried = new EnumMap<>(Priority.class);
  private final Map<Priority, Counter> deadLettered = new EnumMap<>(Priority.class);
  private final Map<Priority, Timer> processingTime = new EnumMap<>(Priority.class);
  private final Counter errors;
  private final Counter batches;
  private final Counter rateLimited;
  private final Gauge activeWorkersGauge;

  private final AtomicInteger activeWorkers = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "syncqueue"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "syncqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.syncqueue"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (Priority priority : Priority.values()) {
      String tag = priority.wireName();
      processed.put(priority, Counter.builder(namePrefix + ".events.processed")
          .description("Events completed successfully")
          .tag("priority", tag)
          .register(registry));
      retried.put(priority, Counter.builder(namePrefix + ".events.retried")
          .description("Events rescheduled after a failed attempt")
          .tag("priority", tag)
          .register(registry));
      deadLettered.put(priority, Counter.builder(namePrefix + ".events.dead_lettered")
          .description("Events that exhausted their retries")
          .tag("priority", tag)
          .register(registry));
      processingTime.put(priority, Timer.builder(namePrefix + ".processing.time")
          .description("Time spent on successfully processed events")
          .tag("priority", tag)
          .register(registry));
    }
    this.errors = Counter.builder(namePrefix + ".errors")
        .description("Errors recorded by the engine")
        .register(registry);
    this.batches = Counter.builder(namePrefix + ".batches")
        .description("Batches processed")
        .register(registry);
    this.rateLimited = Counter.builder(namePrefix + ".rate_limited")
        .description("Priority fetches skipped by the rate limiter")
        .register(registry);
    this.activeWorkersGauge = Gauge.builder(namePrefix + ".workers.active", activeWorkers, AtomicInteger::get)
        .description("Workers currently running")
        .register(registry);
  }

  @Override
  public void incrementProcessed(Priority priority) {
    if (closed) return;
    processed.get(priority).increment();
  }

  @Override
  public void incrementRetried(Priority priority) {
    if (closed) return;
    retried.get(priority).increment();
  }

  @Override
  public void incrementDeadLettered(Priority priority) {
    if (closed) return;
    deadLettered.get(priority).increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    errors.increment();
  }

  @Override
  public void incrementBatches() {
    if (closed) return;
    batches.increment();
  }

  @Override
  public void incrementRateLimited() {
    if (closed) return;
    rateLimited.increment();
  }

  @Override
  public void recordActiveWorkers(int active) {
    if (closed) return;
    activeWorkers.set(active);
  }

  @Override
  public void recordProcessingTimeMs(Priority priority, long durationMs) {
    if (closed) return;
    processingTime.get(priority).record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>();
    meters.addAll(processed.values());
    meters.addAll(retried.values());
    meters.addAll(deadLettered.values());
    meters.addAll(processingTime.values());
    meters.addAll(List.of(errors, batches, rateLimited, activeWorkersGauge));
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
