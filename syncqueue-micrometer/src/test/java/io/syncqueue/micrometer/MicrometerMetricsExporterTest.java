package io.syncqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.syncqueue.model.Priority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void processedIsTaggedByPriority() {
    exporter.incrementProcessed(Priority.CRITICAL);
    exporter.incrementProcessed(Priority.CRITICAL);
    exporter.incrementProcessed(Priority.LOW);

    assertEquals(2.0, counter("syncqueue.events.processed", "critical").count());
    assertEquals(1.0, counter("syncqueue.events.processed", "low").count());
    assertEquals(0.0, counter("syncqueue.events.processed", "high").count());
  }

  @Test
  void retriedAndDeadLettered() {
    exporter.incrementRetried(Priority.HIGH);
    exporter.incrementDeadLettered(Priority.NORMAL);

    assertEquals(1.0, counter("syncqueue.events.retried", "high").count());
    assertEquals(1.0, counter("syncqueue.events.dead_lettered", "normal").count());
  }

  @Test
  void untaggedCounters() {
    exporter.incrementFailed();
    exporter.incrementBatches();
    exporter.incrementBatches();
    exporter.incrementRateLimited();

    assertEquals(1.0, registry.find("syncqueue.errors").counter().count());
    assertEquals(2.0, registry.find("syncqueue.batches").counter().count());
    assertEquals(1.0, registry.find("syncqueue.rate_limited").counter().count());
  }

  @Test
  void activeWorkersGauge() {
    exporter.recordActiveWorkers(4);
    assertEquals(4.0, gauge("syncqueue.workers.active").value());

    exporter.recordActiveWorkers(0);
    assertEquals(0.0, gauge("syncqueue.workers.active").value());
  }

  @Test
  void processingTimeTimer() {
    exporter.recordProcessingTimeMs(Priority.HIGH, 120);
    exporter.recordProcessingTimeMs(Priority.HIGH, 80);

    Timer timer = registry.find("syncqueue.processing.time").tag("priority", "high").timer();
    assertNotNull(timer);
    assertEquals(2, timer.count());
    assertEquals(200.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "orders.syncqueue");
    custom.incrementProcessed(Priority.NORMAL);
    custom.recordActiveWorkers(3);

    assertEquals(1.0, counter("orders.syncqueue.events.processed", "normal").count());
    assertEquals(3.0, gauge("orders.syncqueue.workers.active").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementProcessed(Priority.CRITICAL);
    exporter.recordActiveWorkers(7);

    assertNull(registry.find("syncqueue.events.processed").counter());
    assertNull(registry.find("syncqueue.workers.active").gauge());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "x."));
  }

  private Counter counter(String name, String priority) {
    Counter c = registry.find(name).tag("priority", priority).counter();
    assertNotNull(c, "Counter not found: " + name + " [" + priority + "]");
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
