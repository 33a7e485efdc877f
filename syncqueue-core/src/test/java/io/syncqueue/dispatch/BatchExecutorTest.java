package io.syncqueue.dispatch;

import io.syncqueue.EventResult;
import io.syncqueue.QueueListener;
import io.syncqueue.config.QueueConfig;
import io.syncqueue.model.EventStatus;
import io.syncqueue.model.Priority;
import io.syncqueue.model.SyncEvent;
import io.syncqueue.ratelimit.RateLimiter;
import io.syncqueue.spi.EventProcessor;
import io.syncqueue.spi.MetricsExporter;
import io.syncqueue.support.InMemoryEventStore;
import io.syncqueue.support.MutableClock;
import io.syncqueue.support.Pipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BatchExecutorTest {

  private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
  private final InMemoryEventStore store = new InMemoryEventStore(clock);
  private final List<BatchSummary> batches = new CopyOnWriteArrayList<>();
  private final QueueListener listener = new QueueListener() {
    @Override
    public void onBatchProcessed(BatchSummary summary) {
      batches.add(summary);
    }
  };
  private Pipeline pipeline;

  @AfterEach
  void tearDown() {
    if (pipeline != null) {
      pipeline.close();
    }
  }

  private Pipeline pipeline(EventProcessor processor, QueueConfig config) {
    pipeline = new Pipeline(store, processor, config, clock, RateLimiter.UNLIMITED,
        MetricsExporter.NOOP, listener);
    return pipeline;
  }

  private List<SyncEvent> seed(int orders, int users, Priority priority) {
    for (int i = 0; i < orders; i++) {
      store.add("order-" + i, "orders", priority);
    }
    for (int i = 0; i < users; i++) {
      store.add("user-" + i, "users", priority);
    }
    return store.fetchPendingByPriority(priority, 100, 10);
  }

  @Test
  void twelveEventsAcrossTwoTablesRunInChunksOfAtMostFive() {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    Pipeline p = pipeline(event -> {
      int now = running.incrementAndGet();
      peak.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(20);
      } finally {
        running.decrementAndGet();
      }
      return EventResult.ok();
    }, QueueConfig.builder().maxConcurrentWorkers(5).build());
    List<SyncEvent> events = seed(7, 5, Priority.NORMAL);

    int processed = p.batchExecutor.execute(events, Priority.NORMAL);

    assertEquals(12, processed);
    assertTrue(peak.get() <= 5, "peak concurrency was " + peak.get());
    assertTrue(peak.get() >= 2, "chunk members should overlap, peak was " + peak.get());
    assertEquals(12, p.stats.processed());
    for (SyncEvent event : events) {
      assertEquals(EventStatus.COMPLETED, store.get(event.id()).status());
    }
  }

  @Test
  void batchCompletionIsReported() {
    Pipeline p = pipeline(event -> event.id().startsWith("user")
        ? EventResult.failure("rejected")
        : EventResult.ok(), QueueConfig.defaults());
    List<SyncEvent> events = seed(3, 2, Priority.HIGH);

    int processed = p.batchExecutor.execute(events, Priority.HIGH);

    assertEquals(3, processed);
    assertEquals(1, batches.size());
    BatchSummary summary = batches.get(0);
    assertEquals(Priority.HIGH, summary.priority());
    assertEquals(5, summary.events());
    assertEquals(3, summary.processed());
    assertTrue(summary.batchId().startsWith("batch_high_"));
    assertEquals(1, p.stats.batchesProcessed());
  }

  @Test
  void pageIsSplitIntoBatchesOfMaxBatchSize() {
    QueueConfig config = QueueConfig.builder()
        .batching(new QueueConfig.Batching(true, 4))
        .build();
    Pipeline p = pipeline(event -> EventResult.ok(), config);
    List<SyncEvent> events = seed(10, 0, Priority.LOW);

    assertEquals(10, p.batchExecutor.execute(events, Priority.LOW));

    assertEquals(List.of(4, 4, 2), batches.stream().map(BatchSummary::events).toList());
  }

  @Test
  void batchingDisabledRunsEventsInFetchOrder() {
    List<String> order = new CopyOnWriteArrayList<>();
    QueueConfig config = QueueConfig.builder()
        .batching(new QueueConfig.Batching(false, 50))
        .build();
    Pipeline p = pipeline(event -> {
      order.add(event.id());
      return EventResult.ok();
    }, config);
    List<SyncEvent> events = seed(3, 0, Priority.NORMAL);

    assertEquals(3, p.batchExecutor.execute(events, Priority.NORMAL));

    assertEquals(List.of("order-0", "order-1", "order-2"), order);
    assertTrue(batches.isEmpty());
  }

  @Test
  void sequentialModeReleasesEventsLeftAtWorkerCap() {
    QueueConfig config = QueueConfig.builder()
        .maxConcurrentWorkers(1)
        .batching(new QueueConfig.Batching(false, 50))
        .build();
    Pipeline p = pipeline(event -> EventResult.ok(), config);
    List<SyncEvent> events = seed(2, 0, Priority.NORMAL);
    assertTrue(p.tracker.tryAcquire("manual-run", Priority.CRITICAL));

    assertEquals(EventStatus.PROCESSING, store.get("order-0").status());

    assertEquals(0, p.batchExecutor.execute(events, Priority.NORMAL));

    assertEquals(EventStatus.PENDING, store.get("order-0").status());
    assertEquals(EventStatus.PENDING, store.get("order-1").status());
    assertEquals(0, store.get("order-0").retryCount());
    assertEquals(2, store.fetchPendingByPriority(Priority.NORMAL, 10, 10).size());
  }

  @Test
  void sequentialModeReleasesOnlyTheEventsItDidNotRun() {
    QueueConfig config = QueueConfig.builder()
        .maxConcurrentWorkers(1)
        .batching(new QueueConfig.Batching(false, 50))
        .build();
    List<String> ran = new ArrayList<>();
    Pipeline[] holder = new Pipeline[1];
    holder[0] = pipeline(event -> {
      ran.add(event.id());
      // occupy the only slot once the first event is running
      holder[0].tracker.tryAcquire("manual-run", Priority.CRITICAL);
      return EventResult.ok();
    }, config);
    List<SyncEvent> events = seed(3, 0, Priority.NORMAL);

    assertEquals(1, holder[0].batchExecutor.execute(events, Priority.NORMAL));

    assertEquals(List.of("order-0"), ran);
    assertEquals(EventStatus.COMPLETED, store.get("order-0").status());
    assertEquals(EventStatus.PENDING, store.get("order-1").status());
    assertEquals(EventStatus.PENDING, store.get("order-2").status());
  }

  @Test
  void releaseFailureIsRecordedAndDoesNotEscape() {
    QueueConfig config = QueueConfig.builder()
        .maxConcurrentWorkers(1)
        .batching(new QueueConfig.Batching(false, 50))
        .build();
    Pipeline p = pipeline(event -> EventResult.ok(), config);
    List<SyncEvent> events = seed(1, 0, Priority.NORMAL);
    assertTrue(p.tracker.tryAcquire("manual-run", Priority.CRITICAL));
    store.fail("updateStatus:pending", new IllegalStateException("db down"));

    assertEquals(0, p.batchExecutor.execute(events, Priority.NORMAL));

    assertEquals(EventStatus.PROCESSING, store.get("order-0").status());
    assertEquals("status_update", p.stats.errors().get(0).type());
  }

  @Test
  void groupByTablePreservesFirstSeenOrder() {
    Instant now = clock.instant();
    List<SyncEvent> events = new ArrayList<>();
    events.add(event("a1", "users", now));
    events.add(event("b1", "orders", now));
    events.add(event("a2", "users", now));
    events.add(event("c1", null, now));

    Map<String, List<SyncEvent>> groups = BatchExecutor.groupByTable(events);

    assertEquals(List.of("users", "orders", ""), List.copyOf(groups.keySet()));
    assertEquals(List.of("a1", "a2"), groups.get("users").stream().map(SyncEvent::id).toList());
  }

  @Test
  void chunkSplitsIntoFixedSizeSlices() {
    assertEquals(List.of(List.of(1, 2, 3), List.of(4, 5, 6), List.of(7)),
        BatchExecutor.chunk(List.of(1, 2, 3, 4, 5, 6, 7), 3));
    assertEquals(List.of(), BatchExecutor.chunk(List.of(), 3));
    assertThrows(IllegalArgumentException.class, () -> BatchExecutor.chunk(List.of(1), 0));
  }

  private static SyncEvent event(String id, String table, Instant now) {
    return new SyncEvent(id, table, "{}", Priority.NORMAL, EventStatus.PROCESSING, 0, null, now, now, now);
  }
}
