package io.syncqueue;

import io.syncqueue.config.QueueConfig;
import io.syncqueue.model.EventStatus;
import io.syncqueue.model.Priority;
import io.syncqueue.model.SyncEvent;
import io.syncqueue.stats.ErrorRecord;
import io.syncqueue.support.InMemoryEventStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SyncQueueEngineTest {

  private final InMemoryEventStore store = new InMemoryEventStore();
  private final List<String> processed = new CopyOnWriteArrayList<>();
  private final RecordingListener listener = new RecordingListener();
  private SyncQueueEngine engine;

  @AfterEach
  void tearDown() {
    if (engine != null) {
      engine.close();
    }
  }

  private SyncQueueEngine engine(QueueConfig config) {
    engine = SyncQueueEngine.builder()
        .store(store)
        .processor(event -> {
          processed.add(event.id());
          return EventResult.ok();
        })
        .listener(listener)
        .config(config)
        .build();
    return engine;
  }

  private static QueueConfig slowTicks() {
    return QueueConfig.builder().tickIntervalMs(60_000).build();
  }

  private void awaitFetchCalls(int expected) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
    while (store.fetchCalls.get() < expected && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertTrue(store.fetchCalls.get() >= expected, "expected " + expected + " fetches");
  }

  @Test
  void startBeforeInitializeFails() {
    SyncQueueEngine e = engine(slowTicks());

    assertThrows(IllegalStateException.class, e::start);
    assertThrows(IllegalStateException.class, e::tick);
    assertThrows(IllegalStateException.class, () -> e.runPriorityManually(Priority.HIGH, 1));
    assertFalse(e.getStatus().initialized());
    assertNull(e.getStatus().config());
  }

  @Test
  void initializeFailsWhenStoreIsUnreachable() {
    store.fail("verifyConnectivity", new IllegalStateException("connection refused"));
    SyncQueueEngine e = engine(slowTicks());

    assertFalse(e.initialize());
    assertFalse(e.isInitialized());
    ErrorRecord error = e.getStatus().stats().recentErrors().get(0);
    assertEquals("initialization", error.type());
    assertEquals("connection refused", error.message());
    assertEquals(1, listener.errors.get());
  }

  @Test
  void failedReinitializeLeavesEngineUninitialized() {
    SyncQueueEngine e = engine(slowTicks());
    assertTrue(e.initialize());
    store.fail("verifyConnectivity", new IllegalStateException("connection refused"));

    assertFalse(e.initialize(QueueConfig.builder().tickIntervalMs(30_000).build()));

    assertFalse(e.isInitialized());
    assertFalse(e.getStatus().initialized());
    assertThrows(IllegalStateException.class, e::start);
    assertThrows(IllegalStateException.class, e::tick);

    store.clearFailures();
    assertTrue(e.initialize());
    e.start();
    assertTrue(e.isProcessing());
  }

  @Test
  void restartRunsExactlyOneLoop() throws Exception {
    SyncQueueEngine e = engine(slowTicks());
    assertTrue(e.initialize());

    e.start();
    awaitFetchCalls(4);
    e.stop();
    e.start();
    e.start();
    awaitFetchCalls(8);
    Thread.sleep(200);

    assertEquals(8, store.fetchCalls.get());
    assertTrue(e.isProcessing());
    assertEquals(2, listener.started.get());
    assertEquals(1, listener.stopped.get());
  }

  @Test
  void tickProcessesDueEvents() throws Exception {
    store.add("evt-1", "orders", Priority.HIGH);
    store.add("evt-2", "customers", Priority.LOW);
    SyncQueueEngine e = engine(slowTicks());
    e.initialize();

    assertEquals(2, e.tick());

    assertEquals(List.of("evt-1", "evt-2"), processed);
    assertEquals(EventStatus.COMPLETED, store.get("evt-1").status());
    assertEquals(2, e.getStatus().stats().processed());
  }

  @Test
  void statusReportsConfigAndWorkerPools() {
    QueueConfig config = slowTicks().toBuilder().maxConcurrentWorkers(3).build();
    store.add("evt-1", "orders", Priority.CRITICAL);
    SyncQueueEngine e = engine(config);
    e.initialize();
    e.tick();

    EngineStatus status = e.getStatus();

    assertTrue(status.initialized());
    assertFalse(status.processing());
    assertEquals(0, status.activeWorkers());
    assertEquals(3, status.maxWorkers());
    assertSame(config, status.config());
    assertEquals(4, status.workerPools().size());
    assertEquals(1, status.workerPools().get(Priority.CRITICAL).started());
    assertEquals(0, status.workerPools().get(Priority.LOW).started());
    assertTrue(status.rateLimiterTokens() <= config.rateLimit().burstCapacity());
  }

  @Test
  void manualRunHonoursLimit() {
    for (int i = 0; i < 4; i++) {
      store.add("evt-" + i, "orders", Priority.NORMAL);
    }
    SyncQueueEngine e = engine(slowTicks());
    e.initialize();

    ManualRunResult result = e.runPriorityManually(Priority.NORMAL, 2);

    assertTrue(result.success());
    assertEquals(2, result.processed());
    assertEquals(2, result.total());
    assertThrows(IllegalArgumentException.class, () -> e.runPriorityManually(Priority.NORMAL, 0));
  }

  @Test
  void manualRunReportsStoreFailure() {
    SyncQueueEngine e = engine(slowTicks());
    e.initialize();
    store.failFetch(Priority.LOW, new IllegalStateException("db down"));

    ManualRunResult result = e.runPriorityManually(Priority.LOW, 10);

    assertFalse(result.success());
    assertEquals("db down", result.error());
    assertEquals("manual_run", e.getStatus().stats().recentErrors().get(0).type());
  }

  @Test
  void resetFailedEventsReturnsZeroOnStoreFailure() {
    Instant now = Instant.now();
    store.put(new SyncEvent("evt-1", "orders", "{}", Priority.HIGH, EventStatus.FAILED, 3,
        "boom", now, now, now));
    SyncQueueEngine e = engine(slowTicks());

    assertEquals(1, e.resetFailedEvents(null, 24));
    assertEquals(EventStatus.PENDING, store.get("evt-1").status());
    assertEquals(0, store.get("evt-1").retryCount());

    store.fail("resetFailedEvents", new IllegalStateException("boom"));
    assertEquals(0, e.resetFailedEvents(Priority.HIGH, 24));
    assertThrows(IllegalArgumentException.class, () -> e.resetFailedEvents(null, 0));
  }

  @Test
  void queueStatisticsFailurePropagates() {
    store.add("evt-1", "orders", Priority.HIGH);
    SyncQueueEngine e = engine(slowTicks());

    assertEquals(1, e.getQueueStatistics().count(EventStatus.PENDING));

    store.fail("getQueueStatistics", new IllegalStateException("timeout"));
    assertThrows(IllegalStateException.class, e::getQueueStatistics);
  }

  @Test
  void runCleanupUsesConfiguredRetention() {
    Instant old = Instant.now().minusSeconds(10 * 86_400L);
    store.put(new SyncEvent("done", "orders", "{}", Priority.HIGH, EventStatus.COMPLETED, 0,
        null, old, old, old));
    SyncQueueEngine e = engine(slowTicks());
    e.initialize();

    assertEquals(1, e.runCleanup().completedDeleted());
    assertNull(store.get("done"));
  }

  @Test
  void initializeRejectedWhileProcessing() {
    SyncQueueEngine e = engine(slowTicks());
    e.initialize();
    e.start();

    assertThrows(IllegalStateException.class, e::initialize);

    e.stop();
    assertTrue(e.initialize(QueueConfig.defaults()));
    assertSame(QueueConfig.defaults(), e.getStatus().config());
  }

  @Test
  void closeIsTerminal() {
    SyncQueueEngine e = engine(slowTicks());
    e.initialize();
    e.start();

    e.close();

    assertFalse(e.isProcessing());
    assertFalse(e.isInitialized());
    assertThrows(IllegalStateException.class, e::initialize);
    assertThrows(IllegalStateException.class, e::start);
    assertEquals(1, listener.stopped.get());
  }

  @Test
  void builderRequiresStoreAndProcessor() {
    assertThrows(NullPointerException.class,
        () -> SyncQueueEngine.builder().processor(event -> EventResult.ok()).build());
    assertThrows(NullPointerException.class,
        () -> SyncQueueEngine.builder().store(store).build());
  }

  private static final class RecordingListener implements QueueListener {
    final AtomicInteger started = new AtomicInteger();
    final AtomicInteger stopped = new AtomicInteger();
    final AtomicInteger errors = new AtomicInteger();

    @Override
    public void onProcessingStarted() {
      started.incrementAndGet();
    }

    @Override
    public void onProcessingStopped() {
      stopped.incrementAndGet();
    }

    @Override
    public void onError(ErrorRecord error) {
      errors.incrementAndGet();
    }
  }
}
