package io.syncqueue.config;

import io.syncqueue.model.Priority;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueueConfigTest {

  @Test
  void defaults() {
    QueueConfig config = QueueConfig.defaults();

    assertEquals(20, config.batchSize());
    assertEquals(2000, config.tickIntervalMs());
    assertEquals(5, config.maxConcurrentWorkers());
    assertEquals(new PriorityPolicy(5, 1000, 30_000), config.policy(Priority.CRITICAL));
    assertEquals(new PriorityPolicy(4, 2000, 20_000), config.policy(Priority.HIGH));
    assertEquals(new PriorityPolicy(3, 5000, 15_000), config.policy(Priority.NORMAL));
    assertEquals(new PriorityPolicy(2, 10_000, 10_000), config.policy(Priority.LOW));
    assertEquals(new QueueConfig.DeadLetter(true, 7), config.deadLetter());
    assertEquals(new QueueConfig.Batching(true, 50), config.batching());
    assertEquals(new QueueConfig.RateLimit(true, 100, 200), config.rateLimit());
    assertEquals(3_600_000L, config.cleanupIntervalMs());
    assertEquals(7, config.completedRetentionDays());
  }

  @Test
  void toBuilderOverridesSingleValues() {
    QueueConfig config = QueueConfig.defaults().toBuilder()
        .maxConcurrentWorkers(10)
        .priority(Priority.LOW, new PriorityPolicy(1, 500, 1000))
        .build();

    assertEquals(10, config.maxConcurrentWorkers());
    assertEquals(new PriorityPolicy(1, 500, 1000), config.policy(Priority.LOW));
    assertEquals(QueueConfig.defaults().policy(Priority.HIGH), config.policy(Priority.HIGH));
    assertEquals(5, QueueConfig.defaults().maxConcurrentWorkers());
  }

  @Test
  void priorityTableMustBeComplete() {
    Map<Priority, PriorityPolicy> partial = new EnumMap<>(Priority.class);
    partial.put(Priority.CRITICAL, new PriorityPolicy(1, 100, 100));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> QueueConfig.builder().priorities(partial).build());
    assertTrue(ex.getMessage().contains("high"));
  }

  @Test
  void prioritiesAreUnmodifiable() {
    assertThrows(UnsupportedOperationException.class,
        () -> QueueConfig.defaults().priorities().put(Priority.LOW, new PriorityPolicy(0, 1, 1)));
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class, () -> QueueConfig.builder().batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> QueueConfig.builder().tickIntervalMs(0).build());
    assertThrows(IllegalArgumentException.class, () -> QueueConfig.builder().maxConcurrentWorkers(0).build());
    assertThrows(IllegalArgumentException.class, () -> QueueConfig.builder().cleanupIntervalMs(0).build());
    assertThrows(IllegalArgumentException.class, () -> QueueConfig.builder().completedRetentionDays(-1).build());
    assertThrows(IllegalArgumentException.class, () -> new PriorityPolicy(-1, 1, 1));
    assertThrows(IllegalArgumentException.class, () -> new PriorityPolicy(1, 0, 1));
    assertThrows(IllegalArgumentException.class, () -> new PriorityPolicy(1, 1, 0));
    assertThrows(IllegalArgumentException.class, () -> new QueueConfig.Batching(true, 0));
    assertThrows(IllegalArgumentException.class, () -> new QueueConfig.RateLimit(true, 0, 1));
    assertThrows(IllegalArgumentException.class, () -> new QueueConfig.RateLimit(true, 1, 0));
    assertThrows(IllegalArgumentException.class, () -> new QueueConfig.DeadLetter(true, -1));
  }

  @Test
  void zeroRetentionIsAllowed() {
    assertEquals(0, QueueConfig.builder().completedRetentionDays(0).build().completedRetentionDays());
  }
}
