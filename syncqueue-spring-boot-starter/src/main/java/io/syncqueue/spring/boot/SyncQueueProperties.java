package io.syncqueue.spring.boot;

import io.syncqueue.config.PriorityPolicy;
import io.syncqueue.config.QueueConfig;
import io.syncqueue.model.Priority;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the sync queue engine.
 *
 * @see SyncQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "syncqueue")
public class SyncQueueProperties {

    /**
     * Whether the engine starts processing once the application context is refreshed.
     */
    private boolean autoStart = true;

    /**
     * Database table name for sync events.
     */
    private String tableName = "sync_events";

    /**
     * Age after which a claimed but unfinished event may be claimed again.
     */
    private Duration lockTimeout = Duration.ofMinutes(5);

    private int batchSize = 20;
    private long tickIntervalMs = 2000;
    private int maxConcurrentWorkers = 5;
    private long cleanupIntervalMs = 3_600_000;
    private int completedRetentionDays = 7;

    /**
     * Per-priority overrides keyed by wire name ({@code critical}, {@code high},
     * {@code normal}, {@code low}). Unset fields keep their defaults.
     */
    private final Map<String, PriorityOverride> priorities = new LinkedHashMap<>();

    private final DeadLetter deadLetter = new DeadLetter();
    private final Batching batching = new Batching();
    private final RateLimit rateLimit = new RateLimit();
    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    /**
     * Builds the engine configuration, validating every value.
     *
     * @throws IllegalArgumentException if a value is out of range or a priority name is unknown
     */
    public QueueConfig toQueueConfig() {
        QueueConfig defaults = QueueConfig.defaults();
        QueueConfig.Builder builder = QueueConfig.builder()
            .batchSize(batchSize)
            .tickIntervalMs(tickIntervalMs)
            .maxConcurrentWorkers(maxConcurrentWorkers)
            .cleanupIntervalMs(cleanupIntervalMs)
            .completedRetentionDays(completedRetentionDays)
            .deadLetter(new QueueConfig.DeadLetter(deadLetter.isEnabled(), deadLetter.getRetentionDays()))
            .batching(new QueueConfig.Batching(batching.isEnabled(), batching.getMaxBatchSize()))
            .rateLimit(new QueueConfig.RateLimit(
                rateLimit.isEnabled(), rateLimit.getMaxPerSecond(), rateLimit.getBurstCapacity()));
        for (Map.Entry<String, PriorityOverride> entry : priorities.entrySet()) {
            Priority priority = Priority.fromWireName(entry.getKey());
            builder.priority(priority, entry.getValue().applyTo(defaults.policy(priority)));
        }
        return builder.build();
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
        this.tickIntervalMs = tickIntervalMs;
    }

    public int getMaxConcurrentWorkers() {
        return maxConcurrentWorkers;
    }

    public void setMaxConcurrentWorkers(int maxConcurrentWorkers) {
        this.maxConcurrentWorkers = maxConcurrentWorkers;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public int getCompletedRetentionDays() {
        return completedRetentionDays;
    }

    public void setCompletedRetentionDays(int completedRetentionDays) {
        this.completedRetentionDays = completedRetentionDays;
    }

    public Map<String, PriorityOverride> getPriorities() {
        return priorities;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public Batching getBatching() {
        return batching;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class PriorityOverride {
        private Integer maxRetries;
        private Long baseRetryDelayMs;
        private Long timeoutMs;

        PriorityPolicy applyTo(PriorityPolicy base) {
            return new PriorityPolicy(
                maxRetries != null ? maxRetries : base.maxRetries(),
                baseRetryDelayMs != null ? baseRetryDelayMs : base.baseRetryDelayMs(),
                timeoutMs != null ? timeoutMs : base.timeoutMs());
        }

        public Integer getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Long getBaseRetryDelayMs() {
            return baseRetryDelayMs;
        }

        public void setBaseRetryDelayMs(Long baseRetryDelayMs) {
            this.baseRetryDelayMs = baseRetryDelayMs;
        }

        public Long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class DeadLetter {
        private boolean enabled = true;
        private int retentionDays = 7;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }
    }

    public static class Batching {
        private boolean enabled = true;
        private int maxBatchSize = 50;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }
    }

    public static class RateLimit {
        private boolean enabled = true;
        private double maxPerSecond = 100;
        private int burstCapacity = 200;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getMaxPerSecond() {
            return maxPerSecond;
        }

        public void setMaxPerSecond(double maxPerSecond) {
            this.maxPerSecond = maxPerSecond;
        }

        public int getBurstCapacity() {
            return burstCapacity;
        }

        public void setBurstCapacity(int burstCapacity) {
            this.burstCapacity = burstCapacity;
        }
    }

    public static class Retry {
        /**
         * Upper bound on a single retry delay; {@code 0} leaves delays uncapped.
         */
        private long maxDelayMs = 0;

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "syncqueue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
