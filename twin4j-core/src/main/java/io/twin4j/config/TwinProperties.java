package io.twin4j.config;

import io.twin4j.core.QueueNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime configuration of the engine.
 */
@ConfigurationProperties(prefix = "twin")
public class TwinProperties {
    private boolean enabled = true;
    private Duration pollInterval = Duration.ofMillis(500);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private Duration maxBackoff = Duration.ofMinutes(10);
    private boolean autoMigration = true;
    private boolean cleanupFinishedJobs = false;
    private String workerId;
    private String timezone; // cron evaluation zone, null = system default
    private String version = "0.1.0";
    private boolean ensureIndexesOnStartup = false;
    private boolean autoStartup = true;
    private Upload upload = new Upload();
    private Storage storage = new Storage();
    private Map<String, QueueOptions> queues = defaultQueues();

    /**
     * Per-queue worker and retry settings.
     */
    public static class QueueOptions {
        private int concurrency = 1;
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofSeconds(2); // delay before the 2nd attempt

        public QueueOptions() {
        }

        public QueueOptions(int concurrency, int maxAttempts, Duration backoff) {
            this.concurrency = concurrency;
            this.maxAttempts = maxAttempts;
            this.backoff = backoff;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }
    }

    public static class Upload {
        private long inMemoryThreshold = 1024L * 1024; // bytes carried inline in the job
        private Path scratchDir = Path.of(System.getProperty("java.io.tmpdir"), "twin4j-uploads");

        public long getInMemoryThreshold() {
            return inMemoryThreshold;
        }

        public void setInMemoryThreshold(long inMemoryThreshold) {
            this.inMemoryThreshold = inMemoryThreshold;
        }

        public Path getScratchDir() {
            return scratchDir;
        }

        public void setScratchDir(Path scratchDir) {
            this.scratchDir = scratchDir;
        }
    }

    /**
     * Blob store settings used by the GridFS storage service.
     */
    public static class Storage {
        private String bucket = "twin_blobs";
        private String publicBaseUrl;

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getPublicBaseUrl() {
            return publicBaseUrl;
        }

        public void setPublicBaseUrl(String publicBaseUrl) {
            this.publicBaseUrl = publicBaseUrl;
        }
    }

    private static Map<String, QueueOptions> defaultQueues() {
        Map<String, QueueOptions> queues = new LinkedHashMap<>();
        queues.put(QueueNames.COLLECTORS, new QueueOptions(5, 3, Duration.ofSeconds(2)));
        queues.put(QueueNames.HARVESTERS, new QueueOptions(3, 5, Duration.ofSeconds(5)));
        queues.put(QueueNames.PRIORITY, new QueueOptions(1, 2, Duration.ofSeconds(1)));
        queues.put(QueueNames.UPLOADS, new QueueOptions(2, 1, Duration.ofSeconds(10)));
        return queues;
    }

    /**
     * Options for {@code queueName}, or null when the queue is not configured.
     */
    public QueueOptions queue(String queueName) {
        return queues.get(queueName);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public boolean isAutoMigration() {
        return autoMigration;
    }

    public void setAutoMigration(boolean autoMigration) {
        this.autoMigration = autoMigration;
    }

    public boolean isCleanupFinishedJobs() {
        return cleanupFinishedJobs;
    }

    public void setCleanupFinishedJobs(boolean cleanupFinishedJobs) {
        this.cleanupFinishedJobs = cleanupFinishedJobs;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public Upload getUpload() {
        return upload;
    }

    public void setUpload(Upload upload) {
        this.upload = upload;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Map<String, QueueOptions> getQueues() {
        return queues;
    }

    public void setQueues(Map<String, QueueOptions> queues) {
        this.queues = queues;
    }
}
