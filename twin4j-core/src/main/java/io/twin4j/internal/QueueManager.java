package io.twin4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.twin4j.JobContext;
import io.twin4j.JobHandler;
import io.twin4j.config.TwinProperties;
import io.twin4j.core.Job;
import io.twin4j.core.JobHandlerRegistry;
import io.twin4j.core.JobPayload;
import io.twin4j.core.QueueNames;
import io.twin4j.core.QueueStats;
import io.twin4j.errors.ConfigurationException;
import io.twin4j.errors.QueueException;
import io.twin4j.errors.TwinException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes queued jobs on bounded per-queue worker pools.
 *
 * <p>State machine: {@code WAITING -> ACTIVE -> COMPLETED | FAILED}. A failed attempt goes back to
 * WAITING with an exponential backoff while attempts remain; an error whose code is not retryable
 * ({@link ConfigurationException}, {@link io.twin4j.errors.ValidationException}) fails the job immediately. Jobs sharing a mutex key (the unit name) never run concurrently, whatever their queue.
 *
 * <p>Typical usage:
 * <pre>{@code
 * QueueManager queues = new QueueManager(props, jobStore, new JobHandlerRegistry(handlers), objectMapper);
 * queues.start();
 *
 * String jobId = queues.enqueue("dt-priority", JobPayload.of("weather", TriggerKind.MANUAL));
 * Map<String, QueueStats> stats = queues.getQueueStats();
 *
 * queues.close(Duration.ofSeconds(30));
 * }</pre>
 */
public class QueueManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueManager.class);

    private final TwinProperties props;
    private final JobStore jobStore;
    private final JobHandlerRegistry jobRegistry;
    private final ObjectMapper objectMapper;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean cancelled = false;

    private final Map<String, ExecutorService> workerPools = new ConcurrentHashMap<>();
    private final Map<String, Semaphore> slots = new ConcurrentHashMap<>();
    private final Set<String> runningKeys = ConcurrentHashMap.newKeySet();
    private final Map<String, Job> activeJobs = new ConcurrentHashMap<>();

    private final Semaphore refillSignal = new Semaphore(0);
    private Thread pollerThread;
    private int systemErrorCount = 0;

    public QueueManager(TwinProperties props, JobStore jobStore, JobHandlerRegistry jobRegistry, ObjectMapper objectMapper) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    /**
     * Verifies the job store and starts polling. Idempotent.
     *
     * @throws ConfigurationException when the job store is unreachable
     */
    public void start() {
        if (closed.get()) {
            throw new QueueException("Queue manager is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getPollInterval(), "twin.pollInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new ConfigurationException("twin.pollInterval must be a positive duration");
        }

        try {
            for (String queue : jobRegistry.queueNames()) {
                requireQueue(queue);
            }
            requireSingleAttemptUploads();
        } catch (ConfigurationException e) {
            started.set(false);
            throw e;
        }

        try {
            jobStore.ping();
        } catch (RuntimeException e) {
            started.set(false);
            throw new ConfigurationException(
                    "Job store is unreachable: " + TwinException.messageOf(e),
                    Map.of("workerId", workerId),
                    e
            );
        }

        int recovered = jobStore.requeueOrphaned(workerId, nowInstant());
        if (recovered > 0) {
            log.warn("Queue manager requeued orphaned jobs count={}", recovered);
        }

        for (String queue : jobRegistry.queueNames()) {
            TwinProperties.QueueOptions options = requireQueue(queue);
            int concurrency = Math.max(1, options.getConcurrency());
            slots.put(queue, new Semaphore(concurrency));
            workerPools.put(queue, Executors.newFixedThreadPool(concurrency, r -> {
                Thread t = new Thread(r);
                t.setName("twin.worker." + queue);
                t.setDaemon(true);
                return t;
            }));
        }

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("twin.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();

        log.info("Queue manager started workerId={} queues={} pollInterval={}",
                workerId, jobRegistry.queueNames(), props.getPollInterval());
    }

    /**
     * Persists a job and returns immediately.
     *
     * @return job id
     * @throws QueueException when the manager is closed, the queue is unknown or the store is unreachable
     */
    public String enqueue(String queueName, JobPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        if (closed.get()) {
            throw new QueueException("Queue manager is closed, job rejected", Map.of("queue", queueName, "unitName", payload.unitName()));
        }
        if (!jobRegistry.contains(queueName) || props.queue(queueName) == null) {
            throw new QueueException("Unknown queue: " + queueName, Map.of("queue", queueName));
        }

        Job job;
        try {
            job = jobStore.insert(queueName, payload, Math.max(1, props.queue(queueName).getMaxAttempts()), nowInstant());
        } catch (RuntimeException e) {
            throw new QueueException(
                    "Failed to enqueue job on " + queueName + ": " + TwinException.messageOf(e),
                    Map.of("queue", queueName, "unitName", payload.unitName()),
                    e
            );
        }

        log.debug("Queue job enqueued queue={} unit={} id={} trigger={}", queueName, payload.unitName(), job.jobId(), payload.trigger());
        refillSignal.release();
        return job.jobId();
    }

    public Map<String, QueueStats> getQueueStats() {
        Map<String, QueueStats> stats = new LinkedHashMap<>();
        try {
            for (String queue : props.getQueues().keySet()) {
                if (jobRegistry.contains(queue)) {
                    stats.put(queue, jobStore.countByStatus(queue));
                }
            }
        } catch (RuntimeException e) {
            throw new QueueException("Failed to read queue stats: " + TwinException.messageOf(e), Map.of(), e);
        }
        return stats;
    }

    /**
     * True while the unit runs here or has a waiting or active job in the store.
     */
    public boolean isUnitBusy(String unitName) {
        return runningKeys.contains(unitName) || jobStore.countOpenJobs(unitName) > 0;
    }

    public Optional<Job> findJob(String jobId) {
        return jobStore.findById(jobId);
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    public String workerId() {
        return workerId;
    }

    @Override
    public void close() {
        close(props.getShutdownTimeout());
    }

    /**
     * Stops accepting jobs and waits up to {@code grace} for active ones. Jobs still running after
     * that are force-failed.
     *
     * @throws QueueException when jobs had to be force-failed
     */
    public void close(Duration grace) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Queue manager stopping grace={}", grace);
        started.set(false);
        cancelled = true;

        long deadline = System.nanoTime() + grace.toNanos();
        Thread poller = pollerThread;
        pollerThread = null;
        if (poller != null) {
            poller.interrupt();
            try {
                // a claim in flight must reach a worker pool before the pools shut down
                poller.join(Math.max(1, grace.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (poller.isAlive()) {
                log.warn("Queue manager poller still running after grace={}", grace);
            }
        }

        workerPools.values().forEach(ExecutorService::shutdown);
        try {
            for (ExecutorService pool : workerPools.values()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0 || !pool.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        int forced = 0;
        if (!activeJobs.isEmpty()) {
            String error = "Job cancelled: shutdown grace period of " + grace + " expired";
            forced = jobStore.failActive(workerId, error, nowInstant());
            log.error("Queue manager force-failed jobs count={} ids={}", forced, activeJobs.keySet());
        }
        workerPools.values().forEach(ExecutorService::shutdownNow);
        workerPools.clear();
        refillSignal.drainPermits();

        if (forced > 0) {
            throw new QueueException(
                    "Shutdown grace period expired, " + forced + " active job(s) force-failed",
                    Map.of("forced", forced, "grace", grace.toString())
            );
        }
        log.info("Queue manager stopped.");
    }

    /**
     * Utility: current time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private TwinProperties.QueueOptions requireQueue(String queue) {
        TwinProperties.QueueOptions options = props.queue(queue);
        if (options == null) {
            throw new ConfigurationException("No options configured for queue: " + queue, Map.of("queue", queue));
        }
        return options;
    }

    // A retried upload would find its record FAILED and its scratch file gone.
    private void requireSingleAttemptUploads() {
        if (!jobRegistry.contains(QueueNames.UPLOADS)) {
            return;
        }
        int maxAttempts = requireQueue(QueueNames.UPLOADS).getMaxAttempts();
        if (maxAttempts != 1) {
            throw new ConfigurationException(
                    "Queue " + QueueNames.UPLOADS + " must use maxAttempts = 1, got " + maxAttempts,
                    Map.of("queue", QueueNames.UPLOADS, "maxAttempts", maxAttempts)
            );
        }
    }

    private String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "twin4j";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("Queue manager could not resolve host name msg={}", e.getMessage());
        }

        String pid = Long.toString(ProcessHandle.current().pid());
        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("queue pollOnce failed attempt={} msg={}", systemErrorCount, e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                // woken early by enqueue() and finished jobs
                refillSignal.tryAcquire(backlog ? 50 : props.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
                refillSignal.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(500L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * Delay before the next attempt, {@code base * 2^(attempt-1)} capped at {@code twin.maxBackoff},
     * with equal jitter: half of it fixed, half random.
     * attempt starts from 1 (first failure).
     */
    Duration retryDelay(Duration base, int attempt) {
        int exp = Math.max(0, attempt - 1);
        exp = Math.min(exp, 20); // avoid overflow
        long ms = Math.min(base.toMillis() * (1L << exp), props.getMaxBackoff().toMillis());
        long half = ms / 2;
        long jitter = half > 0 ? ThreadLocalRandom.current().nextLong(half + 1) : 0;
        return Duration.ofMillis(ms - half + jitter);
    }

    /**
     * Claims due jobs while worker slots are free.
     *
     * @return true when at least one queue is saturated
     */
    private boolean pollOnce() {
        boolean backlog = false;
        for (String queue : jobRegistry.queueNames()) {
            Semaphore free = slots.get(queue);
            while (started.get() && free.tryAcquire()) {
                Optional<Job> claimed;
                try {
                    claimed = jobStore.claimNext(queue, nowInstant(), Set.copyOf(runningKeys), workerId);
                } catch (RuntimeException e) {
                    free.release();
                    throw e;
                }
                if (claimed.isEmpty()) {
                    free.release();
                    break;
                }
                submitToWorker(claimed.get(), free);
            }
            if (free.availablePermits() == 0) {
                backlog = true;
            }
        }
        return backlog;
    }

    private void submitToWorker(Job job, Semaphore slot) {
        String key = job.payload().mutexKey();
        runningKeys.add(key);
        activeJobs.put(job.jobId(), job);

        try {
            workerPools.get(job.queueName()).submit(() -> runJob(job, slot, key));
        } catch (RuntimeException e) {
            // pool already shut down: hand the claim back, the attempt never ran
            activeJobs.remove(job.jobId());
            runningKeys.remove(key);
            slot.release();
            log.warn("queue job rejected by worker pool, requeued queue={} id={} msg={}", job.queueName(), job.jobId(), e.getMessage());
            Instant now = nowInstant();
            try {
                jobStore.markRetry(job.jobId(), workerId, now, "Queue manager closed before the job started", now);
            } catch (RuntimeException storeEx) {
                log.error("queue requeue failed id={} msg={}", job.jobId(), storeEx.getMessage(), storeEx);
            }
        }
    }

    private void runJob(Job job, Semaphore slot, String key) {
        String unit = job.unitName();
        try {
            JobHandler<?> handler = jobRegistry.getRequired(job.queueName());
            JobContext context = new JobContext(
                    job.jobId(),
                    job.queueName(),
                    unit,
                    job.payload().trigger(),
                    job.attempt(),
                    job.maxAttempts(),
                    () -> cancelled
            );

            log.debug("Queue job started queue={} unit={} id={} attempt={}/{}", job.queueName(), unit, job.jobId(), job.attempt(), job.maxAttempts());
            executeHandler(handler, job.payload().data(), context);
            Instant finishedAt = nowInstant();
            log.debug("Queue job succeeded queue={} unit={} id={}", job.queueName(), unit, job.jobId());

            if (props.isCleanupFinishedJobs()) {
                jobStore.deleteById(job.jobId());
            } else {
                jobStore.markCompleted(job.jobId(), workerId, finishedAt);
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            markFailure(job, e);
        } finally {
            activeJobs.remove(job.jobId());
            runningKeys.remove(key);
            slot.release();
            refillSignal.release();
        }
    }

    private void markFailure(Job job, Exception e) {
        String error = TwinException.messageOf(e);
        Instant failedAt = nowInstant();
        boolean terminal = (e instanceof TwinException te && !te.retryable()) || !job.hasAttemptsLeft();
        try {
            if (terminal) {
                log.error("queue job failed permanently queue={} unit={} id={} attempts={} msg={}",
                        job.queueName(), job.unitName(), job.jobId(), job.attempt(), error, e);
                jobStore.markFailed(job.jobId(), workerId, error, failedAt);
            } else {
                Duration delay = retryDelay(requireQueue(job.queueName()).getBackoff(), job.attempt());
                log.warn("queue job failed, retrying queue={} unit={} id={} attempt={}/{} delay={} msg={}",
                        job.queueName(), job.unitName(), job.jobId(), job.attempt(), job.maxAttempts(), delay, error);
                jobStore.markRetry(job.jobId(), workerId, failedAt.plus(delay), error, failedAt);
            }
        } catch (Exception storeEx) {
            log.error("queue markFailure failed id={} msg={}", job.jobId(), storeEx.getMessage(), storeEx);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void executeHandler(JobHandler<?> handler, Map<String, Object> rawData, JobContext context) throws Exception {
        var h = (JobHandler<T>) handler;
        T data = (rawData == null || rawData.isEmpty()) ? null : objectMapper.convertValue(rawData, h.dataClass());
        h.execute(data, context);
    }
}
