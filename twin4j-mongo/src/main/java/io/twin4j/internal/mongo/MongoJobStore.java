package io.twin4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.twin4j.core.Job;
import io.twin4j.core.JobPayload;
import io.twin4j.core.JobStatus;
import io.twin4j.core.QueueStats;
import io.twin4j.internal.JobStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB persistence layer for queued jobs (collection {@code twin_jobs}).
 *
 * <p>Claims go through {@code findAndModify}, so two pollers never get the same job. Every write-back
 * is filtered on {@code status=ACTIVE} and {@code lockedBy}, which prevents a stale worker from
 * overwriting a job that was force-failed or requeued meanwhile.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void ping() {
        mongoTemplate.executeCommand("{ ping: 1 }");
    }

    @Override
    public Job insert(String queueName, JobPayload payload, int maxAttempts, Instant runAt) {
        Objects.requireNonNull(queueName, "queueName must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(runAt, "runAt must not be null");

        JobDocument doc = new JobDocument();
        doc.setQueueName(queueName);
        doc.setUnitName(payload.unitName());
        doc.setTrigger(payload.trigger());
        doc.setMutexKey(payload.mutexKey());
        doc.setData(payload.data().isEmpty() ? null : payload.data());
        doc.setStatus(JobStatus.WAITING);
        doc.setAttempt(0);
        doc.setMaxAttempts(maxAttempts);
        doc.setRunAt(runAt);
        doc.setCreatedAt(runAt);
        doc.setUpdatedAt(runAt);

        return toJob(mongoTemplate.insert(doc));
    }

    /**
     * Atomically claims (locks) the oldest due job of the queue.
     *
     * <p>A job is due when {@code status == WAITING} and {@code runAt <= now}; jobs whose mutex key is
     * currently running on this worker are skipped.
     */
    @Override
    public Optional<Job> claimNext(String queueName, Instant now, Set<String> excludedKeys, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        if (isBlank(workerId)) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Criteria c = Criteria.where("queueName").is(queueName)
                .and("status").is(JobStatus.WAITING)
                .and("runAt").lte(now);
        if (excludedKeys != null && !excludedKeys.isEmpty()) {
            c = c.and("mutexKey").nin(excludedKeys);
        }
        Query query = new Query(c).with(Sort.by(Sort.Order.asc("runAt"), Sort.Order.asc("createdAt")));

        Update claim = new Update()
                .set("status", JobStatus.ACTIVE)
                .set("lockedBy", workerId)
                .set("lockedAt", now)
                .set("updatedAt", now)
                .inc("attempt", 1);

        JobDocument doc = mongoTemplate.findAndModify(query, claim, FindAndModifyOptions.options().returnNew(true), JobDocument.class);
        return Optional.ofNullable(doc).map(MongoJobStore::toJob);
    }

    @Override
    public boolean markCompleted(String jobId, String workerId, Instant at) {
        Update u = releaseLock(at)
                .set("status", JobStatus.COMPLETED)
                .unset("lastError");
        return updateLocked(jobId, workerId, u).getModifiedCount() > 0;
    }

    @Override
    public boolean markRetry(String jobId, String workerId, Instant nextRunAt, String error, Instant at) {
        Objects.requireNonNull(nextRunAt, "nextRunAt must not be null");
        Update u = releaseLock(at)
                .set("status", JobStatus.WAITING)
                .set("runAt", nextRunAt)
                .set("lastError", error);
        return updateLocked(jobId, workerId, u).getModifiedCount() > 0;
    }

    @Override
    public boolean markFailed(String jobId, String workerId, String error, Instant at) {
        Update u = releaseLock(at)
                .set("status", JobStatus.FAILED)
                .set("lastError", error);
        return updateLocked(jobId, workerId, u).getModifiedCount() > 0;
    }

    @Override
    public QueueStats countByStatus(String queueName) {
        return new QueueStats(
                count(queueName, JobStatus.WAITING),
                count(queueName, JobStatus.ACTIVE),
                count(queueName, JobStatus.COMPLETED),
                count(queueName, JobStatus.FAILED)
        );
    }

    @Override
    public long countOpenJobs(String mutexKey) {
        Query q = new Query(Criteria.where("mutexKey").is(mutexKey)
                .and("status").in(JobStatus.WAITING, JobStatus.ACTIVE));
        return mongoTemplate.count(q, JobDocument.class);
    }

    @Override
    public Optional<Job> findById(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(jobId, JobDocument.class)).map(MongoJobStore::toJob);
    }

    @Override
    public int failActive(String workerId, String error, Instant at) {
        Query q = new Query(Criteria.where("status").is(JobStatus.ACTIVE).and("lockedBy").is(workerId));
        Update u = releaseLock(at)
                .set("status", JobStatus.FAILED)
                .set("lastError", error);
        return (int) mongoTemplate.updateMulti(q, u, JobDocument.class).getModifiedCount();
    }

    @Override
    public int requeueOrphaned(String workerId, Instant at) {
        Query q = new Query(Criteria.where("status").is(JobStatus.ACTIVE).and("lockedBy").ne(workerId));
        Update u = releaseLock(at)
                .set("status", JobStatus.WAITING)
                .set("runAt", at);
        return (int) mongoTemplate.updateMulti(q, u, JobDocument.class).getModifiedCount();
    }

    /**
     * Hard delete job by document id.
     */
    @Override
    public boolean deleteById(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("_id").is(jobId));
        return mongoTemplate.remove(q, JobDocument.class).getDeletedCount() > 0;
    }

    /**
     * Jobs of a queue in the given state, oldest first. Mostly useful for inspection and tests.
     */
    public List<Job> findByStatus(String queueName, JobStatus status, int limit) {
        Query q = new Query(Criteria.where("queueName").is(queueName).and("status").is(status))
                .with(Sort.by(Sort.Order.asc("createdAt")))
                .limit(limit);
        return mongoTemplate.find(q, JobDocument.class).stream().map(MongoJobStore::toJob).toList();
    }

    private UpdateResult updateLocked(String jobId, String workerId, Update update) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Query q = new Query(
                Criteria.where("_id").is(jobId)
                        .and("status").is(JobStatus.ACTIVE)
                        // Prevent stale write-back if the job was force-failed or requeued meanwhile.
                        .and("lockedBy").is(workerId)
        );
        return mongoTemplate.updateFirst(q, update, JobDocument.class);
    }

    private static Update releaseLock(Instant at) {
        return new Update()
                .set("updatedAt", at)
                .unset("lockedBy")
                .unset("lockedAt");
    }

    private long count(String queueName, JobStatus status) {
        return mongoTemplate.count(new Query(Criteria.where("queueName").is(queueName).and("status").is(status)), JobDocument.class);
    }

    static Job toJob(JobDocument doc) {
        JobPayload payload = new JobPayload(doc.getUnitName(), doc.getTrigger(), doc.getData());
        return new Job(
                doc.getId(),
                doc.getQueueName(),
                payload,
                doc.getStatus(),
                doc.getAttempt(),
                doc.getMaxAttempts(),
                doc.getLastError(),
                doc.getRunAt(),
                doc.getCreatedAt(),
                doc.getUpdatedAt(),
                doc.getLockedBy()
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
