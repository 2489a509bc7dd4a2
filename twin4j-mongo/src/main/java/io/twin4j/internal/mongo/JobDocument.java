package io.twin4j.internal.mongo;

import io.twin4j.core.JobStatus;
import io.twin4j.core.TriggerKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for queued jobs.
 */
@Document(collection = "twin_jobs")
public class JobDocument {

    @Id
    private String id;

    private String queueName;
    private String unitName;
    private TriggerKind trigger;
    private String mutexKey;
    private Map<String, Object> data;

    private JobStatus status;
    private int attempt;
    private int maxAttempts;
    private String lastError;

    @Field(write = Field.Write.ALWAYS)
    private Instant runAt;

    private Instant createdAt;
    private Instant updatedAt;

    private String lockedBy;
    private Instant lockedAt;

    public JobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getQueueName() {
        return queueName;
    }

    public void setQueueName(String queueName) {
        this.queueName = queueName;
    }

    public String getUnitName() {
        return unitName;
    }

    public void setUnitName(String unitName) {
        this.unitName = unitName;
    }

    public TriggerKind getTrigger() {
        return trigger;
    }

    public void setTrigger(TriggerKind trigger) {
        this.trigger = trigger;
    }

    public String getMutexKey() {
        return mutexKey;
    }

    public void setMutexKey(String mutexKey) {
        this.mutexKey = mutexKey;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public void setData(Map<String, Object> data) {
        this.data = data;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getAttempt() {
        return attempt;
    }

    public void setAttempt(int attempt) {
        this.attempt = attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getRunAt() {
        return runAt;
    }

    public void setRunAt(Instant runAt) {
        this.runAt = runAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }
}
