package io.twin4j.config;

import io.twin4j.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

/**
 * MongoDB index definitions for the job collection.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code twin.ensure-indexes-on-startup=true};
 * in production they are usually managed by migrations or ops scripts. Stream collections get their
 * {@code idx_date} index when the engine creates or migrates them.
 *
 * <h3>Required indexes (collection: {@code twin_jobs})</h3>
 * <ul>
 *   <li><b>idx_claim</b>: { queueName: 1, status: 1, runAt: 1, createdAt: 1 }
 *       <br/>Used by pollers claiming the oldest due job of a queue.</li>
 *   <li><b>idx_mutex</b>: { mutexKey: 1, status: 1 }
 *       <br/>Used by the busy check of the scheduler.</li>
 *   <li><b>idx_locked_by</b>: { status: 1, lockedBy: 1 }
 *       <br/>Used when force-failing or requeueing jobs of a worker.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.twin_jobs.createIndex({ queueName: 1, status: 1, runAt: 1, createdAt: 1 }, { name: "idx_claim" });
 * db.twin_jobs.createIndex({ mutexKey: 1, status: 1 }, { name: "idx_mutex" });
 * db.twin_jobs.createIndex({ status: 1, lockedBy: 1 }, { name: "idx_locked_by" });
 * </pre>
 */
public class TwinMongoIndexConfig {

    public static final String IDX_CLAIM = "idx_claim";
    public static final String IDX_MUTEX = "idx_mutex";
    public static final String IDX_LOCKED_BY = "idx_locked_by";

    private final MongoTemplate mongoTemplate;

    public TwinMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Creates the job indexes when missing. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(JobDocument.class);
        ops.ensureIndex(claimIndex());
        ops.ensureIndex(mutexIndex());
        ops.ensureIndex(lockedByIndex());
    }

    public static Index claimIndex() {
        return new Index()
                .on("queueName", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .on("runAt", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CLAIM);
    }

    public static Index mutexIndex() {
        return new Index()
                .on("mutexKey", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .named(IDX_MUTEX);
    }

    public static Index lockedByIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("lockedBy", Sort.Direction.ASC)
                .named(IDX_LOCKED_BY);
    }
}
