package io.twin4j.internal.mongo;

import io.twin4j.core.DataRecord;
import io.twin4j.core.MetadataRow;
import io.twin4j.core.UploadStatus;
import io.twin4j.core.UploadUpdate;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.errors.DatabaseException;
import io.twin4j.storage.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link DatabaseAdapter} keeping one MongoDB collection per stream.
 *
 * <p>Ids are ObjectIds, so sorting by {@code (date, _id)} gives the same order as
 * {@link DataRecord#CHRONOLOGICAL} on their hex form.
 */
public class MongoDatabaseAdapter implements DatabaseAdapter {
    private static final Logger log = LoggerFactory.getLogger(MongoDatabaseAdapter.class);

    static final String IDX_DATE = "idx_date";
    static final String IDX_UPLOAD_STATUS = "idx_upload_status";

    private static final Sort ASCENDING = Sort.by(Sort.Order.asc("date"), Sort.Order.asc("_id"));
    private static final Sort DESCENDING = Sort.by(Sort.Order.desc("date"), Sort.Order.desc("_id"));

    private final MongoTemplate mongoTemplate;
    private final StorageService storage;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public MongoDatabaseAdapter(MongoTemplate mongoTemplate, StorageService storage) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
    }

    @Override
    public boolean doesTableExists(String name) {
        return call("doesTableExists", name, () -> mongoTemplate.collectionExists(name));
    }

    @Override
    public void createTable(String name) {
        call("createTable", name, () -> {
            if (!mongoTemplate.collectionExists(name)) {
                mongoTemplate.createCollection(name);
                log.debug("mongo collection created name={}", name);
            }
            mongoTemplate.indexOps(name).ensureIndex(dateIndex());
            return null;
        });
    }

    /**
     * Adds the indexes missing from a table created by an older version.
     */
    @Override
    public List<String> migrateTableSchema(String name) {
        return call("migrateTableSchema", name, () -> {
            if (!mongoTemplate.collectionExists(name)) {
                throw new DatabaseException("Table does not exist: " + name, Map.of("table", name));
            }
            IndexOperations ops = mongoTemplate.indexOps(name);
            Set<String> existing = ops.getIndexInfo().stream().map(IndexInfo::getName).collect(Collectors.toSet());

            List<String> applied = new ArrayList<>();
            if (!existing.contains(IDX_DATE)) {
                ops.ensureIndex(dateIndex());
                applied.add("create index " + IDX_DATE);
            }
            if (!existing.contains(IDX_UPLOAD_STATUS)) {
                ops.ensureIndex(uploadStatusIndex());
                applied.add("create index " + IDX_UPLOAD_STATUS);
            }
            if (!applied.isEmpty()) {
                log.debug("mongo collection migrated name={} migrations={}", name, applied);
            }
            return applied;
        });
    }

    @Override
    public DataRecord save(MetadataRow row) {
        String name = row.streamName();
        return call("save", name, () -> {
            if (!mongoTemplate.collectionExists(name)) {
                throw new DatabaseException("Table does not exist: " + name, Map.of("table", name));
            }
            RecordDocument doc = new RecordDocument();
            doc.setDate(row.date());
            doc.setContentType(row.contentType());
            doc.setBlobRef(row.blobRef());
            doc.setDescription(row.description());
            doc.setSource(row.source());
            doc.setOwnerId(row.ownerId());
            doc.setFilename(row.filename());
            doc.setIsPublic(row.isPublic());
            doc.setUploadStatus(row.uploadStatus());
            return toRecord(name, mongoTemplate.insert(doc, name));
        });
    }

    @Override
    public Optional<DataRecord> getById(String name, String id) {
        return call("getById", name, () ->
                Optional.ofNullable(mongoTemplate.findById(id, RecordDocument.class, name)).map(d -> toRecord(name, d)));
    }

    @Override
    public Optional<DataRecord> getLatestByName(String name) {
        return call("getLatestByName", name, () -> findOne(name, new Query().with(DESCENDING)));
    }

    @Override
    public Optional<DataRecord> getLatestBefore(String name, Instant beforeDate) {
        Objects.requireNonNull(beforeDate, "beforeDate must not be null");
        return call("getLatestBefore", name, () ->
                findOne(name, new Query(Criteria.where("date").lte(beforeDate)).with(DESCENDING)));
    }

    @Override
    public List<DataRecord> getByDateRange(String name, Instant start, Instant end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        return call("getByDateRange", name, () ->
                find(name, new Query(Criteria.where("date").gte(start).lte(end)).with(ASCENDING)));
    }

    @Override
    public List<DataRecord> getAfterDate(String name, Instant afterDate, int limit) {
        Objects.requireNonNull(afterDate, "afterDate must not be null");
        if (limit <= 0) {
            return List.of();
        }
        return call("getAfterDate", name, () ->
                find(name, new Query(Criteria.where("date").gt(afterDate)).with(ASCENDING).limit(limit)));
    }

    @Override
    public void updateUploadState(String name, String id, UploadUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        call("updateUploadState", name, () -> {
            Update u = new Update();
            if (update.status() != null) {
                u.set("uploadStatus", update.status());
                if (update.status() == UploadStatus.FAILED) {
                    u.set("uploadError", update.uploadError());
                } else {
                    u.unset("uploadError");
                }
            }
            if (update.uploadJobId() != null) {
                u.set("uploadJobId", update.uploadJobId());
            }
            if (update.blobRef() != null) {
                u.set("blobRef", update.blobRef());
            }
            if (update.publicUrl() != null) {
                u.set("publicUrl", update.publicUrl());
            }
            if (u.getUpdateObject().isEmpty()) {
                return null;
            }

            long matched = mongoTemplate.updateFirst(
                    new Query(Criteria.where("_id").is(id)), u, RecordDocument.class, name
            ).getMatchedCount();
            if (matched == 0) {
                throw new DatabaseException("Record not found: " + name + "/" + id, Map.of("table", name, "id", id));
            }
            return null;
        });
    }

    @Override
    public void close() {
        // The MongoClient belongs to whoever built the template; only this adapter is closed.
        closed.set(true);
    }

    static Index dateIndex() {
        return new Index().on("date", Sort.Direction.DESC).on("_id", Sort.Direction.DESC).named(IDX_DATE);
    }

    static Index uploadStatusIndex() {
        return new Index().on("uploadStatus", Sort.Direction.ASC).sparse().named(IDX_UPLOAD_STATUS);
    }

    private Optional<DataRecord> findOne(String name, Query query) {
        return Optional.ofNullable(mongoTemplate.findOne(query, RecordDocument.class, name)).map(d -> toRecord(name, d));
    }

    private List<DataRecord> find(String name, Query query) {
        return mongoTemplate.find(query, RecordDocument.class, name).stream()
                .map(d -> toRecord(name, d))
                .collect(Collectors.toList());
    }

    private DataRecord toRecord(String name, RecordDocument doc) {
        return DataRecord.builder()
                .id(doc.getId())
                .streamName(name)
                .date(doc.getDate())
                .contentType(doc.getContentType())
                .blobRef(doc.getBlobRef())
                .loader(loaderFor(doc.getBlobRef()))
                .description(doc.getDescription())
                .source(doc.getSource())
                .ownerId(doc.getOwnerId())
                .filename(doc.getFilename())
                .isPublic(doc.getIsPublic())
                .publicUrl(doc.getPublicUrl())
                .uploadStatus(doc.getUploadStatus())
                .uploadError(doc.getUploadError())
                .uploadJobId(doc.getUploadJobId())
                .build();
    }

    private Supplier<byte[]> loaderFor(String blobRef) {
        return blobRef == null ? null : () -> storage.retrieve(blobRef);
    }

    private <T> T call(String operation, String table, Supplier<T> body) {
        Objects.requireNonNull(table, "table must not be null");
        if (closed.get()) {
            throw new DatabaseException("Database adapter is closed", Map.of("operation", operation, "table", table));
        }
        try {
            return body.get();
        } catch (DataAccessException e) {
            throw new DatabaseException(
                    "MongoDB " + operation + " failed for '" + table + "': " + e.getMessage(),
                    Map.of("operation", operation, "table", table),
                    e
            );
        }
    }
}
