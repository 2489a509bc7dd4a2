package io.twin4j.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.twin4j.config.TwinProperties;
import io.twin4j.core.DataRecord;
import io.twin4j.core.JobPayload;
import io.twin4j.core.MetadataRow;
import io.twin4j.core.QueueNames;
import io.twin4j.core.TriggerKind;
import io.twin4j.core.UploadRequest;
import io.twin4j.core.UploadStatus;
import io.twin4j.core.UploadTicket;
import io.twin4j.core.UploadUpdate;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.errors.StorageException;
import io.twin4j.errors.TwinException;
import io.twin4j.errors.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Accepts uploads on the caller's thread and hands the transfer to the upload queue.
 *
 * <p>{@link #submit(UploadRequest)} stages the content (inline below {@code twin.upload.inMemoryThreshold},
 * otherwise spilled to a scratch file while streaming), creates a PENDING record and enqueues the job
 * processed by {@link UploadJobHandler}.
 */
public class UploadProcessor {
    private static final Logger log = LoggerFactory.getLogger(UploadProcessor.class);

    private final TwinProperties props;
    private final DatabaseAdapter database;
    private final QueueManager queueManager;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public UploadProcessor(TwinProperties props, DatabaseAdapter database, QueueManager queueManager,
                           ObjectMapper objectMapper, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.queueManager = Objects.requireNonNull(queueManager, "queueManager must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Creates (or, with {@code recordId}, re-opens) the record and enqueues the upload.
     *
     * <p>Re-submitting a COMPLETED record returns its ticket untouched. A record that is still PENDING
     * or PROCESSING is rejected while its upload job is open; once that job has ended the record is
     * re-opened like a FAILED one.
     *
     * @throws ValidationException when the record is unknown or still in progress
     * @throws StorageException    when the content cannot be staged
     * @throws io.twin4j.errors.QueueException when the job cannot be enqueued; the record is marked FAILED
     */
    public UploadTicket submit(UploadRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String stream = request.streamName();

        DataRecord existing = null;
        if (request.recordId() != null) {
            existing = database.getById(stream, request.recordId())
                    .orElseThrow(() -> new ValidationException(
                            "Upload record not found: " + stream + "/" + request.recordId(),
                            Map.of("streamName", stream, "recordId", request.recordId())
                    ));
            UploadStatus status = existing.uploadStatus();
            if (status == UploadStatus.COMPLETED) {
                closeQuietly(request.content());
                log.debug("upload already completed stream={} recordId={}", stream, existing.id());
                return new UploadTicket(stream, existing.id(), existing.uploadJobId());
            }
            if (status != UploadStatus.FAILED && !isAbandoned(existing)) {
                closeQuietly(request.content());
                throw new ValidationException(
                        "Upload " + stream + "/" + existing.id() + " is still " + status,
                        Map.of("streamName", stream, "recordId", existing.id(), "status", String.valueOf(status))
                );
            }
        }

        Staged staged = stage(request);
        String recordId;
        try {
            if (existing == null) {
                if (!database.doesTableExists(stream)) {
                    database.createTable(stream);
                }
                DataRecord created = database.save(new MetadataRow(
                        stream,
                        request.contentType(),
                        null,
                        clock.instant(),
                        request.description(),
                        request.source(),
                        request.ownerId(),
                        request.filename(),
                        request.isPublic(),
                        UploadStatus.PENDING
                ));
                recordId = created.id();
            } else {
                recordId = existing.id();
                database.updateUploadState(stream, recordId, UploadUpdate.pending());
            }
        } catch (RuntimeException e) {
            deleteScratch(staged.file());
            throw e;
        }

        UploadJobData data = new UploadJobData(
                recordId,
                stream,
                request.kind(),
                request.rootEntry(),
                request.extension(),
                request.filename(),
                staged.file() == null ? null : staged.file().toString(),
                staged.inline()
        );

        String jobId;
        try {
            Map<String, Object> raw = objectMapper.convertValue(data, new TypeReference<>() {
            });
            jobId = queueManager.enqueue(QueueNames.UPLOADS, new JobPayload(stream, TriggerKind.UPLOAD, raw));
        } catch (RuntimeException e) {
            deleteScratch(staged.file());
            try {
                database.updateUploadState(stream, recordId, UploadUpdate.failed("Enqueue failed: " + TwinException.messageOf(e)));
            } catch (RuntimeException updateEx) {
                e.addSuppressed(updateEx);
            }
            throw e;
        }

        database.updateUploadState(stream, recordId, UploadUpdate.jobId(jobId));
        log.info("upload accepted stream={} recordId={} jobId={} spilled={} resubmitted={}",
                stream, recordId, jobId, staged.file() != null, existing != null);
        return new UploadTicket(stream, recordId, jobId);
    }

    /**
     * True when the record is still in flight but its upload job is gone or finished, e.g. a job
     * force-failed at shutdown before the handler could record the outcome.
     */
    private boolean isAbandoned(DataRecord record) {
        String jobId = record.uploadJobId();
        if (jobId == null) {
            return false;
        }
        boolean abandoned = queueManager.findJob(jobId).map(job -> !job.status().isOpen()).orElse(true);
        if (abandoned) {
            log.warn("upload record abandoned by its job, accepting resubmission stream={} recordId={} status={} jobId={}",
                    record.streamName(), record.id(), record.uploadStatus(), jobId);
        }
        return abandoned;
    }

    private record Staged(byte[] inline, Path file) {
    }

    // Reads up to threshold + 1 bytes; anything larger continues into a scratch file.
    private Staged stage(UploadRequest request) {
        long threshold = Math.max(0, props.getUpload().getInMemoryThreshold());
        int headLimit = (int) Math.min(threshold + 1, Integer.MAX_VALUE - 8);
        Path file = null;
        try (InputStream in = request.content()) {
            byte[] head = in.readNBytes(headLimit);
            if (head.length <= threshold) {
                return new Staged(head, null);
            }

            Path dir = props.getUpload().getScratchDir();
            Files.createDirectories(dir);
            file = Files.createTempFile(dir, "upload-", ".part");
            long total;
            try (OutputStream out = Files.newOutputStream(file)) {
                out.write(head);
                total = head.length + in.transferTo(out);
            }
            log.debug("upload spilled to scratch file stream={} bytes={} file={}", request.streamName(), total, file);
            return new Staged(null, file);
        } catch (IOException e) {
            deleteScratch(file);
            throw new StorageException(
                    "Failed to stage upload content: " + e.getMessage(),
                    Map.of("streamName", request.streamName()),
                    e
            );
        }
    }

    static void deleteScratch(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("upload scratch cleanup failed file={} msg={}", file, e.getMessage());
        }
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("upload content close failed msg={}", e.getMessage());
        }
    }
}
