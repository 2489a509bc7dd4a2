package io.twin4j.internal;

import io.twin4j.JobContext;
import io.twin4j.JobHandler;
import io.twin4j.core.DataRecord;
import io.twin4j.core.QueueNames;
import io.twin4j.core.UploadKind;
import io.twin4j.core.UploadStatus;
import io.twin4j.core.UploadUpdate;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.errors.TwinException;
import io.twin4j.errors.ValidationException;
import io.twin4j.storage.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Worker side of the upload queue: {@code PENDING -> PROCESSING -> COMPLETED | FAILED}.
 *
 * <p>On failure the record is kept with {@code uploadError} set, blobs already written are removed
 * and the exception is rethrown so the job fails too. The scratch file is always deleted.
 */
public class UploadJobHandler implements JobHandler<UploadJobData> {
    private static final Logger log = LoggerFactory.getLogger(UploadJobHandler.class);

    private final DatabaseAdapter database;
    private final StorageService storage;
    private final Clock clock;

    public UploadJobHandler(DatabaseAdapter database, StorageService storage, Clock clock) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public String queueName() {
        return QueueNames.UPLOADS;
    }

    @Override
    public Class<UploadJobData> dataClass() {
        return UploadJobData.class;
    }

    @Override
    public void execute(UploadJobData data, JobContext context) throws Exception {
        if (data == null) {
            throw new ValidationException("Upload job has no data", Map.of("jobId", context.jobId()));
        }
        Path scratch = data.isSpilled() ? Path.of(data.scratchFile()) : null;
        try {
            process(data, context);
        } finally {
            UploadProcessor.deleteScratch(scratch);
        }
    }

    private void process(UploadJobData data, JobContext context) throws Exception {
        String stream = data.streamName();
        String recordId = data.recordId();

        DataRecord record = database.getById(stream, recordId)
                .orElseThrow(() -> new ValidationException(
                        "Upload record not found: " + stream + "/" + recordId,
                        Map.of("streamName", stream, "recordId", recordId)
                ));
        UploadStatus status = record.uploadStatus();
        if (status == null || !status.canTransitionTo(UploadStatus.PROCESSING)) {
            if (status == UploadStatus.PROCESSING) {
                // picked up before and never finished, e.g. a crash mid-transfer
                database.updateUploadState(stream, recordId, UploadUpdate.failed("Upload interrupted while processing"));
                throw new ValidationException(
                        "Upload " + stream + "/" + recordId + " was interrupted while processing",
                        Map.of("streamName", stream, "recordId", recordId)
                );
            }
            log.warn("upload job rejected, record not pending stream={} recordId={} status={} jobId={}",
                    stream, recordId, status, context.jobId());
            throw new ValidationException(
                    "Upload " + stream + "/" + recordId + " is " + status + ", expected PENDING",
                    Map.of("streamName", stream, "recordId", recordId, "status", String.valueOf(status))
            );
        }

        database.updateUploadState(stream, recordId, UploadUpdate.processing(context.jobId()));

        String basePath = null;
        String ref = null;
        try {
            String publicUrl;
            if (data.kind() == UploadKind.ARCHIVE) {
                basePath = stream + "/" + clock.millis();
                String root = extractArchive(data, basePath);
                ref = basePath;
                publicUrl = root == null ? null : storage.getPublicUrl(basePath + "/" + root);
            } else {
                ref = data.isSpilled()
                        ? storage.save(Path.of(data.scratchFile()), stream, data.extension())
                        : storage.save(data.inlineContent(), stream, data.extension());
                publicUrl = record.isPublic() ? storage.getPublicUrl(ref) : null;
            }

            database.updateUploadState(stream, recordId, UploadUpdate.completed(ref, publicUrl));
            log.info("upload completed stream={} recordId={} ref={} jobId={}", stream, recordId, ref, context.jobId());
        } catch (Exception e) {
            String error = TwinException.messageOf(e);
            log.error("upload failed stream={} recordId={} jobId={} msg={}", stream, recordId, context.jobId(), error);
            cleanupBlobs(basePath, ref, e);
            try {
                database.updateUploadState(stream, recordId, UploadUpdate.failed(error));
            } catch (RuntimeException updateEx) {
                e.addSuppressed(updateEx);
                log.error("upload failed to record FAILED status stream={} recordId={} msg={}", stream, recordId, updateEx.getMessage());
            }
            throw e;
        }
    }

    /**
     * Stores every entry under {@code basePath}.
     *
     * @return path of the root entry relative to {@code basePath}, or null when none is required
     */
    private String extractArchive(UploadJobData data, String basePath) throws IOException {
        String root = null;
        int files = 0;
        try (InputStream raw = data.isSpilled()
                ? Files.newInputStream(Path.of(data.scratchFile()))
                : new ByteArrayInputStream(data.inlineContent());
             ZipInputStream zip = new ZipInputStream(raw)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                String name = normalizeEntryName(entry.getName());
                storage.saveWithPath(zip, basePath + "/" + name);
                files++;
                if (data.rootEntry() != null && isRootEntry(name, data.rootEntry())
                        && (root == null || depth(name) < depth(root))) {
                    root = name;
                }
            }
        }

        if (files == 0) {
            throw new ValidationException("Invalid archive: no entries found", Map.of("streamName", data.streamName()));
        }
        if (data.rootEntry() != null && root == null) {
            throw new ValidationException(
                    "Invalid archive: no " + data.rootEntry() + " found in the ZIP archive",
                    Map.of("streamName", data.streamName(), "rootEntry", data.rootEntry())
            );
        }
        log.debug("upload archive extracted basePath={} files={} root={}", basePath, files, root);
        return root;
    }

    private static String normalizeEntryName(String name) {
        String n = name.replace('\\', '/');
        while (n.startsWith("/")) {
            n = n.substring(1);
        }
        for (String part : n.split("/")) {
            if (part.equals("..")) {
                throw new ValidationException("Invalid archive entry: " + name, Map.of("entry", name));
            }
        }
        return n;
    }

    private static boolean isRootEntry(String name, String rootEntry) {
        return name.equals(rootEntry) || name.endsWith("/" + rootEntry);
    }

    private static int depth(String name) {
        return name.split("/").length;
    }

    private void cleanupBlobs(String basePath, String ref, Exception failure) {
        try {
            if (basePath != null) {
                int removed = storage.deleteByPrefix(basePath);
                log.debug("upload cleanup removed prefix={} files={}", basePath, removed);
            } else if (ref != null) {
                storage.delete(ref);
            }
        } catch (RuntimeException cleanupEx) {
            failure.addSuppressed(cleanupEx);
            log.warn("upload cleanup failed prefix={} ref={} msg={}", basePath, ref, cleanupEx.getMessage());
        }
    }
}
