package io.twin4j.internal.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.gridfs.model.GridFSFile;
import io.twin4j.errors.StorageException;
import io.twin4j.storage.StorageService;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.gridfs.GridFsCriteria;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stores blobs in a GridFS bucket. The reference is the GridFS filename,
 * {@code <stream>/<timestamp>-<objectId>[.<ext>]}, so references stay unique within one millisecond.
 */
public class GridFsStorageService implements StorageService {
    private static final Logger log = LoggerFactory.getLogger(GridFsStorageService.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_INSTANT;

    private final MongoTemplate mongoTemplate;
    private final String bucket;
    private final String publicBaseUrl;
    private final Clock clock;

    private volatile GridFsTemplate gridFs;

    /**
     * @param publicBaseUrl prefix of public URLs; null yields {@code gridfs://<bucket>/<ref>}
     */
    public GridFsStorageService(MongoTemplate mongoTemplate, String bucket, String publicBaseUrl, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.bucket = (bucket == null || bucket.isBlank()) ? "twin_blobs" : bucket;
        this.publicBaseUrl = publicBaseUrl == null ? null : stripTrailingSlash(publicBaseUrl);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String save(byte[] buffer, String streamName, String extension) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        String ref = newRef(streamName, extension);
        store("save", ref, new ByteArrayInputStream(buffer));
        return ref;
    }

    @Override
    public String save(Path file, String streamName, String extension) {
        Objects.requireNonNull(file, "file must not be null");
        String ref = newRef(streamName, extension);
        try (InputStream in = Files.newInputStream(file)) {
            store("save", ref, in);
        } catch (IOException e) {
            throw failure("save", ref, e);
        }
        return ref;
    }

    @Override
    public String saveWithPath(InputStream content, String relativePath) {
        Objects.requireNonNull(content, "content must not be null");
        String ref = checkRef(relativePath);
        try {
            gridFs().delete(byFilename(ref));
        } catch (DataAccessException | MongoException e) {
            throw failure("saveWithPath", ref, e);
        }
        store("saveWithPath", ref, content);
        return ref;
    }

    @Override
    public byte[] retrieve(String ref) {
        checkRef(ref);
        try {
            GridFSFile file = gridFs().findOne(byFilename(ref));
            if (file == null) {
                throw new StorageException("Blob not found: " + ref, Map.of("operation", "retrieve", "target", ref));
            }
            try (InputStream in = gridFs().getResource(file).getInputStream()) {
                return in.readAllBytes();
            }
        } catch (IOException | DataAccessException | MongoException e) {
            throw failure("retrieve", ref, e);
        }
    }

    @Override
    public void delete(String ref) {
        checkRef(ref);
        try {
            gridFs().delete(byFilename(ref));
        } catch (DataAccessException | MongoException e) {
            throw failure("delete", ref, e);
        }
    }

    @Override
    public int deleteByPrefix(String prefix) {
        String folder = stripTrailingSlash(checkRef(prefix));
        Query query = Query.query(GridFsCriteria.whereFilename().regex("^" + Pattern.quote(folder + "/")));
        try {
            int files = gridFs().find(query).into(new ArrayList<>()).size();
            if (files > 0) {
                gridFs().delete(query);
            }
            log.debug("gridfs deleted prefix={} files={}", folder, files);
            return files;
        } catch (DataAccessException | MongoException e) {
            throw failure("deleteByPrefix", folder, e);
        }
    }

    @Override
    public String getPublicUrl(String ref) {
        checkRef(ref);
        if (publicBaseUrl != null) {
            return publicBaseUrl + "/" + ref;
        }
        return "gridfs://" + bucket + "/" + ref;
    }

    @Override
    public void checkConnection() {
        try {
            mongoTemplate.executeCommand("{ ping: 1 }");
        } catch (DataAccessException | MongoException e) {
            throw failure("checkConnection", bucket, e);
        }
    }

    public String bucket() {
        return bucket;
    }

    private void store(String operation, String ref, InputStream content) {
        try {
            gridFs().store(content, ref);
        } catch (DataAccessException | MongoException e) {
            throw failure(operation, ref, e);
        }
    }

    // Built on first use: the database factory may not be reachable when the bean is created.
    private GridFsTemplate gridFs() {
        GridFsTemplate local = gridFs;
        if (local == null) {
            synchronized (this) {
                local = gridFs;
                if (local == null) {
                    local = new GridFsTemplate(mongoTemplate.getMongoDatabaseFactory(), mongoTemplate.getConverter(), bucket);
                    gridFs = local;
                }
            }
        }
        return local;
    }

    private String newRef(String streamName, String extension) {
        String folder = (streamName == null || streamName.isBlank()) ? "default" : checkRef(streamName);
        String stamp = TIMESTAMP.format(clock.instant()).replace(':', '-').replace('.', '-');
        String suffix = (extension == null || extension.isBlank()) ? "" : "." + extension;
        return folder + "/" + stamp + "-" + new ObjectId().toHexString() + suffix;
    }

    private static String checkRef(String ref) {
        Objects.requireNonNull(ref, "path must not be null");
        String normalized = ref.replace('\\', '/');
        for (String segment : normalized.split("/")) {
            if (segment.equals("..")) {
                throw new StorageException(
                        "Invalid path: path traversal detected for \"" + ref + "\"",
                        Map.of("path", ref)
                );
            }
        }
        if (normalized.startsWith("/")) {
            throw new StorageException("Invalid path: absolute path \"" + ref + "\"", Map.of("path", ref));
        }
        return normalized;
    }

    private static Query byFilename(String ref) {
        return Query.query(GridFsCriteria.whereFilename().is(ref));
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static StorageException failure(String operation, String target, Exception cause) {
        return new StorageException(
                "GridFS " + operation + " failed for '" + target + "': " + cause.getMessage(),
                Map.of("operation", operation, "target", target),
                cause
        );
    }
}
