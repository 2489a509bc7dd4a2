package io.twin4j.storage;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Blob store addressed by references of the form {@code <stream>/<timestamp>[.<ext>]}.
 */
public interface StorageService {

    /**
     * Stores a buffer under a fresh timestamped reference.
     *
     * @return the reference to pass to {@link #retrieve(String)}
     */
    String save(byte[] buffer, String streamName, String extension);

    /**
     * Streams a file into the store without loading it into memory.
     */
    String save(Path file, String streamName, String extension);

    default String saveWithPath(byte[] buffer, String relativePath) {
        return saveWithPath(new ByteArrayInputStream(buffer), relativePath);
    }

    /**
     * Stores {@code content} at a caller-chosen path, replacing any blob already there.
     * The stream is read to its end but not closed.
     *
     * @return {@code relativePath}
     */
    String saveWithPath(InputStream content, String relativePath);

    byte[] retrieve(String ref);

    void delete(String ref);

    /**
     * @return number of blobs removed
     */
    int deleteByPrefix(String prefix);

    String getPublicUrl(String ref);

    /**
     * Throws when the backend is unreachable. Used by health checks.
     */
    default void checkConnection() {
    }
}
