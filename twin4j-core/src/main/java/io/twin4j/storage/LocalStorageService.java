package io.twin4j.storage;

import io.twin4j.errors.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores blobs as files below a base directory: {@code <base>/<stream>/<timestamp>[-n][.<ext>]}.
 * References are paths relative to the base directory; anything resolving outside of it is rejected.
 */
public class LocalStorageService implements StorageService {
    private static final Logger log = LoggerFactory.getLogger(LocalStorageService.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_INSTANT;

    private final Path baseDir;
    private final String publicBaseUrl;
    private final Clock clock;

    public LocalStorageService(Path baseDir) {
        this(baseDir, null, Clock.systemUTC());
    }

    /**
     * @param publicBaseUrl prefix of public URLs (e.g. "https://cdn.example.com/assets"); null returns file paths
     */
    public LocalStorageService(Path baseDir, String publicBaseUrl, Clock clock) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir must not be null").toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl == null ? null : stripTrailingSlash(publicBaseUrl);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String save(byte[] buffer, String streamName, String extension) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        Path target = null;
        try {
            target = reserve(streamName, extension);
            Files.write(target, buffer);
            return relativize(target);
        } catch (IOException e) {
            deleteQuietly(target, e);
            throw failure("save", streamName, e);
        }
    }

    @Override
    public String save(Path file, String streamName, String extension) {
        Objects.requireNonNull(file, "file must not be null");
        Path target = null;
        try {
            target = reserve(streamName, extension);
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            return relativize(target);
        } catch (IOException e) {
            deleteQuietly(target, e);
            throw failure("save", streamName, e);
        }
    }

    @Override
    public String saveWithPath(InputStream content, String relativePath) {
        Objects.requireNonNull(content, "content must not be null");
        Path target = resolve(relativePath);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            return relativePath;
        } catch (IOException e) {
            deleteQuietly(target, e);
            throw failure("saveWithPath", relativePath, e);
        }
    }

    @Override
    public byte[] retrieve(String ref) {
        try {
            return Files.readAllBytes(resolve(ref));
        } catch (IOException e) {
            throw failure("retrieve", ref, e);
        }
    }

    @Override
    public void delete(String ref) {
        try {
            Files.deleteIfExists(resolve(ref));
        } catch (IOException e) {
            throw failure("delete", ref, e);
        }
    }

    @Override
    public int deleteByPrefix(String prefix) {
        Path folder = resolve(prefix);
        if (!Files.isDirectory(folder)) {
            return 0;
        }
        try (Stream<Path> walk = Files.walk(folder)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            int files = 0;
            for (Path p : paths) {
                if (!Files.isDirectory(p)) {
                    files++;
                }
                Files.deleteIfExists(p);
            }
            log.debug("local storage deleted prefix={} files={}", prefix, files);
            return files;
        } catch (IOException | UncheckedIOException e) {
            throw failure("deleteByPrefix", prefix, e);
        }
    }

    @Override
    public String getPublicUrl(String ref) {
        Path path = resolve(ref);
        if (publicBaseUrl != null) {
            return publicBaseUrl + "/" + relativize(path);
        }
        return path.toString();
    }

    @Override
    public void checkConnection() {
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw failure("checkConnection", baseDir.toString(), e);
        }
        if (!Files.isWritable(baseDir)) {
            throw new StorageException("Storage directory is not writable: " + baseDir, Map.of("baseDir", baseDir.toString()));
        }
    }

    public Path baseDir() {
        return baseDir;
    }

    // Creates an empty file under a fresh timestamped name; same-millisecond saves get a numeric suffix.
    private Path reserve(String streamName, String extension) throws IOException {
        String folder = (streamName == null || streamName.isBlank()) ? "default" : streamName;
        Path dir = resolve(folder);
        Files.createDirectories(dir);

        String stamp = TIMESTAMP.format(clock.instant()).replace(':', '-').replace('.', '-');
        String suffix = (extension == null || extension.isBlank()) ? "" : "." + extension;
        for (int n = 0; ; n++) {
            String name = n == 0 ? stamp + suffix : stamp + "-" + n + suffix;
            try {
                return Files.createFile(dir.resolve(name));
            } catch (FileAlreadyExistsException ignored) {
                // taken, try the next suffix
            }
        }
    }

    // A partially written file must not outlive the failed write.
    private static void deleteQuietly(Path target, IOException failure) {
        if (target == null) {
            return;
        }
        try {
            Files.deleteIfExists(target);
        } catch (IOException cleanupEx) {
            failure.addSuppressed(cleanupEx);
            log.warn("local storage cleanup failed file={} msg={}", target, cleanupEx.getMessage());
        }
    }

    private Path resolve(String relativePath) {
        Objects.requireNonNull(relativePath, "path must not be null");
        Path resolved = baseDir.resolve(relativePath).normalize();
        if (!resolved.startsWith(baseDir)) {
            throw new StorageException(
                    "Invalid path: path traversal detected for \"" + relativePath + "\"",
                    Map.of("path", relativePath)
            );
        }
        return resolved;
    }

    private String relativize(Path path) {
        return baseDir.relativize(path).toString().replace('\\', '/');
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static StorageException failure(String operation, String target, Exception cause) {
        return new StorageException(
                "Local storage " + operation + " failed for '" + target + "': " + cause.getMessage(),
                Map.of("operation", operation, "target", target),
                cause
        );
    }
}
