package io.twin4j.core;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Objects;

/**
 * Asset ingestion request. The content stream is consumed once by
 * {@link io.twin4j.DigitalTwin#submitUpload(UploadRequest)}.
 *
 * <p>Setting {@code recordId} re-submits a previously failed upload instead of creating a new record.
 */
public final class UploadRequest {

    private final String streamName;
    private final String recordId;
    private final InputStream content;
    private final String filename;
    private final String contentType;
    private final String extension;
    private final String description;
    private final String source;
    private final String ownerId;
    private final Boolean isPublic;
    private final UploadKind kind;
    private final String rootEntry;

    private UploadRequest(Builder b) {
        this.streamName = Objects.requireNonNull(b.streamName, "streamName must not be null");
        this.content = Objects.requireNonNull(b.content, "content must not be null");
        this.recordId = b.recordId;
        this.filename = b.filename;
        this.contentType = b.contentType == null ? "application/octet-stream" : b.contentType;
        this.extension = b.extension;
        this.description = b.description;
        this.source = b.source;
        this.ownerId = b.ownerId;
        this.isPublic = b.isPublic;
        this.kind = b.kind == null ? UploadKind.FILE : b.kind;
        this.rootEntry = b.rootEntry;
    }

    public String streamName() {
        return streamName;
    }

    public String recordId() {
        return recordId;
    }

    public InputStream content() {
        return content;
    }

    public String filename() {
        return filename;
    }

    public String contentType() {
        return contentType;
    }

    /**
     * Extension used for the stored blob: the explicit one, else the filename's, else none.
     */
    public String extension() {
        if (extension != null && !extension.isBlank()) {
            return extension.startsWith(".") ? extension.substring(1) : extension;
        }
        if (filename != null) {
            int dot = filename.lastIndexOf('.');
            if (dot > 0 && dot < filename.length() - 1) {
                return filename.substring(dot + 1);
            }
        }
        return null;
    }

    public String description() {
        return description;
    }

    public String source() {
        return source;
    }

    public String ownerId() {
        return ownerId;
    }

    public Boolean isPublic() {
        return isPublic;
    }

    public UploadKind kind() {
        return kind;
    }

    public String rootEntry() {
        return rootEntry;
    }

    public static Builder builder(String streamName) {
        return new Builder(streamName);
    }

    public static final class Builder {
        private final String streamName;
        private String recordId;
        private InputStream content;
        private String filename;
        private String contentType;
        private String extension;
        private String description;
        private String source;
        private String ownerId;
        private Boolean isPublic;
        private UploadKind kind;
        private String rootEntry;

        private Builder(String streamName) {
            this.streamName = streamName;
        }

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder content(InputStream content) {
            this.content = content;
            return this;
        }

        public Builder content(byte[] content) {
            this.content = new ByteArrayInputStream(Objects.requireNonNull(content, "content must not be null"));
            return this;
        }

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder extension(String extension) {
            this.extension = extension;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder isPublic(Boolean isPublic) {
            this.isPublic = isPublic;
            return this;
        }

        /**
         * Marks the content as a zip archive whose entries are stored individually.
         *
         * @param rootEntry entry that must be present (e.g. "tileset.json"); null for none
         */
        public Builder archive(String rootEntry) {
            this.kind = UploadKind.ARCHIVE;
            this.rootEntry = rootEntry;
            return this;
        }

        public UploadRequest build() {
            return new UploadRequest(this);
        }
    }
}
