package io.twin4j.core;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One entry of a stream: metadata row plus a lazily fetched blob.
 *
 * <p>Records are ordered by {@link #CHRONOLOGICAL}: by date, then by id so that records sharing a
 * timestamp still have a deterministic order (the greatest id is the latest).
 */
public final class DataRecord {

    /**
     * Orders records by date, ties broken by id (numeric when both ids are numbers, lexical otherwise).
     */
    public static final Comparator<DataRecord> CHRONOLOGICAL =
            Comparator.comparing(DataRecord::date).thenComparing(DataRecord::id, DataRecord::compareIds);

    private final String id;
    private final String streamName;
    private final Instant date;
    private final String contentType;
    private final String blobRef;
    private final Supplier<byte[]> loader;

    private final String description;
    private final String source;
    private final String ownerId;
    private final String filename;
    private final Boolean isPublic;
    private final String publicUrl;
    private final UploadStatus uploadStatus;
    private final String uploadError;
    private final String uploadJobId;

    private volatile byte[] cached;

    private DataRecord(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.streamName = Objects.requireNonNull(b.streamName, "streamName must not be null");
        this.date = Objects.requireNonNull(b.date, "date must not be null");
        this.contentType = b.contentType;
        this.blobRef = b.blobRef;
        this.loader = b.loader;
        this.description = b.description;
        this.source = b.source;
        this.ownerId = b.ownerId;
        this.filename = b.filename;
        this.isPublic = b.isPublic;
        this.publicUrl = b.publicUrl;
        this.uploadStatus = b.uploadStatus;
        this.uploadError = b.uploadError;
        this.uploadJobId = b.uploadJobId;
    }

    public String id() {
        return id;
    }

    public String streamName() {
        return streamName;
    }

    public Instant date() {
        return date;
    }

    public String contentType() {
        return contentType;
    }

    public String blobRef() {
        return blobRef;
    }

    /**
     * Fetches the blob on first call and returns the cached bytes afterwards.
     */
    public byte[] data() {
        byte[] local = cached;
        if (local == null) {
            synchronized (this) {
                local = cached;
                if (local == null) {
                    if (loader == null) {
                        throw new IllegalStateException("Record " + streamName + "/" + id + " has no blob loader");
                    }
                    local = loader.get();
                    cached = local;
                }
            }
        }
        return local;
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

    public String filename() {
        return filename;
    }

    /**
     * Assets are public unless explicitly marked otherwise.
     */
    public boolean isPublic() {
        return isPublic == null || isPublic;
    }

    public String publicUrl() {
        return publicUrl;
    }

    public UploadStatus uploadStatus() {
        return uploadStatus;
    }

    public String uploadError() {
        return uploadError;
    }

    public String uploadJobId() {
        return uploadJobId;
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .streamName(streamName)
                .date(date)
                .contentType(contentType)
                .blobRef(blobRef)
                .loader(loader)
                .description(description)
                .source(source)
                .ownerId(ownerId)
                .filename(filename)
                .isPublic(isPublic)
                .publicUrl(publicUrl)
                .uploadStatus(uploadStatus)
                .uploadError(uploadError)
                .uploadJobId(uploadJobId);
    }

    static int compareIds(String a, String b) {
        if (isNumeric(a) && isNumeric(b)) {
            int byLength = Integer.compare(a.length(), b.length());
            return byLength != 0 ? byLength : a.compareTo(b);
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return s.length() == 1 || s.charAt(0) != '0';
    }

    @Override
    public String toString() {
        return "DataRecord{" + streamName + "/" + id + " @ " + date + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String streamName;
        private Instant date;
        private String contentType;
        private String blobRef;
        private Supplier<byte[]> loader;
        private String description;
        private String source;
        private String ownerId;
        private String filename;
        private Boolean isPublic;
        private String publicUrl;
        private UploadStatus uploadStatus;
        private String uploadError;
        private String uploadJobId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder streamName(String streamName) {
            this.streamName = streamName;
            return this;
        }

        public Builder date(Instant date) {
            this.date = date;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder blobRef(String blobRef) {
            this.blobRef = blobRef;
            return this;
        }

        public Builder loader(Supplier<byte[]> loader) {
            this.loader = loader;
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

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder isPublic(Boolean isPublic) {
            this.isPublic = isPublic;
            return this;
        }

        public Builder publicUrl(String publicUrl) {
            this.publicUrl = publicUrl;
            return this;
        }

        public Builder uploadStatus(UploadStatus uploadStatus) {
            this.uploadStatus = uploadStatus;
            return this;
        }

        public Builder uploadError(String uploadError) {
            this.uploadError = uploadError;
            return this;
        }

        public Builder uploadJobId(String uploadJobId) {
            this.uploadJobId = uploadJobId;
            return this;
        }

        public DataRecord build() {
            return new DataRecord(this);
        }
    }
}
