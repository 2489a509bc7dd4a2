package io.twin4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Insert form of a {@link DataRecord}; the adapter assigns the id.
 */
public record MetadataRow(
        String streamName,
        String contentType,
        String blobRef,
        Instant date,

        // asset streams only
        String description,
        String source,
        String ownerId,
        String filename,
        Boolean isPublic,
        UploadStatus uploadStatus
) {
    public MetadataRow {
        Objects.requireNonNull(streamName, "streamName must not be null");
        Objects.requireNonNull(date, "date must not be null");
    }

    public static MetadataRow of(String streamName, String contentType, String blobRef, Instant date) {
        return new MetadataRow(streamName, contentType, blobRef, date, null, null, null, null, null, null);
    }
}
