package io.twin4j.internal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.twin4j.core.UploadKind;

/**
 * Job data of an upload: which record to complete and where its staged content lives.
 *
 * <p>Exactly one of {@code inlineContent} and {@code scratchFile} is set.
 */
public record UploadJobData(
        String recordId,
        String streamName,
        UploadKind kind,
        String rootEntry,
        String extension,
        String filename,
        String scratchFile,
        byte[] inlineContent
) {
    @JsonIgnore
    public boolean isSpilled() {
        return scratchFile != null;
    }
}
