package io.twin4j.core;

/**
 * Handle returned to the caller of an upload submission.
 */
public record UploadTicket(
        String streamName,
        String recordId,
        String jobId
) {
}
