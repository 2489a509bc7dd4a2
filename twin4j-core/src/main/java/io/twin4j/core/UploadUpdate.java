package io.twin4j.core;

/**
 * Change applied to the upload fields of an asset record. Null fields are left untouched;
 * {@code uploadError} is rewritten together with any status change (cleared unless FAILED).
 */
public record UploadUpdate(
        UploadStatus status,
        String uploadError,
        String uploadJobId,
        String blobRef,
        String publicUrl
) {

    public static UploadUpdate pending() {
        return new UploadUpdate(UploadStatus.PENDING, null, null, null, null);
    }

    public static UploadUpdate processing(String jobId) {
        return new UploadUpdate(UploadStatus.PROCESSING, null, jobId, null, null);
    }

    public static UploadUpdate completed(String blobRef, String publicUrl) {
        return new UploadUpdate(UploadStatus.COMPLETED, null, null, blobRef, publicUrl);
    }

    public static UploadUpdate failed(String error) {
        return new UploadUpdate(UploadStatus.FAILED, error, null, null, null);
    }

    /**
     * Records the job id without touching the status.
     */
    public static UploadUpdate jobId(String jobId) {
        return new UploadUpdate(null, null, jobId, null, null);
    }
}
