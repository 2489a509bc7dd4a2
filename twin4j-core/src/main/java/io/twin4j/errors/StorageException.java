package io.twin4j.errors;

import java.util.Map;

/**
 * Blob storage or unit execution failure, retried by the queue manager.
 */
public class StorageException extends TwinException {

    public StorageException(String message) {
        super(ErrorCode.STORAGE_ERROR, message);
    }

    public StorageException(String message, Map<String, ?> context) {
        super(ErrorCode.STORAGE_ERROR, message, context, null);
    }

    public StorageException(String message, Map<String, ?> context, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, context, cause);
    }
}
