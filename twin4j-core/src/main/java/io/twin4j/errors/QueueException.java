package io.twin4j.errors;

import java.util.Map;

/**
 * Raised when a job cannot be accepted or the queue is shutting down.
 */
public class QueueException extends TwinException {

    public QueueException(String message) {
        super(ErrorCode.QUEUE_ERROR, message);
    }

    public QueueException(String message, Map<String, ?> context) {
        super(ErrorCode.QUEUE_ERROR, message, context, null);
    }

    public QueueException(String message, Map<String, ?> context, Throwable cause) {
        super(ErrorCode.QUEUE_ERROR, message, context, cause);
    }
}
