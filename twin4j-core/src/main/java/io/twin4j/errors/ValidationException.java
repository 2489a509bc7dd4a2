package io.twin4j.errors;

import java.util.Map;

public class ValidationException extends TwinException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, ?> context) {
        super(ErrorCode.VALIDATION_ERROR, message, context, null);
    }

    public ValidationException(String message, Map<String, ?> context, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, context, cause);
    }
}
