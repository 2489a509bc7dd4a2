package io.twin4j.errors;

import java.util.Map;

public class DatabaseException extends TwinException {

    public DatabaseException(String message) {
        super(ErrorCode.DATABASE_ERROR, message);
    }

    public DatabaseException(String message, Map<String, ?> context) {
        super(ErrorCode.DATABASE_ERROR, message, context, null);
    }

    public DatabaseException(String message, Map<String, ?> context, Throwable cause) {
        super(ErrorCode.DATABASE_ERROR, message, context, cause);
    }
}
