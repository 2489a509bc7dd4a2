package io.twin4j.errors;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of every error raised by the runtime.
 *
 * <p>Callers branch on {@link #code()} (or on the concrete subclass) rather than on the message.
 * The context map carries identifiers such as the unit name or the job id.
 */
public class TwinException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> context;
    private final Instant timestamp = Instant.now();

    public TwinException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public TwinException(ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = (context == null || context.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public ErrorCode code() {
        return code;
    }

    public Map<String, Object> context() {
        return context;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public boolean retryable() {
        return code.retryable();
    }

    /**
     * Returns {@code error} unchanged when it already is a {@link TwinException}, otherwise wraps it
     * into a {@link StorageException} carrying the given context.
     */
    public static TwinException wrap(Throwable error, Map<String, ?> context) {
        if (error instanceof TwinException te) {
            return te;
        }
        Map<String, Object> ctx = new LinkedHashMap<>();
        if (context != null) {
            ctx.putAll(context);
        }
        ctx.put("originalError", error.getClass().getSimpleName());
        return new StorageException(messageOf(error), ctx, error);
    }

    public static String messageOf(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String msg = error.getMessage();
        return (msg == null || msg.isBlank()) ? error.getClass().getName() : msg;
    }
}
