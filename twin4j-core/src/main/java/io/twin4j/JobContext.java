package io.twin4j;

import io.twin4j.core.TriggerKind;

import java.util.function.BooleanSupplier;

/**
 * Per-execution view of a claimed job.
 *
 * attempt      : 1 for the first execution
 * cancellation : raised when the queue manager is shutting down
 */
public record JobContext(
        String jobId,
        String queueName,
        String unitName,
        TriggerKind trigger,
        int attempt,
        int maxAttempts,
        BooleanSupplier cancellation
) {
    public boolean isCancelled() {
        return cancellation != null && cancellation.getAsBoolean();
    }

    public boolean isLastAttempt() {
        return attempt >= maxAttempts;
    }
}
