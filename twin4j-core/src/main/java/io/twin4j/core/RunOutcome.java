package io.twin4j.core;

/**
 * Result of one unit invocation.
 *
 * recordsWritten : number of DataRecords persisted (0 for a successful no-op run)
 */
public record RunOutcome(
        String unitName,
        int recordsWritten
) {
    public static RunOutcome noop(String unitName) {
        return new RunOutcome(unitName, 0);
    }

    public boolean produced() {
        return recordsWritten > 0;
    }
}
