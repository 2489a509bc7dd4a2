package io.twin4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * How many primary records a fusion run consumes: a fixed count, or every record inside a time
 * window that starts at the unit's last run.
 */
public record SourceRange(Integer count, Duration window) {

    public SourceRange {
        if ((count == null) == (window == null)) {
            throw new IllegalArgumentException("SourceRange must define exactly one of count or window");
        }
        if (count != null && count <= 0) {
            throw new IllegalArgumentException("SourceRange count must be positive: " + count);
        }
        if (window != null && (window.isZero() || window.isNegative())) {
            throw new IllegalArgumentException("SourceRange window must be a positive duration: " + window);
        }
    }

    public static SourceRange count(int count) {
        return new SourceRange(count, null);
    }

    public static SourceRange window(Duration window) {
        return new SourceRange(null, Objects.requireNonNull(window, "window must not be null"));
    }

    public boolean isWindow() {
        return window != null;
    }

    public Instant windowEnd(Instant start) {
        if (!isWindow()) {
            throw new IllegalStateException("count ranges have no window end");
        }
        return start.plus(window);
    }
}
