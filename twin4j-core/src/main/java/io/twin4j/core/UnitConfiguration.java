package io.twin4j.core;

import io.twin4j.utils.IntervalParser;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Static descriptor of a Producer or Fusion Unit.
 *
 * <p>{@code name} doubles as the stream name, the table name and the key of the per-unit mutex.
 * {@code dependenciesLimit} is positional: entry {@code i} bounds the staleness of dependency
 * {@code i}; a missing or null entry means unlimited lookback.
 */
public record UnitConfiguration(

        // identity
        String name,
        UnitType type,
        String description,
        String contentType,
        String extension,

        // scheduling
        String schedule,
        TriggerMode triggerMode,
        Duration debounce,

        // temporal join (fusion units only)
        String source,
        SourceRange sourceRange,
        boolean sourceRangeMin,
        boolean multipleResults,
        List<String> dependencies,
        List<Duration> dependenciesLimit
) {

    /** Schedule used by fusion units that are scheduled without an explicit cron expression. */
    public static final String DEFAULT_FUSION_SCHEDULE = "0 * * * * *";

    public UnitConfiguration {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(type, "type must not be null");
        triggerMode = triggerMode == null ? TriggerMode.SCHEDULED : triggerMode;
        debounce = debounce == null ? Duration.ofSeconds(1) : debounce;
        contentType = contentType == null ? "application/octet-stream" : contentType;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        dependenciesLimit = dependenciesLimit == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(dependenciesLimit));
    }

    /**
     * Lookback window for the dependency at {@code index}, or null when unlimited.
     */
    public Duration dependencyLimit(int index) {
        return index < dependenciesLimit.size() ? dependenciesLimit.get(index) : null;
    }

    /**
     * Cron expression the scheduler should register, or null when the unit has no timer.
     */
    public String effectiveSchedule() {
        if (!triggerMode.usesSchedule()) {
            return null;
        }
        if (schedule != null && !schedule.isBlank()) {
            return schedule;
        }
        return type == UnitType.FUSION ? DEFAULT_FUSION_SCHEDULE : null;
    }

    public static Builder producer(String name) {
        return new Builder(name, UnitType.PRODUCER);
    }

    public static Builder fusion(String name) {
        return new Builder(name, UnitType.FUSION);
    }

    public static final class Builder {
        private final String name;
        private final UnitType type;
        private String description;
        private String contentType;
        private String extension;
        private String schedule;
        private TriggerMode triggerMode;
        private Duration debounce;
        private String source;
        private SourceRange sourceRange;
        private boolean sourceRangeMin;
        private boolean multipleResults;
        private final List<String> dependencies = new ArrayList<>();
        private final List<Duration> dependenciesLimit = new ArrayList<>();

        private Builder(String name, UnitType type) {
            this.name = name;
            this.type = type;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder extension(String extension) {
            this.extension = extension;
            return this;
        }

        public Builder schedule(String cron) {
            this.schedule = cron;
            return this;
        }

        public Builder triggerMode(TriggerMode triggerMode) {
            this.triggerMode = triggerMode;
            return this;
        }

        public Builder debounce(Duration debounce) {
            this.debounce = debounce;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder sourceRange(SourceRange sourceRange) {
            this.sourceRange = sourceRange;
            return this;
        }

        /**
         * Accepts a record count ("100") or a window ("30m", "1h", "7d").
         */
        public Builder sourceRange(String spec) {
            this.sourceRange = IntervalParser.parseSourceRange(spec);
            return this;
        }

        public Builder sourceRangeMin(boolean sourceRangeMin) {
            this.sourceRangeMin = sourceRangeMin;
            return this;
        }

        public Builder multipleResults(boolean multipleResults) {
            this.multipleResults = multipleResults;
            return this;
        }

        /**
         * Adds a dependency with unlimited lookback.
         */
        public Builder dependency(String name) {
            return dependency(name, (Duration) null);
        }

        public Builder dependency(String name, Duration lookback) {
            Objects.requireNonNull(name, "dependency name must not be null");
            dependencies.add(name);
            dependenciesLimit.add(lookback);
            return this;
        }

        public Builder dependency(String name, String lookback) {
            return dependency(name, IntervalParser.parseHumanDuration(lookback));
        }

        public UnitConfiguration build() {
            return new UnitConfiguration(
                    name,
                    type,
                    description,
                    contentType,
                    extension,
                    schedule,
                    triggerMode,
                    debounce,
                    source,
                    sourceRange,
                    sourceRangeMin,
                    multipleResults,
                    dependencies,
                    dependenciesLimit
            );
        }
    }
}
