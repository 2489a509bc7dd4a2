package io.twin4j.core;

public enum TriggerMode {
    /** Run on the unit's cron schedule only. */
    SCHEDULED {
        @Override
        public boolean usesSchedule() {
            return true;
        }

        @Override
        public boolean usesSourceEvents() {
            return false;
        }
    },
    /** Run after the primary source has produced a record. */
    ON_SOURCE {
        @Override
        public boolean usesSchedule() {
            return false;
        }

        @Override
        public boolean usesSourceEvents() {
            return true;
        }
    },
    BOTH {
        @Override
        public boolean usesSchedule() {
            return true;
        }

        @Override
        public boolean usesSourceEvents() {
            return true;
        }
    };

    public abstract boolean usesSchedule();

    public abstract boolean usesSourceEvents();
}
