package io.twin4j.core;

/**
 * Lifecycle of an asynchronously ingested asset.
 *
 * <p>Transitions only move forward: PENDING -> PROCESSING -> COMPLETED | FAILED.
 * A FAILED record, or one whose upload job ended before it settled, may be put back to PENDING
 * by a re-submission.
 */
public enum UploadStatus {
    PENDING {
        @Override
        public boolean canTransitionTo(UploadStatus next) {
            return next == PROCESSING || next == FAILED;
        }
    },
    PROCESSING {
        @Override
        public boolean canTransitionTo(UploadStatus next) {
            return next == COMPLETED || next == FAILED;
        }
    },
    COMPLETED {
        @Override
        public boolean canTransitionTo(UploadStatus next) {
            return false;
        }
    },
    FAILED {
        @Override
        public boolean canTransitionTo(UploadStatus next) {
            return next == PENDING;
        }
    };

    public abstract boolean canTransitionTo(UploadStatus next);
}
