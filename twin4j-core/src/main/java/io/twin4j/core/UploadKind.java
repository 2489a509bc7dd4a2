package io.twin4j.core;

public enum UploadKind {
    /** A single file stored as one blob. */
    FILE,
    /** A zip archive extracted entry by entry under a common prefix. */
    ARCHIVE
}
