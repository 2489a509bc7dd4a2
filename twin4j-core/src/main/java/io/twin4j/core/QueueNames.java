package io.twin4j.core;

import java.util.List;

public final class QueueNames {
    private QueueNames() {
    }

    public static final String COLLECTORS = "dt-collectors";
    public static final String HARVESTERS = "dt-harvesters";
    public static final String PRIORITY = "dt-priority";
    public static final String UPLOADS = "dt-uploads";

    public static final List<String> ALL = List.of(COLLECTORS, HARVESTERS, PRIORITY, UPLOADS);
}
