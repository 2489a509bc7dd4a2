package io.twin4j.health;

import io.twin4j.database.DatabaseAdapter;
import io.twin4j.internal.QueueManager;
import io.twin4j.storage.StorageService;

/**
 * Built-in pings.
 */
public final class HealthChecks {
    private HealthChecks() {
    }

    // table name that never exists; the lookup itself is the ping
    static final String PING_TABLE = "_health_check_ping";

    public static Runnable database(DatabaseAdapter database) {
        return () -> database.doesTableExists(PING_TABLE);
    }

    public static Runnable queue(QueueManager queueManager) {
        return queueManager::getQueueStats;
    }

    public static Runnable storage(StorageService storage) {
        return storage::checkConnection;
    }
}
