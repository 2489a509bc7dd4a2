package io.twin4j;

import io.twin4j.core.HealthStatus;
import io.twin4j.core.QueueStats;
import io.twin4j.core.UploadRequest;
import io.twin4j.core.UploadTicket;
import io.twin4j.core.ValidationReport;

import java.util.Map;

/**
 * Main engine API.
 *
 * <p>Typical usage:
 * <pre>{@code
 * DigitalTwin twin = new DefaultDigitalTwin(props, units, database, storage, jobStore, objectMapper);
 * twin.start();
 *
 * twin.trigger("traffic-fusion");
 * UploadTicket ticket = twin.submitUpload(UploadRequest.builder("assets")
 *         .filename("city.glb")
 *         .content(stream)
 *         .build());
 *
 * twin.stop();
 * }</pre>
 */
public interface DigitalTwin {

    /**
     * Ensures tables, starts the queue manager and the scheduler. Idempotent.
     *
     * @throws io.twin4j.errors.ConfigurationException when the configuration is invalid or the job store is unreachable
     */
    void start();

    /**
     * Stops the scheduler, drains the queues within the shutdown timeout and closes the database.
     *
     * @throws io.twin4j.errors.TwinException when work had to be force-failed or a component failed to close
     */
    void stop();

    /**
     * Enqueues a manual run of the unit on the priority queue.
     *
     * @return job id
     */
    String trigger(String unitName);

    UploadTicket submitUpload(UploadRequest request);

    Map<String, QueueStats> getQueueStats();

    HealthStatus health();

    ValidationReport validateConfiguration();
}
