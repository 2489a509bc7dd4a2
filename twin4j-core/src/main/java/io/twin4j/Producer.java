package io.twin4j;

import io.twin4j.core.DataRecord;
import io.twin4j.core.MetadataRow;
import io.twin4j.core.RunOutcome;
import io.twin4j.core.UnitConfiguration;
import io.twin4j.core.UnitEvent;
import io.twin4j.core.UnitType;
import io.twin4j.errors.ConfigurationException;
import io.twin4j.errors.StorageException;
import io.twin4j.errors.TwinException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A unit that writes one new record to its stream per run.
 *
 * <pre>{@code
 * public class WeatherProducer extends Producer {
 *     public WeatherProducer() {
 *         super(UnitConfiguration.producer("weather")
 *                 .schedule("*&#47;5 * * * *")
 *                 .contentType("application/json")
 *                 .build());
 *     }
 *
 *     protected byte[] collect() throws Exception {
 *         return client.fetchCurrentConditions();
 *     }
 * }
 * }</pre>
 */
public abstract class Producer implements Unit {
    private static final Logger log = LoggerFactory.getLogger(Producer.class);

    private final UnitConfiguration configuration;

    protected Producer(UnitConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
        if (configuration.type() != UnitType.PRODUCER) {
            throw new ConfigurationException(
                    "Unit '" + configuration.name() + "' is not a producer configuration",
                    Map.of("unitName", configuration.name())
            );
        }
    }

    @Override
    public final UnitConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Fetches the payload of the next record. Returning {@code null} skips the run without writing.
     */
    protected abstract byte[] collect() throws Exception;

    @Override
    public final RunOutcome run(UnitContext context) {
        String name = configuration.name();
        try {
            byte[] payload = collect();
            if (payload == null) {
                log.debug("producer collected nothing unit={}", name);
                return RunOutcome.noop(name);
            }

            Instant now = context.now();
            String ref = context.storage().save(payload, name, configuration.extension());
            DataRecord record = context.database().save(MetadataRow.of(name, configuration.contentType(), ref, now));

            log.debug("producer stored record unit={} id={} bytes={}", name, record.id(), payload.length);
            context.publish(new UnitEvent(
                    UnitEvent.Type.PRODUCER_COMPLETED,
                    name,
                    now,
                    Map.of("recordId", record.id(), "bytesCollected", payload.length)
            ));
            return new RunOutcome(name, 1);
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new StorageException(
                    "Producer '" + name + "' failed: " + TwinException.messageOf(e),
                    Map.of("unitName", name),
                    e
            );
        }
    }
}
