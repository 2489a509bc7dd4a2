package io.twin4j.config;

import io.twin4j.DigitalTwin;
import io.twin4j.errors.ConfigurationException;
import io.twin4j.errors.QueueException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TwinLifecycleTest {

    private final DigitalTwin twin = mock(DigitalTwin.class);

    @Test
    void failedStartShouldLeaveLifecycleStopped() {
        doThrow(new ConfigurationException("Invalid configuration: weather: Producer must specify a schedule"))
                .when(twin).start();
        TwinLifecycle lifecycle = new TwinLifecycle(twin, true);

        assertThatThrownBy(lifecycle::start).isInstanceOf(ConfigurationException.class);

        assertFalse(lifecycle.isRunning());
        lifecycle.stop();
        verify(twin, never()).stop();
    }

    @Test
    void repeatedStartAndStopShouldReachEngineOnce() {
        TwinLifecycle lifecycle = new TwinLifecycle(twin, false);

        lifecycle.start();
        lifecycle.start();
        lifecycle.stop();
        lifecycle.stop();

        assertFalse(lifecycle.isAutoStartup());
        verify(twin, times(1)).start();
        verify(twin, times(1)).stop();
    }

    @Test
    void incompleteShutdownShouldPropagateAndMarkStopped() {
        doThrow(new QueueException("Shutdown grace period expired, 1 active job(s) force-failed", Map.of("forced", 1)))
                .when(twin).stop();
        TwinLifecycle lifecycle = new TwinLifecycle(twin, true);
        lifecycle.start();
        assertTrue(lifecycle.isRunning());

        assertThatThrownBy(lifecycle::stop)
                .isInstanceOf(QueueException.class)
                .hasMessageContaining("force-failed");
        assertFalse(lifecycle.isRunning());
    }
}
