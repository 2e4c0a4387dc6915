package io.seriescache.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineConfigTest {

    @AfterEach
    void clear() {
        System.clearProperty("seriescache.queue");
        System.clearProperty("seriescache.drain.timeout.ms");
    }

    @Test
    void system_properties_override_defaults() {
        System.setProperty("seriescache.queue", "7");
        System.setProperty("seriescache.drain.timeout.ms", "1500");
        PipelineConfig c = PipelineConfig.fromEnv();
        assertEquals(7, c.queueCapacity());
        assertEquals(Duration.ofMillis(1500), c.drainTimeout());
    }

    @Test
    void defaults_match_the_documented_values() {
        PipelineConfig c = PipelineConfig.defaults();
        assertEquals(100, c.queueCapacity());
        assertEquals(20, c.progressEvery());
        assertEquals(3, c.retryAttempts());
    }
}
