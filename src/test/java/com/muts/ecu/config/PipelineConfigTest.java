package com.muts.ecu.config;

import com.muts.ecu.mode.OperatorMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    void defaultsAreSafe() {
        PipelineConfig config = PipelineConfig.defaults();

        assertEquals(OperatorMode.DEV, config.operatorMode());
        assertEquals(Duration.ofMinutes(10), config.armTtl());
        assertEquals(1, config.maxConcurrentSessions());
        assertEquals(3, config.safetyQueue().maxRetries());
        assertEquals(7, config.safetyQueue().retentionDays());
    }

    @Test
    void environmentOverridesDefaults() {
        PipelineConfig config = PipelineConfig.fromEnvironment(Map.of(
            PipelineConfig.ENV_OPERATOR_MODE, "workshop",
            PipelineConfig.ENV_ARM_TTL_SECONDS, "90",
            PipelineConfig.ENV_QUEUE_MAX_RETRIES, "5",
            PipelineConfig.ENV_RETENTION_DAYS, "30"));

        assertEquals(OperatorMode.WORKSHOP, config.operatorMode());
        assertEquals(Duration.ofSeconds(90), config.armTtl());
        assertEquals(5, config.safetyQueue().maxRetries());
        assertEquals(30, config.safetyQueue().retentionDays());
    }

    @Test
    void invalidOrMissingModeFallsBackToDev() {
        assertEquals(OperatorMode.DEV,
            PipelineConfig.fromEnvironment(Map.of(PipelineConfig.ENV_OPERATOR_MODE, "race")).operatorMode());
        assertEquals(OperatorMode.DEV, PipelineConfig.fromEnvironment(Map.of()).operatorMode());
    }

    @Test
    void nonNumericSettingIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> PipelineConfig.fromEnvironment(Map.of(PipelineConfig.ENV_ARM_TTL_SECONDS, "ten")));
        assertTrue(e.getMessage().contains(PipelineConfig.ENV_ARM_TTL_SECONDS));
    }

    @Test
    void builderValidatesRanges() {
        assertThrows(IllegalArgumentException.class,
            () -> PipelineConfig.builder().withArmTtl(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> PipelineConfig.builder().withMaxConcurrentSessions(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> SafetyQueueConfig.defaults().withMaxRetries(0));
    }
}
