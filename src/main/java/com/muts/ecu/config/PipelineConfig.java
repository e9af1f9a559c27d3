package com.muts.ecu.config;

import com.muts.ecu.mode.OperatorMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PipelineConfig
 * =============================================================================
 * Aggregated configuration for the ECU pipeline runtime.
 *
 * <p>The operator mode is part of this record and is therefore fixed for the
 * lifetime of the runtime built from it.</p>
 *
 * <h2>Environment</h2>
 * {@link #fromEnvironment(Map)} reads:
 * <ul>
 *   <li>{@code OPERATOR_MODE}: {@code dev}, {@code workshop} or {@code lab};
 *       anything else falls back to DEV with a warning</li>
 *   <li>{@code ECU_ARM_TTL_SECONDS}</li>
 *   <li>{@code ECU_SAFETY_QUEUE_MAX_RETRIES}</li>
 *   <li>{@code ECU_SAFETY_RETENTION_DAYS}</li>
 * </ul>
 */
public record PipelineConfig(
    OperatorMode operatorMode,
    Duration armTtl,
    Duration applyTokenTtl,
    Duration expirySweepInterval,
    Duration telemetryInterval,
    Duration hardwareTimeout,
    int maxConcurrentSessions,
    int flashBlockSize,
    int flashHistoryLimit,
    int sessionHistoryLimit,
    int maxFlashImageBytes,
    SafetyQueueConfig safetyQueue
) {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String ENV_OPERATOR_MODE = "OPERATOR_MODE";
    public static final String ENV_ARM_TTL_SECONDS = "ECU_ARM_TTL_SECONDS";
    public static final String ENV_QUEUE_MAX_RETRIES = "ECU_SAFETY_QUEUE_MAX_RETRIES";
    public static final String ENV_RETENTION_DAYS = "ECU_SAFETY_RETENTION_DAYS";

    public PipelineConfig {
        Objects.requireNonNull(operatorMode, "operatorMode");
        Objects.requireNonNull(armTtl, "armTtl");
        Objects.requireNonNull(applyTokenTtl, "applyTokenTtl");
        Objects.requireNonNull(expirySweepInterval, "expirySweepInterval");
        Objects.requireNonNull(telemetryInterval, "telemetryInterval");
        Objects.requireNonNull(hardwareTimeout, "hardwareTimeout");
        Objects.requireNonNull(safetyQueue, "safetyQueue");

        requirePositive(armTtl, "armTtl");
        requirePositive(applyTokenTtl, "applyTokenTtl");
        requirePositive(expirySweepInterval, "expirySweepInterval");
        requirePositive(telemetryInterval, "telemetryInterval");
        requirePositive(hardwareTimeout, "hardwareTimeout");

        if (maxConcurrentSessions <= 0) {
            throw new IllegalArgumentException("maxConcurrentSessions must be > 0");
        }
        if (flashBlockSize <= 0) {
            throw new IllegalArgumentException("flashBlockSize must be > 0");
        }
        if (flashHistoryLimit < 0) {
            throw new IllegalArgumentException("flashHistoryLimit must be >= 0");
        }
        if (sessionHistoryLimit <= 0) {
            throw new IllegalArgumentException("sessionHistoryLimit must be > 0");
        }
        if (maxFlashImageBytes <= 0) {
            throw new IllegalArgumentException("maxFlashImageBytes must be > 0");
        }
    }

    private static void requirePositive(Duration d, String name)
    {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    public static PipelineConfig defaults()
    {
        return builder().build();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Builds a configuration from environment-style settings, starting from
     * {@link #defaults()}.
     */
    public static PipelineConfig fromEnvironment(Map<String, String> env)
    {
        Objects.requireNonNull(env, "env");
        Builder b = builder();

        String modeSetting = env.get(ENV_OPERATOR_MODE);
        Optional<OperatorMode> mode = OperatorMode.fromSetting(modeSetting);
        if (mode.isPresent()) {
            b.withOperatorMode(mode.get());
        } else {
            if (modeSetting != null) {
                log.warn("Invalid operator mode '{}', defaulting to DEV", modeSetting);
            } else {
                log.warn("{} not set, defaulting to DEV", ENV_OPERATOR_MODE);
            }
            b.withOperatorMode(OperatorMode.DEV);
        }

        SafetyQueueConfig queue = SafetyQueueConfig.defaults();

        Integer armTtlSeconds = parseInt(env, ENV_ARM_TTL_SECONDS);
        if (armTtlSeconds != null) {
            b.withArmTtl(Duration.ofSeconds(armTtlSeconds));
        }
        Integer maxRetries = parseInt(env, ENV_QUEUE_MAX_RETRIES);
        if (maxRetries != null) {
            queue = queue.withMaxRetries(maxRetries);
        }
        Integer retentionDays = parseInt(env, ENV_RETENTION_DAYS);
        if (retentionDays != null) {
            queue = queue.withRetentionDays(retentionDays);
        }

        PipelineConfig config = b.withSafetyQueue(queue).build();
        log.info("Operator mode: {}", config.operatorMode().displayName());
        return config;
    }

    private static Integer parseInt(Map<String, String> env, String key)
    {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    public static final class Builder {
        private OperatorMode operatorMode = OperatorMode.DEV;
        private Duration armTtl = Duration.ofMinutes(10);
        private Duration applyTokenTtl = Duration.ofMinutes(5);
        private Duration expirySweepInterval = Duration.ofSeconds(1);
        private Duration telemetryInterval = Duration.ofMillis(100);
        private Duration hardwareTimeout = Duration.ofSeconds(10);
        private int maxConcurrentSessions = 1;
        private int flashBlockSize = 256;
        private int flashHistoryLimit = 20;
        private int sessionHistoryLimit = 50;
        private int maxFlashImageBytes = 4 * 1024 * 1024;
        private SafetyQueueConfig safetyQueue = SafetyQueueConfig.defaults();

        public Builder withOperatorMode(OperatorMode operatorMode) {
            this.operatorMode = operatorMode;
            return this;
        }

        public Builder withArmTtl(Duration armTtl) {
            this.armTtl = armTtl;
            return this;
        }

        public Builder withApplyTokenTtl(Duration applyTokenTtl) {
            this.applyTokenTtl = applyTokenTtl;
            return this;
        }

        public Builder withExpirySweepInterval(Duration expirySweepInterval) {
            this.expirySweepInterval = expirySweepInterval;
            return this;
        }

        public Builder withTelemetryInterval(Duration telemetryInterval) {
            this.telemetryInterval = telemetryInterval;
            return this;
        }

        public Builder withHardwareTimeout(Duration hardwareTimeout) {
            this.hardwareTimeout = hardwareTimeout;
            return this;
        }

        public Builder withMaxConcurrentSessions(int maxConcurrentSessions) {
            this.maxConcurrentSessions = maxConcurrentSessions;
            return this;
        }

        public Builder withFlashBlockSize(int flashBlockSize) {
            this.flashBlockSize = flashBlockSize;
            return this;
        }

        public Builder withFlashHistoryLimit(int flashHistoryLimit) {
            this.flashHistoryLimit = flashHistoryLimit;
            return this;
        }

        public Builder withSessionHistoryLimit(int sessionHistoryLimit) {
            this.sessionHistoryLimit = sessionHistoryLimit;
            return this;
        }

        public Builder withMaxFlashImageBytes(int maxFlashImageBytes) {
            this.maxFlashImageBytes = maxFlashImageBytes;
            return this;
        }

        public Builder withSafetyQueue(SafetyQueueConfig safetyQueue) {
            this.safetyQueue = safetyQueue;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(operatorMode, armTtl, applyTokenTtl, expirySweepInterval,
                telemetryInterval, hardwareTimeout, maxConcurrentSessions, flashBlockSize,
                flashHistoryLimit, sessionHistoryLimit, maxFlashImageBytes, safetyQueue);
        }
    }
}
