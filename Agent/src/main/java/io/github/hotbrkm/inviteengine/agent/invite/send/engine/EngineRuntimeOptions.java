package io.github.hotbrkm.inviteengine.agent.invite.send.engine;

import io.github.hotbrkm.inviteengine.agent.invite.config.InviteEngineProperties;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Set of normalized runtime options for the invite engine.
 */
record EngineRuntimeOptions(int workerCount,
                            Duration lockTimeout,
                            long runTimeoutMs,
                            double healthSmoothingFactor,
                            int healthErrorPenalty,
                            long initialRetryDelayMs,
                            long maxRetryDelayMs,
                            double retryBackoffMultiplier,
                            int metricsRetentionWindows,
                            int metricsWindowSeconds,
                            Long randomSeed,
                            boolean dailyResetEnabled,
                            ZoneId boundaryZone,
                            LocalTime boundaryTime,
                            DayOfWeek weeklyResetDay,
                            long resetCheckIntervalSeconds) {

    /**
     * Calculates runtime options from configuration.
     */
    static EngineRuntimeOptions fromProperties(InviteEngineProperties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        InviteEngineProperties.Engine engine = Objects.requireNonNull(properties.getEngine(), "invite.engine must not be null");
        InviteEngineProperties.DailyReset dailyReset = properties.getDailyReset() == null
                ? new InviteEngineProperties.DailyReset()
                : properties.getDailyReset();

        long initialRetryDelayMs = engine.resolveInitialRetryDelayMs();
        long maxRetryDelayMs = Math.max(initialRetryDelayMs, engine.resolveMaxRetryDelayMs());
        return new EngineRuntimeOptions(
                engine.resolveWorkerCount(),
                Duration.ofMillis(engine.resolveLockTimeoutMs()),
                engine.resolveRunTimeoutMs(),
                engine.resolveHealthSmoothingFactor(),
                engine.resolveHealthErrorPenalty(),
                initialRetryDelayMs,
                maxRetryDelayMs,
                engine.resolveRetryBackoffMultiplier(),
                engine.resolveMetricsRetentionWindows(),
                engine.resolveMetricsWindowSeconds(),
                engine.getRandomSeed(),
                dailyReset.isEnabled(),
                dailyReset.resolveZone(),
                dailyReset.resolveBoundaryTime(),
                dailyReset.resolveWeeklyResetDay(),
                dailyReset.resolveCheckIntervalSeconds());
    }
}
