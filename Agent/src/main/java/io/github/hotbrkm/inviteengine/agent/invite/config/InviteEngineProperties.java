package io.github.hotbrkm.inviteengine.agent.invite.config;

import io.github.hotbrkm.inviteengine.agent.invite.domain.FallbackPolicy;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "invite")
public class InviteEngineProperties {

    private boolean enabled = true;

    private Engine engine = new Engine();
    private Scheduling scheduling = new Scheduling();
    private DailyReset dailyReset = new DailyReset();

    @Data
    public static class Engine {
        public static final int DEFAULT_WORKER_COUNT = 8;
        public static final long DEFAULT_LOCK_TIMEOUT_MS = 2_000L;
        public static final long DEFAULT_RUN_TIMEOUT_MS = 600_000L;
        public static final double DEFAULT_HEALTH_SMOOTHING_FACTOR = 0.2d;
        public static final int DEFAULT_HEALTH_ERROR_PENALTY = 10;
        public static final long DEFAULT_INITIAL_RETRY_DELAY_MS = 1_000L;
        public static final long DEFAULT_MAX_RETRY_DELAY_MS = 30_000L;
        public static final double DEFAULT_RETRY_BACKOFF_MULTIPLIER = 2.0d;
        public static final int DEFAULT_METRICS_RETENTION_WINDOWS = 60;
        public static final int DEFAULT_METRICS_WINDOW_SECONDS = 60;

        private int workerCount = DEFAULT_WORKER_COUNT;
        private long lockTimeoutMs = DEFAULT_LOCK_TIMEOUT_MS;
        private long runTimeoutMs = DEFAULT_RUN_TIMEOUT_MS;
        private double healthSmoothingFactor = DEFAULT_HEALTH_SMOOTHING_FACTOR;
        private int healthErrorPenalty = DEFAULT_HEALTH_ERROR_PENALTY;
        private long initialRetryDelayMs = DEFAULT_INITIAL_RETRY_DELAY_MS;
        private long maxRetryDelayMs = DEFAULT_MAX_RETRY_DELAY_MS;
        private double retryBackoffMultiplier = DEFAULT_RETRY_BACKOFF_MULTIPLIER;
        private int metricsRetentionWindows = DEFAULT_METRICS_RETENTION_WINDOWS;
        private int metricsWindowSeconds = DEFAULT_METRICS_WINDOW_SECONDS;

        // Seed for slot time randomness, unset means a fresh seed per start
        private Long randomSeed;

        public int resolveWorkerCount() {
            return workerCount > 0 ? workerCount : DEFAULT_WORKER_COUNT;
        }

        public long resolveLockTimeoutMs() {
            return lockTimeoutMs >= 0 ? lockTimeoutMs : DEFAULT_LOCK_TIMEOUT_MS;
        }

        public long resolveRunTimeoutMs() {
            return runTimeoutMs >= 0 ? runTimeoutMs : DEFAULT_RUN_TIMEOUT_MS;
        }

        public double resolveHealthSmoothingFactor() {
            return healthSmoothingFactor > 0 && healthSmoothingFactor <= 1 ? healthSmoothingFactor : DEFAULT_HEALTH_SMOOTHING_FACTOR;
        }

        public int resolveHealthErrorPenalty() {
            return healthErrorPenalty >= 0 && healthErrorPenalty <= 100 ? healthErrorPenalty : DEFAULT_HEALTH_ERROR_PENALTY;
        }

        public long resolveInitialRetryDelayMs() {
            return initialRetryDelayMs >= 0 ? initialRetryDelayMs : DEFAULT_INITIAL_RETRY_DELAY_MS;
        }

        public long resolveMaxRetryDelayMs() {
            return maxRetryDelayMs >= 0 ? maxRetryDelayMs : DEFAULT_MAX_RETRY_DELAY_MS;
        }

        public double resolveRetryBackoffMultiplier() {
            return retryBackoffMultiplier >= 1 ? retryBackoffMultiplier : DEFAULT_RETRY_BACKOFF_MULTIPLIER;
        }

        public int resolveMetricsRetentionWindows() {
            return metricsRetentionWindows > 0 ? metricsRetentionWindows : DEFAULT_METRICS_RETENTION_WINDOWS;
        }

        public int resolveMetricsWindowSeconds() {
            return metricsWindowSeconds > 0 ? metricsWindowSeconds : DEFAULT_METRICS_WINDOW_SECONDS;
        }
    }

    /**
     * Scheduling values. Unset fields keep the value of the layer below: built-in defaults for the global
     * section, the global section for a campaign override.
     */
    @Data
    public static class SchedulingValues {
        private Integer minLeadTimeDays;
        private Integer maxLeadTimeDays;
        private Integer preferredStartHour;
        private Integer preferredEndHour;
        private Boolean excludeWeekends;
        private Boolean allowDoubleBooking;
        private Integer maxDoubleBookingsPerSlot;
        private String fallbackPolicy;
        private Integer cooldownMinutes;
        private Integer maxErrorsBeforePause;
        private Integer healthThreshold;
        private Integer slotSearchAttempts;
        private Integer slotGranularityMinutes;
        private String defaultTimezone;
        private Boolean enableTimezoneDetection;
        private Integer sendRetryAttempts;

        public SchedulingSettings applyTo(SchedulingSettings base) {
            SchedulingSettings.SchedulingSettingsBuilder builder = base.toBuilder();
            if (minLeadTimeDays != null) builder.minLeadTimeDays(minLeadTimeDays);
            if (maxLeadTimeDays != null) builder.maxLeadTimeDays(maxLeadTimeDays);
            if (preferredStartHour != null) builder.preferredStartHour(preferredStartHour);
            if (preferredEndHour != null) builder.preferredEndHour(preferredEndHour);
            if (excludeWeekends != null) builder.excludeWeekends(excludeWeekends);
            if (allowDoubleBooking != null) builder.allowDoubleBooking(allowDoubleBooking);
            if (maxDoubleBookingsPerSlot != null) builder.maxDoubleBookingsPerSlot(maxDoubleBookingsPerSlot);
            if (fallbackPolicy != null) builder.fallbackPolicy(FallbackPolicy.from(fallbackPolicy));
            if (cooldownMinutes != null) builder.cooldownMinutes(cooldownMinutes);
            if (maxErrorsBeforePause != null) builder.maxErrorsBeforePause(maxErrorsBeforePause);
            if (healthThreshold != null) builder.healthThreshold(healthThreshold);
            if (slotSearchAttempts != null) builder.slotSearchAttempts(slotSearchAttempts);
            if (slotGranularityMinutes != null) builder.slotGranularityMinutes(slotGranularityMinutes);
            if (defaultTimezone != null) builder.defaultTimezone(defaultTimezone);
            if (enableTimezoneDetection != null) builder.enableTimezoneDetection(enableTimezoneDetection);
            if (sendRetryAttempts != null) builder.sendRetryAttempts(sendRetryAttempts);
            return builder.build();
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class Scheduling extends SchedulingValues {
        // Per-campaign overrides keyed by campaign id
        private Map<String, SchedulingValues> campaigns = new HashMap<>();
        // Mail domain to IANA zone, used when a recipient has no timezone
        private Map<String, String> domainTimezones = new HashMap<>(Map.of(
                "gmail.com", "America/New_York",
                "outlook.com", "America/New_York",
                "hotmail.com", "America/New_York"));
    }

    @Data
    public static class DailyReset {
        public static final String DEFAULT_ZONE = "UTC";
        public static final long DEFAULT_CHECK_INTERVAL_SECONDS = 60L;

        private boolean enabled;
        private String zone = DEFAULT_ZONE;
        private String boundaryTime = "00:00";
        private String weeklyResetDay = DayOfWeek.MONDAY.name();
        private long checkIntervalSeconds = DEFAULT_CHECK_INTERVAL_SECONDS;

        public ZoneId resolveZone() {
            return ZoneId.of(zone == null || zone.isBlank() ? DEFAULT_ZONE : zone.trim());
        }

        public LocalTime resolveBoundaryTime() {
            return boundaryTime == null || boundaryTime.isBlank() ? LocalTime.MIDNIGHT : LocalTime.parse(boundaryTime.trim());
        }

        public DayOfWeek resolveWeeklyResetDay() {
            return weeklyResetDay == null || weeklyResetDay.isBlank()
                    ? DayOfWeek.MONDAY
                    : DayOfWeek.valueOf(weeklyResetDay.trim().toUpperCase(Locale.ROOT));
        }

        public long resolveCheckIntervalSeconds() {
            return checkIntervalSeconds > 0 ? checkIntervalSeconds : DEFAULT_CHECK_INTERVAL_SECONDS;
        }
    }
}
