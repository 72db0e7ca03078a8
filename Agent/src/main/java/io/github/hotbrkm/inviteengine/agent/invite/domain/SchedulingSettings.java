package io.github.hotbrkm.inviteengine.agent.invite.domain;

import lombok.Builder;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Immutable scheduling settings snapshot passed into every engine call.
 * <p>
 * Start from {@link #defaults()} and override through {@code toBuilder()}.
 *
 * @param minLeadTimeDays          minimum business days between now and the slot
 * @param maxLeadTimeDays          maximum business days between now and the slot
 * @param preferredStartHour       first hour of the sending window, recipient local time (inclusive)
 * @param preferredEndHour         end of the sending window, recipient local time (exclusive)
 * @param excludeWeekends          skip Saturday and Sunday when counting and picking days
 * @param allowDoubleBooking       allow two slots of one inbox at the same instant
 * @param maxDoubleBookingsPerSlot extra bookings tolerated on one instant when double booking is allowed
 * @param fallbackPolicy           behaviour once the slot search is exhausted
 * @param cooldownMinutes          idle time after each send from an inbox
 * @param maxErrorsBeforePause     consecutive errors that pause an inbox
 * @param healthThreshold          minimum health score (0-100) for selection
 * @param slotSearchAttempts       number of candidate days tried before the fallback applies
 * @param slotGranularityMinutes   minute grid for slot times
 * @param defaultTimezone          zone used when the recipient zone is missing or unknown
 * @param enableTimezoneDetection  guess the zone from the recipient's mail domain
 * @param sendRetryAttempts        send attempts per recipient including the first one
 */
@Builder(toBuilder = true)
public record SchedulingSettings(int minLeadTimeDays,
                                 int maxLeadTimeDays,
                                 int preferredStartHour,
                                 int preferredEndHour,
                                 boolean excludeWeekends,
                                 boolean allowDoubleBooking,
                                 int maxDoubleBookingsPerSlot,
                                 FallbackPolicy fallbackPolicy,
                                 int cooldownMinutes,
                                 int maxErrorsBeforePause,
                                 int healthThreshold,
                                 int slotSearchAttempts,
                                 int slotGranularityMinutes,
                                 String defaultTimezone,
                                 boolean enableTimezoneDetection,
                                 int sendRetryAttempts) {

    public static final int DEFAULT_MIN_LEAD_TIME_DAYS = 2;
    public static final int DEFAULT_MAX_LEAD_TIME_DAYS = 6;
    public static final int DEFAULT_PREFERRED_START_HOUR = 12;
    public static final int DEFAULT_PREFERRED_END_HOUR = 16;
    public static final int DEFAULT_COOLDOWN_MINUTES = 30;
    public static final int DEFAULT_MAX_ERRORS_BEFORE_PAUSE = 3;
    public static final int DEFAULT_HEALTH_THRESHOLD = 70;
    public static final int DEFAULT_SLOT_SEARCH_ATTEMPTS = 5;
    public static final int DEFAULT_SLOT_GRANULARITY_MINUTES = 15;
    public static final String DEFAULT_TIMEZONE = "UTC";
    public static final int DEFAULT_SEND_RETRY_ATTEMPTS = 3;

    public static SchedulingSettings defaults() {
        return new SchedulingSettings(DEFAULT_MIN_LEAD_TIME_DAYS, DEFAULT_MAX_LEAD_TIME_DAYS,
                DEFAULT_PREFERRED_START_HOUR, DEFAULT_PREFERRED_END_HOUR, true, false, 1, FallbackPolicy.SKIP,
                DEFAULT_COOLDOWN_MINUTES, DEFAULT_MAX_ERRORS_BEFORE_PAUSE, DEFAULT_HEALTH_THRESHOLD,
                DEFAULT_SLOT_SEARCH_ATTEMPTS, DEFAULT_SLOT_GRANULARITY_MINUTES, DEFAULT_TIMEZONE, true,
                DEFAULT_SEND_RETRY_ATTEMPTS);
    }

    /**
     * Fails fast on settings that cannot produce a meaningful schedule.
     *
     * @return this, for chaining
     * @throws SchedulingConfigurationException on the first invalid value
     */
    public SchedulingSettings validate() {
        if (minLeadTimeDays < 0) {
            throw new SchedulingConfigurationException("minLeadTimeDays must not be negative: " + minLeadTimeDays);
        }
        if (minLeadTimeDays > maxLeadTimeDays) {
            throw new SchedulingConfigurationException("minLeadTimeDays (" + minLeadTimeDays
                    + ") must not exceed maxLeadTimeDays (" + maxLeadTimeDays + ")");
        }
        if (preferredStartHour < 0 || preferredStartHour > 23) {
            throw new SchedulingConfigurationException("preferredStartHour must be within 0..23: " + preferredStartHour);
        }
        if (preferredEndHour < 1 || preferredEndHour > 24 || preferredEndHour <= preferredStartHour) {
            throw new SchedulingConfigurationException("preferredEndHour must be within " + (preferredStartHour + 1)
                    + "..24: " + preferredEndHour);
        }
        if (slotGranularityMinutes <= 0 || slotGranularityMinutes > 60 || 60 % slotGranularityMinutes != 0) {
            throw new SchedulingConfigurationException("slotGranularityMinutes must divide 60: " + slotGranularityMinutes);
        }
        if (fallbackPolicy == null) {
            throw new SchedulingConfigurationException("fallbackPolicy must not be null");
        }
        if (cooldownMinutes < 0) {
            throw new SchedulingConfigurationException("cooldownMinutes must not be negative: " + cooldownMinutes);
        }
        if (maxErrorsBeforePause < 1) {
            throw new SchedulingConfigurationException("maxErrorsBeforePause must be at least 1: " + maxErrorsBeforePause);
        }
        if (healthThreshold < 0 || healthThreshold > 100) {
            throw new SchedulingConfigurationException("healthThreshold must be within 0..100: " + healthThreshold);
        }
        if (maxDoubleBookingsPerSlot < 0) {
            throw new SchedulingConfigurationException("maxDoubleBookingsPerSlot must not be negative: " + maxDoubleBookingsPerSlot);
        }
        if (slotSearchAttempts < 1) {
            throw new SchedulingConfigurationException("slotSearchAttempts must be at least 1: " + slotSearchAttempts);
        }
        if (sendRetryAttempts < 1) {
            throw new SchedulingConfigurationException("sendRetryAttempts must be at least 1: " + sendRetryAttempts);
        }
        defaultZone();
        return this;
    }

    /**
     * Zone used when a recipient zone cannot be resolved.
     */
    public ZoneId defaultZone() {
        if (defaultTimezone == null || defaultTimezone.isBlank()) {
            return ZoneId.of(DEFAULT_TIMEZONE);
        }
        try {
            return ZoneId.of(defaultTimezone.trim());
        } catch (DateTimeException e) {
            throw new SchedulingConfigurationException("defaultTimezone is not a valid zone id: " + defaultTimezone, e);
        }
    }

    public Duration cooldown() {
        return Duration.ofMinutes(cooldownMinutes);
    }

    /**
     * Bookings tolerated on one instant of one inbox.
     */
    public int maxBookingsPerInstant() {
        return allowDoubleBooking ? 1 + maxDoubleBookingsPerSlot : 1;
    }
}
