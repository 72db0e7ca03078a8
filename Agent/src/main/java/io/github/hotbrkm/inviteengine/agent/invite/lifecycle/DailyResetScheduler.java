package io.github.hotbrkm.inviteengine.agent.invite.lifecycle;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Periodic tick that triggers the daily and weekly quota resets.
 * <p>
 * The engine calls {@link #tick()} at a fixed rate. A reset fires on the first tick at or after the boundary
 * time of a date and at most once per date, so a coarse tick interval only delays the reset.
 */
@Slf4j
public class DailyResetScheduler {

    private final InboxMaintenanceService maintenanceService;
    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime boundaryTime;
    private final DayOfWeek weeklyResetDay;

    private LocalDate lastDailyReset;
    private LocalDate lastWeeklyReset;

    public DailyResetScheduler(InboxMaintenanceService maintenanceService, Clock clock, ZoneId zone,
                               LocalTime boundaryTime, DayOfWeek weeklyResetDay) {
        this.maintenanceService = Objects.requireNonNull(maintenanceService, "maintenanceService must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.boundaryTime = Objects.requireNonNull(boundaryTime, "boundaryTime must not be null");
        this.weeklyResetDay = Objects.requireNonNull(weeklyResetDay, "weeklyResetDay must not be null");
    }

    public synchronized void tick() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        LocalDate today = now.toLocalDate();
        if (now.toLocalTime().isBefore(boundaryTime)) {
            return;
        }
        if (!today.equals(lastDailyReset)) {
            maintenanceService.resetDaily(today);
            lastDailyReset = today;
        }
        if (today.getDayOfWeek() == weeklyResetDay && !today.equals(lastWeeklyReset)) {
            maintenanceService.resetWeekly();
            lastWeeklyReset = today;
        }
    }

    /**
     * Tick for the periodic executor. Failures are logged so the schedule keeps running.
     */
    public void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("zone={}, event=daily_reset_tick_failed", zone, e);
        }
    }
}
