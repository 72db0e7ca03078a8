package io.github.hotbrkm.inviteengine.agent.invite.lifecycle;

import io.github.hotbrkm.inviteengine.agent.invite.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.MONDAY_MORNING;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("DailyResetScheduler test")
class DailyResetSchedulerTest {

    private final InboxMaintenanceService maintenanceService = mock(InboxMaintenanceService.class);

    private final MutableClock clock = new MutableClock(MONDAY_MORNING);

    private DailyResetScheduler scheduler(LocalTime boundaryTime) {
        return new DailyResetScheduler(maintenanceService, clock, ZoneOffset.UTC, boundaryTime, DayOfWeek.MONDAY);
    }

    @Test
    @DisplayName("Resets once per date and weekly on the reset day")
    void tick_resetsOncePerDate() {
        DailyResetScheduler scheduler = scheduler(LocalTime.MIDNIGHT);

        scheduler.tick();
        scheduler.tick();
        clock.advance(Duration.ofDays(1));
        scheduler.tick();

        verify(maintenanceService).resetDaily(LocalDate.of(2024, 1, 8));
        verify(maintenanceService).resetDaily(LocalDate.of(2024, 1, 9));
        verify(maintenanceService, times(1)).resetWeekly();
    }

    @Test
    @DisplayName("Nothing happens before the boundary time")
    void tick_beforeBoundary() {
        DailyResetScheduler scheduler = scheduler(LocalTime.of(10, 0));

        scheduler.tick();
        verifyNoInteractions(maintenanceService);

        clock.advance(Duration.ofHours(1));
        scheduler.tick();
        verify(maintenanceService).resetDaily(LocalDate.of(2024, 1, 8));
    }

    @Test
    @DisplayName("Weekly reset skips other weekdays")
    void tick_weeklyOnlyOnResetDay() {
        clock.advance(Duration.ofDays(2));
        DailyResetScheduler scheduler = scheduler(LocalTime.MIDNIGHT);

        scheduler.tick();

        verify(maintenanceService).resetDaily(LocalDate.of(2024, 1, 10));
        verify(maintenanceService, never()).resetWeekly();
    }

    @Test
    @DisplayName("Failures in a tick are logged and not propagated")
    void safeTick_swallowsFailure() {
        when(maintenanceService.resetDaily(any())).thenThrow(new IllegalStateException("store unavailable"));
        DailyResetScheduler scheduler = scheduler(LocalTime.MIDNIGHT);

        assertThatCode(scheduler::safeTick).doesNotThrowAnyException();

        verify(maintenanceService).resetDaily(LocalDate.of(2024, 1, 8));
    }
}
