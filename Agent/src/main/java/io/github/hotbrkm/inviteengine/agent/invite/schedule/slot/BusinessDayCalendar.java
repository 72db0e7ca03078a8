package io.github.hotbrkm.inviteengine.agent.invite.schedule.slot;

import lombok.experimental.UtilityClass;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Business-day arithmetic. Saturday and Sunday are the only non-business days; holidays are not modelled.
 */
@UtilityClass
public class BusinessDayCalendar {

    public boolean isBusinessDay(LocalDate date, boolean excludeWeekends) {
        if (!excludeWeekends) {
            return true;
        }
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }

    /**
     * Moves {@code days} business days forward from {@code start}. With zero days, a non-business start rolls
     * forward to the next business day.
     */
    public LocalDate plusBusinessDays(LocalDate start, int days, boolean excludeWeekends) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative: " + days);
        }
        LocalDate date = start;
        int counted = 0;
        while (counted < days) {
            date = date.plusDays(1);
            if (isBusinessDay(date, excludeWeekends)) {
                counted++;
            }
        }
        while (!isBusinessDay(date, excludeWeekends)) {
            date = date.plusDays(1);
        }
        return date;
    }

    public LocalDate nextBusinessDay(LocalDate date, boolean excludeWeekends) {
        return plusBusinessDays(date, 1, excludeWeekends);
    }

    /**
     * Business days in {@code (from, to]}. Zero when {@code to} is not after {@code from}.
     */
    public int businessDaysBetween(LocalDate from, LocalDate to, boolean excludeWeekends) {
        int count = 0;
        LocalDate date = from;
        while (date.isBefore(to)) {
            date = date.plusDays(1);
            if (isBusinessDay(date, excludeWeekends)) {
                count++;
            }
        }
        return count;
    }
}
