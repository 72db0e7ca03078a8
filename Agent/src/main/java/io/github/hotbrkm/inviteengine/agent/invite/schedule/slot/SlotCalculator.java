package io.github.hotbrkm.inviteengine.agent.invite.schedule.slot;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Computes send instants for one inbox.
 * <p>
 * The calculator holds no state besides its {@link Random}; results depend only on the arguments and the random
 * sequence, so a seeded instance gives repeatable schedules. Bookings passed in are expected to belong to the
 * inbox being scheduled; only occupying statuses count as conflicts.
 */
@Slf4j
public class SlotCalculator {

    private final Random random;

    public SlotCalculator() {
        this(new Random());
    }

    public SlotCalculator(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Picks a send instant inside the lead-time window.
     * <ol>
     *   <li>Earliest and latest dates are {@code minLeadTimeDays} and {@code maxLeadTimeDays} business days
     *   after today in the recipient zone.</li>
     *   <li>Up to {@code slotSearchAttempts} dates are tried. On each, a random grid instant inside the preferred
     *   hours is proposed; if taken, double booking or another free grid instant of the same date is used.</li>
     *   <li>When every attempt fails, the fallback policy decides between no slot and the first proposal.</li>
     * </ol>
     *
     * @throws io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingConfigurationException on invalid settings
     */
    public SlotComputation computeSlot(SchedulingSettings settings, String recipientTimezone, Instant now,
                                       Collection<BookedSlot> existingBookings) {
        settings.validate();
        boolean flagged = false;
        ZoneId zone = parseZone(recipientTimezone);
        if (zone == null) {
            zone = settings.defaultZone();
            flagged = true;
            log.debug("recipientTimezone={}, fallbackZone={}, event=timezone_fallback", recipientTimezone, zone);
        }

        boolean excludeWeekends = settings.excludeWeekends();
        LocalDate today = LocalDate.ofInstant(now, zone);
        LocalDate latest = BusinessDayCalendar.plusBusinessDays(today, settings.maxLeadTimeDays(), excludeWeekends);
        LocalDate date = BusinessDayCalendar.plusBusinessDays(today, settings.minLeadTimeDays(), excludeWeekends);

        Map<Instant, Integer> occupancy = occupancy(existingBookings, null);
        int maxPerInstant = settings.maxBookingsPerInstant();
        Instant firstProposal = null;
        LocalDate firstProposalDate = null;

        for (int attempt = 0; attempt < settings.slotSearchAttempts() && !date.isAfter(latest); attempt++) {
            List<Instant> grid = gridInstants(date, zone, settings, now);
            if (!grid.isEmpty()) {
                Instant proposal = propose(date, zone, settings, now, grid);
                if (firstProposal == null) {
                    firstProposal = proposal;
                    firstProposalDate = date;
                }
                int lead = BusinessDayCalendar.businessDaysBetween(today, date, excludeWeekends);
                int taken = occupancy.getOrDefault(proposal, 0);
                if (taken == 0) {
                    return SlotComputation.free(proposal, lead, flagged, zone);
                }
                if (settings.allowDoubleBooking() && taken < maxPerInstant) {
                    return SlotComputation.doubleBooked(proposal, lead, flagged, zone);
                }
                List<Instant> free = grid.stream().filter(i -> !occupancy.containsKey(i)).toList();
                if (!free.isEmpty()) {
                    return SlotComputation.free(free.get(random.nextInt(free.size())), lead, flagged, zone);
                }
            }
            date = BusinessDayCalendar.nextBusinessDay(date, excludeWeekends);
        }

        if (firstProposal == null) {
            log.debug("zone={}, today={}, event=slot_window_empty", zone, today);
            return SlotComputation.unavailable(flagged, zone);
        }
        int lead = BusinessDayCalendar.businessDaysBetween(today, firstProposalDate, excludeWeekends);
        return switch (settings.fallbackPolicy()) {
            case SKIP -> SlotComputation.unavailable(flagged, zone);
            case FORCE -> SlotComputation.doubleBooked(firstProposal, lead, flagged, zone);
            case NEEDS_ATTENTION -> SlotComputation.needsAttention(firstProposal, lead, flagged, zone);
        };
    }

    /**
     * Every free grid instant in the lead-time window, in chronological order.
     */
    public List<Instant> listFreeSlots(SchedulingSettings settings, String recipientTimezone, Instant now,
                                       Collection<BookedSlot> existingBookings) {
        settings.validate();
        ZoneId zone = Objects.requireNonNullElseGet(parseZone(recipientTimezone), settings::defaultZone);
        boolean excludeWeekends = settings.excludeWeekends();
        LocalDate today = LocalDate.ofInstant(now, zone);
        LocalDate latest = BusinessDayCalendar.plusBusinessDays(today, settings.maxLeadTimeDays(), excludeWeekends);
        LocalDate date = BusinessDayCalendar.plusBusinessDays(today, settings.minLeadTimeDays(), excludeWeekends);
        Map<Instant, Integer> occupancy = occupancy(existingBookings, null);

        List<Instant> result = new ArrayList<>();
        while (!date.isAfter(latest)) {
            for (Instant instant : gridInstants(date, zone, settings, now)) {
                if (!occupancy.containsKey(instant)) {
                    result.add(instant);
                }
            }
            date = BusinessDayCalendar.nextBusinessDay(date, excludeWeekends);
        }
        return result;
    }

    /**
     * True if no occupying booking sits exactly on {@code instant}.
     */
    public boolean isFree(Instant instant, Collection<BookedSlot> existingBookings) {
        return !occupancy(existingBookings, null).containsKey(instant);
    }

    /**
     * True if one more booking fits on {@code instant}, counting double booking when allowed.
     *
     * @param ignoredSlotId slot excluded from the count, typically the slot being moved
     */
    public boolean canBook(Instant instant, Collection<BookedSlot> existingBookings, SchedulingSettings settings,
                           String ignoredSlotId) {
        int taken = occupancy(existingBookings, ignoredSlotId).getOrDefault(instant, 0);
        return taken < settings.maxBookingsPerInstant();
    }

    /**
     * Lead-time window in UTC, widened by two days on each side so it covers every recipient zone.
     */
    public static Duration lookAhead(SchedulingSettings settings) {
        int calendarDays = settings.excludeWeekends()
                ? settings.maxLeadTimeDays() + 2 * (settings.maxLeadTimeDays() / 5 + 1)
                : settings.maxLeadTimeDays();
        return Duration.ofDays(calendarDays + 2L);
    }

    /**
     * Parses an IANA zone id.
     *
     * @return the zone, or {@code null} if the value is blank or unknown
     */
    public static ZoneId parseZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return null;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.debug("timezone={}, error={}, event=timezone_invalid", timezone, e.getMessage());
            return null;
        }
    }

    private Instant propose(LocalDate date, ZoneId zone, SchedulingSettings settings, Instant now,
                            List<Instant> grid) {
        int hour = settings.preferredStartHour()
                + random.nextInt(settings.preferredEndHour() - settings.preferredStartHour());
        int steps = 60 / settings.slotGranularityMinutes();
        int minute = random.nextInt(steps) * settings.slotGranularityMinutes();
        Instant candidate = ZonedDateTime.of(date, LocalTime.of(hour, minute), zone).toInstant();
        if (!candidate.isAfter(now)) {
            return grid.get(random.nextInt(grid.size()));
        }
        return candidate;
    }

    private List<Instant> gridInstants(LocalDate date, ZoneId zone, SchedulingSettings settings, Instant now) {
        List<Instant> grid = new ArrayList<>();
        int step = settings.slotGranularityMinutes();
        for (int hour = settings.preferredStartHour(); hour < settings.preferredEndHour(); hour++) {
            for (int minute = 0; minute < 60; minute += step) {
                Instant instant = ZonedDateTime.of(date, LocalTime.of(hour, minute), zone).toInstant();
                if (instant.isAfter(now) && !grid.contains(instant)) {
                    grid.add(instant);
                }
            }
        }
        return grid;
    }

    private static Map<Instant, Integer> occupancy(Collection<BookedSlot> bookings, String ignoredSlotId) {
        Map<Instant, Integer> counts = new HashMap<>();
        if (bookings == null) {
            return counts;
        }
        for (BookedSlot slot : bookings) {
            if (slot.isOccupying() && !slot.getId().equals(ignoredSlotId)) {
                counts.merge(slot.getScheduledTimeUtc(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
