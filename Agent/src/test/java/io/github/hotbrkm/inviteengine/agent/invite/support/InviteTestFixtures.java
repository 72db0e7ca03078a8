package io.github.hotbrkm.inviteengine.agent.invite.support;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SlotStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

public final class InviteTestFixtures {

    /** Monday 2024-01-08 09:00 UTC. */
    public static final Instant MONDAY_MORNING = Instant.parse("2024-01-08T09:00:00Z");
    /** Two business days after {@link #MONDAY_MORNING}. */
    public static final LocalDate WEDNESDAY = LocalDate.of(2024, 1, 10);

    private InviteTestFixtures() {
    }

    public static Clock fixedClock() {
        return fixedClock(MONDAY_MORNING);
    }

    public static Clock fixedClock(Instant instant) {
        return Clock.fixed(instant, ZoneOffset.UTC);
    }

    public static Inbox inbox(String id, int dailyQuota) {
        return Inbox.builder()
                .id(id)
                .email(id + "@sender.example.com")
                .dailyQuota(dailyQuota)
                .build();
    }

    public static BookedSlot slot(String inboxId, Instant at) {
        return slot(inboxId, at, SlotStatus.PENDING);
    }

    public static BookedSlot slot(String inboxId, Instant at, SlotStatus status) {
        return BookedSlot.builder()
                .inboxId(inboxId)
                .campaignId("campaign-1")
                .recipientEmail("prospect-" + at.getEpochSecond() + "@example.com")
                .recipientTimezone("UTC")
                .scheduledTimeUtc(at)
                .status(status)
                .createdAt(MONDAY_MORNING)
                .build();
    }

    /**
     * Only Wednesday is eligible and only one date is searched.
     */
    public static SchedulingSettings singleDaySettings() {
        return SchedulingSettings.defaults().toBuilder()
                .minLeadTimeDays(2)
                .maxLeadTimeDays(2)
                .slotSearchAttempts(1)
                .build();
    }

    /**
     * Every grid instant of {@code date} inside the preferred hours.
     */
    public static List<Instant> gridOf(LocalDate date, ZoneId zone, SchedulingSettings settings) {
        List<Instant> grid = new ArrayList<>();
        for (int hour = settings.preferredStartHour(); hour < settings.preferredEndHour(); hour++) {
            for (int minute = 0; minute < 60; minute += settings.slotGranularityMinutes()) {
                grid.add(ZonedDateTime.of(date, LocalTime.of(hour, minute), zone).toInstant());
            }
        }
        return grid;
    }
}
