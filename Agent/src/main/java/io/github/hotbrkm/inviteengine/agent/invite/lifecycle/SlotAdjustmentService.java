package io.github.hotbrkm.inviteengine.agent.invite.lifecycle;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.RsvpStatus;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SlotStatus;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.registry.InboxRegistry;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.InboxLockManager;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.slot.BusinessDayCalendar;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.slot.SlotCalculator;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.slot.SlotComputation;
import io.github.hotbrkm.inviteengine.agent.invite.store.InboxStore;
import io.github.hotbrkm.inviteengine.agent.invite.store.SlotConflictException;
import io.github.hotbrkm.inviteengine.agent.invite.store.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * User-driven slot changes: reschedule, cancel and RSVP updates.
 * <p>
 * Every change runs under the lock of the slot's inbox. A slot holds a provisional quota unit exactly while it
 * is PENDING, so each change consumes or returns one unit when it moves the slot into or out of PENDING.
 */
@Slf4j
@RequiredArgsConstructor
public class SlotAdjustmentService {

    private final InboxStore store;
    private final InboxRegistry registry;
    private final SlotCalculator slotCalculator;
    private final InboxLockManager lockManager;
    private final Clock clock;

    /**
     * Recomputes the slot's time on its current inbox, ignoring the slot's own booking.
     *
     * @throws IllegalStateException when the fallback policy leaves no slot
     */
    public BookedSlot reschedule(String slotId, SchedulingSettings settings) {
        settings.validate();
        return adjust(slotId, slot -> {
            Instant now = clock.instant();
            List<BookedSlot> others = otherBookings(slot, settings, now);
            SlotComputation computation = slotCalculator.computeSlot(settings, slot.getRecipientTimezone(), now, others);
            if (!computation.isAvailable()) {
                throw new IllegalStateException("No free slot for " + slot.getId() + " on inbox " + slot.getInboxId());
            }
            slot.reschedule(computation.timeUtc(), computation.leadTimeDays(), computation.wasDoubleBooked(), now);
            slot.setFlaggedForReview(slot.isFlaggedForReview() || computation.flaggedForReview());
            if (computation.needsAttention()) {
                slot.transitionTo(SlotStatus.NEEDS_ATTENTION, "No free slot in lead-time window", now);
            }
            return slot;
        });
    }

    /**
     * Moves the slot to a caller-chosen instant.
     *
     * @throws SlotConflictException if the instant is taken and double booking does not allow another booking
     */
    public BookedSlot rescheduleTo(String slotId, Instant newTimeUtc, SchedulingSettings settings) {
        settings.validate();
        Objects.requireNonNull(newTimeUtc, "newTimeUtc must not be null");
        return adjust(slotId, slot -> {
            Instant now = clock.instant();
            if (!newTimeUtc.isAfter(now)) {
                throw new IllegalArgumentException("newTimeUtc must be in the future: " + newTimeUtc);
            }
            List<BookedSlot> others = otherBookings(slot, settings, now);
            if (!slotCalculator.canBook(newTimeUtc, others, settings, slot.getId())) {
                throw new SlotConflictException(slot.getInboxId(), newTimeUtc);
            }
            boolean doubleBooked = !slotCalculator.isFree(newTimeUtc, others);
            ZoneId zone = Objects.requireNonNullElseGet(SlotCalculator.parseZone(slot.getRecipientTimezone()),
                    settings::defaultZone);
            int leadTimeDays = BusinessDayCalendar.businessDaysBetween(LocalDate.ofInstant(now, zone),
                    LocalDate.ofInstant(newTimeUtc, zone), settings.excludeWeekends());
            slot.reschedule(newTimeUtc, leadTimeDays, doubleBooked, now);
            return slot;
        });
    }

    public BookedSlot cancel(String slotId, String reason) {
        return adjust(slotId, slot -> {
            slot.transitionTo(SlotStatus.CANCELED, reason, clock.instant());
            return slot;
        });
    }

    /**
     * Records the recipient's response to a sent invite.
     */
    public BookedSlot applyRsvp(String slotId, RsvpStatus rsvp) {
        Objects.requireNonNull(rsvp, "rsvp must not be null");
        return adjust(slotId, slot -> {
            slot.transitionTo(rsvp.toSlotStatus(), null, clock.instant());
            return slot;
        });
    }

    private BookedSlot adjust(String slotId, Function<BookedSlot, BookedSlot> change) {
        BookedSlot located = requireSlot(slotId);
        BookedSlot updated = lockManager.withLock(located.getInboxId(), () -> {
            BookedSlot slot = requireSlot(slotId);
            boolean heldQuota = slot.getStatus() == SlotStatus.PENDING;
            BookedSlot result = change.apply(slot);
            boolean holdsQuota = result.getStatus() == SlotStatus.PENDING;
            if (heldQuota != holdsQuota) {
                Inbox inbox = store.findInbox(result.getInboxId())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown inbox: " + result.getInboxId()));
                if (holdsQuota) {
                    registry.consumeQuota(inbox);
                } else {
                    registry.releaseQuota(inbox);
                }
                store.persistBookedSlot(result);
                store.persistInbox(inbox);
            } else {
                store.persistBookedSlot(result);
            }
            return result;
        });
        log.info("slotId={}, inboxId={}, status={}, at={}, rescheduledCount={}, event=slot_adjusted",
                updated.getId(), updated.getInboxId(), updated.getStatus(), updated.getScheduledTimeUtc(),
                updated.getRescheduledCount());
        return updated;
    }

    private List<BookedSlot> otherBookings(BookedSlot slot, SchedulingSettings settings, Instant now) {
        TimeWindow window = new TimeWindow(now.minus(Duration.ofDays(1)), now.plus(SlotCalculator.lookAhead(settings)));
        return store.loadBookingsForInbox(slot.getInboxId(), window).stream()
                .filter(other -> !other.getId().equals(slot.getId()))
                .toList();
    }

    private BookedSlot requireSlot(String slotId) {
        return store.findBookedSlot(slotId).orElseThrow(() -> new IllegalArgumentException("Unknown slot: " + slotId));
    }
}
