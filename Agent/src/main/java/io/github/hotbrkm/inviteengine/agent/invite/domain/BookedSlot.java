package io.github.hotbrkm.inviteengine.agent.invite.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Reservation of one (inbox, UTC instant) pair for one recipient.
 */
@Getter
@Setter
public class BookedSlot {

    private final String id;
    private String inboxId;
    private final String campaignId;
    private final String recipientEmail;
    private final String recipientName;
    private String recipientTimezone;

    private Instant scheduledTimeUtc;
    private Instant originalScheduledTimeUtc;
    private int leadTimeDays;
    private boolean wasDoubleBooked;
    private boolean flaggedForReview;

    private SlotStatus status;
    private String statusReason;
    private String eventId;
    private int rescheduledCount;

    private final Instant createdAt;
    private Instant updatedAt;

    @Builder
    public BookedSlot(String id, String inboxId, String campaignId, String recipientEmail, String recipientName,
                      String recipientTimezone, Instant scheduledTimeUtc, Instant originalScheduledTimeUtc,
                      int leadTimeDays, boolean wasDoubleBooked, boolean flaggedForReview, SlotStatus status,
                      String statusReason, String eventId, int rescheduledCount, Instant createdAt, Instant updatedAt) {
        this.id = id == null ? UUID.randomUUID().toString() : id;
        this.inboxId = Objects.requireNonNull(inboxId, "inboxId must not be null");
        this.campaignId = campaignId;
        this.recipientEmail = Objects.requireNonNull(recipientEmail, "recipientEmail must not be null");
        this.recipientName = recipientName;
        this.recipientTimezone = recipientTimezone;
        this.scheduledTimeUtc = Objects.requireNonNull(scheduledTimeUtc, "scheduledTimeUtc must not be null");
        this.originalScheduledTimeUtc = originalScheduledTimeUtc;
        this.leadTimeDays = leadTimeDays;
        this.wasDoubleBooked = wasDoubleBooked;
        this.flaggedForReview = flaggedForReview;
        this.status = status == null ? SlotStatus.PENDING : status;
        this.statusReason = statusReason;
        this.eventId = eventId;
        this.rescheduledCount = Math.max(0, rescheduledCount);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    /**
     * Moves the slot to {@code next}, enforcing {@link SlotStatus#canTransitionTo}.
     */
    public void transitionTo(SlotStatus next, String reason, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidSlotTransitionException(id, status, next);
        }
        this.status = next;
        this.statusReason = reason;
        this.updatedAt = now;
    }

    /**
     * Moves the slot to a new time, keeping the first scheduled time for reference. Status returns to PENDING.
     */
    public void reschedule(Instant newTimeUtc, int newLeadTimeDays, boolean doubleBooked, Instant now) {
        if (status.isTerminal()) {
            throw new InvalidSlotTransitionException(id, status, SlotStatus.PENDING);
        }
        if (originalScheduledTimeUtc == null) {
            originalScheduledTimeUtc = scheduledTimeUtc;
        }
        this.scheduledTimeUtc = Objects.requireNonNull(newTimeUtc, "newTimeUtc must not be null");
        this.leadTimeDays = newLeadTimeDays;
        this.wasDoubleBooked = doubleBooked;
        this.rescheduledCount++;
        this.status = SlotStatus.PENDING;
        this.statusReason = null;
        this.updatedAt = now;
    }

    public boolean isOccupying() {
        return status.isOccupying();
    }

    public BookedSlot copy() {
        return new BookedSlot(id, inboxId, campaignId, recipientEmail, recipientName, recipientTimezone,
                scheduledTimeUtc, originalScheduledTimeUtc, leadTimeDays, wasDoubleBooked, flaggedForReview, status,
                statusReason, eventId, rescheduledCount, createdAt, updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        BookedSlot that = (BookedSlot) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "BookedSlot{id=" + id + ", inboxId=" + inboxId + ", campaignId=" + campaignId + ", recipient="
                + recipientEmail + ", at=" + scheduledTimeUtc + ", status=" + status + ", doubleBooked="
                + wasDoubleBooked + "}";
    }
}
