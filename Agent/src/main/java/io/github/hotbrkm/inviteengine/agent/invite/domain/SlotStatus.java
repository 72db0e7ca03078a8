package io.github.hotbrkm.inviteengine.agent.invite.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a {@link BookedSlot}.
 */
public enum SlotStatus {
    PENDING,
    SENT,
    ACCEPTED,
    DECLINED,
    TENTATIVE,
    NEEDS_ATTENTION,
    CANCELED;

    private static final Set<SlotStatus> OCCUPYING = EnumSet.of(PENDING, SENT, ACCEPTED, TENTATIVE);
    private static final Set<SlotStatus> RSVP = EnumSet.of(ACCEPTED, DECLINED, TENTATIVE);

    /**
     * Whether a slot in this status holds its (inbox, time) pair.
     */
    public boolean isOccupying() {
        return OCCUPYING.contains(this);
    }

    public boolean isRsvp() {
        return RSVP.contains(this);
    }

    public boolean isTerminal() {
        return this == CANCELED;
    }

    /**
     * Allowed forward transitions. Rescheduling back to PENDING is handled separately.
     */
    public boolean canTransitionTo(SlotStatus next) {
        if (next == null || next == this) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == SENT || next == NEEDS_ATTENTION || next == CANCELED;
            case SENT -> next.isRsvp() || next == NEEDS_ATTENTION || next == CANCELED;
            case ACCEPTED, DECLINED, TENTATIVE -> next.isRsvp() || next == CANCELED;
            case NEEDS_ATTENTION -> next == PENDING || next == CANCELED;
            case CANCELED -> false;
        };
    }
}
