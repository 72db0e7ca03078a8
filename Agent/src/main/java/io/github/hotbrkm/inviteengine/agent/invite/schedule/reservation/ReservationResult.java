package io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;

/**
 * Outcome of {@link ReservationCoordinator#reserve}.
 */
public sealed interface ReservationResult permits ReservationResult.Reserved, ReservationResult.Rejected {

    static Reserved reserved(BookedSlot slot, Inbox inbox) {
        return new Reserved(slot, inbox);
    }

    static Rejected rejected(RejectionReason reason, String message) {
        return new Rejected(reason, reason == RejectionReason.LOCK_TIMEOUT, message);
    }

    /**
     * @param slot  persisted slot, PENDING or NEEDS_ATTENTION
     * @param inbox inbox snapshot taken right after the reservation
     */
    record Reserved(BookedSlot slot, Inbox inbox) implements ReservationResult {
    }

    record Rejected(RejectionReason reason, boolean retryable, String message) implements ReservationResult {
    }
}
