package io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation;

public enum RejectionReason {
    /** No inbox passed the availability check. */
    NO_ELIGIBLE_INBOX,
    /** Every eligible inbox was fully booked and the fallback policy skips. */
    NO_SLOT_AVAILABLE,
    /** At least one candidate inbox could not be locked in time. */
    LOCK_TIMEOUT
}
