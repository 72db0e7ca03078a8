package io.github.hotbrkm.inviteengine.agent.invite.domain;

/**
 * Raised when a booked slot is moved to a status its current status does not allow.
 */
public class InvalidSlotTransitionException extends RuntimeException {

    public InvalidSlotTransitionException(String slotId, SlotStatus from, SlotStatus to) {
        super("Slot [" + slotId + "] cannot move from " + from + " to " + to);
    }
}
