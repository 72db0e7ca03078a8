package io.github.hotbrkm.inviteengine.agent.invite.store;

import java.time.Instant;

/**
 * Raised when a booking would put two occupying slots of one inbox on the same instant without double booking.
 */
public class SlotConflictException extends RuntimeException {

    private final String inboxId;
    private final Instant scheduledTimeUtc;

    public SlotConflictException(String inboxId, Instant scheduledTimeUtc) {
        super("Inbox " + inboxId + " already has a booking at " + scheduledTimeUtc);
        this.inboxId = inboxId;
        this.scheduledTimeUtc = scheduledTimeUtc;
    }

    public String getInboxId() {
        return inboxId;
    }

    public Instant getScheduledTimeUtc() {
        return scheduledTimeUtc;
    }
}
