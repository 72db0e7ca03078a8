package io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation;

import java.time.Duration;

/**
 * Raised when the per-inbox lock cannot be acquired in time. Always retryable.
 */
public class InboxLockTimeoutException extends RuntimeException {

    private final String inboxId;

    public InboxLockTimeoutException(String inboxId, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + " ms waiting for lock of inbox " + inboxId);
        this.inboxId = inboxId;
    }

    public InboxLockTimeoutException(String inboxId, Throwable cause) {
        super("Interrupted while waiting for lock of inbox " + inboxId, cause);
        this.inboxId = inboxId;
    }

    public String getInboxId() {
        return inboxId;
    }
}
