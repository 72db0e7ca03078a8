package io.github.hotbrkm.inviteengine.agent.invite.send.result;

import org.jspecify.annotations.Nullable;

/**
 * Result of driving one recipient through reserve, send and outcome.
 *
 * @param recipientEmail Recipient address
 * @param outcome        Final outcome
 * @param slotId         Last slot reserved for the recipient, if any
 * @param inboxId        Inbox of that slot, if any
 * @param attempts       Send attempts made
 * @param message        Error or rejection message, null on success
 */
public record RecipientResult(String recipientEmail, RecipientOutcome outcome, @Nullable String slotId,
                              @Nullable String inboxId, int attempts, @Nullable String message) {

    public static RecipientResult sent(String recipientEmail, String slotId, String inboxId, int attempts) {
        return new RecipientResult(recipientEmail, RecipientOutcome.SENT, slotId, inboxId, attempts, null);
    }

    public static RecipientResult needsAttention(String recipientEmail, @Nullable String slotId,
                                                 @Nullable String inboxId, int attempts, String message) {
        return new RecipientResult(recipientEmail, RecipientOutcome.NEEDS_ATTENTION, slotId, inboxId, attempts, message);
    }

    public static RecipientResult skippedDuplicate(String recipientEmail) {
        return new RecipientResult(recipientEmail, RecipientOutcome.SKIPPED_DUPLICATE, null, null, 0, null);
    }

    public static RecipientResult deferred(String recipientEmail) {
        return new RecipientResult(recipientEmail, RecipientOutcome.DEFERRED, null, null, 0,
                "Campaign daily invite cap reached");
    }
}
