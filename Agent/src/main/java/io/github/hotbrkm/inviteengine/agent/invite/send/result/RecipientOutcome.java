package io.github.hotbrkm.inviteengine.agent.invite.send.result;

public enum RecipientOutcome {
    SENT,
    NEEDS_ATTENTION,
    /** Recipient already holds a slot in the campaign, or appears twice in the list. */
    SKIPPED_DUPLICATE,
    /** Campaign cap reached for this run; the recipient stays queued for a later run. */
    DEFERRED
}
