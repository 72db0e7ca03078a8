package io.github.hotbrkm.inviteengine.agent.invite.domain;

/**
 * Classification of a failed send attempt.
 */
public enum SendErrorKind {
    /** Rate limit, timeout, 5xx from the provider. Worth retrying later. */
    TRANSIENT,
    /** Revoked token, deleted mailbox. The inbox must be reconnected before reuse. */
    PERMANENT
}
