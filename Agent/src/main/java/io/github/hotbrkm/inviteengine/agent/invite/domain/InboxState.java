package io.github.hotbrkm.inviteengine.agent.invite.domain;

/**
 * Read-only view of an inbox derived from its stored fields at a given instant.
 * Never persisted.
 */
public enum InboxState {
    ACTIVE,
    COOLDOWN,
    PAUSED,
    QUOTA_EXHAUSTED,
    UNHEALTHY,
    DISABLED;

    public boolean isSelectable() {
        return this == ACTIVE;
    }
}
