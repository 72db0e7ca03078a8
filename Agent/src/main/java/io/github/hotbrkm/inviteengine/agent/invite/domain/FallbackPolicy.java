package io.github.hotbrkm.inviteengine.agent.invite.domain;

import java.util.Locale;

/**
 * What to do when every candidate slot in the lead-time window conflicts and double booking is not allowed.
 */
public enum FallbackPolicy {
    /** Do not create a slot. */
    SKIP,
    /** Use the conflicting time anyway and mark the slot as double booked. */
    FORCE,
    /** Use the conflicting time but park the slot as {@link SlotStatus#NEEDS_ATTENTION}. */
    NEEDS_ATTENTION;

    /**
     * Parses configuration values such as {@code skip}, {@code force} or {@code needs-attention}.
     *
     * @throws SchedulingConfigurationException for an unknown value
     */
    public static FallbackPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return SKIP;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return FallbackPolicy.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new SchedulingConfigurationException("Unknown fallback policy: " + value, e);
        }
    }
}
