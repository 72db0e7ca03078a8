package io.github.hotbrkm.inviteengine.agent.invite.schedule.slot;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Outcome of {@link SlotCalculator#computeSlot}.
 *
 * @param timeUtc          chosen instant, {@code null} when no slot is available
 * @param wasDoubleBooked  the instant already holds another occupying booking of the inbox
 * @param needsAttention   the fallback policy asks for the slot to be created as NEEDS_ATTENTION
 * @param flaggedForReview the recipient zone could not be used and the default zone was applied
 * @param leadTimeDays     business days between today and the slot date, in the recipient zone
 * @param zone             zone the slot was computed in
 */
public record SlotComputation(@Nullable Instant timeUtc,
                              boolean wasDoubleBooked,
                              boolean needsAttention,
                              boolean flaggedForReview,
                              int leadTimeDays,
                              ZoneId zone) {

    static SlotComputation free(Instant timeUtc, int leadTimeDays, boolean flagged, ZoneId zone) {
        return new SlotComputation(timeUtc, false, false, flagged, leadTimeDays, zone);
    }

    static SlotComputation doubleBooked(Instant timeUtc, int leadTimeDays, boolean flagged, ZoneId zone) {
        return new SlotComputation(timeUtc, true, false, flagged, leadTimeDays, zone);
    }

    static SlotComputation needsAttention(Instant timeUtc, int leadTimeDays, boolean flagged, ZoneId zone) {
        return new SlotComputation(timeUtc, true, true, flagged, leadTimeDays, zone);
    }

    public static SlotComputation unavailable(boolean flagged, ZoneId zone) {
        return new SlotComputation(null, false, false, flagged, 0, zone);
    }

    public boolean isAvailable() {
        return timeUtc != null;
    }
}
