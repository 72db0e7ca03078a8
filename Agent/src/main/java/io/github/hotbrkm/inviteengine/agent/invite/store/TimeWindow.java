package io.github.hotbrkm.inviteengine.agent.invite.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval {@code [from, to)} used to bound booking lookups.
 */
public record TimeWindow(Instant from, Instant to) {

    public TimeWindow {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("to must not be before from: " + from + " > " + to);
        }
    }

    public static TimeWindow unbounded() {
        return new TimeWindow(Instant.MIN, Instant.MAX);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(from) && instant.isBefore(to);
    }
}
