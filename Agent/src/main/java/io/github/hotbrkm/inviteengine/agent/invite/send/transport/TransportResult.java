package io.github.hotbrkm.inviteengine.agent.invite.send.transport;

import org.jspecify.annotations.Nullable;

/**
 * Either the calendar event id of a delivered invite or a {@link TransportError}.
 */
public record TransportResult(@Nullable String eventId, @Nullable TransportError error) {

    public TransportResult {
        if ((eventId == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of eventId and error must be set");
        }
    }

    public static TransportResult success(String eventId) {
        return new TransportResult(eventId, null);
    }

    public static TransportResult failure(TransportError error) {
        return new TransportResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
