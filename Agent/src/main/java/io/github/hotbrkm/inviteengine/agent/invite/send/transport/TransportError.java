package io.github.hotbrkm.inviteengine.agent.invite.send.transport;

import io.github.hotbrkm.inviteengine.agent.invite.domain.SendErrorKind;

import java.util.Objects;

/**
 * Classified transport failure.
 *
 * @param kind    TRANSIENT failures may be retried, PERMANENT ones disable the inbox
 * @param message provider message, for logs and slot status reasons
 */
public record TransportError(SendErrorKind kind, String message) {

    public TransportError {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? "" : message;
    }

    public static TransportError transientError(String message) {
        return new TransportError(SendErrorKind.TRANSIENT, message);
    }

    public static TransportError permanentError(String message) {
        return new TransportError(SendErrorKind.PERMANENT, message);
    }
}
