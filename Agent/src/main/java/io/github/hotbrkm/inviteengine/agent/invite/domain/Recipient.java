package io.github.hotbrkm.inviteengine.agent.invite.domain;

import java.util.Objects;

/**
 * Prospect receiving an invite.
 *
 * @param email    recipient address
 * @param name     display name, may be null
 * @param timezone IANA zone id supplied with the prospect, may be null or invalid
 */
public record Recipient(String email, String name, String timezone) {

    public Recipient {
        Objects.requireNonNull(email, "email must not be null");
        email = email.trim();
        if (email.isEmpty()) {
            throw new IllegalArgumentException("email must not be blank");
        }
    }

    public static Recipient of(String email) {
        return new Recipient(email, null, null);
    }

    public static Recipient of(String email, String timezone) {
        return new Recipient(email, null, timezone);
    }

    /**
     * Lower-cased address used for duplicate detection.
     */
    public String normalizedEmail() {
        return EmailAddressUtil.normalize(email);
    }
}
