package io.github.hotbrkm.inviteengine.agent.invite.domain;

/**
 * Kind of provider behind a sending identity.
 * <p>
 * The engine never talks to a provider directly; the kind only selects which transport handles the send.
 */
public enum ProviderKind {
    GOOGLE,
    MICROSOFT,
    APP_PASSWORD
}
