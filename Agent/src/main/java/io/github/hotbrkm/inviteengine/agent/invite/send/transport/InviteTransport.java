package io.github.hotbrkm.inviteengine.agent.invite.send.transport;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.ProviderKind;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Recipient;

import java.util.Set;

/**
 * Delivers one calendar invite through a provider.
 * <p>
 * Called outside every inbox lock and may block on network I/O. Implementations report failures as
 * {@link TransportResult#failure}; an exception thrown from {@link #sendInvite} is treated as transient.
 */
public interface InviteTransport {

    TransportResult sendInvite(Inbox inbox, Recipient recipient, BookedSlot slot);

    /**
     * Providers this transport can send for. The default claims every provider.
     */
    default Set<ProviderKind> supportedProviders() {
        return Set.of(ProviderKind.values());
    }
}
