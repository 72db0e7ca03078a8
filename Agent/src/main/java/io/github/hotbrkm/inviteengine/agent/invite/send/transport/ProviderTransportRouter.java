package io.github.hotbrkm.inviteengine.agent.invite.send.transport;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.ProviderKind;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Recipient;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes each send to the transport registered for the inbox's {@link ProviderKind}.
 * <p>
 * Lookup only; when two transports claim the same provider the first registered wins.
 */
@Slf4j
public class ProviderTransportRouter implements InviteTransport {

    private final Map<ProviderKind, InviteTransport> transports = new EnumMap<>(ProviderKind.class);

    public ProviderTransportRouter(List<InviteTransport> delegates) {
        List<InviteTransport> safeList = delegates == null ? Collections.emptyList() : delegates;
        for (InviteTransport delegate : safeList) {
            for (ProviderKind kind : delegate.supportedProviders()) {
                transports.putIfAbsent(kind, delegate);
            }
        }
        log.info("Invite transports registered for providers {}", transports.keySet());
    }

    @Override
    public TransportResult sendInvite(Inbox inbox, Recipient recipient, BookedSlot slot) {
        InviteTransport transport = transports.get(inbox.getProviderKind());
        if (transport == null) {
            log.warn("inboxId={}, provider={}, event=transport_missing", inbox.getId(), inbox.getProviderKind());
            return TransportResult.failure(TransportError.permanentError(
                    "No transport registered for provider " + inbox.getProviderKind()));
        }
        return transport.sendInvite(inbox, recipient, slot);
    }

    @Override
    public Set<ProviderKind> supportedProviders() {
        return Collections.unmodifiableSet(transports.keySet());
    }
}
