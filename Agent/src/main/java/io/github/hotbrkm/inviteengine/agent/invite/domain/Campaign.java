package io.github.hotbrkm.inviteengine.agent.invite.domain;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A batch of recipients to invite.
 *
 * @param campaignId      campaign identifier, carried on every booked slot
 * @param recipients      recipients in processing order
 * @param inboxPool       inbox ids the campaign may send from, empty means every inbox
 * @param maxDailyInvites cap on reservations per run, 0 means unlimited
 * @param settingsScope   scope used to look up the campaign's scheduling settings
 */
public record Campaign(String campaignId, List<Recipient> recipients, Set<String> inboxPool, int maxDailyInvites,
                       SettingsScope settingsScope) {

    public Campaign {
        if (campaignId == null || campaignId.isBlank()) {
            throw new IllegalArgumentException("campaignId must not be blank");
        }
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        inboxPool = inboxPool == null ? Set.of() : Set.copyOf(inboxPool);
        maxDailyInvites = Math.max(0, maxDailyInvites);
        settingsScope = Objects.requireNonNullElseGet(settingsScope, () -> SettingsScope.campaign(campaignId));
    }

    public static Campaign of(String campaignId, List<Recipient> recipients) {
        return new Campaign(campaignId, recipients, Set.of(), 0, null);
    }

    public boolean allowsInbox(String inboxId) {
        return inboxPool.isEmpty() || inboxPool.contains(inboxId);
    }

    public boolean hasDailyCap() {
        return maxDailyInvites > 0;
    }
}
