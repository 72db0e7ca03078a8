package io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation;

import io.github.hotbrkm.inviteengine.agent.invite.domain.Recipient;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;

import java.util.Objects;
import java.util.Set;

/**
 * @param campaignId     campaign the slot belongs to
 * @param recipient      invite recipient
 * @param settings       settings snapshot for this reservation
 * @param inboxPool      inbox ids allowed for the reservation, empty means all
 * @param avoidInboxIds  inboxes ranked last, typically those that just failed for this recipient
 */
public record ReservationRequest(String campaignId, Recipient recipient, SchedulingSettings settings,
                                 Set<String> inboxPool, Set<String> avoidInboxIds) {

    public ReservationRequest {
        Objects.requireNonNull(recipient, "recipient must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        inboxPool = inboxPool == null ? Set.of() : Set.copyOf(inboxPool);
        avoidInboxIds = avoidInboxIds == null ? Set.of() : Set.copyOf(avoidInboxIds);
    }

    public static ReservationRequest of(String campaignId, Recipient recipient, SchedulingSettings settings) {
        return new ReservationRequest(campaignId, recipient, settings, Set.of(), Set.of());
    }

    boolean allows(String inboxId) {
        return inboxPool.isEmpty() || inboxPool.contains(inboxId);
    }
}
