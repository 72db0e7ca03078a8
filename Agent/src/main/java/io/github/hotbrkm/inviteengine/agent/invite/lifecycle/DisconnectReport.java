package io.github.hotbrkm.inviteengine.agent.invite.lifecycle;

import java.util.List;

/**
 * @param inboxId          disconnected inbox
 * @param reassignedSlots  slot ids moved to another inbox
 * @param attentionSlots   slot ids that could not be moved and now need a human
 */
public record DisconnectReport(String inboxId, List<String> reassignedSlots, List<String> attentionSlots) {

    public DisconnectReport {
        reassignedSlots = List.copyOf(reassignedSlots);
        attentionSlots = List.copyOf(attentionSlots);
    }
}
