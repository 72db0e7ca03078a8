package io.github.hotbrkm.inviteengine.agent.invite.send.result;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;

import java.util.Collection;

/**
 * Slot counts per status for one campaign, as shown to operators.
 */
public record CampaignStatusSummary(String campaignId, int pending, int sent, int needsAttention, int canceled,
                                    int accepted, int declined, int tentative) {

    public static CampaignStatusSummary of(String campaignId, Collection<BookedSlot> slots) {
        int pending = 0, sent = 0, needsAttention = 0, canceled = 0, accepted = 0, declined = 0, tentative = 0;
        for (BookedSlot slot : slots) {
            switch (slot.getStatus()) {
                case PENDING -> pending++;
                case SENT -> sent++;
                case NEEDS_ATTENTION -> needsAttention++;
                case CANCELED -> canceled++;
                case ACCEPTED -> accepted++;
                case DECLINED -> declined++;
                case TENTATIVE -> tentative++;
            }
        }
        return new CampaignStatusSummary(campaignId, pending, sent, needsAttention, canceled, accepted, declined,
                tentative);
    }

    public int total() {
        return pending + sent + needsAttention + canceled + accepted + declined + tentative;
    }
}
