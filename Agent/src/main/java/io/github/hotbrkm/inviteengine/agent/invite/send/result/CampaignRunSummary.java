package io.github.hotbrkm.inviteengine.agent.invite.send.result;

import lombok.Builder;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Summary of one {@code process} run over a campaign.
 * Includes per-outcome counts, per-inbox send statistics and every recipient result.
 */
@Builder
public record CampaignRunSummary(String campaignId, int totalRecipients, int sent, int needsAttention,
                                 int skippedDuplicate, int deferred, int notCompleted,
                                 Map<String, InboxStats> inboxStats, List<RecipientResult> results) {

    public Map<String, InboxStats> inboxStatsView() {
        return inboxStats == null ? Collections.emptyMap() : Collections.unmodifiableMap(inboxStats);
    }

    public List<RecipientResult> resultsView() {
        return results == null ? Collections.emptyList() : Collections.unmodifiableList(results);
    }

    /**
     * @param attempts Recipients whose last reservation landed on the inbox
     * @param sent     Recipients the inbox delivered
     */
    public record InboxStats(int attempts, int sent) {
        public double successRate() {
            return attempts > 0 ? (sent * 100.0) / attempts : 0.0;
        }
    }
}
