package io.github.hotbrkm.inviteengine.agent.invite.schedule.registry;

import io.github.hotbrkm.inviteengine.agent.invite.domain.InboxState;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Read-only usage view of one inbox, for operators deciding whether to resume, reconnect or raise a quota.
 *
 * @param nextAvailableAt estimated time the inbox becomes selectable again, {@code null} when it needs a human
 */
public record InboxUsageStats(String inboxId,
                              InboxState state,
                              int sentToday,
                              int dailyQuota,
                              int remainingToday,
                              int sentThisWeek,
                              int weeklyQuota,
                              int healthScore,
                              int consecutiveErrorCount,
                              @Nullable Instant lastUsedAt,
                              @Nullable Instant cooldownUntil,
                              @Nullable String pausedReason,
                              @Nullable String disabledReason,
                              @Nullable Instant nextAvailableAt) {
}
