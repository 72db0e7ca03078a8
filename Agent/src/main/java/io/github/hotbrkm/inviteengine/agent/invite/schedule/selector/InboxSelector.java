package io.github.hotbrkm.inviteengine.agent.invite.schedule.selector;

import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.InboxState;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.registry.InboxRegistry;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Load balancer over a set of inboxes.
 * <p>
 * Selection strategy is least usage first: fewest sends today, then highest health score, then the inbox idle
 * the longest (never used comes first), then id. The order is total, so equal inputs always give the same pick.
 * Selection never mutates an inbox; callers re-validate under the inbox lock.
 */
public class InboxSelector {

    static final Comparator<Inbox> RANKING = Comparator.comparingInt(Inbox::getSentToday)
            .thenComparing(Comparator.comparingInt(Inbox::getHealthScore).reversed())
            .thenComparing(Inbox::getLastUsedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Inbox::getId);

    private final InboxRegistry registry;

    public InboxSelector(InboxRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * @return the best available inbox, or empty when none is available
     */
    public Optional<Inbox> selectInbox(Collection<Inbox> inboxes, SchedulingSettings settings, Instant now) {
        return inboxes.stream()
                .filter(inbox -> registry.isAvailable(inbox, settings, now))
                .min(RANKING);
    }

    /**
     * Every available inbox, best first.
     */
    public List<Inbox> rank(Collection<Inbox> inboxes, SchedulingSettings settings, Instant now) {
        return inboxes.stream()
                .filter(inbox -> registry.isAvailable(inbox, settings, now))
                .sorted(RANKING)
                .toList();
    }

    /**
     * Earliest time any inbox is expected to become available without operator action.
     */
    public Optional<Instant> nextAvailableAt(Collection<Inbox> inboxes, SchedulingSettings settings, Instant now) {
        return inboxes.stream()
                .filter(inbox -> {
                    InboxState state = registry.stateOf(inbox, settings, now);
                    return state != InboxState.DISABLED && state != InboxState.PAUSED;
                })
                .map(inbox -> registry.nextAvailableAt(inbox, settings, now))
                .flatMap(Optional::stream)
                .min(Comparator.naturalOrder());
    }
}
