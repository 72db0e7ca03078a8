package io.github.hotbrkm.inviteengine.agent.invite.send.outcome;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SendErrorKind;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SlotStatus;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.registry.InboxRegistry;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.InboxLockManager;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.InboxLockTimeoutException;
import io.github.hotbrkm.inviteengine.agent.invite.send.engine.metrics.InboxSendMetrics;
import io.github.hotbrkm.inviteengine.agent.invite.store.InboxStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Writes the result of a transport call back into slot and inbox state.
 * <p>
 * Each outcome is applied under the lock of the slot's inbox. Lock acquisition is retried a few times because
 * losing an outcome after a real send would desync the quota.
 */
@Slf4j
public class SendOutcomeHandler {

    static final int LOCK_ATTEMPTS = 3;

    private final InboxStore store;
    private final InboxRegistry registry;
    private final InboxLockManager lockManager;
    private final InboxSendMetrics metrics;
    private final Clock clock;

    public SendOutcomeHandler(InboxStore store, InboxRegistry registry, InboxLockManager lockManager,
                              InboxSendMetrics metrics, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Slot becomes SENT with the provider event id; the inbox gets its cooldown and a health boost. The quota
     * unit taken at reservation time is kept.
     */
    public BookedSlot success(BookedSlot slot, String eventId, SchedulingSettings settings) {
        BookedSlot updated = underLock(slot.getInboxId(), () -> {
            Instant now = clock.instant();
            BookedSlot current = reload(slot);
            current.setEventId(eventId);
            current.transitionTo(SlotStatus.SENT, null, now);
            store.persistBookedSlot(current);
            Inbox inbox = requireInbox(current.getInboxId());
            registry.confirmSent(inbox, now, settings.cooldownMinutes());
            store.persistInbox(inbox);
            return current;
        });
        metrics.recordSuccess(slot.getInboxId());
        log.debug("slotId={}, inboxId={}, eventId={}, event=send_success", slot.getId(), slot.getInboxId(), eventId);
        return updated;
    }

    /**
     * Counts the error against the inbox. The slot and its provisional quota are left for the caller, which
     * either retries elsewhere or gives up on the recipient.
     *
     * @return true if this failure paused the inbox
     */
    public boolean transientFailure(BookedSlot slot, String reason, SchedulingSettings settings) {
        boolean paused = underLock(slot.getInboxId(), () -> {
            Inbox inbox = requireInbox(slot.getInboxId());
            boolean changed = registry.markError(inbox, SendErrorKind.TRANSIENT, settings, reason);
            store.persistInbox(inbox);
            return changed;
        });
        metrics.recordFailure(slot.getInboxId(), SendErrorKind.TRANSIENT);
        log.warn("slotId={}, inboxId={}, reason={}, paused={}, event=send_transient_failure",
                slot.getId(), slot.getInboxId(), reason, paused);
        return paused;
    }

    /**
     * Disables the inbox, moves the slot to NEEDS_ATTENTION and returns its provisional quota.
     */
    public BookedSlot permanentFailure(BookedSlot slot, String reason, SchedulingSettings settings) {
        BookedSlot updated = underLock(slot.getInboxId(), () -> {
            BookedSlot current = reload(slot);
            boolean heldQuota = current.getStatus() == SlotStatus.PENDING;
            current.transitionTo(SlotStatus.NEEDS_ATTENTION, reason, clock.instant());
            store.persistBookedSlot(current);
            Inbox inbox = requireInbox(current.getInboxId());
            registry.markError(inbox, SendErrorKind.PERMANENT, settings, reason);
            if (heldQuota) {
                registry.releaseQuota(inbox);
            }
            store.persistInbox(inbox);
            return current;
        });
        metrics.recordFailure(slot.getInboxId(), SendErrorKind.PERMANENT);
        log.warn("slotId={}, inboxId={}, reason={}, event=send_permanent_failure",
                slot.getId(), slot.getInboxId(), reason);
        return updated;
    }

    private BookedSlot reload(BookedSlot slot) {
        return store.findBookedSlot(slot.getId()).orElse(slot.copy());
    }

    private Inbox requireInbox(String inboxId) {
        return store.findInbox(inboxId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown inbox: " + inboxId));
    }

    private <T> T underLock(String inboxId, Supplier<T> action) {
        InboxLockTimeoutException last = null;
        for (int attempt = 1; attempt <= LOCK_ATTEMPTS; attempt++) {
            try {
                return lockManager.withLock(inboxId, action);
            } catch (InboxLockTimeoutException e) {
                metrics.recordLockTimeout(inboxId);
                log.warn("inboxId={}, attempt={}, event=outcome_lock_timeout", inboxId, attempt);
                last = e;
            }
        }
        throw last;
    }
}
