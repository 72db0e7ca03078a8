package io.github.hotbrkm.inviteengine.agent.invite.lifecycle;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SlotStatus;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.registry.InboxRegistry;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.registry.InboxUsageStats;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.InboxLockManager;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.InboxLockTimeoutException;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.ReservationCoordinator;
import io.github.hotbrkm.inviteengine.agent.invite.store.InboxStore;
import io.github.hotbrkm.inviteengine.agent.invite.store.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Operator and scheduler actions on inboxes: quota resets, resume and disconnect.
 */
@Slf4j
@RequiredArgsConstructor
public class InboxMaintenanceService {

    private final InboxStore store;
    private final InboxRegistry registry;
    private final InboxLockManager lockManager;
    private final ReservationCoordinator coordinator;
    private final Clock clock;

    /**
     * Zeroes {@code sentToday} of every inbox for the boundary date. Inboxes already reset for that date are
     * left alone.
     *
     * @return number of inboxes reset
     */
    public int resetDaily(LocalDate boundaryDate) {
        int reset = forEachInbox("daily_reset", inbox -> registry.resetDaily(inbox, boundaryDate));
        log.info("boundaryDate={}, inboxesReset={}, event=daily_reset", boundaryDate, reset);
        return reset;
    }

    public int resetWeekly() {
        int reset = forEachInbox("weekly_reset", inbox -> {
            registry.resetWeekly(inbox);
            return true;
        });
        log.info("inboxesReset={}, event=weekly_reset", reset);
        return reset;
    }

    /**
     * Clears an automatic pause.
     *
     * @throws IllegalArgumentException for an unknown inbox
     */
    public Inbox resume(String inboxId) {
        Inbox resumed = lockManager.withLock(inboxId, () -> {
            Inbox inbox = requireInbox(inboxId);
            registry.resume(inbox);
            store.persistInbox(inbox);
            return inbox;
        });
        log.info("inboxId={}, event=inbox_resumed", inboxId);
        return resumed;
    }

    /**
     * Removes an inbox. Unsent slots are moved to other inboxes first; those that cannot be moved become
     * NEEDS_ATTENTION.
     */
    public DisconnectReport disconnect(String inboxId, SchedulingSettings settings) {
        lockManager.withLock(inboxId, () -> {
            Inbox inbox = requireInbox(inboxId);
            inbox.setActive(false);
            inbox.setDisabledReason("disconnected");
            store.persistInbox(inbox);
        });

        List<String> reassigned = new ArrayList<>();
        List<String> attention = new ArrayList<>();
        for (BookedSlot slot : store.loadBookingsForInbox(inboxId, TimeWindow.unbounded())) {
            if (slot.getStatus() != SlotStatus.PENDING && slot.getStatus() != SlotStatus.NEEDS_ATTENTION) {
                continue;
            }
            Optional<BookedSlot> moved = coordinator.reassign(slot, settings);
            if (moved.isPresent()) {
                reassigned.add(slot.getId());
            } else {
                if (slot.getStatus() == SlotStatus.PENDING) {
                    coordinator.release(slot, SlotStatus.NEEDS_ATTENTION, "Inbox disconnected, no inbox to reassign to");
                }
                attention.add(slot.getId());
            }
        }

        store.deleteInbox(inboxId);
        log.info("inboxId={}, reassigned={}, needsAttention={}, event=inbox_disconnected",
                inboxId, reassigned.size(), attention.size());
        return new DisconnectReport(inboxId, reassigned, attention);
    }

    public List<InboxUsageStats> usageStats(SchedulingSettings settings) {
        Instant now = clock.instant();
        return store.listInboxes().stream()
                .map(inbox -> registry.usageStats(inbox, settings, now))
                .toList();
    }

    private int forEachInbox(String event, Predicate<Inbox> mutation) {
        int changed = 0;
        List<String> failed = new ArrayList<>();
        for (Inbox listed : store.listInboxes()) {
            String inboxId = listed.getId();
            try {
                boolean updated = lockManager.withLock(inboxId, () -> {
                    Optional<Inbox> current = store.findInbox(inboxId);
                    if (current.isEmpty() || !mutation.test(current.get())) {
                        return false;
                    }
                    store.persistInbox(current.get());
                    return true;
                });
                if (updated) {
                    changed++;
                }
            } catch (InboxLockTimeoutException e) {
                failed.add(inboxId);
                log.warn("inboxId={}, event={}_lock_timeout", inboxId, event);
            }
        }
        if (!failed.isEmpty()) {
            log.error("inboxIds={}, event={}_incomplete", failed, event);
        }
        return changed;
    }

    private Inbox requireInbox(String inboxId) {
        return store.findInbox(inboxId).orElseThrow(() -> new IllegalArgumentException("Unknown inbox: " + inboxId));
    }
}
