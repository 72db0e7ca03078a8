package io.github.hotbrkm.inviteengine.agent.invite.store;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link InboxStore}.
 * <p>
 * Every read and write copies the entity so callers never share mutable state with the store. Slot writes are
 * serialized to keep the (inbox, instant) uniqueness check atomic.
 */
@Slf4j
public class InMemoryInboxStore implements InboxStore {

    private final Map<String, Inbox> inboxes = new ConcurrentHashMap<>();
    private final Map<String, BookedSlot> slots = new LinkedHashMap<>();
    private final Object slotMonitor = new Object();

    public InMemoryInboxStore() {
    }

    public InMemoryInboxStore(List<Inbox> initialInboxes) {
        if (initialInboxes != null) {
            initialInboxes.forEach(this::persistInbox);
        }
    }

    @Override
    public List<Inbox> listInboxes() {
        return inboxes.values().stream()
                .map(Inbox::copy)
                .sorted(Comparator.comparing(Inbox::getId))
                .toList();
    }

    @Override
    public Optional<Inbox> findInbox(String inboxId) {
        return Optional.ofNullable(inboxes.get(inboxId)).map(Inbox::copy);
    }

    @Override
    public List<BookedSlot> loadBookingsForInbox(String inboxId, TimeWindow window) {
        synchronized (slotMonitor) {
            List<BookedSlot> result = new ArrayList<>();
            for (BookedSlot slot : slots.values()) {
                if (slot.getInboxId().equals(inboxId) && window.contains(slot.getScheduledTimeUtc())) {
                    result.add(slot.copy());
                }
            }
            return result;
        }
    }

    @Override
    public void persistInbox(Inbox inbox) {
        Objects.requireNonNull(inbox, "inbox must not be null");
        inboxes.put(inbox.getId(), inbox.copy());
    }

    @Override
    public void persistBookedSlot(BookedSlot slot) {
        Objects.requireNonNull(slot, "slot must not be null");
        synchronized (slotMonitor) {
            if (slot.isOccupying() && !slot.isWasDoubleBooked()) {
                for (BookedSlot existing : slots.values()) {
                    if (!existing.getId().equals(slot.getId())
                            && existing.isOccupying()
                            && existing.getInboxId().equals(slot.getInboxId())
                            && existing.getScheduledTimeUtc().equals(slot.getScheduledTimeUtc())) {
                        log.error("inboxId={}, slotId={}, conflictingSlotId={}, at={}, event=slot_uniqueness_violation",
                                slot.getInboxId(), slot.getId(), existing.getId(), slot.getScheduledTimeUtc());
                        throw new SlotConflictException(slot.getInboxId(), slot.getScheduledTimeUtc());
                    }
                }
            }
            slots.put(slot.getId(), slot.copy());
        }
    }

    @Override
    public Optional<BookedSlot> findBookedSlot(String slotId) {
        synchronized (slotMonitor) {
            return Optional.ofNullable(slots.get(slotId)).map(BookedSlot::copy);
        }
    }

    @Override
    public List<BookedSlot> loadBookingsForCampaign(String campaignId) {
        synchronized (slotMonitor) {
            List<BookedSlot> result = new ArrayList<>();
            for (BookedSlot slot : slots.values()) {
                if (Objects.equals(slot.getCampaignId(), campaignId)) {
                    result.add(slot.copy());
                }
            }
            return result;
        }
    }

    @Override
    public void deleteInbox(String inboxId) {
        inboxes.remove(inboxId);
    }

    /**
     * Every slot in insertion order. Intended for diagnostics and tests.
     */
    public List<BookedSlot> allBookings() {
        synchronized (slotMonitor) {
            return slots.values().stream().map(BookedSlot::copy).toList();
        }
    }
}
