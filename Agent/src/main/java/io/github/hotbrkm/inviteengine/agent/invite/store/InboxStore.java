package io.github.hotbrkm.inviteengine.agent.invite.store;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for inboxes and booked slots.
 * <p>
 * Implementations return detached copies. Callers mutate a copy and write it back with the persist methods;
 * the engine serializes writes per inbox, so implementations only need to be safe for concurrent access
 * across different inboxes.
 */
public interface InboxStore {

    List<Inbox> listInboxes();

    Optional<Inbox> findInbox(String inboxId);

    /**
     * Bookings of one inbox whose scheduled time falls in {@code window}, in every status.
     */
    List<BookedSlot> loadBookingsForInbox(String inboxId, TimeWindow window);

    void persistInbox(Inbox inbox);

    /**
     * Inserts or replaces a slot.
     *
     * @throws SlotConflictException when an occupying slot would share its instant with another one on the same
     *                               inbox and neither is marked as double booked
     */
    void persistBookedSlot(BookedSlot slot);

    Optional<BookedSlot> findBookedSlot(String slotId);

    List<BookedSlot> loadBookingsForCampaign(String campaignId);

    void deleteInbox(String inboxId);
}
