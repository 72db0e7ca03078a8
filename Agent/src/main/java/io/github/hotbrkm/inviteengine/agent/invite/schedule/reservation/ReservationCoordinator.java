package io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Recipient;
import io.github.hotbrkm.inviteengine.agent.invite.domain.RecipientTimezoneResolver;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SlotStatus;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.registry.InboxRegistry;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.selector.InboxSelector;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.slot.SlotCalculator;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.slot.SlotComputation;
import io.github.hotbrkm.inviteengine.agent.invite.send.engine.metrics.InboxSendMetrics;
import io.github.hotbrkm.inviteengine.agent.invite.store.InboxStore;
import io.github.hotbrkm.inviteengine.agent.invite.store.SlotConflictException;
import io.github.hotbrkm.inviteengine.agent.invite.store.TimeWindow;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reserves (inbox, instant) pairs.
 * <p>
 * Ranking is done lock-free on a possibly stale inbox list. Each candidate is then re-read and re-checked under
 * its own lock, where the slot is computed against the inbox's current bookings and the slot and the
 * provisional quota are written together. A candidate that fails re-validation, has no slot under a skipping
 * fallback, or cannot be locked in time is passed over for the next one.
 * <p>
 * A PENDING slot holds one provisional unit of its inbox's quota until it is sent, canceled or moved to
 * NEEDS_ATTENTION.
 */
@Slf4j
public class ReservationCoordinator {

    private final InboxStore store;
    private final InboxRegistry registry;
    private final InboxSelector selector;
    private final SlotCalculator slotCalculator;
    private final InboxLockManager lockManager;
    private final RecipientTimezoneResolver timezoneResolver;
    private final InboxSendMetrics metrics;
    private final Clock clock;

    public ReservationCoordinator(InboxStore store, InboxRegistry registry, InboxSelector selector,
                                  SlotCalculator slotCalculator, InboxLockManager lockManager,
                                  RecipientTimezoneResolver timezoneResolver, InboxSendMetrics metrics, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.slotCalculator = Objects.requireNonNull(slotCalculator, "slotCalculator must not be null");
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager must not be null");
        this.timezoneResolver = Objects.requireNonNull(timezoneResolver, "timezoneResolver must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ReservationResult reserve(String campaignId, Recipient recipient, SchedulingSettings settings) {
        return reserve(ReservationRequest.of(campaignId, recipient, settings));
    }

    /**
     * @throws io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingConfigurationException on invalid settings
     */
    public ReservationResult reserve(ReservationRequest request) {
        SchedulingSettings settings = request.settings().validate();
        Recipient recipient = request.recipient();
        Instant now = clock.instant();
        String timezone = timezoneResolver.resolve(recipient, settings);

        List<Inbox> candidates = candidates(request, null, now);
        if (candidates.isEmpty()) {
            log.debug("campaignId={}, recipient={}, event=reservation_no_eligible_inbox",
                    request.campaignId(), recipient.email());
            return ReservationResult.rejected(RejectionReason.NO_ELIGIBLE_INBOX, "No eligible inbox");
        }

        boolean lockTimedOut = false;
        boolean noSlot = false;
        for (Inbox candidate : candidates) {
            String inboxId = candidate.getId();
            Attempt attempt;
            try {
                attempt = lockManager.withLock(inboxId, () -> reserveOn(inboxId, request, timezone, now));
            } catch (InboxLockTimeoutException e) {
                metrics.recordLockTimeout(inboxId);
                log.warn("campaignId={}, recipient={}, inboxId={}, event=reservation_lock_timeout",
                        request.campaignId(), recipient.email(), inboxId);
                lockTimedOut = true;
                continue;
            }

            if (attempt.slot() != null) {
                log.debug("campaignId={}, recipient={}, inboxId={}, slotId={}, at={}, status={}, event=reserved",
                        request.campaignId(), recipient.email(), inboxId, attempt.slot().getId(),
                        attempt.slot().getScheduledTimeUtc(), attempt.slot().getStatus());
                return ReservationResult.reserved(attempt.slot(), attempt.inbox());
            }
            noSlot |= attempt.noSlot();
        }

        if (lockTimedOut) {
            return ReservationResult.rejected(RejectionReason.LOCK_TIMEOUT, "Inbox lock timed out");
        }
        if (noSlot) {
            return ReservationResult.rejected(RejectionReason.NO_SLOT_AVAILABLE, "Every eligible inbox is fully booked");
        }
        return ReservationResult.rejected(RejectionReason.NO_ELIGIBLE_INBOX, "No eligible inbox after re-validation");
    }

    /**
     * Moves a slot to {@code status} (CANCELED or NEEDS_ATTENTION) and returns its provisional quota if it was
     * still pending.
     *
     * @return the updated slot
     */
    public BookedSlot release(BookedSlot slot, SlotStatus status, String reason) {
        if (status != SlotStatus.CANCELED && status != SlotStatus.NEEDS_ATTENTION) {
            throw new IllegalArgumentException("release only supports CANCELED or NEEDS_ATTENTION: " + status);
        }
        return lockManager.withLock(slot.getInboxId(), () -> {
            BookedSlot current = store.findBookedSlot(slot.getId()).orElse(slot.copy());
            boolean heldQuota = current.getStatus() == SlotStatus.PENDING;
            current.transitionTo(status, reason, clock.instant());
            store.persistBookedSlot(current);
            if (heldQuota) {
                store.findInbox(current.getInboxId()).ifPresent(inbox -> {
                    registry.releaseQuota(inbox);
                    store.persistInbox(inbox);
                });
            }
            log.debug("slotId={}, inboxId={}, status={}, reason={}, event=slot_released",
                    current.getId(), current.getInboxId(), status, reason);
            return current;
        });
    }

    /**
     * Moves an unsent slot to another inbox, recomputing its time there. The caller is responsible for the old
     * inbox's quota and must not hold any inbox lock.
     *
     * @return the moved slot, or empty when no other inbox could take it
     */
    public Optional<BookedSlot> reassign(BookedSlot slot, SchedulingSettings settings) {
        settings.validate();
        Instant now = clock.instant();
        Recipient recipient = new Recipient(slot.getRecipientEmail(), slot.getRecipientName(), slot.getRecipientTimezone());
        ReservationRequest request = new ReservationRequest(slot.getCampaignId(), recipient, settings, Set.of(), Set.of());
        String timezone = timezoneResolver.resolve(recipient, settings);

        for (Inbox candidate : candidates(request, slot.getInboxId(), now)) {
            String inboxId = candidate.getId();
            try {
                Optional<BookedSlot> moved = lockManager.withLock(inboxId, () -> moveTo(inboxId, slot, settings, timezone, now));
                if (moved.isPresent()) {
                    log.info("slotId={}, fromInboxId={}, toInboxId={}, at={}, event=slot_reassigned",
                            slot.getId(), slot.getInboxId(), inboxId, moved.get().getScheduledTimeUtc());
                    return moved;
                }
            } catch (InboxLockTimeoutException e) {
                metrics.recordLockTimeout(inboxId);
                log.warn("slotId={}, inboxId={}, event=reassign_lock_timeout", slot.getId(), inboxId);
            }
        }
        return Optional.empty();
    }

    private List<Inbox> candidates(ReservationRequest request, String excludedInboxId, Instant now) {
        List<Inbox> pool = store.listInboxes().stream()
                .filter(inbox -> request.allows(inbox.getId()))
                .filter(inbox -> !inbox.getId().equals(excludedInboxId))
                .toList();
        List<Inbox> ranked = selector.rank(pool, request.settings(), now);
        if (request.avoidInboxIds().isEmpty()) {
            return ranked;
        }
        List<Inbox> ordered = new ArrayList<>(ranked.size());
        List<Inbox> avoided = new ArrayList<>();
        for (Inbox inbox : ranked) {
            (request.avoidInboxIds().contains(inbox.getId()) ? avoided : ordered).add(inbox);
        }
        ordered.addAll(avoided);
        return ordered;
    }

    private Attempt reserveOn(String inboxId, ReservationRequest request, String timezone, Instant now) {
        SchedulingSettings settings = request.settings();
        Optional<Inbox> latest = store.findInbox(inboxId);
        if (latest.isEmpty() || !registry.isAvailable(latest.get(), settings, now)) {
            log.debug("inboxId={}, event=reservation_revalidation_failed", inboxId);
            return Attempt.INELIGIBLE;
        }
        Inbox inbox = latest.get();

        SlotComputation computation = slotCalculator.computeSlot(settings, timezone, now, bookingsOf(inboxId, settings, now));
        if (!computation.isAvailable()) {
            return Attempt.NO_SLOT;
        }

        Recipient recipient = request.recipient();
        SlotStatus status = computation.needsAttention() ? SlotStatus.NEEDS_ATTENTION : SlotStatus.PENDING;
        BookedSlot slot = BookedSlot.builder()
                .inboxId(inboxId)
                .campaignId(request.campaignId())
                .recipientEmail(recipient.email())
                .recipientName(recipient.name())
                .recipientTimezone(computation.zone().getId())
                .scheduledTimeUtc(computation.timeUtc())
                .leadTimeDays(computation.leadTimeDays())
                .wasDoubleBooked(computation.wasDoubleBooked())
                .flaggedForReview(computation.flaggedForReview())
                .status(status)
                .statusReason(computation.needsAttention() ? "No free slot in lead-time window" : null)
                .createdAt(now)
                .build();

        try {
            store.persistBookedSlot(slot);
        } catch (SlotConflictException e) {
            log.error("inboxId={}, at={}, event=reservation_conflict_under_lock", inboxId, slot.getScheduledTimeUtc(), e);
            return Attempt.NO_SLOT;
        }
        if (status == SlotStatus.PENDING) {
            registry.consumeQuota(inbox);
            store.persistInbox(inbox);
        }
        return new Attempt(slot, inbox.copy(), false);
    }

    private Optional<BookedSlot> moveTo(String inboxId, BookedSlot original, SchedulingSettings settings,
                                        String timezone, Instant now) {
        Optional<Inbox> latest = store.findInbox(inboxId);
        if (latest.isEmpty() || !registry.isAvailable(latest.get(), settings, now)) {
            return Optional.empty();
        }
        Inbox inbox = latest.get();
        SlotComputation computation = slotCalculator.computeSlot(settings, timezone, now, bookingsOf(inboxId, settings, now));
        if (!computation.isAvailable() || computation.needsAttention()) {
            return Optional.empty();
        }

        BookedSlot moved = store.findBookedSlot(original.getId()).orElse(original.copy());
        moved.setInboxId(inboxId);
        moved.setRecipientTimezone(computation.zone().getId());
        moved.setFlaggedForReview(moved.isFlaggedForReview() || computation.flaggedForReview());
        moved.reschedule(computation.timeUtc(), computation.leadTimeDays(), computation.wasDoubleBooked(), now);
        try {
            store.persistBookedSlot(moved);
        } catch (SlotConflictException e) {
            log.error("inboxId={}, slotId={}, event=reassign_conflict_under_lock", inboxId, moved.getId(), e);
            return Optional.empty();
        }
        registry.consumeQuota(inbox);
        store.persistInbox(inbox);
        return Optional.of(moved);
    }

    private List<BookedSlot> bookingsOf(String inboxId, SchedulingSettings settings, Instant now) {
        Duration lookAhead = SlotCalculator.lookAhead(settings);
        return store.loadBookingsForInbox(inboxId, new TimeWindow(now.minus(Duration.ofDays(1)), now.plus(lookAhead)));
    }

    private record Attempt(BookedSlot slot, Inbox inbox, boolean noSlot) {
        static final Attempt INELIGIBLE = new Attempt(null, null, false);
        static final Attempt NO_SLOT = new Attempt(null, null, true);
    }
}
