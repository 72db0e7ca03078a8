package io.github.hotbrkm.inviteengine.agent.invite.send.queue;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Campaign;
import io.github.hotbrkm.inviteengine.agent.invite.domain.EmailAddressUtil;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Recipient;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SendErrorKind;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SlotStatus;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.InboxLockTimeoutException;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.ReservationCoordinator;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.ReservationRequest;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.ReservationResult;
import io.github.hotbrkm.inviteengine.agent.invite.send.engine.metrics.InboxSendMetrics;
import io.github.hotbrkm.inviteengine.agent.invite.send.outcome.SendOutcomeHandler;
import io.github.hotbrkm.inviteengine.agent.invite.send.result.CampaignRunSummary;
import io.github.hotbrkm.inviteengine.agent.invite.send.result.CampaignStatusSummary;
import io.github.hotbrkm.inviteengine.agent.invite.send.result.RecipientResult;
import io.github.hotbrkm.inviteengine.agent.invite.send.transport.InviteTransport;
import io.github.hotbrkm.inviteengine.agent.invite.send.transport.TransportError;
import io.github.hotbrkm.inviteengine.agent.invite.send.transport.TransportResult;
import io.github.hotbrkm.inviteengine.agent.invite.store.InboxStore;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Drives a campaign's recipients through reserve, send and outcome.
 * <p>
 * Each recipient runs as an independent pipeline on the worker executor; a failure in one pipeline never
 * touches another recipient's slots. The transport call happens outside every inbox lock.
 * Only invalid settings abort a run, and they do so before any recipient is touched.
 */
@Slf4j
public class CampaignQueueProcessor {

    static final int SETTLE_ATTEMPTS = 3;

    private final ReservationCoordinator coordinator;
    private final SendOutcomeHandler outcomeHandler;
    private final InviteTransport transport;
    private final InboxStore store;
    private final InboxSendMetrics metrics;
    private final RetryBackoffPolicy retryPolicy;
    private final RetryDelayer retryDelayer;
    private final Executor workerExecutor;
    private final long runTimeoutMillis;
    private final Clock clock;

    @Builder
    public CampaignQueueProcessor(ReservationCoordinator coordinator, SendOutcomeHandler outcomeHandler,
                                  InviteTransport transport, InboxStore store, InboxSendMetrics metrics,
                                  RetryBackoffPolicy retryPolicy, RetryDelayer retryDelayer, Executor workerExecutor,
                                  long runTimeoutMillis, Clock clock) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.outcomeHandler = Objects.requireNonNull(outcomeHandler, "outcomeHandler must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.retryPolicy = retryPolicy == null ? RetryBackoffPolicy.defaults() : retryPolicy;
        this.retryDelayer = retryDelayer == null ? RetryDelayer.sleeping() : retryDelayer;
        this.workerExecutor = workerExecutor == null ? Runnable::run : workerExecutor;
        this.runTimeoutMillis = runTimeoutMillis > 0 ? runTimeoutMillis : Long.MAX_VALUE;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * @throws io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingConfigurationException on invalid settings
     */
    public CampaignRunSummary process(Campaign campaign, SchedulingSettings settings) {
        settings.validate();
        String campaignId = campaign.campaignId();
        List<BookedSlot> existing = store.loadBookingsForCampaign(campaignId);

        Set<String> seen = new HashSet<>();
        for (BookedSlot slot : existing) {
            if (slot.isOccupying()) {
                seen.add(EmailAddressUtil.normalize(slot.getRecipientEmail()));
            }
        }
        int remainingCap = campaign.hasDailyCap()
                ? Math.max(0, campaign.maxDailyInvites() - reservedToday(existing))
                : Integer.MAX_VALUE;

        log.info("campaignId={}, recipients={}, remainingCap={}, event=campaign_run_start",
                campaignId, campaign.recipients().size(), campaign.hasDailyCap() ? remainingCap : "unlimited");

        List<RecipientResult> settled = new ArrayList<>();
        List<CompletableFuture<RecipientResult>> futures = new ArrayList<>();
        for (Recipient recipient : campaign.recipients()) {
            if (!seen.add(recipient.normalizedEmail())) {
                log.debug("campaignId={}, recipient={}, event=recipient_duplicate", campaignId, recipient.email());
                settled.add(RecipientResult.skippedDuplicate(recipient.email()));
                continue;
            }
            if (remainingCap <= 0) {
                settled.add(RecipientResult.deferred(recipient.email()));
                continue;
            }
            remainingCap--;
            futures.add(CompletableFuture.supplyAsync(() -> processRecipient(campaign, recipient, settings), workerExecutor));
        }

        return new CampaignRunAggregator(campaignId).aggregate(settled, futures, runTimeoutMillis);
    }

    public CampaignStatusSummary statusOf(String campaignId) {
        return CampaignStatusSummary.of(campaignId, store.loadBookingsForCampaign(campaignId));
    }

    RecipientResult processRecipient(Campaign campaign, Recipient recipient, SchedulingSettings settings) {
        try {
            return runPipeline(campaign, recipient, settings);
        } catch (RuntimeException e) {
            log.warn("campaignId={}, recipient={}, event=recipient_pipeline_error, message={}",
                    campaign.campaignId(), recipient.email(), e.getMessage(), e);
            return RecipientResult.needsAttention(recipient.email(), null, null, 0, e.getMessage());
        }
    }

    private RecipientResult runPipeline(Campaign campaign, Recipient recipient, SchedulingSettings settings) {
        String campaignId = campaign.campaignId();
        int maxAttempts = settings.sendRetryAttempts();
        Set<String> failedInboxes = new LinkedHashSet<>();
        String lastMessage = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ReservationResult reservation = coordinator.reserve(
                    new ReservationRequest(campaignId, recipient, settings, campaign.inboxPool(), failedInboxes));

            if (reservation instanceof ReservationResult.Rejected rejected) {
                lastMessage = rejected.reason() + ": " + rejected.message();
                if (rejected.retryable() && attempt < maxAttempts && awaitRetry(attempt)) {
                    continue;
                }
                log.warn("campaignId={}, recipient={}, reason={}, event=recipient_rejected",
                        campaignId, recipient.email(), rejected.reason());
                return RecipientResult.needsAttention(recipient.email(), null, null, attempt, lastMessage);
            }

            ReservationResult.Reserved reserved = (ReservationResult.Reserved) reservation;
            BookedSlot slot = reserved.slot();
            Inbox inbox = reserved.inbox();
            if (slot.getStatus() == SlotStatus.NEEDS_ATTENTION) {
                return RecipientResult.needsAttention(recipient.email(), slot.getId(), inbox.getId(), attempt,
                        slot.getStatusReason());
            }

            TransportResult result = send(inbox, recipient, slot);
            try {
                if (result.isSuccess()) {
                    outcomeHandler.success(slot, result.eventId(), settings);
                    return RecipientResult.sent(recipient.email(), slot.getId(), inbox.getId(), attempt);
                }

                TransportError error = result.error();
                lastMessage = error.message();
                if (error.kind() == SendErrorKind.PERMANENT) {
                    outcomeHandler.permanentFailure(slot, error.message(), settings);
                    return RecipientResult.needsAttention(recipient.email(), slot.getId(), inbox.getId(), attempt,
                            error.message());
                }

                outcomeHandler.transientFailure(slot, error.message(), settings);
                failedInboxes.add(inbox.getId());
                if (attempt < maxAttempts) {
                    coordinator.release(slot, SlotStatus.CANCELED, "Retrying after transient failure: " + error.message());
                    metrics.recordRetry(inbox.getId());
                    if (awaitRetry(attempt)) {
                        continue;
                    }
                    return RecipientResult.needsAttention(recipient.email(), slot.getId(), inbox.getId(), attempt,
                            "Interrupted while waiting to retry");
                }
                coordinator.release(slot, SlotStatus.NEEDS_ATTENTION, "Send retries exhausted: " + error.message());
                log.warn("campaignId={}, recipient={}, attempts={}, event=recipient_retries_exhausted",
                        campaignId, recipient.email(), attempt);
                return RecipientResult.needsAttention(recipient.email(), slot.getId(), inbox.getId(), attempt,
                        error.message());
            } catch (InboxLockTimeoutException e) {
                return settleUnrecordedOutcome(campaignId, recipient, slot, attempt, result, e);
            }
        }
        return RecipientResult.needsAttention(recipient.email(), null, null, maxAttempts, lastMessage);
    }

    /**
     * The outcome of a send could not be written because the inbox lock stayed busy. Moves the slot out of PENDING
     * so it neither holds quota nor looks unsent.
     */
    private RecipientResult settleUnrecordedOutcome(String campaignId, Recipient recipient, BookedSlot slot,
                                                    int attempt, TransportResult result,
                                                    InboxLockTimeoutException cause) {
        String reason = result.isSuccess()
                ? "Invite sent as " + result.eventId() + " but the outcome could not be recorded"
                : "Send outcome could not be recorded: " + result.error().message();
        log.warn("campaignId={}, recipient={}, slotId={}, inboxId={}, event=outcome_not_recorded, message={}",
                campaignId, recipient.email(), slot.getId(), slot.getInboxId(), cause.getMessage());

        for (int settleAttempt = 1; settleAttempt <= SETTLE_ATTEMPTS; settleAttempt++) {
            try {
                BookedSlot released = coordinator.release(slot, SlotStatus.NEEDS_ATTENTION, reason);
                return RecipientResult.needsAttention(recipient.email(), released.getId(), released.getInboxId(),
                        attempt, reason);
            } catch (InboxLockTimeoutException e) {
                metrics.recordLockTimeout(slot.getInboxId());
                if (settleAttempt == SETTLE_ATTEMPTS || !awaitRetry(settleAttempt)) {
                    log.error("campaignId={}, slotId={}, inboxId={}, event=slot_left_pending",
                            campaignId, slot.getId(), slot.getInboxId(), e);
                    break;
                }
            }
        }
        return RecipientResult.needsAttention(recipient.email(), slot.getId(), slot.getInboxId(), attempt, reason);
    }

    private TransportResult send(Inbox inbox, Recipient recipient, BookedSlot slot) {
        long startedAt = clock.millis();
        try {
            TransportResult result = transport.sendInvite(inbox, recipient, slot);
            return Objects.requireNonNull(result, "transport returned null");
        } catch (RuntimeException e) {
            log.warn("inboxId={}, slotId={}, event=transport_exception, message={}",
                    inbox.getId(), slot.getId(), e.getMessage(), e);
            return TransportResult.failure(TransportError.transientError(
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        } finally {
            metrics.recordSendTime(inbox.getId(), clock.millis() - startedAt);
        }
    }

    private boolean awaitRetry(int attempt) {
        long delayMillis = retryPolicy.computeDelayMillis(attempt);
        try {
            retryDelayer.delay(delayMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("event=retry_wait_interrupted, attempt={}", attempt);
            return false;
        }
    }

    private int reservedToday(List<BookedSlot> existing) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        int count = 0;
        for (BookedSlot slot : existing) {
            if (slot.getStatus() != SlotStatus.CANCELED && slot.getCreatedAt() != null
                    && LocalDate.ofInstant(slot.getCreatedAt(), ZoneOffset.UTC).equals(today)) {
                count++;
            }
        }
        return count;
    }
}
