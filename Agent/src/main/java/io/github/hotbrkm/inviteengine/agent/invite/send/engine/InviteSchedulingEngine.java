package io.github.hotbrkm.inviteengine.agent.invite.send.engine;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Campaign;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Recipient;
import io.github.hotbrkm.inviteengine.agent.invite.domain.RsvpStatus;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SettingsScope;
import io.github.hotbrkm.inviteengine.agent.invite.lifecycle.DailyResetScheduler;
import io.github.hotbrkm.inviteengine.agent.invite.lifecycle.DisconnectReport;
import io.github.hotbrkm.inviteengine.agent.invite.lifecycle.InboxMaintenanceService;
import io.github.hotbrkm.inviteengine.agent.invite.lifecycle.SlotAdjustmentService;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.registry.InboxUsageStats;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.ReservationCoordinator;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.ReservationRequest;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.ReservationResult;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.selector.InboxSelector;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.slot.SlotCalculator;
import io.github.hotbrkm.inviteengine.agent.invite.send.engine.metrics.InboxMetricSnapshot;
import io.github.hotbrkm.inviteengine.agent.invite.send.engine.metrics.InboxSendMetrics;
import io.github.hotbrkm.inviteengine.agent.invite.send.queue.CampaignQueueProcessor;
import io.github.hotbrkm.inviteengine.agent.invite.send.result.CampaignRunSummary;
import io.github.hotbrkm.inviteengine.agent.invite.send.result.CampaignStatusSummary;
import io.github.hotbrkm.inviteengine.agent.invite.store.InboxStore;
import io.github.hotbrkm.inviteengine.agent.invite.store.SchedulingSettingsProvider;
import io.github.hotbrkm.inviteengine.agent.invite.store.TimeWindow;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Invite scheduling engine
 * <p>
 * Key features:
 * 1. Inbox selection and slot reservation under per-inbox locks
 * 2. Campaign runs on a fixed worker pool with retry on another inbox
 * 3. Inbox maintenance (daily/weekly reset, resume, disconnect)
 * 4. Slot adjustments (reschedule, cancel, RSVP) and per-inbox send metrics
 */
@Slf4j
public class InviteSchedulingEngine {

    private static final long METRICS_EVICT_PERIOD_SECONDS = 60L;

    private final EngineRuntimeOptions runtimeOptions;
    private final InboxStore store;
    private final Clock clock;
    private final InboxSelector selector;
    private final SlotCalculator slotCalculator;
    private final InboxSendMetrics metrics;
    private final EngineExecutors engineExecutors;
    private final SchedulingSettingsProvider settingsProvider;
    private final ReservationCoordinator coordinator;
    private final CampaignQueueProcessor queueProcessor;
    private final InboxMaintenanceService maintenanceService;
    private final SlotAdjustmentService slotAdjustmentService;
    private final DailyResetScheduler dailyResetScheduler;

    private volatile boolean isRunning = false;

    InviteSchedulingEngine(InviteSchedulingEngineFactory.Assembly assembly) {
        EngineRuntimeContext context = assembly.context();

        this.runtimeOptions = context.runtimeOptions();
        this.store = context.store();
        this.clock = context.clock();
        this.selector = context.selector();
        this.slotCalculator = context.slotCalculator();
        this.metrics = context.metrics();
        this.engineExecutors = context.engineExecutors();

        this.settingsProvider = assembly.settingsProvider();
        this.coordinator = assembly.coordinator();
        this.queueProcessor = assembly.queueProcessor();
        this.maintenanceService = assembly.maintenanceService();
        this.slotAdjustmentService = assembly.slotAdjustmentService();
        this.dailyResetScheduler = assembly.dailyResetScheduler();

        log.info("InviteSchedulingEngine initialized with workers={}, lockTimeoutMs={}, dailyReset={}",
                runtimeOptions.workerCount(), runtimeOptions.lockTimeout().toMillis(),
                runtimeOptions.dailyResetEnabled());
        log.debug("InviteSchedulingEngine tuning: runTimeoutMs={}, healthSmoothingFactor={}, healthErrorPenalty={}, initialRetryDelayMs={}, maxRetryDelayMs={}, retryBackoffMultiplier={}, boundaryZone={}, boundaryTime={}, weeklyResetDay={}",
                runtimeOptions.runTimeoutMs(), runtimeOptions.healthSmoothingFactor(), runtimeOptions.healthErrorPenalty(),
                runtimeOptions.initialRetryDelayMs(), runtimeOptions.maxRetryDelayMs(),
                runtimeOptions.retryBackoffMultiplier(), runtimeOptions.boundaryZone(),
                runtimeOptions.boundaryTime(), runtimeOptions.weeklyResetDay());
    }

    /**
     * Starts periodic jobs: metrics eviction and, when enabled, the daily reset check.
     */
    public void start() {
        if (isRunning) {
            log.warn("Engine is already running");
            return;
        }
        isRunning = true;
        log.info("Starting InviteSchedulingEngine...");
        engineExecutors.scheduleAtFixedRate(metrics::evict, METRICS_EVICT_PERIOD_SECONDS,
                METRICS_EVICT_PERIOD_SECONDS, TimeUnit.SECONDS);
        if (runtimeOptions.dailyResetEnabled()) {
            engineExecutors.scheduleAtFixedRate(dailyResetScheduler::safeTick, 0,
                    runtimeOptions.resetCheckIntervalSeconds(), TimeUnit.SECONDS);
        }
    }

    public String getStatus() {
        if (!isRunning) {
            return "Stopped";
        }
        return engineExecutors.activeWorkerCount() == 0 ? "Idle" : "Running";
    }

    public int getActiveWorkers() {
        return engineExecutors.activeWorkerCount();
    }

    public SchedulingSettings settingsFor(SettingsScope scope) {
        return settingsProvider.getSchedulingSettings(scope).validate();
    }

    public ReservationResult reserve(String campaignId, Recipient recipient) {
        return coordinator.reserve(campaignId, recipient, settingsFor(SettingsScope.campaign(campaignId)));
    }

    public ReservationResult reserve(ReservationRequest request) {
        return coordinator.reserve(request);
    }

    /**
     * Runs a campaign on the worker pool and blocks until every recipient settled or the run timed out.
     */
    public CampaignRunSummary process(Campaign campaign) {
        return queueProcessor.process(campaign, settingsFor(campaign.settingsScope()));
    }

    /**
     * Runs a campaign without blocking the caller. Invalid settings fail the returned future.
     */
    public CompletableFuture<CampaignRunSummary> processAsync(Campaign campaign) {
        return engineExecutors.supplyOnCompletion(() -> process(campaign));
    }

    public Optional<Inbox> selectInbox(SchedulingSettings settings) {
        return selector.selectInbox(store.listInboxes(), settings, clock.instant());
    }

    /**
     * Earliest instant at which any inbox is expected to accept a reservation again.
     */
    public Optional<Instant> nextAvailableAt(SchedulingSettings settings) {
        return selector.nextAvailableAt(store.listInboxes(), settings, clock.instant());
    }

    public List<InboxUsageStats> usageStats(SchedulingSettings settings) {
        return maintenanceService.usageStats(settings);
    }

    public int resetDaily(LocalDate boundaryDate) {
        return maintenanceService.resetDaily(boundaryDate);
    }

    public int resetWeekly() {
        return maintenanceService.resetWeekly();
    }

    public Inbox resume(String inboxId) {
        return maintenanceService.resume(inboxId);
    }

    public DisconnectReport disconnect(String inboxId, SchedulingSettings settings) {
        return maintenanceService.disconnect(inboxId, settings);
    }

    public BookedSlot reschedule(String slotId, SchedulingSettings settings) {
        return slotAdjustmentService.reschedule(slotId, settings);
    }

    public BookedSlot rescheduleTo(String slotId, Instant newTimeUtc, SchedulingSettings settings) {
        return slotAdjustmentService.rescheduleTo(slotId, newTimeUtc, settings);
    }

    public BookedSlot cancel(String slotId, String reason) {
        return slotAdjustmentService.cancel(slotId, reason);
    }

    public BookedSlot applyRsvp(String slotId, RsvpStatus rsvp) {
        return slotAdjustmentService.applyRsvp(slotId, rsvp);
    }

    public CampaignStatusSummary campaignStatus(String campaignId) {
        return queueProcessor.statusOf(campaignId);
    }

    /**
     * Free grid instants of one inbox for a recipient timezone.
     *
     * @throws IllegalArgumentException if the inbox is unknown
     */
    public List<Instant> listFreeSlots(String inboxId, String recipientTimezone, SchedulingSettings settings) {
        if (store.findInbox(inboxId).isEmpty()) {
            throw new IllegalArgumentException("Unknown inbox: " + inboxId);
        }
        Instant now = clock.instant();
        TimeWindow window = new TimeWindow(now.minus(Duration.ofDays(1)), now.plus(SlotCalculator.lookAhead(settings)));
        List<BookedSlot> bookings = store.loadBookingsForInbox(inboxId, window);
        return slotCalculator.listFreeSlots(settings, recipientTimezone, now, bookings);
    }

    /**
     * Returns a snapshot of send metrics for a specific inbox over the last 'seconds'.
     */
    public InboxMetricSnapshot getInboxMetrics(String inboxId, int seconds) {
        return metrics.snapshot(inboxId, seconds);
    }

    /**
     * Returns snapshots of send metrics for all inboxes over the last 'seconds'.
     */
    public Map<String, InboxMetricSnapshot> getAllInboxMetrics(int seconds) {
        return metrics.snapshotAll(seconds);
    }

    /**
     * Shuts down all executors and waits for remaining tasks to terminate.
     */
    public void shutdown() {
        log.info("Shutting down InviteSchedulingEngine...");
        isRunning = false;
        engineExecutors.shutdown();
        log.info("InviteSchedulingEngine shut down completed");
    }
}
