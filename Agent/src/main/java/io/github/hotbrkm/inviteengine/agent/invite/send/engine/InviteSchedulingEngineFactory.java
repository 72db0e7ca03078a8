package io.github.hotbrkm.inviteengine.agent.invite.send.engine;

import io.github.hotbrkm.inviteengine.agent.invite.config.InviteEngineProperties;
import io.github.hotbrkm.inviteengine.agent.invite.domain.RecipientTimezoneResolver;
import io.github.hotbrkm.inviteengine.agent.invite.lifecycle.DailyResetScheduler;
import io.github.hotbrkm.inviteengine.agent.invite.lifecycle.InboxMaintenanceService;
import io.github.hotbrkm.inviteengine.agent.invite.lifecycle.SlotAdjustmentService;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.ReservationCoordinator;
import io.github.hotbrkm.inviteengine.agent.invite.send.outcome.SendOutcomeHandler;
import io.github.hotbrkm.inviteengine.agent.invite.send.queue.CampaignQueueProcessor;
import io.github.hotbrkm.inviteengine.agent.invite.send.queue.RetryBackoffPolicy;
import io.github.hotbrkm.inviteengine.agent.invite.send.queue.RetryDelayer;
import io.github.hotbrkm.inviteengine.agent.invite.send.transport.InviteTransport;
import io.github.hotbrkm.inviteengine.agent.invite.store.InboxStore;
import io.github.hotbrkm.inviteengine.agent.invite.store.SchedulingSettingsProvider;
import lombok.experimental.UtilityClass;

import java.time.Clock;
import java.util.Objects;

/**
 * Factory dedicated to assembling InviteSchedulingEngine.
 */
@UtilityClass
public class InviteSchedulingEngineFactory {

    /**
     * Creates an engine based on configuration.
     */
    public static InviteSchedulingEngine create(InviteEngineProperties properties, InboxStore store,
                                                InviteTransport transport, SchedulingSettingsProvider settingsProvider,
                                                Clock clock) {
        EngineRuntimeOptions options = EngineRuntimeOptions.fromProperties(properties);
        RecipientTimezoneResolver timezoneResolver = properties.getScheduling() == null
                ? RecipientTimezoneResolver.none()
                : new RecipientTimezoneResolver(properties.getScheduling().getDomainTimezones());
        return new InviteSchedulingEngine(assemble(options, store, transport, settingsProvider, clock,
                timezoneResolver, RetryDelayer.sleeping()));
    }

    /**
     * Assembles runtime components and returns the engine Assembly.
     */
    static Assembly assemble(EngineRuntimeOptions options, InboxStore store, InviteTransport transport,
                             SchedulingSettingsProvider settingsProvider, Clock clock,
                             RecipientTimezoneResolver timezoneResolver, RetryDelayer retryDelayer) {
        Objects.requireNonNull(transport, "transport must not be null");
        SchedulingSettingsProvider requiredProvider =
                Objects.requireNonNull(settingsProvider, "settingsProvider must not be null");

        EngineRuntimeContext context = EngineRuntimeContext.initialize(options, store, clock, timezoneResolver);
        EngineRuntimeOptions runtimeOptions = context.runtimeOptions();

        ReservationCoordinator coordinator = new ReservationCoordinator(context.store(), context.registry(),
                context.selector(), context.slotCalculator(), context.lockManager(), context.timezoneResolver(),
                context.metrics(), context.clock());
        SendOutcomeHandler outcomeHandler = new SendOutcomeHandler(context.store(), context.registry(),
                context.lockManager(), context.metrics(), context.clock());
        CampaignQueueProcessor queueProcessor = CampaignQueueProcessor.builder()
                .coordinator(coordinator)
                .outcomeHandler(outcomeHandler)
                .transport(transport)
                .store(context.store())
                .metrics(context.metrics())
                .retryPolicy(new RetryBackoffPolicy(runtimeOptions.initialRetryDelayMs(),
                        runtimeOptions.maxRetryDelayMs(), runtimeOptions.retryBackoffMultiplier()))
                .retryDelayer(retryDelayer)
                .workerExecutor(context.engineExecutors().workers())
                .runTimeoutMillis(runtimeOptions.runTimeoutMs())
                .clock(context.clock())
                .build();

        InboxMaintenanceService maintenanceService = new InboxMaintenanceService(context.store(), context.registry(),
                context.lockManager(), coordinator, context.clock());
        SlotAdjustmentService slotAdjustmentService = new SlotAdjustmentService(context.store(), context.registry(),
                context.slotCalculator(), context.lockManager(), context.clock());
        DailyResetScheduler dailyResetScheduler = new DailyResetScheduler(maintenanceService, context.clock(),
                runtimeOptions.boundaryZone(), runtimeOptions.boundaryTime(), runtimeOptions.weeklyResetDay());

        return new Assembly(context, requiredProvider, coordinator, queueProcessor, maintenanceService,
                slotAdjustmentService, dailyResetScheduler);
    }

    /**
     * Assembly result object for engine configuration.
     */
    record Assembly(EngineRuntimeContext context,
                    SchedulingSettingsProvider settingsProvider,
                    ReservationCoordinator coordinator,
                    CampaignQueueProcessor queueProcessor,
                    InboxMaintenanceService maintenanceService,
                    SlotAdjustmentService slotAdjustmentService,
                    DailyResetScheduler dailyResetScheduler) {
    }
}
