package io.github.hotbrkm.inviteengine.agent.invite.send.engine;

import io.github.hotbrkm.inviteengine.agent.invite.domain.RecipientTimezoneResolver;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.registry.HealthScorePolicy;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.registry.InboxRegistry;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation.InboxLockManager;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.selector.InboxSelector;
import io.github.hotbrkm.inviteengine.agent.invite.schedule.slot.SlotCalculator;
import io.github.hotbrkm.inviteengine.agent.invite.send.engine.metrics.InboxSendMetrics;
import io.github.hotbrkm.inviteengine.agent.invite.store.InboxStore;

import java.time.Clock;
import java.util.Objects;
import java.util.Random;

/**
 * Context holding runtime dependencies required for engine execution.
 */
record EngineRuntimeContext(EngineRuntimeOptions runtimeOptions,
                            InboxStore store,
                            Clock clock,
                            InboxRegistry registry,
                            InboxSelector selector,
                            SlotCalculator slotCalculator,
                            InboxLockManager lockManager,
                            RecipientTimezoneResolver timezoneResolver,
                            InboxSendMetrics metrics,
                            EngineExecutors engineExecutors) {

    /**
     * Initializes runtime components and creates the context.
     */
    static EngineRuntimeContext initialize(EngineRuntimeOptions runtimeOptions, InboxStore store, Clock clock,
                                           RecipientTimezoneResolver timezoneResolver) {
        EngineRuntimeOptions options = Objects.requireNonNull(runtimeOptions, "runtimeOptions must not be null");
        InboxStore requiredStore = Objects.requireNonNull(store, "store must not be null");
        Clock requiredClock = Objects.requireNonNull(clock, "clock must not be null");

        HealthScorePolicy healthScorePolicy = new HealthScorePolicy(options.healthSmoothingFactor(),
                options.healthErrorPenalty());
        InboxRegistry registry = new InboxRegistry(healthScorePolicy, options.boundaryZone(), options.weeklyResetDay());
        InboxSelector selector = new InboxSelector(registry);
        Random random = options.randomSeed() == null ? new Random() : new Random(options.randomSeed());
        SlotCalculator slotCalculator = new SlotCalculator(random);
        InboxLockManager lockManager = new InboxLockManager(options.lockTimeout());
        InboxSendMetrics metrics = new InboxSendMetrics(options.metricsRetentionWindows(),
                options.metricsWindowSeconds(), requiredClock);
        EngineExecutors engineExecutors = new EngineExecutors(options.workerCount());

        return new EngineRuntimeContext(options, requiredStore, requiredClock, registry, selector, slotCalculator,
                lockManager, timezoneResolver == null ? RecipientTimezoneResolver.none() : timezoneResolver,
                metrics, engineExecutors);
    }
}
