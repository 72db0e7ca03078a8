package io.github.hotbrkm.inviteengine.agent.invite.config;

import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SettingsScope;
import io.github.hotbrkm.inviteengine.agent.invite.store.SchedulingSettingsProvider;

import java.util.Objects;

/**
 * Builds settings snapshots from {@code invite.scheduling}: built-in defaults, then the global section, then the
 * campaign's override when one is configured.
 */
public class ConfiguredSchedulingSettingsProvider implements SchedulingSettingsProvider {

    private final InviteEngineProperties.Scheduling scheduling;

    public ConfiguredSchedulingSettingsProvider(InviteEngineProperties.Scheduling scheduling) {
        this.scheduling = Objects.requireNonNull(scheduling, "scheduling must not be null");
    }

    @Override
    public SchedulingSettings getSchedulingSettings(SettingsScope scope) {
        SchedulingSettings global = scheduling.applyTo(SchedulingSettings.defaults());
        if (scope == null || scope.isGlobal() || scheduling.getCampaigns() == null) {
            return global.validate();
        }
        InviteEngineProperties.SchedulingValues override = scheduling.getCampaigns().get(scope.campaignId());
        return (override == null ? global : override.applyTo(global)).validate();
    }
}
