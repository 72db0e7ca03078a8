package io.github.hotbrkm.inviteengine.agent.invite.store;

import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SettingsScope;

/**
 * Source of scheduling settings snapshots. Each call returns an immutable snapshot for one operation.
 */
@FunctionalInterface
public interface SchedulingSettingsProvider {

    SchedulingSettings getSchedulingSettings(SettingsScope scope);
}
