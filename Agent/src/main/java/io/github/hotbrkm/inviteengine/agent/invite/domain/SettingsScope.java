package io.github.hotbrkm.inviteengine.agent.invite.domain;

/**
 * Lookup key for scheduling settings: global, or a single campaign.
 *
 * @param campaignId campaign id, or {@code null} for the global scope
 */
public record SettingsScope(String campaignId) {

    private static final SettingsScope GLOBAL = new SettingsScope(null);

    public static SettingsScope global() {
        return GLOBAL;
    }

    public static SettingsScope campaign(String campaignId) {
        if (campaignId == null || campaignId.isBlank()) {
            return GLOBAL;
        }
        return new SettingsScope(campaignId);
    }

    public boolean isGlobal() {
        return campaignId == null;
    }
}
