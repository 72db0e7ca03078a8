package io.github.hotbrkm.inviteengine.agent.invite.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A connected sending identity.
 * <p>
 * Instances are mutable working copies. Stores hand out copies, mutation happens under the per-inbox lock,
 * and the result is written back with {@code persistInbox}. Availability is always derived from these fields.
 */
@Getter
@Setter
public class Inbox {

    public static final int MAX_HEALTH_SCORE = 100;

    private final String id;
    private String email;
    private ProviderKind providerKind;
    private boolean active;

    private int dailyQuota;
    private int sentToday;
    private int weeklyQuota;
    private int sentThisWeek;

    private Instant lastUsedAt;
    private Instant cooldownUntil;
    private int healthScore;
    private int consecutiveErrorCount;
    private String pausedReason;
    private String disabledReason;
    private LocalDate lastResetDate;

    @Builder
    public Inbox(String id, String email, ProviderKind providerKind, Boolean active, int dailyQuota, int sentToday,
                 int weeklyQuota, int sentThisWeek, Instant lastUsedAt, Instant cooldownUntil, Integer healthScore,
                 int consecutiveErrorCount, String pausedReason, String disabledReason, LocalDate lastResetDate) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        this.id = id;
        this.email = email;
        this.providerKind = providerKind == null ? ProviderKind.GOOGLE : providerKind;
        this.active = active == null || active;
        this.dailyQuota = Math.max(0, dailyQuota);
        this.sentToday = Math.max(0, sentToday);
        this.weeklyQuota = Math.max(0, weeklyQuota);
        this.sentThisWeek = Math.max(0, sentThisWeek);
        this.lastUsedAt = lastUsedAt;
        this.cooldownUntil = cooldownUntil;
        this.healthScore = healthScore == null ? MAX_HEALTH_SCORE : clampHealth(healthScore);
        this.consecutiveErrorCount = Math.max(0, consecutiveErrorCount);
        this.pausedReason = pausedReason;
        this.disabledReason = disabledReason;
        this.lastResetDate = lastResetDate;
    }

    public boolean isPaused() {
        return pausedReason != null;
    }

    public boolean isCoolingDown(Instant now) {
        return cooldownUntil != null && now.isBefore(cooldownUntil);
    }

    public boolean isDailyQuotaExhausted() {
        return sentToday >= dailyQuota;
    }

    public boolean isWeeklyQuotaExhausted() {
        return weeklyQuota > 0 && sentThisWeek >= weeklyQuota;
    }

    public int remainingDailyQuota() {
        return Math.max(0, dailyQuota - sentToday);
    }

    public void setHealthScore(int healthScore) {
        this.healthScore = clampHealth(healthScore);
    }

    public Inbox copy() {
        return new Inbox(id, email, providerKind, active, dailyQuota, sentToday, weeklyQuota, sentThisWeek,
                lastUsedAt, cooldownUntil, healthScore, consecutiveErrorCount, pausedReason, disabledReason,
                lastResetDate);
    }

    private static int clampHealth(int value) {
        return Math.max(0, Math.min(MAX_HEALTH_SCORE, value));
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Inbox that = (Inbox) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Inbox{id=" + id + ", provider=" + providerKind + ", active=" + active + ", sentToday=" + sentToday
                + "/" + dailyQuota + ", health=" + healthScore + ", errors=" + consecutiveErrorCount
                + ", paused=" + pausedReason + ", cooldownUntil=" + cooldownUntil + "}";
    }
}
