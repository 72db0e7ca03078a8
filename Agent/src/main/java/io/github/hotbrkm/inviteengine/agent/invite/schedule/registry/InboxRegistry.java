package io.github.hotbrkm.inviteengine.agent.invite.schedule.registry;

import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.InboxState;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SendErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;
import java.util.Optional;

/**
 * State machine over the stored inbox fields.
 * <p>
 * States are never persisted. {@link #stateOf} derives them from {@code active}, {@code pausedReason},
 * the quota counters, {@code cooldownUntil} and {@code healthScore} at read time. Mutating methods change the
 * passed working copy only; callers hold the per-inbox lock and persist the copy afterwards.
 */
@Slf4j
public class InboxRegistry {

    private final HealthScorePolicy healthScorePolicy;
    private final ZoneId boundaryZone;
    private final DayOfWeek weeklyResetDay;

    public InboxRegistry() {
        this(HealthScorePolicy.defaults(), ZoneId.of("UTC"), DayOfWeek.MONDAY);
    }

    public InboxRegistry(HealthScorePolicy healthScorePolicy, ZoneId boundaryZone, DayOfWeek weeklyResetDay) {
        this.healthScorePolicy = Objects.requireNonNull(healthScorePolicy, "healthScorePolicy must not be null");
        this.boundaryZone = Objects.requireNonNull(boundaryZone, "boundaryZone must not be null");
        this.weeklyResetDay = Objects.requireNonNull(weeklyResetDay, "weeklyResetDay must not be null");
    }

    public boolean isAvailable(Inbox inbox, SchedulingSettings settings, Instant now) {
        return stateOf(inbox, settings, now) == InboxState.ACTIVE;
    }

    /**
     * Precedence: DISABLED, PAUSED, QUOTA_EXHAUSTED, COOLDOWN, UNHEALTHY, ACTIVE.
     */
    public InboxState stateOf(Inbox inbox, SchedulingSettings settings, Instant now) {
        if (!inbox.isActive()) {
            return InboxState.DISABLED;
        }
        if (inbox.isPaused()) {
            return InboxState.PAUSED;
        }
        if (inbox.isDailyQuotaExhausted() || inbox.isWeeklyQuotaExhausted()) {
            return InboxState.QUOTA_EXHAUSTED;
        }
        if (inbox.isCoolingDown(now)) {
            return InboxState.COOLDOWN;
        }
        if (inbox.getHealthScore() < settings.healthThreshold()) {
            return InboxState.UNHEALTHY;
        }
        return InboxState.ACTIVE;
    }

    /**
     * Records a completed send in one step: counts it against the quotas and applies the success effects.
     *
     * @throws IllegalStateException if the send would push {@code sentToday} past {@code dailyQuota}
     */
    public void markSent(Inbox inbox, Instant now, int cooldownMinutes) {
        consumeQuota(inbox);
        confirmSent(inbox, now, cooldownMinutes);
    }

    /**
     * Provisionally counts one invite against the daily and weekly quotas.
     *
     * @throws IllegalStateException if a quota is already used up
     */
    public void consumeQuota(Inbox inbox) {
        if (inbox.getSentToday() + 1 > inbox.getDailyQuota()) {
            throw new IllegalStateException("Inbox " + inbox.getId() + " daily quota exhausted: "
                    + inbox.getSentToday() + "/" + inbox.getDailyQuota());
        }
        if (inbox.isWeeklyQuotaExhausted()) {
            throw new IllegalStateException("Inbox " + inbox.getId() + " weekly quota exhausted: "
                    + inbox.getSentThisWeek() + "/" + inbox.getWeeklyQuota());
        }
        inbox.setSentToday(inbox.getSentToday() + 1);
        inbox.setSentThisWeek(inbox.getSentThisWeek() + 1);
    }

    /**
     * Returns a provisional quota unit for an invite that was never sent.
     */
    public void releaseQuota(Inbox inbox) {
        if (inbox.getSentToday() <= 0) {
            log.warn("inboxId={}, event=quota_release_underflow", inbox.getId());
        }
        inbox.setSentToday(Math.max(0, inbox.getSentToday() - 1));
        inbox.setSentThisWeek(Math.max(0, inbox.getSentThisWeek() - 1));
    }

    /**
     * Applies the effects of a successful send whose quota unit was already consumed at reservation time.
     */
    public void confirmSent(Inbox inbox, Instant now, int cooldownMinutes) {
        inbox.setLastUsedAt(now);
        inbox.setCooldownUntil(now.plus(Duration.ofMinutes(Math.max(0, cooldownMinutes))));
        inbox.setConsecutiveErrorCount(0);
        inbox.setHealthScore(healthScorePolicy.afterSuccess(inbox.getHealthScore()));
    }

    /**
     * Records a failed send.
     *
     * @return true if this error paused or disabled the inbox
     */
    public boolean markError(Inbox inbox, SendErrorKind kind, SchedulingSettings settings, String reason) {
        inbox.setConsecutiveErrorCount(inbox.getConsecutiveErrorCount() + 1);
        if (kind == SendErrorKind.PERMANENT) {
            boolean wasActive = inbox.isActive();
            inbox.setActive(false);
            inbox.setDisabledReason(reason == null ? "permanent send failure" : reason);
            inbox.setHealthScore(healthScorePolicy.afterPermanentFailure());
            log.warn("inboxId={}, reason={}, event=inbox_disabled", inbox.getId(), inbox.getDisabledReason());
            return wasActive;
        }

        inbox.setHealthScore(healthScorePolicy.afterError(inbox.getHealthScore()));
        if (!inbox.isPaused() && inbox.getConsecutiveErrorCount() >= settings.maxErrorsBeforePause()) {
            inbox.setPausedReason("Paused after " + inbox.getConsecutiveErrorCount() + " consecutive errors"
                    + (reason == null ? "" : ": " + reason));
            log.warn("inboxId={}, consecutiveErrors={}, healthScore={}, event=inbox_paused",
                    inbox.getId(), inbox.getConsecutiveErrorCount(), inbox.getHealthScore());
            return true;
        }
        log.debug("inboxId={}, consecutiveErrors={}, healthScore={}, event=inbox_error_recorded",
                inbox.getId(), inbox.getConsecutiveErrorCount(), inbox.getHealthScore());
        return false;
    }

    /**
     * Explicit operator resume. Clears the pause and the error streak and gives back the streak's health penalty.
     * Does not re-enable a disabled inbox.
     */
    public void resume(Inbox inbox) {
        inbox.setPausedReason(null);
        clearErrorStreak(inbox);
    }

    /**
     * Zeroes {@code sentToday} for the given boundary date. An error streak that stayed below the pause limit is
     * cleared too; a paused inbox keeps its streak until it is resumed.
     *
     * @return false if the inbox was already reset for this boundary and nothing changed
     */
    public boolean resetDaily(Inbox inbox, LocalDate boundaryDate) {
        if (boundaryDate.equals(inbox.getLastResetDate())) {
            return false;
        }
        inbox.setSentToday(0);
        inbox.setLastResetDate(boundaryDate);
        if (inbox.isActive() && !inbox.isPaused() && inbox.getConsecutiveErrorCount() > 0) {
            log.debug("inboxId={}, clearedErrors={}, event=error_streak_cleared",
                    inbox.getId(), inbox.getConsecutiveErrorCount());
            clearErrorStreak(inbox);
        }
        return true;
    }

    private void clearErrorStreak(Inbox inbox) {
        if (inbox.isActive()) {
            inbox.setHealthScore(healthScorePolicy.afterStreakCleared(inbox.getHealthScore(),
                    inbox.getConsecutiveErrorCount()));
        }
        inbox.setConsecutiveErrorCount(0);
    }

    public void resetWeekly(Inbox inbox) {
        inbox.setSentThisWeek(0);
    }

    public InboxUsageStats usageStats(Inbox inbox, SchedulingSettings settings, Instant now) {
        InboxState state = stateOf(inbox, settings, now);
        return new InboxUsageStats(inbox.getId(), state, inbox.getSentToday(), inbox.getDailyQuota(),
                inbox.remainingDailyQuota(), inbox.getSentThisWeek(), inbox.getWeeklyQuota(), inbox.getHealthScore(),
                inbox.getConsecutiveErrorCount(), inbox.getLastUsedAt(), inbox.getCooldownUntil(),
                inbox.getPausedReason(), inbox.getDisabledReason(),
                nextAvailableAt(inbox, settings, now).orElse(null));
    }

    /**
     * Estimates when the inbox becomes selectable without human action. Empty when it is disabled, paused or
     * unhealthy for a reason the daily reset does not clear.
     */
    public Optional<Instant> nextAvailableAt(Inbox inbox, SchedulingSettings settings, Instant now) {
        return switch (stateOf(inbox, settings, now)) {
            case ACTIVE -> Optional.of(now);
            case COOLDOWN -> Optional.of(inbox.getCooldownUntil());
            case QUOTA_EXHAUSTED -> Optional.of(quotaRecoveryTime(inbox, now));
            case UNHEALTHY -> recoversAtDailyReset(inbox, settings)
                    ? Optional.of(nextDailyBoundary(now))
                    : Optional.empty();
            case PAUSED, DISABLED -> Optional.empty();
        };
    }

    private boolean recoversAtDailyReset(Inbox inbox, SchedulingSettings settings) {
        return inbox.getConsecutiveErrorCount() > 0
                && healthScorePolicy.afterStreakCleared(inbox.getHealthScore(), inbox.getConsecutiveErrorCount())
                >= settings.healthThreshold();
    }

    private Instant nextDailyBoundary(Instant now) {
        return LocalDate.ofInstant(now, boundaryZone).plusDays(1).atStartOfDay(boundaryZone).toInstant();
    }

    private Instant quotaRecoveryTime(Inbox inbox, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, boundaryZone);
        Instant candidate = nextDailyBoundary(now);
        if (inbox.isWeeklyQuotaExhausted()) {
            LocalDate nextWeekly = today.with(TemporalAdjusters.next(weeklyResetDay));
            candidate = nextWeekly.atStartOfDay(boundaryZone).toInstant();
        }
        if (inbox.getCooldownUntil() != null && inbox.getCooldownUntil().isAfter(candidate)) {
            return inbox.getCooldownUntil();
        }
        return candidate;
    }

    public ZoneId boundaryZone() {
        return boundaryZone;
    }
}
