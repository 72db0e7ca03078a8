package io.github.hotbrkm.inviteengine.agent.invite.schedule.registry;

import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;

/**
 * Health score arithmetic.
 * <p>
 * Each transient error in the current streak costs a fixed penalty. A success moves the score a fraction of the
 * way toward 100, at least one point per step. Clearing an error streak (explicit resume, or the daily reset of an
 * inbox that never reached the pause limit) gives the streak's penalty back, so a score lost to errors is always
 * recoverable. The score depends only on stored fields and survives restarts.
 */
public final class HealthScorePolicy {

    public static final double DEFAULT_SMOOTHING_FACTOR = 0.2d;
    public static final int DEFAULT_ERROR_PENALTY = 10;

    private final double smoothingFactor;
    private final int errorPenalty;

    public HealthScorePolicy(double smoothingFactor, int errorPenalty) {
        if (!(smoothingFactor > 0d && smoothingFactor <= 1d)) {
            throw new IllegalArgumentException("smoothingFactor must be within (0, 1]: " + smoothingFactor);
        }
        if (errorPenalty < 0 || errorPenalty > Inbox.MAX_HEALTH_SCORE) {
            throw new IllegalArgumentException("errorPenalty must be within [0, 100]: " + errorPenalty);
        }
        this.smoothingFactor = smoothingFactor;
        this.errorPenalty = errorPenalty;
    }

    public static HealthScorePolicy defaults() {
        return new HealthScorePolicy(DEFAULT_SMOOTHING_FACTOR, DEFAULT_ERROR_PENALTY);
    }

    public int afterSuccess(int current) {
        if (current >= Inbox.MAX_HEALTH_SCORE) {
            return Inbox.MAX_HEALTH_SCORE;
        }
        long step = Math.max(1L, Math.round(smoothingFactor * (Inbox.MAX_HEALTH_SCORE - current)));
        return (int) Math.min(Inbox.MAX_HEALTH_SCORE, current + step);
    }

    public int afterError(int current) {
        return Math.max(0, current - errorPenalty);
    }

    /**
     * Returns the penalty of a cleared error streak.
     */
    public int afterStreakCleared(int current, int clearedErrors) {
        long restored = (long) current + (long) errorPenalty * Math.max(0, clearedErrors);
        return (int) Math.min(Inbox.MAX_HEALTH_SCORE, restored);
    }

    public int afterPermanentFailure() {
        return 0;
    }

    public double smoothingFactor() {
        return smoothingFactor;
    }

    public int errorPenalty() {
        return errorPenalty;
    }
}
