package io.github.hotbrkm.inviteengine.agent.invite.send.queue;

/**
 * Exponential backoff between send attempts of one recipient.
 *
 * @param initialDelayMillis delay before the second attempt
 * @param maxDelayMillis     upper bound for any delay
 * @param multiplier         growth factor per attempt
 */
public record RetryBackoffPolicy(long initialDelayMillis, long maxDelayMillis, double multiplier) {

    public static final long DEFAULT_INITIAL_DELAY_MS = 1_000L;
    public static final long DEFAULT_MAX_DELAY_MS = 30_000L;
    public static final double DEFAULT_MULTIPLIER = 2.0d;

    public RetryBackoffPolicy {
        if (initialDelayMillis < 0 || maxDelayMillis < 0) {
            throw new IllegalArgumentException("retry delays must not be negative");
        }
        if (multiplier < 1.0d) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
    }

    public static RetryBackoffPolicy defaults() {
        return new RetryBackoffPolicy(DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS, DEFAULT_MULTIPLIER);
    }

    /**
     * initial x multiplier^(retryCount-1), capped at the maximum.
     */
    public long computeDelayMillis(int retryCount) {
        if (retryCount <= 1) {
            return Math.min(initialDelayMillis, maxDelayMillis);
        }
        double factor = Math.pow(multiplier, retryCount - 1);
        long candidate = (long) (initialDelayMillis * factor);
        if (candidate < 0L) {
            candidate = Long.MAX_VALUE;
        }
        return Math.min(candidate, maxDelayMillis);
    }
}
