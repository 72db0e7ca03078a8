package io.github.hotbrkm.inviteengine.agent.invite.send.engine.metrics;

/**
 * Send activity of one inbox over a recent period.
 *
 * @param inboxId               Inbox id
 * @param durationSeconds       Aggregation duration (seconds)
 * @param successCount          Invites delivered to the transport
 * @param transientFailureCount Retryable transport failures
 * @param permanentFailureCount Non-retryable transport failures
 * @param retryCount            Retries scheduled after a failure on this inbox
 * @param lockTimeoutCount      Reservations that gave up waiting for the inbox lock
 * @param totalSendTimeMs       Total transport call time (ms)
 * @param sendTimeSampleCount   Transport call time sample count
 */
public record InboxMetricSnapshot(String inboxId, int durationSeconds, long successCount, long transientFailureCount,
        long permanentFailureCount, long retryCount, long lockTimeoutCount, long totalSendTimeMs,
        long sendTimeSampleCount) {

    public long failureCount() {
        return transientFailureCount + permanentFailureCount;
    }

    /**
     * Share of failed attempts, 0.0 when nothing was sent.
     */
    public double failureRate() {
        long attempts = successCount + failureCount();
        if (attempts == 0) {
            return 0.0;
        }
        return (double) failureCount() / attempts;
    }

    public double avgSendTimeMs() {
        if (sendTimeSampleCount == 0) {
            return 0.0;
        }
        return (double) totalSendTimeMs / sendTimeSampleCount;
    }
}
