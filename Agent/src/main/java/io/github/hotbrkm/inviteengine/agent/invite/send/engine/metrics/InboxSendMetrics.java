package io.github.hotbrkm.inviteengine.agent.invite.send.engine.metrics;

import io.github.hotbrkm.inviteengine.agent.invite.domain.SendErrorKind;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-inbox rolling send metrics.
 * <p>
 * Recording is safe from any worker thread. Old windows are dropped by {@link #evict()}, which the engine runs
 * periodically.
 */
public class InboxSendMetrics {

    private final ConcurrentHashMap<String, InboxCounters> countersByInbox = new ConcurrentHashMap<>();
    private final int retentionWindows;
    private final int windowSeconds;
    private final Clock clock;

    public InboxSendMetrics(int retentionWindows, int windowSeconds) {
        this(retentionWindows, windowSeconds, Clock.systemUTC());
    }

    /**
     * @param retentionWindows Number of windows to retain
     * @param windowSeconds    Size of one window (seconds)
     * @param clock            Clock that drives window rollover
     */
    public InboxSendMetrics(int retentionWindows, int windowSeconds, Clock clock) {
        this.retentionWindows = retentionWindows;
        this.windowSeconds = windowSeconds;
        this.clock = clock;
    }

    public void recordSuccess(String inboxId) {
        getCounters(inboxId).success.record(1);
    }

    public void recordFailure(String inboxId, SendErrorKind kind) {
        InboxCounters counters = getCounters(inboxId);
        if (kind == SendErrorKind.PERMANENT) {
            counters.permanentFailure.record(1);
        } else {
            counters.transientFailure.record(1);
        }
    }

    public void recordRetry(String inboxId) {
        getCounters(inboxId).retry.record(1);
    }

    public void recordLockTimeout(String inboxId) {
        getCounters(inboxId).lockTimeout.record(1);
    }

    public void recordSendTime(String inboxId, long elapsedMs) {
        if (elapsedMs < 0) {
            return;
        }
        InboxCounters counters = getCounters(inboxId);
        counters.sendTimeSum.record(elapsedMs);
        counters.sendTimeCount.record(1);
    }

    /**
     * Returns a snapshot of the last {@code seconds} for one inbox.
     */
    public InboxMetricSnapshot snapshot(String inboxId, int seconds) {
        int windows = Math.max(1, seconds / windowSeconds);
        InboxCounters counters = countersByInbox.get(inboxId);
        if (counters == null) {
            return new InboxMetricSnapshot(inboxId, seconds, 0, 0, 0, 0, 0, 0, 0);
        }
        return buildSnapshot(inboxId, seconds, windows, counters);
    }

    public Map<String, InboxMetricSnapshot> snapshotAll(int seconds) {
        int windows = Math.max(1, seconds / windowSeconds);
        Map<String, InboxMetricSnapshot> result = new HashMap<>();
        countersByInbox.forEach((inboxId, counters) ->
                result.put(inboxId, buildSnapshot(inboxId, seconds, windows, counters)));
        return result;
    }

    public void evict() {
        for (InboxCounters counters : countersByInbox.values()) {
            counters.evict();
        }
        countersByInbox.entrySet().removeIf(e -> e.getValue().isEmpty());
    }

    private InboxCounters getCounters(String inboxId) {
        return countersByInbox.computeIfAbsent(inboxId, k -> new InboxCounters(retentionWindows, windowSeconds, clock));
    }

    private InboxMetricSnapshot buildSnapshot(String inboxId, int durationSeconds, int windows, InboxCounters c) {
        return new InboxMetricSnapshot(inboxId, durationSeconds,
                c.success.sumRange(windows),
                c.transientFailure.sumRange(windows),
                c.permanentFailure.sumRange(windows),
                c.retry.sumRange(windows),
                c.lockTimeout.sumRange(windows),
                c.sendTimeSum.sumRange(windows),
                c.sendTimeCount.sumRange(windows));
    }

    static final class InboxCounters {
        private final TimeWindowCounter success;
        private final TimeWindowCounter transientFailure;
        private final TimeWindowCounter permanentFailure;
        private final TimeWindowCounter retry;
        private final TimeWindowCounter lockTimeout;
        private final TimeWindowCounter sendTimeSum;
        private final TimeWindowCounter sendTimeCount;

        InboxCounters(int retentionWindows, int windowSeconds, Clock clock) {
            this.success = new TimeWindowCounter(retentionWindows, windowSeconds, clock);
            this.transientFailure = new TimeWindowCounter(retentionWindows, windowSeconds, clock);
            this.permanentFailure = new TimeWindowCounter(retentionWindows, windowSeconds, clock);
            this.retry = new TimeWindowCounter(retentionWindows, windowSeconds, clock);
            this.lockTimeout = new TimeWindowCounter(retentionWindows, windowSeconds, clock);
            this.sendTimeSum = new TimeWindowCounter(retentionWindows, windowSeconds, clock);
            this.sendTimeCount = new TimeWindowCounter(retentionWindows, windowSeconds, clock);
        }

        void evict() {
            success.evict();
            transientFailure.evict();
            permanentFailure.evict();
            retry.evict();
            lockTimeout.evict();
            sendTimeSum.evict();
            sendTimeCount.evict();
        }

        boolean isEmpty() {
            return success.windowCount() == 0 && transientFailure.windowCount() == 0
                    && permanentFailure.windowCount() == 0 && retry.windowCount() == 0
                    && lockTimeout.windowCount() == 0 && sendTimeSum.windowCount() == 0
                    && sendTimeCount.windowCount() == 0;
        }
    }
}
