package io.github.hotbrkm.inviteengine.agent.invite.send.engine.metrics;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counter bucketed into fixed-size time windows.
 * <p>
 * Thread-safe; each window is a {@link LongAdder} so concurrent senders never contend on one value.
 * Windows older than the retention count are dropped by {@link #evict()}.
 */
class TimeWindowCounter {

    private final ConcurrentHashMap<Long, LongAdder> windows = new ConcurrentHashMap<>();
    private final int retentionWindows;
    private final int windowSeconds;
    private final Clock clock;

    /**
     * @param retentionWindows Number of windows to retain
     * @param windowSeconds    Size of one window (seconds)
     * @param clock            Source of the current window
     */
    TimeWindowCounter(int retentionWindows, int windowSeconds, Clock clock) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive: " + windowSeconds);
        }
        this.retentionWindows = retentionWindows;
        this.windowSeconds = windowSeconds;
        this.clock = clock;
    }

    void record(long count) {
        if (count <= 0) {
            return;
        }
        windows.computeIfAbsent(currentWindowKey(), k -> new LongAdder()).add(count);
    }

    /**
     * Sum of the last {@code windows} windows, the current one included.
     */
    long sumRange(int windows) {
        if (windows <= 0) {
            return 0;
        }
        long now = currentWindowKey();
        long total = 0;
        for (long t = now - windows + 1; t <= now; t++) {
            LongAdder adder = this.windows.get(t);
            if (adder != null) {
                total += adder.sum();
            }
        }
        return total;
    }

    void evict() {
        long cutoff = currentWindowKey() - retentionWindows;
        windows.keySet().removeIf(key -> key < cutoff);
    }

    int windowCount() {
        return windows.size();
    }

    private long currentWindowKey() {
        return clock.millis() / 1000 / windowSeconds;
    }
}
