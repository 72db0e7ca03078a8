package io.github.hotbrkm.inviteengine.agent.invite.send.engine.metrics;

import io.github.hotbrkm.inviteengine.agent.invite.domain.SendErrorKind;
import io.github.hotbrkm.inviteengine.agent.invite.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.MONDAY_MORNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("InboxSendMetrics test")
class InboxSendMetricsTest {

    private final MutableClock clock = new MutableClock(MONDAY_MORNING);
    private final InboxSendMetrics metrics = new InboxSendMetrics(5, 60, clock);

    @Test
    @DisplayName("Snapshot counts each kind of event separately")
    void snapshot_countsEvents() {
        metrics.recordSuccess("inbox-1");
        metrics.recordFailure("inbox-1", SendErrorKind.TRANSIENT);
        metrics.recordFailure("inbox-1", SendErrorKind.PERMANENT);
        metrics.recordRetry("inbox-1");
        metrics.recordLockTimeout("inbox-1");
        metrics.recordSendTime("inbox-1", 100);
        metrics.recordSendTime("inbox-1", 300);
        metrics.recordSendTime("inbox-1", -5);

        InboxMetricSnapshot snapshot = metrics.snapshot("inbox-1", 60);

        assertThat(snapshot.successCount()).isEqualTo(1);
        assertThat(snapshot.transientFailureCount()).isEqualTo(1);
        assertThat(snapshot.permanentFailureCount()).isEqualTo(1);
        assertThat(snapshot.retryCount()).isEqualTo(1);
        assertThat(snapshot.lockTimeoutCount()).isEqualTo(1);
        assertThat(snapshot.sendTimeSampleCount()).isEqualTo(2);
        assertThat(snapshot.avgSendTimeMs()).isEqualTo(200.0);
        assertThat(snapshot.failureRate()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    @DisplayName("Snapshot covers only the requested number of windows")
    void snapshot_windowed() {
        metrics.recordSuccess("inbox-1");
        clock.advance(Duration.ofSeconds(61));
        metrics.recordSuccess("inbox-1");

        assertThat(metrics.snapshot("inbox-1", 60).successCount()).isEqualTo(1);
        assertThat(metrics.snapshot("inbox-1", 120).successCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Unknown inbox gives an empty snapshot")
    void snapshot_unknownInbox() {
        InboxMetricSnapshot snapshot = metrics.snapshot("missing", 60);

        assertThat(snapshot.successCount()).isZero();
        assertThat(snapshot.failureRate()).isZero();
        assertThat(snapshot.avgSendTimeMs()).isZero();
    }

    @Test
    @DisplayName("Eviction drops windows past retention and forgets idle inboxes")
    void evict_dropsOldWindows() {
        metrics.recordSuccess("inbox-1");
        metrics.recordSuccess("inbox-2");
        assertThat(metrics.snapshotAll(60)).containsOnlyKeys("inbox-1", "inbox-2");

        clock.advance(Duration.ofMinutes(10));
        metrics.recordSuccess("inbox-2");
        metrics.evict();

        assertThat(metrics.snapshotAll(60)).containsOnlyKeys("inbox-2");
        assertThat(metrics.snapshot("inbox-2", 600).successCount()).isEqualTo(1);
    }
}
