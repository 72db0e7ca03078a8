package io.github.hotbrkm.inviteengine.agent.invite.schedule.registry;

import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.InboxState;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SendErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.MONDAY_MORNING;
import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.inbox;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InboxRegistry state machine test")
class InboxRegistryTest {

    private final InboxRegistry registry = new InboxRegistry();
    private final SchedulingSettings settings = SchedulingSettings.defaults();

    @Nested
    @DisplayName("Derived state")
    class DerivedState {

        @Test
        @DisplayName("Precedence is DISABLED, PAUSED, QUOTA_EXHAUSTED, COOLDOWN, UNHEALTHY, ACTIVE")
        void statePrecedence() {
            Inbox inbox = inbox("inbox-1", 1);
            inbox.setActive(false);
            inbox.setPausedReason("errors");
            inbox.setSentToday(1);
            inbox.setCooldownUntil(MONDAY_MORNING.plus(Duration.ofMinutes(5)));
            inbox.setHealthScore(10);
            assertThat(registry.stateOf(inbox, settings, MONDAY_MORNING)).isEqualTo(InboxState.DISABLED);

            inbox.setActive(true);
            assertThat(registry.stateOf(inbox, settings, MONDAY_MORNING)).isEqualTo(InboxState.PAUSED);

            inbox.setPausedReason(null);
            assertThat(registry.stateOf(inbox, settings, MONDAY_MORNING)).isEqualTo(InboxState.QUOTA_EXHAUSTED);

            inbox.setSentToday(0);
            assertThat(registry.stateOf(inbox, settings, MONDAY_MORNING)).isEqualTo(InboxState.COOLDOWN);

            inbox.setCooldownUntil(null);
            assertThat(registry.stateOf(inbox, settings, MONDAY_MORNING)).isEqualTo(InboxState.UNHEALTHY);

            inbox.setHealthScore(70);
            assertThat(registry.stateOf(inbox, settings, MONDAY_MORNING)).isEqualTo(InboxState.ACTIVE);
        }

        @Test
        @DisplayName("Weekly quota excludes an inbox that still has daily quota")
        void weeklyQuota_exhausts() {
            Inbox inbox = Inbox.builder().id("inbox-1").dailyQuota(10).weeklyQuota(2).sentThisWeek(2).build();

            assertThat(registry.stateOf(inbox, settings, MONDAY_MORNING)).isEqualTo(InboxState.QUOTA_EXHAUSTED);

            registry.resetWeekly(inbox);
            assertThat(registry.isAvailable(inbox, settings, MONDAY_MORNING)).isTrue();
        }
    }

    @Nested
    @DisplayName("Sends and quota")
    class Sends {

        @Test
        @DisplayName("markSent counts the send, starts the cooldown and raises health")
        void markSent_updatesInbox() {
            Inbox inbox = inbox("inbox-1", 5);
            inbox.setHealthScore(80);

            registry.markSent(inbox, MONDAY_MORNING, 30);

            assertThat(inbox.getSentToday()).isEqualTo(1);
            assertThat(inbox.getSentThisWeek()).isEqualTo(1);
            assertThat(inbox.getLastUsedAt()).isEqualTo(MONDAY_MORNING);
            assertThat(inbox.getCooldownUntil()).isEqualTo(MONDAY_MORNING.plus(Duration.ofMinutes(30)));
            assertThat(inbox.getHealthScore()).isEqualTo(84);
        }

        @Test
        @DisplayName("Cooldown is respected until it ends")
        void cooldown_respected() {
            Inbox inbox = inbox("inbox-1", 5);
            registry.markSent(inbox, MONDAY_MORNING, 30);

            assertThat(registry.isAvailable(inbox, settings, MONDAY_MORNING.plus(Duration.ofMinutes(29)))).isFalse();
            assertThat(registry.isAvailable(inbox, settings, MONDAY_MORNING.plus(Duration.ofMinutes(30)))).isTrue();
        }

        @Test
        @DisplayName("Sending past the daily quota is refused")
        void markSent_pastQuota_throws() {
            Inbox inbox = inbox("inbox-1", 1);
            registry.markSent(inbox, MONDAY_MORNING, 0);

            assertThatThrownBy(() -> registry.markSent(inbox, MONDAY_MORNING, 0))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(inbox.getSentToday()).isEqualTo(1);
        }

        @Test
        @DisplayName("Provisional quota can be returned")
        void consumeAndReleaseQuota() {
            Inbox inbox = inbox("inbox-1", 2);

            registry.consumeQuota(inbox);
            registry.consumeQuota(inbox);
            assertThat(inbox.isDailyQuotaExhausted()).isTrue();

            registry.releaseQuota(inbox);
            assertThat(inbox.getSentToday()).isEqualTo(1);
            assertThat(inbox.getSentThisWeek()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Errors and recovery")
    class Errors {

        @Test
        @DisplayName("Third consecutive transient error pauses the inbox")
        void transientErrors_pauseAtThreshold() {
            Inbox inbox = inbox("inbox-1", 5);

            assertThat(registry.markError(inbox, SendErrorKind.TRANSIENT, settings, "timeout")).isFalse();
            assertThat(registry.markError(inbox, SendErrorKind.TRANSIENT, settings, "timeout")).isFalse();
            assertThat(registry.markError(inbox, SendErrorKind.TRANSIENT, settings, "timeout")).isTrue();

            assertThat(inbox.getConsecutiveErrorCount()).isEqualTo(3);
            assertThat(inbox.isPaused()).isTrue();
            assertThat(inbox.getHealthScore()).isEqualTo(70);
            assertThat(registry.stateOf(inbox, settings, MONDAY_MORNING)).isEqualTo(InboxState.PAUSED);
        }

        @Test
        @DisplayName("Two transient errors keep the inbox above the default health threshold")
        void twoErrors_stillAvailable() {
            Inbox inbox = inbox("inbox-1", 5);

            registry.markError(inbox, SendErrorKind.TRANSIENT, settings, "timeout");
            registry.markError(inbox, SendErrorKind.TRANSIENT, settings, "timeout");

            assertThat(inbox.getHealthScore()).isEqualTo(80);
            assertThat(inbox.isPaused()).isFalse();
            assertThat(registry.isAvailable(inbox, settings, MONDAY_MORNING)).isTrue();
        }

        @Test
        @DisplayName("Resume after a pause returns the inbox to ACTIVE")
        void resume_afterPause_isActive() {
            Inbox inbox = inbox("inbox-1", 5);
            for (int i = 0; i < 3; i++) {
                registry.markError(inbox, SendErrorKind.TRANSIENT, settings, "timeout");
            }

            registry.resume(inbox);

            assertThat(inbox.getHealthScore()).isEqualTo(Inbox.MAX_HEALTH_SCORE);
            assertThat(registry.stateOf(inbox, settings, MONDAY_MORNING)).isEqualTo(InboxState.ACTIVE);
            assertThat(registry.nextAvailableAt(inbox, settings, MONDAY_MORNING)).contains(MONDAY_MORNING);
        }

        @Test
        @DisplayName("Success resets the error streak")
        void success_resetsStreak() {
            Inbox inbox = inbox("inbox-1", 5);
            registry.markError(inbox, SendErrorKind.TRANSIENT, settings, "timeout");
            registry.markError(inbox, SendErrorKind.TRANSIENT, settings, "timeout");

            registry.markSent(inbox, MONDAY_MORNING, 0);
            registry.markError(inbox, SendErrorKind.TRANSIENT, settings, "timeout");

            assertThat(inbox.getConsecutiveErrorCount()).isEqualTo(1);
            assertThat(inbox.isPaused()).isFalse();
        }

        @Test
        @DisplayName("Permanent error disables the inbox and zeroes health")
        void permanentError_disables() {
            Inbox inbox = inbox("inbox-1", 5);

            boolean changed = registry.markError(inbox, SendErrorKind.PERMANENT, settings, "token revoked");

            assertThat(changed).isTrue();
            assertThat(inbox.isActive()).isFalse();
            assertThat(inbox.getDisabledReason()).isEqualTo("token revoked");
            assertThat(inbox.getHealthScore()).isZero();
        }

        @Test
        @DisplayName("Resume clears the pause but does not re-enable a disabled inbox")
        void resume_clearsPauseOnly() {
            Inbox paused = inbox("inbox-1", 5);
            paused.setPausedReason("errors");
            paused.setConsecutiveErrorCount(3);
            Inbox disabled = inbox("inbox-2", 5);
            disabled.setActive(false);

            registry.resume(paused);
            registry.resume(disabled);

            assertThat(paused.isPaused()).isFalse();
            assertThat(paused.getConsecutiveErrorCount()).isZero();
            assertThat(registry.stateOf(disabled, settings, MONDAY_MORNING)).isEqualTo(InboxState.DISABLED);
        }
    }

    @Nested
    @DisplayName("Resets and availability estimate")
    class Resets {

        @Test
        @DisplayName("Daily reset is idempotent per boundary date")
        void resetDaily_idempotent() {
            LocalDate monday = LocalDate.of(2024, 1, 8);
            Inbox inbox = inbox("inbox-1", 10);
            inbox.setSentToday(5);

            assertThat(registry.resetDaily(inbox, monday)).isTrue();
            assertThat(inbox.getSentToday()).isZero();

            inbox.setSentToday(3);
            assertThat(registry.resetDaily(inbox, monday)).isFalse();
            assertThat(inbox.getSentToday()).isEqualTo(3);

            assertThat(registry.resetDaily(inbox, monday.plusDays(1))).isTrue();
            assertThat(inbox.getSentToday()).isZero();
        }

        @Test
        @DisplayName("Daily reset clears an error streak below the pause limit but keeps a paused one")
        void resetDaily_clearsUnpausedStreak() {
            SchedulingSettings strict = SchedulingSettings.defaults().toBuilder().healthThreshold(90).build();
            Inbox unhealthy = inbox("unhealthy", 5);
            registry.markError(unhealthy, SendErrorKind.TRANSIENT, strict, "timeout");
            registry.markError(unhealthy, SendErrorKind.TRANSIENT, strict, "timeout");
            Inbox paused = inbox("paused", 5);
            for (int i = 0; i < 3; i++) {
                registry.markError(paused, SendErrorKind.TRANSIENT, strict, "timeout");
            }
            assertThat(registry.stateOf(unhealthy, strict, MONDAY_MORNING)).isEqualTo(InboxState.UNHEALTHY);
            assertThat(registry.nextAvailableAt(unhealthy, strict, MONDAY_MORNING))
                    .contains(Instant.parse("2024-01-09T00:00:00Z"));

            registry.resetDaily(unhealthy, LocalDate.of(2024, 1, 9));
            registry.resetDaily(paused, LocalDate.of(2024, 1, 9));

            assertThat(registry.stateOf(unhealthy, strict, MONDAY_MORNING)).isEqualTo(InboxState.ACTIVE);
            assertThat(paused.getConsecutiveErrorCount()).isEqualTo(3);
            assertThat(registry.stateOf(paused, strict, MONDAY_MORNING)).isEqualTo(InboxState.PAUSED);
        }

        @Test
        @DisplayName("Next availability follows cooldown, quota boundary or operator action")
        void nextAvailableAt() {
            Inbox cooling = inbox("cooling", 5);
            cooling.setCooldownUntil(MONDAY_MORNING.plus(Duration.ofMinutes(10)));
            Inbox exhausted = inbox("exhausted", 1);
            exhausted.setSentToday(1);
            Inbox paused = inbox("paused", 5);
            paused.setPausedReason("errors");

            assertThat(registry.nextAvailableAt(inbox("idle", 5), settings, MONDAY_MORNING)).contains(MONDAY_MORNING);
            assertThat(registry.nextAvailableAt(cooling, settings, MONDAY_MORNING))
                    .contains(MONDAY_MORNING.plus(Duration.ofMinutes(10)));
            assertThat(registry.nextAvailableAt(exhausted, settings, MONDAY_MORNING))
                    .contains(Instant.parse("2024-01-09T00:00:00Z"));
            assertThat(registry.nextAvailableAt(paused, settings, MONDAY_MORNING)).isEmpty();
        }

        @Test
        @DisplayName("Usage stats reflect counters and state")
        void usageStats() {
            Inbox inbox = inbox("inbox-1", 10);
            inbox.setSentToday(4);

            InboxUsageStats stats = registry.usageStats(inbox, settings, MONDAY_MORNING);

            assertThat(stats.inboxId()).isEqualTo("inbox-1");
            assertThat(stats.state()).isEqualTo(InboxState.ACTIVE);
            assertThat(stats.remainingToday()).isEqualTo(6);
            assertThat(stats.nextAvailableAt()).isEqualTo(MONDAY_MORNING);
        }
    }
}
