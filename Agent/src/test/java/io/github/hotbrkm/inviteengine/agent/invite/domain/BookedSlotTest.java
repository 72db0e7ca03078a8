package io.github.hotbrkm.inviteengine.agent.invite.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.MONDAY_MORNING;
import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.slot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BookedSlot status and reschedule test")
class BookedSlotTest {

    @Nested
    @DisplayName("Status transitions")
    class Transitions {

        @Test
        @DisplayName("Occupying statuses are PENDING, SENT, ACCEPTED and TENTATIVE")
        void occupyingStatuses() {
            assertThat(SlotStatus.PENDING.isOccupying()).isTrue();
            assertThat(SlotStatus.SENT.isOccupying()).isTrue();
            assertThat(SlotStatus.ACCEPTED.isOccupying()).isTrue();
            assertThat(SlotStatus.TENTATIVE.isOccupying()).isTrue();
            assertThat(SlotStatus.DECLINED.isOccupying()).isFalse();
            assertThat(SlotStatus.NEEDS_ATTENTION.isOccupying()).isFalse();
            assertThat(SlotStatus.CANCELED.isOccupying()).isFalse();
        }

        @Test
        @DisplayName("RSVP only applies after the invite was sent")
        void rsvpRequiresSent() {
            BookedSlot pending = slot("inbox-1", MONDAY_MORNING.plus(Duration.ofDays(2)));

            assertThatThrownBy(() -> pending.transitionTo(SlotStatus.ACCEPTED, null, MONDAY_MORNING))
                    .isInstanceOf(InvalidSlotTransitionException.class);

            pending.transitionTo(SlotStatus.SENT, null, MONDAY_MORNING);
            pending.transitionTo(SlotStatus.TENTATIVE, null, MONDAY_MORNING);
            pending.transitionTo(SlotStatus.ACCEPTED, null, MONDAY_MORNING);
            assertThat(pending.getStatus()).isEqualTo(SlotStatus.ACCEPTED);
        }

        @Test
        @DisplayName("Canceled is final")
        void canceledIsFinal() {
            BookedSlot slot = slot("inbox-1", MONDAY_MORNING.plus(Duration.ofDays(2)));
            slot.transitionTo(SlotStatus.CANCELED, "user request", MONDAY_MORNING);

            assertThat(slot.getStatusReason()).isEqualTo("user request");
            assertThatThrownBy(() -> slot.transitionTo(SlotStatus.PENDING, null, MONDAY_MORNING))
                    .isInstanceOf(InvalidSlotTransitionException.class);
            assertThatThrownBy(() -> slot.reschedule(MONDAY_MORNING.plus(Duration.ofDays(3)), 3, false, MONDAY_MORNING))
                    .isInstanceOf(InvalidSlotTransitionException.class);
        }
    }

    @Nested
    @DisplayName("Reschedule bookkeeping")
    class Reschedule {

        @Test
        @DisplayName("Original time is kept from the first reschedule and the counter grows")
        void reschedule_keepsOriginalTime() {
            Instant first = MONDAY_MORNING.plus(Duration.ofDays(2));
            Instant second = first.plus(Duration.ofHours(1));
            Instant third = second.plus(Duration.ofHours(1));
            BookedSlot slot = slot("inbox-1", first);

            slot.reschedule(second, 2, false, MONDAY_MORNING);
            slot.reschedule(third, 2, true, MONDAY_MORNING);

            assertThat(slot.getScheduledTimeUtc()).isEqualTo(third);
            assertThat(slot.getOriginalScheduledTimeUtc()).isEqualTo(first);
            assertThat(slot.getRescheduledCount()).isEqualTo(2);
            assertThat(slot.isWasDoubleBooked()).isTrue();
            assertThat(slot.getStatus()).isEqualTo(SlotStatus.PENDING);
        }

        @Test
        @DisplayName("A slot needing attention returns to PENDING when rescheduled")
        void reschedule_fromNeedsAttention_returnsToPending() {
            BookedSlot slot = slot("inbox-1", MONDAY_MORNING.plus(Duration.ofDays(2)), SlotStatus.NEEDS_ATTENTION);

            slot.reschedule(MONDAY_MORNING.plus(Duration.ofDays(3)), 3, false, MONDAY_MORNING);

            assertThat(slot.getStatus()).isEqualTo(SlotStatus.PENDING);
            assertThat(slot.getStatusReason()).isNull();
        }
    }
}
