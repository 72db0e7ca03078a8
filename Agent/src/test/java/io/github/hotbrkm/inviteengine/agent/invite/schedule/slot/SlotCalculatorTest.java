package io.github.hotbrkm.inviteengine.agent.invite.schedule.slot;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.FallbackPolicy;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingConfigurationException;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SchedulingSettings;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SlotStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.MONDAY_MORNING;
import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.WEDNESDAY;
import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.gridOf;
import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.singleDaySettings;
import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.slot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SlotCalculator test")
class SlotCalculatorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    private final SlotCalculator calculator = new SlotCalculator(new Random(42L));

    @Nested
    @DisplayName("Free slot search")
    class FreeSlots {

        @Test
        @DisplayName("Slot lies within lead-time window, preferred hours and grid")
        void computeSlot_respectsWindow() {
            SlotComputation result = calculator.computeSlot(SchedulingSettings.defaults(), "UTC", MONDAY_MORNING, List.of());

            ZonedDateTime local = result.timeUtc().atZone(UTC);
            assertThat(result.isAvailable()).isTrue();
            assertThat(result.wasDoubleBooked()).isFalse();
            assertThat(result.flaggedForReview()).isFalse();
            assertThat(local.toLocalDate()).isBetween(WEDNESDAY, LocalDate.of(2024, 1, 16));
            assertThat(local.getHour()).isBetween(12, 15);
            assertThat(local.getMinute() % 15).isZero();
            assertThat(result.leadTimeDays()).isBetween(2, 6);
        }

        @Test
        @DisplayName("Slot follows the recipient's local business hours")
        void computeSlot_usesRecipientZone() {
            ZoneId tokyo = ZoneId.of("Asia/Tokyo");

            SlotComputation result = calculator.computeSlot(SchedulingSettings.defaults(), "Asia/Tokyo", MONDAY_MORNING, List.of());

            assertThat(result.zone()).isEqualTo(tokyo);
            assertThat(result.timeUtc().atZone(tokyo).getHour()).isBetween(12, 15);
        }

        @Test
        @DisplayName("Friday request with two lead days lands on Tuesday or later")
        void computeSlot_fromFriday_skipsWeekend() {
            Instant fridayMorning = Instant.parse("2024-01-12T09:00:00Z");

            SlotComputation result = calculator.computeSlot(singleDaySettings(), "UTC", fridayMorning, List.of());

            assertThat(result.timeUtc().atZone(UTC).toLocalDate()).isEqualTo(LocalDate.of(2024, 1, 16));
            assertThat(result.leadTimeDays()).isEqualTo(2);
        }

        @Test
        @DisplayName("Friday request with a two to six day lead lands on a business day from Tuesday through the sixth")
        void computeSlot_fromFriday_fullLeadWindow() {
            Instant fridayMorning = Instant.parse("2024-01-12T09:00:00Z");
            SchedulingSettings settings = SchedulingSettings.defaults();

            for (long seed = 1; seed <= 25; seed++) {
                SlotComputation result = new SlotCalculator(new Random(seed))
                        .computeSlot(settings, "UTC", fridayMorning, List.of());

                LocalDate date = result.timeUtc().atZone(UTC).toLocalDate();
                assertThat(date).isBetween(LocalDate.of(2024, 1, 16), LocalDate.of(2024, 1, 22));
                assertThat(date.getDayOfWeek()).isNotIn(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
                assertThat(result.leadTimeDays()).isBetween(2, 6);
            }
        }

        @Test
        @DisplayName("Repeated scheduling never double books by default")
        void computeSlot_neverDoubleBooks() {
            SchedulingSettings settings = SchedulingSettings.defaults();
            List<BookedSlot> bookings = new ArrayList<>();
            Set<Instant> instants = new HashSet<>();

            for (int i = 0; i < 40; i++) {
                SlotComputation result = calculator.computeSlot(settings, "UTC", MONDAY_MORNING, bookings);
                assertThat(result.isAvailable()).isTrue();
                assertThat(result.wasDoubleBooked()).isFalse();
                instants.add(result.timeUtc());
                bookings.add(slot("inbox-1", result.timeUtc()));
            }

            assertThat(instants).hasSize(40);
        }

        @Test
        @DisplayName("Canceled and declined slots do not block an instant")
        void computeSlot_ignoresNonOccupyingSlots() {
            SchedulingSettings settings = singleDaySettings();
            List<BookedSlot> bookings = new ArrayList<>();
            for (Instant instant : gridOf(WEDNESDAY, UTC, settings)) {
                bookings.add(slot("inbox-1", instant, SlotStatus.CANCELED));
                bookings.add(slot("inbox-1", instant, SlotStatus.DECLINED));
            }

            SlotComputation result = calculator.computeSlot(settings, "UTC", MONDAY_MORNING, bookings);

            assertThat(result.isAvailable()).isTrue();
            assertThat(result.wasDoubleBooked()).isFalse();
        }

        @Test
        @DisplayName("Same seed gives the same schedule")
        void computeSlot_seededIsRepeatable() {
            SlotComputation first = new SlotCalculator(new Random(99L))
                    .computeSlot(SchedulingSettings.defaults(), "UTC", MONDAY_MORNING, List.of());
            SlotComputation second = new SlotCalculator(new Random(99L))
                    .computeSlot(SchedulingSettings.defaults(), "UTC", MONDAY_MORNING, List.of());

            assertThat(first).isEqualTo(second);
        }
    }

    @Nested
    @DisplayName("Fully booked window")
    class FullyBooked {

        private List<BookedSlot> fullWednesday(SchedulingSettings settings) {
            return gridOf(WEDNESDAY, UTC, settings).stream().map(instant -> slot("inbox-1", instant)).toList();
        }

        @Test
        @DisplayName("SKIP returns no slot")
        void skip_returnsUnavailable() {
            SchedulingSettings settings = singleDaySettings();

            SlotComputation result = calculator.computeSlot(settings, "UTC", MONDAY_MORNING, fullWednesday(settings));

            assertThat(result.isAvailable()).isFalse();
        }

        @Test
        @DisplayName("FORCE returns a double-booked slot")
        void force_returnsDoubleBooked() {
            SchedulingSettings settings = singleDaySettings().toBuilder().fallbackPolicy(FallbackPolicy.FORCE).build();
            List<BookedSlot> bookings = fullWednesday(settings);

            SlotComputation result = calculator.computeSlot(settings, "UTC", MONDAY_MORNING, bookings);

            assertThat(result.isAvailable()).isTrue();
            assertThat(result.wasDoubleBooked()).isTrue();
            assertThat(result.needsAttention()).isFalse();
            assertThat(gridOf(WEDNESDAY, UTC, settings)).contains(result.timeUtc());
        }

        @Test
        @DisplayName("NEEDS_ATTENTION returns a slot to be parked")
        void needsAttention_returnsParkedSlot() {
            SchedulingSettings settings = singleDaySettings().toBuilder()
                    .fallbackPolicy(FallbackPolicy.NEEDS_ATTENTION)
                    .build();

            SlotComputation result = calculator.computeSlot(settings, "UTC", MONDAY_MORNING, fullWednesday(settings));

            assertThat(result.isAvailable()).isTrue();
            assertThat(result.needsAttention()).isTrue();
        }

        @Test
        @DisplayName("Allowed double booking shares an instant up to the limit")
        void allowDoubleBooking_sharesInstant() {
            SchedulingSettings settings = singleDaySettings().toBuilder()
                    .allowDoubleBooking(true)
                    .maxDoubleBookingsPerSlot(1)
                    .build();
            List<BookedSlot> bookings = new ArrayList<>(fullWednesday(settings));

            SlotComputation shared = calculator.computeSlot(settings, "UTC", MONDAY_MORNING, bookings);
            assertThat(shared.wasDoubleBooked()).isTrue();

            bookings.addAll(fullWednesday(settings));
            SlotComputation exhausted = calculator.computeSlot(settings, "UTC", MONDAY_MORNING, bookings);
            assertThat(exhausted.isAvailable()).isFalse();
        }

        @Test
        @DisplayName("Double booking with zero extra bookings never shares an instant")
        void allowDoubleBooking_zeroExtra_neverShares() {
            SchedulingSettings settings = singleDaySettings().toBuilder()
                    .allowDoubleBooking(true)
                    .maxDoubleBookingsPerSlot(0)
                    .build();

            SlotComputation result = calculator.computeSlot(settings, "UTC", MONDAY_MORNING, fullWednesday(settings));

            assertThat(result.isAvailable()).isFalse();
        }
    }

    @Nested
    @DisplayName("Timezone fallback")
    class TimezoneFallback {

        @Test
        @DisplayName("Invalid recipient zone falls back to the default zone and flags the slot")
        void invalidZone_isFlagged() {
            SchedulingSettings settings = SchedulingSettings.defaults().toBuilder()
                    .defaultTimezone("America/New_York")
                    .build();

            SlotComputation result = calculator.computeSlot(settings, "Mars/Olympus_Mons", MONDAY_MORNING, List.of());

            assertThat(result.flaggedForReview()).isTrue();
            assertThat(result.zone()).isEqualTo(ZoneId.of("America/New_York"));
            assertThat(result.timeUtc().atZone(result.zone()).getHour()).isBetween(12, 15);
        }

        @Test
        @DisplayName("Missing recipient zone is flagged as well")
        void missingZone_isFlagged() {
            SlotComputation result = calculator.computeSlot(SchedulingSettings.defaults(), null, MONDAY_MORNING, List.of());

            assertThat(result.flaggedForReview()).isTrue();
            assertThat(result.zone()).isEqualTo(ZoneId.of("UTC"));
        }
    }

    @Test
    @DisplayName("Free slot listing excludes occupied instants")
    void listFreeSlots_excludesOccupied() {
        SchedulingSettings settings = singleDaySettings();
        Instant taken = gridOf(WEDNESDAY, UTC, settings).get(0);

        List<Instant> free = calculator.listFreeSlots(settings, "UTC", MONDAY_MORNING, List.of(slot("inbox-1", taken)));

        assertThat(free).hasSize(15).doesNotContain(taken).isSorted();
        assertThat(calculator.isFree(taken, List.of(slot("inbox-1", taken)))).isFalse();
        assertThat(calculator.canBook(taken, List.of(slot("inbox-1", taken)), settings, null)).isFalse();
    }

    @Test
    @DisplayName("Invalid settings fail before any computation")
    void invalidSettings_throw() {
        SchedulingSettings settings = SchedulingSettings.defaults().toBuilder().minLeadTimeDays(9).build();

        assertThatThrownBy(() -> calculator.computeSlot(settings, "UTC", MONDAY_MORNING, List.of()))
                .isInstanceOf(SchedulingConfigurationException.class);
    }
}
