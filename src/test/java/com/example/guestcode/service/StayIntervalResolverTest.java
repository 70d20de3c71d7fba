package com.example.guestcode.service;

import com.example.guestcode.model.AccessWindow;
import com.example.guestcode.model.Booking;
import com.example.guestcode.model.ResolutionMode;
import com.example.guestcode.model.StayResolution;
import com.example.guestcode.model.StayRules;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StayIntervalResolverTest {

    private static final ZoneId AMSTERDAM = ZoneId.of("Europe/Amsterdam");
    private static final StayRules NEXT = rules(ResolutionMode.CURRENT_OR_NEXT);
    private static final StayRules ARRIVAL_DAY = rules(ResolutionMode.ARRIVAL_DAY_WITH_TURNOVER);

    private final StayIntervalResolver resolver = new StayIntervalResolver();

    @Test
    void shouldPickSoonestFutureBooking() {
        List<Booking> bookings = List.of(
                booking("2025-06-15", "2025-06-18"),
                booking("2025-06-10", "2025-06-12"));

        StayResolution resolution = resolver.resolve(bookings, LocalDate.parse("2025-06-01"), NEXT);

        assertThat(resolution.booking()).isEqualTo(booking("2025-06-10", "2025-06-12"));
    }

    @Test
    void shouldPreferCurrentStayOverAnyFutureOne() {
        List<Booking> bookings = List.of(
                booking("2025-06-05", "2025-06-06"),
                booking("2025-05-28", "2025-06-04"),
                booking("2025-06-02", "2025-06-03"));

        StayResolution resolution = resolver.resolve(bookings, LocalDate.parse("2025-06-01"), NEXT);

        assertThat(resolution.booking()).isEqualTo(booking("2025-05-28", "2025-06-04"));
        assertThat(resolution.window()).isEqualTo(AccessWindow.of(
                local("2025-05-28T15:00"), local("2025-06-04T11:00")));
    }

    @Test
    void shouldUseArrivalAtCheckinAndDepartureAtCheckout() {
        StayResolution resolution = resolver.resolve(
                List.of(booking("2025-06-10", "2025-06-12")), LocalDate.parse("2025-06-01"), NEXT);

        AccessWindow window = resolution.window();
        assertThat(window.start()).isEqualTo(local("2025-06-10T15:00"));
        assertThat(window.end()).isEqualTo(local("2025-06-12T11:00"));
        assertThat(window.start()).isEqualTo(Instant.parse("2025-06-10T13:00:00Z"));
    }

    @Test
    void shouldFollowDaylightSavingChangeWithinStay() {
        StayResolution resolution = resolver.resolve(
                List.of(booking("2025-03-29", "2025-03-31")), LocalDate.parse("2025-03-29"), NEXT);

        assertThat(resolution.window().start()).isEqualTo(Instant.parse("2025-03-29T14:00:00Z"));
        assertThat(resolution.window().end()).isEqualTo(Instant.parse("2025-03-31T09:00:00Z"));
    }

    @Test
    void shouldTreatDepartureDayAsOver() {
        StayResolution resolution = resolver.resolve(
                List.of(booking("2025-05-28", "2025-06-01")), LocalDate.parse("2025-06-01"), NEXT);

        assertThat(resolution.hasStay()).isFalse();
        assertThat(resolution.window().isAbsent()).isTrue();
    }

    @Test
    void shouldReturnAbsentWithoutCurrentOrFutureBookings() {
        StayResolution resolution = resolver.resolve(
                List.of(booking("2025-05-01", "2025-05-03")), LocalDate.parse("2025-06-01"), NEXT);

        assertThat(resolution.window()).isEqualTo(AccessWindow.ABSENT);
        assertThat(resolver.resolve(List.of(), LocalDate.parse("2025-06-01"), NEXT).hasStay()).isFalse();
    }

    @Test
    void shouldKeepSheetOrderOnFullTie() {
        Booking first = booking("2025-06-10", "2025-06-12");
        Booking second = booking("2025-06-10", "2025-06-14");

        StayResolution resolution = resolver.resolve(List.of(first, second), LocalDate.parse("2025-06-01"), NEXT);

        assertThat(resolution.booking()).isSameAs(first);
    }

    @Test
    void shouldIgnoreLaterArrivalsInArrivalDayMode() {
        StayResolution resolution = resolver.resolve(
                List.of(booking("2025-06-10", "2025-06-12")), LocalDate.parse("2025-06-01"), ARRIVAL_DAY);

        assertThat(resolution.hasStay()).isFalse();
        assertThat(resolution.turnover()).isFalse();
    }

    @Test
    void shouldFlagTurnoverAndActivateArrivingStay() {
        List<Booking> bookings = List.of(
                booking("2025-05-28", "2025-06-01"),
                booking("2025-06-01", "2025-06-05"));

        StayResolution resolution = resolver.resolve(bookings, LocalDate.parse("2025-06-01"), ARRIVAL_DAY);

        assertThat(resolution.turnover()).isTrue();
        assertThat(resolution.booking()).isEqualTo(booking("2025-06-01", "2025-06-05"));
    }

    @Test
    void shouldNotFlagTurnoverInDefaultMode() {
        List<Booking> bookings = List.of(
                booking("2025-05-28", "2025-06-01"),
                booking("2025-06-01", "2025-06-05"));

        assertThat(resolver.resolve(bookings, LocalDate.parse("2025-06-01"), NEXT).turnover()).isFalse();
    }

    private static StayRules rules(ResolutionMode mode) {
        return new StayRules(LocalTime.of(15, 0), LocalTime.of(11, 0), AMSTERDAM, mode);
    }

    private static Booking booking(String arrival, String departure) {
        return new Booking(LocalDate.parse(arrival), LocalDate.parse(departure));
    }

    private static Instant local(String dateTime) {
        return LocalDateTime.parse(dateTime).atZone(AMSTERDAM).toInstant();
    }
}
