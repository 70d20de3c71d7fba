package com.example.guestcode.service;

import com.example.guestcode.model.AccessWindow;
import com.example.guestcode.model.Booking;
import com.example.guestcode.model.ResolutionMode;
import com.example.guestcode.model.StayResolution;
import com.example.guestcode.model.StayRules;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the one stay that the guest code should follow today and turns it into
 * an absolute window. No I/O.
 */
@Component
public class StayIntervalResolver {

    public StayResolution resolve(Collection<Booking> bookings, LocalDate today, StayRules rules) {
        boolean turnover = rules.mode() == ResolutionMode.ARRIVAL_DAY_WITH_TURNOVER
                && isTurnoverDay(bookings, today);

        // a current stay ranks 0 days away, so it always beats a future one;
        // ties keep sheet order
        Optional<Booking> chosen = bookings.stream()
                .filter(booking -> isCandidate(booking, today, rules.mode()))
                .min(Comparator.comparingLong((Booking booking) -> booking.daysUntilArrival(today))
                        .thenComparing(Booking::arrival));

        return chosen
                .map(booking -> new StayResolution(windowFor(booking, rules), booking, turnover))
                .orElseGet(() -> StayResolution.none(turnover));
    }

    /**
     * Arrival date at check-in to departure date at check-out in the unit's zone.
     * An end not after the start is pushed one day later.
     */
    public AccessWindow windowFor(Booking booking, StayRules rules) {
        ZonedDateTime start = booking.arrival().atTime(rules.checkinTime()).atZone(rules.zone());
        ZonedDateTime end = booking.departure().atTime(rules.checkoutTime()).atZone(rules.zone());
        if (!end.isAfter(start)) {
            end = end.plusDays(1);
        }
        return AccessWindow.of(start.toInstant(), end.toInstant());
    }

    /** One stay ends and another begins on {@code day}. */
    public boolean isTurnoverDay(Collection<Booking> bookings, LocalDate day) {
        boolean departure = bookings.stream().anyMatch(booking -> booking.departsOn(day));
        boolean arrival = bookings.stream().anyMatch(booking -> booking.arrivesOn(day));
        return departure && arrival;
    }

    private boolean isCandidate(Booking booking, LocalDate today, ResolutionMode mode) {
        return switch (mode) {
            case CURRENT_OR_NEXT -> booking.isCurrentOn(today) || booking.isFutureOn(today);
            case ARRIVAL_DAY_WITH_TURNOVER -> booking.isCurrentOn(today) || booking.arrivesOn(today);
        };
    }
}
