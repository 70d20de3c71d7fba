package com.example.guestcode.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One calendar row of the booking sheet. Rows with {@code departure <= arrival}
 * never make it this far, the constructor rejects them.
 */
public record Booking(LocalDate arrival, LocalDate departure) {

    public Booking {
        Objects.requireNonNull(arrival, "arrival");
        Objects.requireNonNull(departure, "departure");
        if (!departure.isAfter(arrival)) {
            throw new IllegalArgumentException("departure " + departure + " is not after arrival " + arrival);
        }
    }

    /** Guest is in the unit on {@code day}: {@code arrival <= day < departure}. */
    public boolean isCurrentOn(LocalDate day) {
        return !arrival.isAfter(day) && day.isBefore(departure);
    }

    /** Stay has not started before {@code day}: {@code arrival >= day}. */
    public boolean isFutureOn(LocalDate day) {
        return !arrival.isBefore(day);
    }

    public boolean arrivesOn(LocalDate day) {
        return arrival.equals(day);
    }

    public boolean departsOn(LocalDate day) {
        return departure.equals(day);
    }

    /** Zero for a current stay, otherwise the number of days until arrival. */
    public long daysUntilArrival(LocalDate day) {
        if (isCurrentOn(day)) {
            return 0;
        }
        return ChronoUnit.DAYS.between(day, arrival);
    }
}
