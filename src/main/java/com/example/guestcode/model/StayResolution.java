package com.example.guestcode.model;

/**
 * Result of resolving a unit's bookings for one day. {@code booking} is
 * {@code null} when {@code window} is absent.
 */
public record StayResolution(AccessWindow window, Booking booking, boolean turnover) {

    public static StayResolution none(boolean turnover) {
        return new StayResolution(AccessWindow.ABSENT, null, turnover);
    }

    public boolean hasStay() {
        return booking != null;
    }
}
