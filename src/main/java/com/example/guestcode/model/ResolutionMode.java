package com.example.guestcode.model;

/**
 * How the authoritative stay is chosen among the bookings of a unit.
 */
public enum ResolutionMode {

    /** The stay in progress today, otherwise the next one to arrive. */
    CURRENT_OR_NEXT,

    /**
     * Only a stay in progress today or arriving today; later stays leave the
     * code disabled. Also flags turnover days.
     */
    ARRIVAL_DAY_WITH_TURNOVER
}
