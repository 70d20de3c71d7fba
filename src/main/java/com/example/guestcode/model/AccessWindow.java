package com.example.guestcode.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Time window of a guest code in UTC. Both bounds {@code null} means absent
 * (code disabled). A lock may report only one bound, such a window is
 * partial: neither absent nor equal to any desired window.
 */
public record AccessWindow(Instant start, Instant end) {

    /** Backend rounding allowance per bound. */
    public static final Duration TOLERANCE = Duration.ofSeconds(60);

    public static final AccessWindow ABSENT = new AccessWindow(null, null);

    public static AccessWindow of(Instant start, Instant end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("window end " + end + " is not after start " + start);
        }
        return new AccessWindow(start, end);
    }

    public boolean isAbsent() {
        return start == null && end == null;
    }

    public boolean isPresent() {
        return start != null && end != null;
    }

    /**
     * Equality used for reconciliation: both absent, or every bound within
     * {@link #TOLERANCE} of the other.
     */
    public boolean matches(AccessWindow other) {
        if (other == null) {
            return false;
        }
        return boundMatches(start, other.start) && boundMatches(end, other.end);
    }

    private static boolean boundMatches(Instant a, Instant b) {
        if (a == null && b == null) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        return Duration.between(a, b).abs().compareTo(TOLERANCE) <= 0;
    }
}
