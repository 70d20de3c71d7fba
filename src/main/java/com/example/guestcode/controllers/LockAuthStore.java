package com.example.guestcode.controllers;

import com.example.guestcode.dto.SmartlockAuthDTO;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface LockAuthStore {

    /** Bitmask for Monday..Sunday. */
    int ALL_WEEKDAYS = 127;

    /** Every authorization of the lock, empty when the backend returns none. */
    List<SmartlockAuthDTO> list(long lockId);

    /**
     * Creates a keypad code. An "already exists" answer is accepted.
     *
     * @return the created authorization if the backend returned one, otherwise empty and the
     * caller has to look it up again
     */
    Optional<SmartlockAuthDTO> create(long lockId, String name, int pin, int weekdayMask);

    /** Sets the time window of an authorization; {@code null} bounds clear it. */
    void setWindow(long lockId, String authId, Instant start, Instant end);

    /** Asks the backend to push pending changes to the device. */
    void forceSync(long lockId);
}
