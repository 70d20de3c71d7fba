package com.example.guestcode.model;

/**
 * A named authorization on the lock backend. Only keypad codes
 * ({@link #KEYPAD_CODE}) are ever touched.
 */
public record AuthorizationEntry(String authId, String name, AccessWindow currentWindow, int kind) {

    public static final int KEYPAD_CODE = 13;

    public boolean isKeypadCode() {
        return kind == KEYPAD_CODE;
    }
}
