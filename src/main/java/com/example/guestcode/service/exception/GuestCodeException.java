package com.example.guestcode.service.exception;

public class GuestCodeException extends RuntimeException {

    public GuestCodeException(String message) {
        super(message);
    }

    public GuestCodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
