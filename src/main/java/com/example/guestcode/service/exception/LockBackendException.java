package com.example.guestcode.service.exception;

/** Lock API answered with an unexpected status or payload. */
public class LockBackendException extends GuestCodeException {

    public LockBackendException(String message) {
        super(message);
    }

    public LockBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
