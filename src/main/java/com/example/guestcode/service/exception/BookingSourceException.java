package com.example.guestcode.service.exception;

/** Booking spreadsheet could not be fetched or read. */
public class BookingSourceException extends GuestCodeException {

    public BookingSourceException(String message) {
        super(message);
    }

    public BookingSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
