package com.example.guestcode.service.exception;

public class ReportDeliveryException extends GuestCodeException {

    public ReportDeliveryException(String message) {
        super(message);
    }

    public ReportDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
