package com.example.guestcode.service.exception;

/** Unit configuration is incomplete or the guest code cannot be provisioned. */
public class ConfigurationException extends GuestCodeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
