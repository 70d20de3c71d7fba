package com.example.guestcode.service;

/** Destination of the run report. */
public interface ReportSink {

    String name();

    /**
     * @throws com.example.guestcode.service.exception.ReportDeliveryException if the report could not be sent
     */
    void deliver(String subject, String body);
}
