package com.example.guestcode.controllers.impl;

import com.example.guestcode.controllers.BookingSource;
import com.example.guestcode.controllers.GoogleDriveClient;
import com.example.guestcode.model.Booking;
import com.example.guestcode.service.BookingSheetParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DriveBookingSource implements BookingSource {

    private final GoogleDriveClient driveClient;
    private final BookingSheetParser parser;

    @Override
    public List<Booking> fetchBookings(String fileId) {
        List<Booking> bookings = parser.parse(driveClient.download(fileId));
        log.info("Loaded {} booking(s) from file {}", bookings.size(), fileId);
        return bookings;
    }
}
