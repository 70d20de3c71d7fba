package com.example.guestcode.controllers;

import com.example.guestcode.model.Booking;

import java.util.List;

public interface BookingSource {

    /** Valid bookings of one unit's spreadsheet, in sheet order. */
    List<Booking> fetchBookings(String fileId);
}
