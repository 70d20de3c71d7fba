package com.example.guestcode.service.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class WindowFormat {

    public static final DateTimeFormatter LOCAL_DATE_TIME = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");
    public static final DateTimeFormatter LOCAL_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private WindowFormat() {
    }

    public static String local(Instant instant, ZoneId zone) {
        return instant == null ? "-" : LOCAL_DATE_TIME.format(instant.atZone(zone));
    }
}
