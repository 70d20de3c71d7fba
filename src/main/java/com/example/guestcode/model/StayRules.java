package com.example.guestcode.model;

import java.time.LocalTime;
import java.time.ZoneId;

public record StayRules(LocalTime checkinTime, LocalTime checkoutTime, ZoneId zone, ResolutionMode mode) {
}
