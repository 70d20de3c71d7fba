package com.example.guestcode.config;

import com.example.guestcode.model.ResolutionMode;
import com.example.guestcode.service.exception.ConfigurationException;
import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

@Configuration
@Data
@PropertySource("application.properties")
public class SchedulerConfig {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("H:mm");

    @Value("${lock.timezone}")
    String timezone;

    @Value("${lock.checkin-time}")
    String checkinTime;

    @Value("${lock.checkout-time}")
    String checkoutTime;

    @Value("${lock.run-time}")
    String runTime;

    @Value("${lock.resolution-mode}")
    ResolutionMode resolutionMode;

    @Value("${lock.force-sync-after-change}")
    boolean forceSyncAfterChange;

    @Value("${lock.default-auth-name}")
    String defaultAuthName;

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public LocalTime checkin() {
        return parseTime("lock.checkin-time", checkinTime);
    }

    public LocalTime checkout() {
        return parseTime("lock.checkout-time", checkoutTime);
    }

    public LocalTime dailyRunTime() {
        return parseTime("lock.run-time", runTime);
    }

    @Bean
    public Clock clock() {
        return Clock.system(zone());
    }

    /** Parses local {@code HH:MM}. */
    public static LocalTime parseTime(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(key + " is not set");
        }
        try {
            return LocalTime.parse(value.trim(), HH_MM);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(key + " must be HH:MM, got '" + value + "'", e);
        }
    }
}
