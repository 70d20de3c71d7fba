package com.example.guestcode.service;

import com.example.guestcode.config.SchedulerConfig;
import com.example.guestcode.model.UnitConfig;
import com.example.guestcode.service.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertySource;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Managed units, read once at startup from {@code APTS} and the
 * {@code APT_<ID>_*} variables. Without {@code APTS} every
 * {@code APT_<ID>_SMARTLOCK_ID} variable defines a unit.
 */
@Slf4j
@Component
@Profile("!" + GoogleAuthorizeRunner.PROFILE)
@RequiredArgsConstructor
public class UnitRegistry {

    private static final Pattern LOCK_ID_KEY = Pattern.compile("^APT_(?<id>[A-Za-z0-9\\-]+)_SMARTLOCK_ID$");

    private final Environment environment;
    private final SchedulerConfig config;

    private volatile List<UnitConfig> units = List.of();

    @PostConstruct
    public void load() {
        if (property("nuki.api.token") == null) {
            throw new ConfigurationException("NUKI_ACCESS_TOKEN is not set");
        }
        List<UnitConfig> loaded = new ArrayList<>();
        for (String id : unitIds()) {
            toUnit(id).ifPresent(loaded::add);
        }
        if (loaded.isEmpty()) {
            throw new ConfigurationException("No valid units configured, set APTS and APT_<ID>_* variables");
        }
        units = List.copyOf(loaded);
        log.info("Managing {} unit(s): {}", units.size(),
                units.stream().map(UnitConfig::displayName).toList());
    }

    public List<UnitConfig> getUnits() {
        return units;
    }

    List<String> unitIds() {
        String listed = environment.getProperty("APTS", "");
        List<String> ids = Arrays.stream(listed.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        if (!ids.isEmpty()) {
            return ids;
        }

        TreeSet<String> discovered = new TreeSet<>();
        if (environment instanceof ConfigurableEnvironment configurable) {
            for (PropertySource<?> source : configurable.getPropertySources()) {
                if (source instanceof EnumerablePropertySource<?> enumerable) {
                    for (String name : enumerable.getPropertyNames()) {
                        Matcher matcher = LOCK_ID_KEY.matcher(name);
                        if (matcher.matches()) {
                            discovered.add(matcher.group("id"));
                        }
                    }
                }
            }
        }
        return new ArrayList<>(discovered);
    }

    private Optional<UnitConfig> toUnit(String id) {
        String prefix = "APT_" + id + "_";
        String fileId = property(prefix + "DRIVE_FILE_ID");
        String lockId = property(prefix + "SMARTLOCK_ID");

        List<String> missing = new ArrayList<>();
        if (fileId == null) {
            missing.add("DRIVE_FILE_ID");
        }
        if (lockId == null) {
            missing.add("SMARTLOCK_ID");
        }
        if (!missing.isEmpty()) {
            log.error("[ERR] Configuration incomplete for {}: missing {}, skipped", id, String.join(", ", missing));
            return Optional.empty();
        }

        try {
            String pin = property(prefix + "PIN");
            return Optional.of(UnitConfig.builder()
                    .unitId(id)
                    .displayName(propertyOr(prefix + "NAME", "Apartment " + id))
                    .authName(propertyOr(prefix + "AUTH_NAME", config.getDefaultAuthName()))
                    .bookingFileId(fileId)
                    .lockId(Long.parseLong(lockId))
                    .provisioningPin(pin == null ? null : Integer.valueOf(pin))
                    .checkinTime(timeOr(prefix + "CHECKIN_TIME", config.checkin()))
                    .checkoutTime(timeOr(prefix + "CHECKOUT_TIME", config.checkout()))
                    .build());
        } catch (NumberFormatException e) {
            log.error("[ERR] Invalid number in {}SMARTLOCK_ID or {}PIN, skipped", prefix, prefix);
        } catch (ConfigurationException e) {
            log.error("[ERR] {}, unit {} skipped", e.getMessage(), id);
        }
        return Optional.empty();
    }

    private LocalTime timeOr(String key, LocalTime fallback) {
        String value = property(key);
        return value == null ? fallback : SchedulerConfig.parseTime(key, value);
    }

    private String propertyOr(String key, String fallback) {
        String value = property(key);
        return value == null ? fallback : value;
    }

    private String property(String key) {
        String value = environment.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
