package com.example.guestcode.service;

import com.example.guestcode.controllers.LockAuthStore;
import com.example.guestcode.dto.SmartlockAuthDTO;
import com.example.guestcode.model.AccessWindow;
import com.example.guestcode.model.AuthorizationEntry;
import com.example.guestcode.service.exception.LockBackendException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Looks up the guest code by name on the lock. Always asks the backend, the
 * code may have been changed by hand since the last pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LockStateReader {

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));

    private final LockAuthStore store;

    public Optional<AuthorizationEntry> readCurrent(long lockId, String authName) {
        String wanted = normalizeName(authName);
        Optional<AuthorizationEntry> entry = store.list(lockId).stream()
                .filter(dto -> dto.getType() != null && dto.getType() == AuthorizationEntry.KEYPAD_CODE)
                .filter(dto -> normalizeName(dto.getName()).equals(wanted))
                .findFirst()
                .map(this::toEntry);
        log.debug("Lock {} code '{}': {}", lockId, authName, entry.map(AuthorizationEntry::currentWindow).orElse(null));
        return entry;
    }

    public AuthorizationEntry toEntry(SmartlockAuthDTO dto) {
        String authId = dto.resolveId();
        if (authId == null || authId.isBlank()) {
            throw new LockBackendException("Code '" + dto.getName() + "' has no id: " + dto);
        }
        AccessWindow window = new AccessWindow(
                parseTimestamp(dto.getAllowedFromDate()),
                parseTimestamp(dto.getAllowedUntilDate()));
        int kind = dto.getType() != null ? dto.getType() : AuthorizationEntry.KEYPAD_CODE;
        return new AuthorizationEntry(authId, dto.getName(), window, kind);
    }

    /**
     * ISO-8601 with {@code Z}, with an offset, or without any zone (read as UTC).
     * Blank means unset.
     */
    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();
        DateTimeParseException failure = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }
        throw new LockBackendException("Unreadable timestamp from lock API: '" + raw + "'", failure);
    }

    /** Case folding: upper-casing first maps {@code ß} to {@code SS}, so both compare equal. */
    static String normalizeName(String name) {
        return name == null ? "" : name.strip().toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }
}
