package com.example.guestcode.service;

import com.example.guestcode.config.SchedulerConfig;
import com.example.guestcode.controllers.LockAuthStore;
import com.example.guestcode.dto.SmartlockAuthDTO;
import com.example.guestcode.model.AccessWindow;
import com.example.guestcode.model.AuthorizationEntry;
import com.example.guestcode.model.ReconcileAction;
import com.example.guestcode.model.ReconcileOutcome;
import com.example.guestcode.model.UnitConfig;
import com.example.guestcode.service.exception.ConfigurationException;
import com.example.guestcode.service.exception.LockBackendException;
import com.example.guestcode.service.util.Msg;
import com.example.guestcode.service.util.WindowFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Brings the guest code of one unit to the desired window with at most one
 * write. Running it twice without a calendar change writes nothing the
 * second time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessWindowReconciler {

    private final LockStateReader reader;
    private final LockAuthStore store;
    private final SchedulerConfig config;
    private final Msg msg;

    public ReconcileOutcome reconcile(UnitConfig unit, AccessWindow desired) {
        List<String> messages = new ArrayList<>();
        boolean created = false;

        Optional<AuthorizationEntry> existing = reader.readCurrent(unit.lockId(), unit.authName());
        AuthorizationEntry entry;
        if (existing.isPresent()) {
            entry = existing.get();
        } else {
            entry = provision(unit);
            created = true;
            messages.add(logged(msg.get("summary.created", unit.displayName(), unit.authName())));
        }

        AccessWindow current = entry.currentWindow();
        ReconcileAction action;
        if (desired.isAbsent()) {
            if (current.isAbsent()) {
                action = ReconcileAction.ALREADY_DISABLED;
            } else {
                store.setWindow(unit.lockId(), entry.authId(), null, null);
                action = ReconcileAction.CLEARED;
            }
        } else if (desired.matches(current)) {
            action = ReconcileAction.ALREADY_CORRECT;
        } else {
            store.setWindow(unit.lockId(), entry.authId(), desired.start(), desired.end());
            action = ReconcileAction.UPDATED;
        }
        messages.add(logged(describe(unit, desired, action)));

        if (action.isWrite() && config.isForceSyncAfterChange()) {
            requestSync(unit);
        }
        return new ReconcileOutcome(action, created, messages);
    }

    private AuthorizationEntry provision(UnitConfig unit) {
        if (!unit.hasProvisioningPin()) {
            throw new ConfigurationException("Code '" + unit.authName() + "' does not exist on lock "
                    + unit.lockId() + " and no PIN is configured");
        }
        Optional<SmartlockAuthDTO> created = store.create(unit.lockId(), unit.authName(),
                unit.provisioningPin(), LockAuthStore.ALL_WEEKDAYS);

        return reader.readCurrent(unit.lockId(), unit.authName())
                .or(() -> created.map(reader::toEntry))
                .orElseThrow(() -> new LockBackendException("Code '" + unit.authName()
                        + "' was created but is not listed on lock " + unit.lockId()));
    }

    private void requestSync(UnitConfig unit) {
        try {
            store.forceSync(unit.lockId());
            log.info("[OK] {}: forced sync requested", unit.displayName());
        } catch (Exception e) {
            log.warn("[WARN] {}: forced sync failed: {}", unit.displayName(), e.getMessage());
        }
    }

    private String describe(UnitConfig unit, AccessWindow desired, ReconcileAction action) {
        ZoneId zone = config.zone();
        String start = WindowFormat.local(desired.start(), zone);
        String end = WindowFormat.local(desired.end(), zone);
        return switch (action) {
            case UPDATED -> msg.get("summary.updated", unit.displayName(), unit.authName(), start, end);
            case ALREADY_CORRECT -> msg.get("summary.already-correct", unit.displayName(), unit.authName(), start, end);
            case CLEARED -> msg.get("summary.cleared", unit.displayName(), unit.authName());
            case ALREADY_DISABLED -> msg.get("summary.already-disabled", unit.displayName(), unit.authName());
        };
    }

    private static String logged(String line) {
        log.info(line);
        return line;
    }
}
