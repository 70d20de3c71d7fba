package com.example.guestcode.service;

import com.example.guestcode.config.SchedulerConfig;
import com.example.guestcode.controllers.BookingSource;
import com.example.guestcode.model.Booking;
import com.example.guestcode.model.ReconcileOutcome;
import com.example.guestcode.model.RunOutcome;
import com.example.guestcode.model.StayResolution;
import com.example.guestcode.model.StayRules;
import com.example.guestcode.model.UnitConfig;
import com.example.guestcode.service.util.Msg;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One full pass over all units. A failing unit becomes an error line in the
 * summary, the remaining units are still reconciled.
 */
@Slf4j
@Service
@Profile("!" + GoogleAuthorizeRunner.PROFILE)
@RequiredArgsConstructor
public class ReconciliationRunService {

    private final UnitRegistry unitRegistry;
    private final BookingSource bookingSource;
    private final StayIntervalResolver resolver;
    private final AccessWindowReconciler reconciler;
    private final ReportService reportService;
    private final SchedulerConfig config;
    private final Msg msg;
    private final Clock clock;

    /** Reconciles every configured unit for today and sends the report. */
    public RunOutcome runAndReport() {
        LocalDate today = LocalDate.now(clock.withZone(config.zone()));
        RunOutcome outcome = runAll(unitRegistry.getUnits(), today);
        reportService.send(outcome, today);
        return outcome;
    }

    public RunOutcome runAll(List<UnitConfig> units) {
        return runAll(units, LocalDate.now(clock.withZone(config.zone())));
    }

    public RunOutcome runAll(List<UnitConfig> units, LocalDate today) {
        log.info("Reconciling {} unit(s) for {}", units.size(), today);
        boolean hadError = false;
        List<String> summary = new ArrayList<>();

        for (UnitConfig unit : units) {
            try {
                summary.addAll(reconcileUnit(unit, today));
            } catch (Exception e) {
                hadError = true;
                String line = msg.get("summary.error", unit.displayName(), describe(e));
                log.error(line);
                log.debug("Unit {} failed", unit.unitId(), e);
                summary.add(line);
            }
        }

        log.info("Pass finished: {} unit(s), {}", units.size(), hadError ? "with errors" : "all ok");
        return new RunOutcome(hadError, summary);
    }

    private List<String> reconcileUnit(UnitConfig unit, LocalDate today) {
        List<Booking> bookings = bookingSource.fetchBookings(unit.bookingFileId());
        StayRules rules = new StayRules(unit.checkinTime(), unit.checkoutTime(), config.zone(),
                config.getResolutionMode());
        StayResolution resolution = resolver.resolve(bookings, today, rules);
        log.debug("{}: {} booking(s), chosen stay {}", unit.displayName(), bookings.size(), resolution.booking());

        ReconcileOutcome outcome = reconciler.reconcile(unit, resolution.window());

        List<String> lines = new ArrayList<>(outcome.messages());
        if (resolution.turnover()) {
            String line = msg.get("summary.turnover", unit.displayName());
            log.info(line);
            lines.add(line);
        }
        return lines;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
