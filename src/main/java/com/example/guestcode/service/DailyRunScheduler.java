package com.example.guestcode.service;

import com.example.guestcode.config.SchedulerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Loop mode: one pass right after startup, then one per day at
 * {@code lock.run-time} local time.
 */
@Slf4j
@Service
@Profile("!" + GoogleAuthorizeRunner.PROFILE)
@RequiredArgsConstructor
public class DailyRunScheduler implements SchedulingConfigurer {

    static final Duration MIN_SLEEP = Duration.ofSeconds(60);
    static final Duration FALLBACK_SLEEP = Duration.ofHours(1);

    private final ReconciliationRunService runService;
    private final SchedulerConfig config;
    private final ApplicationArguments arguments;
    private final Clock clock;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        if (RunOnceRunner.isRunOnce(arguments)) {
            log.info("Run-once mode, daily schedule not registered");
            return;
        }
        registrar.addTriggerTask(this::runPass, this::nextExecution);
        log.info("Daily reconciliation scheduled at {} ({})", config.dailyRunTime(), config.zone());
    }

    void runPass() {
        try {
            runService.runAndReport();
        } catch (Exception e) {
            log.error("Reconciliation pass aborted: {}", e.getMessage(), e);
        }
    }

    Instant nextExecution(TriggerContext context) {
        if (context.lastCompletion() == null) {
            return clock.instant();
        }
        ZonedDateTime next = nextRunTime(ZonedDateTime.now(clock.withZone(config.zone())));
        log.info("Next reconciliation pass at {}", next);
        return next.toInstant();
    }

    /**
     * Today's run time if still ahead, otherwise tomorrow's. A run time less than
     * a minute away is replaced by one hour from now.
     */
    public ZonedDateTime nextRunTime(ZonedDateTime now) {
        LocalTime runAt = config.dailyRunTime();
        ZonedDateTime target = now.toLocalDate().atTime(runAt).atZone(now.getZone());
        if (!now.isBefore(target)) {
            target = now.toLocalDate().plusDays(1).atTime(runAt).atZone(now.getZone());
        }
        if (Duration.between(now, target).compareTo(MIN_SLEEP) < 0) {
            return now.plus(FALLBACK_SLEEP);
        }
        return target;
    }
}
