package com.example.guestcode.service;

import com.example.guestcode.model.RunOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * {@code --once}: a single pass for external schedulers. Exit code is 0
 * whenever the pass completes, failed units only show up in the report.
 * 1 means the pass itself could not run.
 */
@Slf4j
@Component
@Profile("!" + GoogleAuthorizeRunner.PROFILE)
@RequiredArgsConstructor
public class RunOnceRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final String ONCE_OPTION = "once";

    private final ReconciliationRunService runService;

    private int exitCode;

    public static boolean isRunOnce(ApplicationArguments arguments) {
        return arguments.containsOption(ONCE_OPTION);
    }

    @Override
    public void run(ApplicationArguments arguments) {
        if (!isRunOnce(arguments)) {
            return;
        }
        try {
            RunOutcome outcome = runService.runAndReport();
            log.info("Single pass finished {}", outcome.hadError() ? "with unit errors" : "without errors");
            exitCode = 0;
        } catch (Exception e) {
            log.error("Single pass aborted: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
