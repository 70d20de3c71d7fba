package com.example.guestcode.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * {@code --authorize}: creates or renews the Google token file and exits.
 * Units and the lock API are not needed in this mode.
 */
@Slf4j
@Component
@Profile(GoogleAuthorizeRunner.PROFILE)
@RequiredArgsConstructor
public class GoogleAuthorizeRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final String AUTHORIZE_OPTION = "authorize";
    public static final String PROFILE = "authorize";

    private final GoogleAuthorizer authorizer;

    private int exitCode;

    public static boolean isAuthorize(ApplicationArguments arguments) {
        return arguments.containsOption(AUTHORIZE_OPTION);
    }

    @Override
    public void run(ApplicationArguments arguments) {
        try {
            authorizer.authorize();
            exitCode = 0;
        } catch (Exception e) {
            log.error("Google authorization failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
