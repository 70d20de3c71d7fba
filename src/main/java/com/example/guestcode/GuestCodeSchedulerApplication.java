package com.example.guestcode;

import com.example.guestcode.service.GoogleAuthorizeRunner;
import com.example.guestcode.service.RunOnceRunner;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GuestCodeSchedulerApplication {

	public static void main(String[] args) {
		ApplicationArguments arguments = new DefaultApplicationArguments(args);
		SpringApplication application = new SpringApplication(GuestCodeSchedulerApplication.class);
		if (GoogleAuthorizeRunner.isAuthorize(arguments)) {
			application.setAdditionalProfiles(GoogleAuthorizeRunner.PROFILE);
		}
		ConfigurableApplicationContext context = application.run(args);
		if (exitsAfterRun(arguments)) {
			System.exit(SpringApplication.exit(context));
		}
	}

	/** Single pass and authorization end the process, the daily loop keeps it alive. */
	static boolean exitsAfterRun(ApplicationArguments arguments) {
		return RunOnceRunner.isRunOnce(arguments) || GoogleAuthorizeRunner.isAuthorize(arguments);
	}

}
