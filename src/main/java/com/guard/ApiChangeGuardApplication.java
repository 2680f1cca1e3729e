package com.guard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ApiChangeGuardApplication {

	public static void main(String[] args) {
        System.exit(run(args));
	}

    /**
     * Boots the context, lets the check runner do its work and returns the exit code it chose.
     */
    static int run(String... args) {
        SpringApplication app = new SpringApplication(ApiChangeGuardApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        return SpringApplication.exit(app.run(args));
    }

}
