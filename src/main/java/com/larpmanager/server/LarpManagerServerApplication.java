package com.larpmanager.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the LARP Manager Server.
 *
 * Startup binds {@link com.larpmanager.server.config.AppSettings}, opens the
 * database through {@link com.larpmanager.server.config.DatabaseLifecycle}
 * and then starts the web server.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class LarpManagerServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LarpManagerServerApplication.class, args);
    }
}
