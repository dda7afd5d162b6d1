package com.position.fix;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;

/**
 * Entry point of the position fix service.
 *
 * <p>A device gateway pushes readings into the service and polls the power mode the scheduler
 * wants; application clients request one-shot fixes over HTTP.
 */
@Slf4j
@SpringBootApplication
public class PositionFixServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PositionFixServiceApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        Environment env = event.getApplicationContext().getEnvironment();

        log.info("=========================================");
        log.info("Position Fix Service Started Successfully");
        log.info("=========================================");
        log.info("Application Name: {}", env.getProperty("spring.application.name"));
        log.info("Server Port: {}", env.getProperty("server.port", "8080"));
        log.info("Default Fix Timeout: {}", env.getProperty("positioning.one-shot.default-timeout"));
        log.info("Continuous Tracking Mode: {}", env.getProperty("positioning.tracking.mode"));
        log.info("=========================================");
    }
}
