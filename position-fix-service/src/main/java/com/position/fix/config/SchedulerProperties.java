// com/position/fix/config/SchedulerProperties.java
package com.position.fix.config;

import com.position.fix.dto.AuthorizationStatus;
import com.position.fix.dto.TrackingMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the position fix scheduler.
 * Maps to the 'positioning' section in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "positioning")
public class SchedulerProperties {

    private OneShot oneShot = new OneShot();
    private Tracking tracking = new Tracking();
    private Dispatch dispatch = new Dispatch();
    private Deadline deadline = new Deadline();
    private Provider provider = new Provider();

    @Data
    public static class OneShot {
        private Duration defaultTimeout = Duration.ofSeconds(30);
        /**
         * Oldest cached sample that may resolve a new request without starting the provider.
         * Zero disables reuse of cached samples.
         */
        private Duration maxCachedSampleAge = Duration.ofSeconds(10);
    }

    @Data
    public static class Tracking {
        private TrackingMode mode = TrackingMode.LOW_POWER;
        /**
         * Accuracy hint in meters for active updates kept running only for continuous tracking.
         */
        private double activeAccuracy = 100.0;
    }

    @Data
    public static class Dispatch {
        private int workers = 2;
        private int queueCapacity = 1000;
    }

    @Data
    public static class Deadline {
        private int poolSize = 1;
    }

    @Data
    public static class Provider {
        private AuthorizationStatus initialAuthorization = AuthorizationStatus.NOT_DETERMINED;
    }
}
