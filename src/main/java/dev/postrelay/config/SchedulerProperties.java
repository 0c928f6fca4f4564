package dev.postrelay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for the adaptive scheduler.
 * Loaded from application.yml under 'relay.scheduler' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "relay.scheduler")
public class SchedulerProperties {

    /**
     * Whether the tick loop runs on this instance. Manual triggers work either way.
     */
    private boolean enabled = true;
    private Duration tickInterval = Duration.ofSeconds(60);
    private Duration lockLease = Duration.ofMinutes(2);
    private Duration overlapExpiry = Duration.ofHours(24);
    private String instanceId;
    private double startupDelayFraction = 0.20;

    /**
     * Seed values for job settings rows, keyed by job name.
     */
    private Map<String, JobDefaults> jobs = new HashMap<>();

    public JobDefaults defaultsFor(String jobName) {
        return jobs.getOrDefault(jobName, new JobDefaults());
    }

    @Data
    public static class JobDefaults {
        private boolean enabled = false;
        private int minMinutes = 60;
        private int maxMinutes = 120;

        /**
         * Overrides whether the job waits a random startup delay before running. Unset keeps the
         * job's own default.
         */
        private Boolean startupDelay;
    }
}
