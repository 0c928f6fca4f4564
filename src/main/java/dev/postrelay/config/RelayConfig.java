package dev.postrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class RelayConfig {

    /**
     * All persisted timestamps are UTC instants.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Scheduler jobExecutionScheduler() {
        return Schedulers.boundedElastic();
    }
}
