package dev.postrelay.scheduler;

import dev.postrelay.config.SchedulerProperties;
import dev.postrelay.entity.JobScheduleState;
import dev.postrelay.model.IntervalBounds;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Due-ness rule and random draws of the adaptive scheduler.
 */
@Component
@RequiredArgsConstructor
public class IntervalPolicy {

    private final JitterSource jitter;
    private final SchedulerProperties properties;

    /**
     * A job that never ran is due. Otherwise it is due once the interval drawn at its last
     * firing has fully elapsed.
     */
    public boolean isDue(JobScheduleState state, Instant now) {
        if (state.getLastRunAt() == null || state.getChosenIntervalMinutes() == null) {
            return true;
        }
        Duration elapsed = Duration.between(state.getLastRunAt(), now);
        return elapsed.compareTo(Duration.ofMinutes(state.getChosenIntervalMinutes())) >= 0;
    }

    /**
     * Draw the next interval, in minutes, uniformly within the bounds.
     */
    public int drawInterval(IntervalBounds bounds) {
        return (int) jitter.uniform(bounds.minMinutes(), bounds.maxMinutes());
    }

    /**
     * One-shot delay before a run: uniform in {@code [0, fraction * average interval]} seconds.
     */
    public Duration startupDelay(IntervalBounds bounds) {
        long maxSeconds = (long) (bounds.averageSeconds() * properties.getStartupDelayFraction());
        return Duration.ofSeconds(jitter.uniform(0, maxSeconds));
    }
}
