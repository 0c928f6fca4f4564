package dev.postrelay.dto;

import dev.postrelay.entity.JobScheduleState;
import dev.postrelay.entity.JobSettings;

import java.time.Duration;
import java.time.Instant;

/**
 * Settings and scheduling state of one job.
 *
 * @param nextDueAt earliest time of the next scheduled firing; null when the job never ran
 */
public record JobView(String name,
                      boolean enabled,
                      int minMinutes,
                      int maxMinutes,
                      Instant lastRunAt,
                      Integer chosenIntervalMinutes,
                      Instant nextDueAt,
                      boolean running,
                      Instant runningSince,
                      Instant lastFinishedAt,
                      Integer lastExitStatus) {

    public static JobView of(JobSettings settings, JobScheduleState state) {
        Instant lastRunAt = state != null ? state.getLastRunAt() : null;
        Integer interval = state != null ? state.getChosenIntervalMinutes() : null;
        Instant nextDueAt = lastRunAt != null && interval != null
                ? lastRunAt.plus(Duration.ofMinutes(interval))
                : null;
        Instant runningSince = state != null ? state.getRunningSince() : null;

        return new JobView(
                settings.getJobName(),
                settings.isEnabled(),
                settings.getMinMinutes(),
                settings.getMaxMinutes(),
                lastRunAt,
                interval,
                nextDueAt,
                runningSince != null,
                runningSince,
                state != null ? state.getLastFinishedAt() : null,
                state != null ? state.getLastExitStatus() : null);
    }
}
