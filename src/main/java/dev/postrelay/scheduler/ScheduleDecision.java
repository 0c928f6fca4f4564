package dev.postrelay.scheduler;

import java.time.Instant;

/**
 * Result of one attempt to claim a run of a job.
 *
 * @param outcome           what the store decided
 * @param intervalMinutes   interval drawn for the next run when fired, otherwise the current one
 * @param runningSince      in-flight marker written by a firing claim, null otherwise
 */
public record ScheduleDecision(Outcome outcome, Integer intervalMinutes, Instant runningSince) {

    public enum Outcome {
        FIRED,
        NOT_DUE,
        IN_FLIGHT
    }

    public static ScheduleDecision fired(int intervalMinutes, Instant runningSince) {
        return new ScheduleDecision(Outcome.FIRED, intervalMinutes, runningSince);
    }

    public static ScheduleDecision notDue(Integer intervalMinutes) {
        return new ScheduleDecision(Outcome.NOT_DUE, intervalMinutes, null);
    }

    public static ScheduleDecision inFlight(Integer intervalMinutes) {
        return new ScheduleDecision(Outcome.IN_FLIGHT, intervalMinutes, null);
    }

    public boolean isFired() {
        return outcome == Outcome.FIRED;
    }
}
