package dev.postrelay.scheduler;

/**
 * What the scheduler did with one job in one tick or trigger.
 */
public enum TickOutcome {
    DISABLED,
    LOCKED_ELSEWHERE,
    NOT_DUE,
    IN_FLIGHT,
    FIRED,
    ERROR
}
