package dev.postrelay.scheduler;

import dev.postrelay.jobs.AutomatedJob;
import dev.postrelay.model.IntervalBounds;

import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * A job as the scheduler sees it. Bounds and the enabled flag are suppliers so that every tick
 * reads their current value.
 */
public record RegisteredJob(AutomatedJob job,
                            Supplier<IntervalBounds> bounds,
                            BooleanSupplier enabled,
                            boolean startupDelay) {

    public String name() {
        return job.getName();
    }
}
