package dev.postrelay.jobs;

import reactor.core.publisher.Mono;

/**
 * Interface for jobs started by the adaptive scheduler.
 */
public interface AutomatedJob {

    /**
     * Get the name of this job.
     */
    String getName();

    /**
     * Whether a scheduled run waits a random startup delay first.
     */
    boolean usesStartupDelay();

    /**
     * Run the job once.
     *
     * @return Mono emitting the exit status, 0 on success
     */
    Mono<Integer> run(JobRequest request);
}
