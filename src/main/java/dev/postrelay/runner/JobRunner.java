package dev.postrelay.runner;

import reactor.core.publisher.Mono;

/**
 * Starts external jobs and reports how they terminated.
 */
public interface JobRunner {

    /**
     * Run the job to completion.
     *
     * @return Mono emitting the exit status; errors with
     *         {@link dev.postrelay.exception.ExternalProcessFailureException} if the job could not be run
     */
    Mono<Integer> invoke(JobInvocation invocation);
}
