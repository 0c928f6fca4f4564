package dev.postrelay.jobs;

import dev.postrelay.runner.JobInvocation;
import dev.postrelay.runner.JobRunner;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Job that delegates all of its work to an external process through the {@link JobRunner}.
 */
@Slf4j
public abstract class AbstractExternalJob implements AutomatedJob {

    protected final JobRunner jobRunner;

    protected AbstractExternalJob(JobRunner jobRunner) {
        this.jobRunner = jobRunner;
    }

    /**
     * Extra arguments passed to the external process.
     */
    protected List<String> arguments(JobRequest request) {
        return List.of();
    }

    @Override
    public boolean usesStartupDelay() {
        return true;
    }

    @Override
    public Mono<Integer> run(JobRequest request) {
        JobInvocation invocation = new JobInvocation(getName(), arguments(request));
        log.debug("Invoking external job {} with {}", getName(), invocation.args());
        return jobRunner.invoke(invocation);
    }
}
