package dev.postrelay.scheduler;

import dev.postrelay.config.SchedulerProperties;
import dev.postrelay.exception.PersistenceConflictException;
import dev.postrelay.jobs.JobRequest;
import dev.postrelay.metrics.RelayMetrics;
import dev.postrelay.model.IntervalBounds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fires automated jobs at randomly jittered intervals.
 *
 * <p>For each job a decision is taken under the job's cluster lock: the schedule store claims the
 * run, the lock is released, and the job is launched without waiting for it. The in-flight marker
 * written by the claim is cleared when the job reports completion, whatever its exit status.
 */
@Slf4j
@Service
public class AdaptiveScheduler {

    static final int FAILED_EXIT = -1;
    private static final String SEPARATOR = "----------------------------------------";

    private final JobRegistry registry;
    private final ClusterLockService lockService;
    private final JobScheduleStore scheduleStore;
    private final IntervalPolicy intervalPolicy;
    private final SchedulerProperties properties;
    private final RelayMetrics metrics;
    private final Scheduler jobExecutionScheduler;

    public AdaptiveScheduler(JobRegistry registry,
                             ClusterLockService lockService,
                             JobScheduleStore scheduleStore,
                             IntervalPolicy intervalPolicy,
                             SchedulerProperties properties,
                             RelayMetrics metrics,
                             @Qualifier("jobExecutionScheduler") Scheduler jobExecutionScheduler) {
        this.registry = registry;
        this.lockService = lockService;
        this.scheduleStore = scheduleStore;
        this.intervalPolicy = intervalPolicy;
        this.properties = properties;
        this.metrics = metrics;
        this.jobExecutionScheduler = jobExecutionScheduler;
    }

    /**
     * Evaluate every registered job once. A failure on one job never prevents the others.
     *
     * @return outcome per job name
     */
    public Map<String, TickOutcome> tick() {
        Map<String, TickOutcome> outcomes = new LinkedHashMap<>();
        for (RegisteredJob job : registry.all()) {
            outcomes.put(job.name(), evaluateSafely(job));
        }
        log.debug("Tick outcomes: {}", outcomes);
        return outcomes;
    }

    /**
     * Run a job now, ignoring its enabled flag and interval. A run still in flight, or a lock held
     * by another instance, is respected.
     *
     * @throws dev.postrelay.exception.NotFoundException if no job has that name
     */
    public TickOutcome trigger(String jobName, JobRequest request) {
        RegisteredJob job = registry.get(jobName);
        log.info("Manual trigger of {} (target items {}, skip delay {})",
                jobName, request.targetItemIds(), request.skipDelay());
        try {
            return decideAndLaunch(job, request, true);
        } catch (OptimisticLockingFailureException e) {
            throw new PersistenceConflictException("Schedule of " + jobName + " changed concurrently", e);
        }
    }

    TickOutcome evaluate(RegisteredJob job) {
        if (!job.enabled().getAsBoolean()) {
            return TickOutcome.DISABLED;
        }
        return decideAndLaunch(job, JobRequest.scheduled(), false);
    }

    private TickOutcome evaluateSafely(RegisteredJob job) {
        try {
            return evaluate(job);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Schedule of {} changed concurrently - skipping this tick", job.name());
            return TickOutcome.LOCKED_ELSEWHERE;
        } catch (RuntimeException e) {
            log.error("Scheduling decision for {} failed: {}", job.name(), e.getMessage(), e);
            return TickOutcome.ERROR;
        }
    }

    private TickOutcome decideAndLaunch(RegisteredJob job, JobRequest request, boolean force) {
        String name = job.name();
        if (!lockService.tryLock(name, properties.getLockLease())) {
            metrics.recordLockContention(name);
            return TickOutcome.LOCKED_ELSEWHERE;
        }

        IntervalBounds bounds;
        ScheduleDecision decision;
        try {
            bounds = job.bounds().get();
            decision = scheduleStore.claim(name, bounds, force);
        } finally {
            lockService.unlock(name);
        }

        switch (decision.outcome()) {
            case NOT_DUE:
                return TickOutcome.NOT_DUE;
            case IN_FLIGHT:
                log.warn("{} is due but its previous run has not finished - suppressed", name);
                metrics.recordOverlapSuppressed(name);
                return TickOutcome.IN_FLIGHT;
            default:
                break;
        }

        log.info("Firing {} (next interval {} min)", name, decision.intervalMinutes());
        metrics.recordJobFired(name);
        launch(job, bounds, request, decision.runningSince());
        return TickOutcome.FIRED;
    }

    private void launch(RegisteredJob job, IntervalBounds bounds, JobRequest request, Instant runningSince) {
        String name = job.name();
        Mono<Integer> run = Mono.defer(() -> job.job().run(request));

        if (job.startupDelay() && !request.skipDelay()) {
            Duration delay = intervalPolicy.startupDelay(bounds);
            if (!delay.isZero()) {
                log.info("{} waits {}s before starting", name, delay.toSeconds());
                run = Mono.delay(delay, jobExecutionScheduler).then(run);
            }
        }

        run.subscribeOn(jobExecutionScheduler)
                .defaultIfEmpty(FAILED_EXIT)
                .onErrorResume(e -> {
                    log.error("{} failed: {}", name, e.getMessage(), e);
                    return Mono.just(FAILED_EXIT);
                })
                .subscribe(exitStatus -> finish(name, runningSince, exitStatus));
    }

    private void finish(String name, Instant runningSince, int exitStatus) {
        if (exitStatus != 0) {
            metrics.recordJobFailure(name);
            log.error("{} terminated with status {} - next attempt at its next due time", name, exitStatus);
        }
        try {
            scheduleStore.complete(name, runningSince, exitStatus);
        } catch (RuntimeException e) {
            log.error("Could not record completion of {}: {}", name, e.getMessage(), e);
        }
        log.info(SEPARATOR);
        log.info("{} finished with status {}", name, exitStatus);
        log.info(SEPARATOR);
    }
}
