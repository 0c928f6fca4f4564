package dev.postrelay.jobs.impl;

import dev.postrelay.entity.ContentItem;
import dev.postrelay.exception.RelayException;
import dev.postrelay.jobs.AutomatedJob;
import dev.postrelay.jobs.JobNames;
import dev.postrelay.jobs.JobRequest;
import dev.postrelay.runner.JobInvocation;
import dev.postrelay.runner.JobRunner;
import dev.postrelay.service.PublishQueueService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

/**
 * Publishes approved items through the external publisher: on a scheduled run the next item in
 * queue order, on a manual run the operator's targets one after another.
 *
 * <p>Each item is reserved before the publisher starts. Exit 0 marks it published; any other
 * outcome releases the reservation so the item stays approved and eligible.
 */
@Slf4j
@Component
public class PublishJob implements AutomatedJob {

    static final String ITEM_ARG = "--item-id=";
    static final int TARGET_REJECTED = 1;

    private final JobRunner jobRunner;
    private final PublishQueueService publishQueue;
    private final Scheduler jobExecutionScheduler;

    public PublishJob(JobRunner jobRunner,
                      PublishQueueService publishQueue,
                      @Qualifier("jobExecutionScheduler") Scheduler jobExecutionScheduler) {
        this.jobRunner = jobRunner;
        this.publishQueue = publishQueue;
        this.jobExecutionScheduler = jobExecutionScheduler;
    }

    @Override
    public String getName() {
        return JobNames.PUBLISH;
    }

    @Override
    public boolean usesStartupDelay() {
        return false;
    }

    @Override
    public Mono<Integer> run(JobRequest request) {
        if (request.hasTargets()) {
            return publishTargets(request.targetItemIds());
        }
        return Mono.fromCallable(() -> publishQueue.reserveNext().orElse(null))
                .flatMap(this::publish)
                .switchIfEmpty(Mono.fromCallable(() -> {
                    log.info("No approved item eligible for publication");
                    return 0;
                }));
    }

    /**
     * Publish each target in turn. The run exits with the first non-zero status met, or 0.
     */
    private Mono<Integer> publishTargets(List<Long> itemIds) {
        return Flux.fromIterable(itemIds)
                .concatMap(this::publishTarget)
                .reduce(0, (status, next) -> status != 0 ? status : next);
    }

    private Mono<Integer> publishTarget(Long itemId) {
        return Mono.fromCallable(() -> publishQueue.reserve(itemId))
                .flatMap(this::publish)
                .onErrorResume(RelayException.class, e -> {
                    log.warn("Skipping item {}: {}", itemId, e.getMessage());
                    return Mono.just(TARGET_REJECTED);
                });
    }

    private Mono<Integer> publish(ContentItem item) {
        Long itemId = item.getId();
        log.info("Publishing item {} (priority {})", itemId, item.getPublishPriority());

        return jobRunner.invoke(new JobInvocation(getName(), List.of(ITEM_ARG + itemId)))
                .publishOn(jobExecutionScheduler)
                .map(exitCode -> {
                    if (exitCode == 0) {
                        publishQueue.completePublish(itemId);
                    } else {
                        log.warn("Publisher exited with {} for item {} - item stays approved", exitCode, itemId);
                        publishQueue.release(itemId);
                    }
                    return exitCode;
                })
                .doOnError(e -> {
                    log.error("Publishing item {} failed: {}", itemId, e.getMessage());
                    publishQueue.release(itemId);
                });
    }
}
