package dev.postrelay.jobs.impl;

import dev.postrelay.config.ContentProperties;
import dev.postrelay.entity.ContentItem;
import dev.postrelay.jobs.AbstractExternalJob;
import dev.postrelay.jobs.JobNames;
import dev.postrelay.jobs.JobRequest;
import dev.postrelay.model.ApprovalState;
import dev.postrelay.repository.ContentItemRepository;
import dev.postrelay.runner.JobRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs the media generator when items are waiting for media. The generator calls back per item
 * once its artifact is stored.
 */
@Slf4j
@Component
public class MediaGenerationJob extends AbstractExternalJob {

    private final ContentItemRepository contentItemRepository;
    private final ContentProperties contentProperties;

    public MediaGenerationJob(JobRunner jobRunner,
                              ContentItemRepository contentItemRepository,
                              ContentProperties contentProperties) {
        super(jobRunner);
        this.contentItemRepository = contentItemRepository;
        this.contentProperties = contentProperties;
    }

    @Override
    public String getName() {
        return JobNames.MEDIA_GENERATION;
    }

    @Override
    public Mono<Integer> run(JobRequest request) {
        return Mono.fromCallable(this::hasPendingItems)
                .flatMap(pending -> {
                    if (!pending && !request.manual()) {
                        log.info("No items awaiting media generation - skipping run");
                        return Mono.just(0);
                    }
                    return super.run(request);
                });
    }

    private boolean hasPendingItems() {
        List<ContentItem> pending = contentItemRepository.findAwaitingMedia(
                ApprovalState.UNSET, contentProperties.getMinWordCount(), PageRequest.of(0, 1));
        return !pending.isEmpty();
    }
}
