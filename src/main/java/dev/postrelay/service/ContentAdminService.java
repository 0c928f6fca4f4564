package dev.postrelay.service;

import dev.postrelay.config.ContentProperties;
import dev.postrelay.entity.ContentItem;
import dev.postrelay.exception.NotFoundException;
import dev.postrelay.exception.PersistenceConflictException;
import dev.postrelay.exception.PreconditionViolationException;
import dev.postrelay.exception.RelayException;
import dev.postrelay.jobs.JobNames;
import dev.postrelay.jobs.JobRequest;
import dev.postrelay.model.BulkResult;
import dev.postrelay.model.LifecycleBucket;
import dev.postrelay.model.LifecycleState;
import dev.postrelay.model.LifecycleTransition;
import dev.postrelay.model.MediaDownload;
import dev.postrelay.repository.ContentItemRepository;
import dev.postrelay.repository.ContentSpecifications;
import dev.postrelay.scheduler.AdaptiveScheduler;
import dev.postrelay.scheduler.TickOutcome;
import dev.postrelay.storage.MediaStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Entry point of the admin surface for content: queries, single and bulk transitions, manual
 * publishing and media download.
 *
 * <p>Transitions run in their own transaction inside {@link ContentLifecycleService}; a lost
 * optimistic-lock race surfaces here as {@link PersistenceConflictException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentAdminService {

    private final ContentItemRepository contentItemRepository;
    private final ContentLifecycleService lifecycleService;
    private final PublishQueueService publishQueue;
    private final AdaptiveScheduler scheduler;
    private final MediaStorage mediaStorage;
    private final ContentProperties contentProperties;

    /**
     * Count of items per bucket. Items at or below the word threshold are never counted.
     */
    public Map<LifecycleBucket, Long> stats() {
        Map<LifecycleBucket, Long> counts = new EnumMap<>(LifecycleBucket.class);
        for (LifecycleBucket bucket : LifecycleBucket.values()) {
            counts.put(bucket, contentItemRepository.count(
                    ContentSpecifications.inBucket(bucket, contentProperties.getMinWordCount())));
        }
        return counts;
    }

    public Page<ContentItem> list(LifecycleBucket bucket, Pageable pageable) {
        return contentItemRepository.findAll(
                ContentSpecifications.inBucket(bucket, contentProperties.getMinWordCount()), pageable);
    }

    public ContentItem get(Long itemId) {
        return lifecycleService.get(itemId);
    }

    public ContentItem approve(Long itemId, boolean autoPost, Integer priority) {
        return guarded(itemId, () -> lifecycleService.approve(itemId, autoPost, priority));
    }

    public ContentItem reject(Long itemId) {
        return guarded(itemId, () -> lifecycleService.reject(itemId));
    }

    public void delete(Long itemId) {
        guarded(itemId, () -> {
            lifecycleService.delete(itemId);
            return null;
        });
    }

    public ContentItem markMediaGenerated(Long itemId, String mediaRef) {
        return guarded(itemId, () -> lifecycleService.markMediaGenerated(itemId, mediaRef));
    }

    /**
     * Store an uploaded artifact and mark the item's media as generated.
     */
    public ContentItem uploadMedia(Long itemId, String fileName, InputStream content) {
        LifecycleState state = LifecycleState.of(lifecycleService.get(itemId));
        if (!LifecycleTransition.GENERATE_MEDIA.isAllowedFrom(state)) {
            throw PreconditionViolationException.of(itemId, state, LifecycleTransition.GENERATE_MEDIA);
        }
        String ref = mediaStorage.put(itemId + "_" + fileName, content);
        return markMediaGenerated(itemId, ref);
    }

    public BulkResult bulkApprove(List<Long> itemIds, boolean autoPost, Integer priority) {
        return forEach(itemIds, id -> approve(id, autoPost, priority));
    }

    public BulkResult bulkReject(List<Long> itemIds) {
        return forEach(itemIds, this::reject);
    }

    public BulkResult bulkDelete(List<Long> itemIds) {
        return forEach(itemIds, this::delete);
    }

    /**
     * Publish one approved item now, bypassing its auto-post flag, the queue order and the
     * publish interval.
     *
     * @throws NotFoundException if the item does not exist
     * @throws PreconditionViolationException if it is not approved, already published, or the
     *                                        publish job is still running
     */
    public void publishNow(Long itemId) {
        ContentItem item = publishQueue.validateManualTarget(itemId);
        TickOutcome outcome = scheduler.trigger(JobNames.PUBLISH, JobRequest.forItems(List.of(itemId)));
        if (outcome != TickOutcome.FIRED) {
            throw new PreconditionViolationException(itemId, LifecycleState.of(item),
                    "Publish job could not start (" + outcome + ") - try again shortly");
        }
    }

    /**
     * Validate every item, then hand the valid ones to a single publish run which publishes them
     * in the given order.
     */
    public BulkResult bulkPublishNow(List<Long> itemIds) {
        List<Long> valid = new ArrayList<>();
        Map<Long, String> failed = new LinkedHashMap<>();
        for (Long id : itemIds) {
            try {
                publishQueue.validateManualTarget(id);
                valid.add(id);
            } catch (RelayException e) {
                failed.put(id, e.getMessage());
            }
        }

        if (!valid.isEmpty()) {
            TickOutcome outcome = scheduler.trigger(JobNames.PUBLISH, JobRequest.forItems(valid));
            if (outcome != TickOutcome.FIRED) {
                valid.forEach(id -> failed.put(id, "Publish job could not start (" + outcome + ")"));
                valid.clear();
            }
        }
        log.info("Bulk publish-now: {} submitted, {} rejected", valid.size(), failed.size());
        return new BulkResult(valid, failed);
    }

    /**
     * Open the media of a published item and mark the item downloaded.
     *
     * @throws NotFoundException if the item or its stored artifact does not exist
     */
    public MediaDownload downloadMedia(Long itemId) {
        ContentItem item = lifecycleService.get(itemId);
        LifecycleState state = LifecycleState.of(item);
        if (!LifecycleTransition.DOWNLOAD.isAllowedFrom(state)) {
            throw PreconditionViolationException.of(itemId, state, LifecycleTransition.DOWNLOAD);
        }
        String ref = item.getMediaRef();
        if (ref == null || !mediaStorage.exists(ref)) {
            throw new NotFoundException("No media stored for item " + itemId);
        }

        MediaDownload download = new MediaDownload(itemId, ref, mediaStorage.size(ref), mediaStorage.open(ref));
        guarded(itemId, () -> lifecycleService.markDownloaded(itemId));
        return download;
    }

    private BulkResult forEach(List<Long> itemIds, Consumer<Long> action) {
        List<Long> succeeded = new ArrayList<>();
        Map<Long, String> failed = new LinkedHashMap<>();
        for (Long id : itemIds) {
            try {
                action.accept(id);
                succeeded.add(id);
            } catch (RelayException e) {
                log.debug("Bulk action skipped item {}: {}", id, e.getMessage());
                failed.put(id, e.getMessage());
            }
        }
        return new BulkResult(succeeded, failed);
    }

    private <T> T guarded(Long itemId, Supplier<T> action) {
        try {
            return action.get();
        } catch (OptimisticLockingFailureException e) {
            throw new PersistenceConflictException("Item " + itemId + " was modified concurrently", e);
        }
    }
}
