package dev.postrelay.service;

import dev.postrelay.config.ContentProperties;
import dev.postrelay.entity.ContentItem;
import dev.postrelay.exception.NotFoundException;
import dev.postrelay.exception.PreconditionViolationException;
import dev.postrelay.exception.StorageFailureException;
import dev.postrelay.metrics.RelayMetrics;
import dev.postrelay.model.ApprovalMode;
import dev.postrelay.model.ApprovalState;
import dev.postrelay.model.LifecycleState;
import dev.postrelay.model.LifecycleTransition;
import dev.postrelay.repository.ContentItemRepository;
import dev.postrelay.storage.MediaStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Operator and collaborator driven transitions of the content lifecycle.
 *
 * <p>Every method loads the item, checks the transition against its derived
 * {@link LifecycleState} and writes the new flags in one transaction; the {@code @Version}
 * column rejects a concurrent writer instead of overwriting it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentLifecycleService {

    private final ContentItemRepository contentItemRepository;
    private final MediaStorage mediaStorage;
    private final ContentProperties contentProperties;
    private final RelayMetrics metrics;
    private final Clock clock;

    /**
     * Scraped → MediaGenerated, called back by the media generator.
     */
    @Transactional
    public ContentItem markMediaGenerated(Long itemId, String mediaRef) {
        if (mediaRef == null || mediaRef.isBlank()) {
            throw new IllegalArgumentException("mediaRef is required");
        }
        ContentItem item = load(itemId);
        require(item, LifecycleTransition.GENERATE_MEDIA);

        item.setMediaGenerated(true);
        item.setMediaRef(mediaRef);
        log.info("Media generated for item {}: {}", itemId, mediaRef);
        return contentItemRepository.save(item);
    }

    /**
     * Approve an item for publication.
     *
     * @param autoPost true to let the publish job pick it, false for manual publishing only
     * @param priority publish priority, higher goes first; null keeps the current value
     */
    @Transactional
    public ContentItem approve(Long itemId, boolean autoPost, Integer priority) {
        ContentItem item = load(itemId);
        require(item, LifecycleTransition.APPROVE);
        requireNotReserved(item);

        item.setApprovalState(ApprovalState.APPROVED);
        item.setApprovedAt(clock.instant());
        item.setAutoPostEnabled(autoPost);
        item.setApprovalMode(ApprovalMode.of(autoPost));
        if (priority != null) {
            item.setPublishPriority(priority);
        }
        log.info("Item {} approved ({}, priority {})", itemId, item.getApprovalMode(), item.getPublishPriority());
        return contentItemRepository.save(item);
    }

    /**
     * Reject an item. {@code approvedAt} records the time of the decision.
     */
    @Transactional
    public ContentItem reject(Long itemId) {
        ContentItem item = load(itemId);
        require(item, LifecycleTransition.REJECT);
        requireNotReserved(item);

        item.setApprovalState(ApprovalState.REJECTED);
        item.setApprovedAt(clock.instant());
        item.setAutoPostEnabled(false);
        item.setApprovalMode(null);
        log.info("Item {} rejected", itemId);
        return contentItemRepository.save(item);
    }

    /**
     * Approved → Published. Irreversible; clears any publish reservation.
     */
    @Transactional
    public ContentItem markPublished(Long itemId) {
        ContentItem item = load(itemId);
        require(item, LifecycleTransition.PUBLISH);

        item.setPublishedToTarget(true);
        item.setPublishedAt(clock.instant());
        item.setPublishClaimedAt(null);
        ContentItem saved = contentItemRepository.save(item);

        metrics.recordPublished();
        log.info("Item {} published (priority {}, approved at {})",
                itemId, item.getPublishPriority(), item.getApprovedAt());
        return saved;
    }

    /**
     * Published → Downloaded. Repeating the call keeps the first {@code downloadedAt}.
     */
    @Transactional
    public ContentItem markDownloaded(Long itemId) {
        ContentItem item = load(itemId);
        LifecycleState state = require(item, LifecycleTransition.DOWNLOAD);
        if (state == LifecycleState.DOWNLOADED) {
            return item;
        }

        item.setDownloaded(true);
        item.setDownloadedAt(clock.instant());
        log.info("Item {} marked as downloaded", itemId);
        return contentItemRepository.save(item);
    }

    /**
     * Delete an item and, best effort, its media artifact. Approved but unpublished items are
     * protected and cannot be deleted.
     */
    @Transactional
    public void delete(Long itemId) {
        ContentItem item = load(itemId);
        require(item, LifecycleTransition.DELETE);
        requireNotReserved(item);

        contentItemRepository.delete(item);
        if (item.getMediaRef() != null) {
            try {
                mediaStorage.delete(item.getMediaRef());
            } catch (StorageFailureException e) {
                log.warn("Item {} deleted but its artifact {} could not be removed: {}",
                        itemId, item.getMediaRef(), e.getMessage());
            }
        }
        log.info("Item {} deleted", itemId);
    }

    @Transactional(readOnly = true)
    public ContentItem get(Long itemId) {
        return load(itemId);
    }

    private LifecycleState require(ContentItem item, LifecycleTransition transition) {
        LifecycleState state = LifecycleState.of(item);
        if (!transition.isAllowedFrom(state)) {
            throw PreconditionViolationException.of(item.getId(), state, transition);
        }
        return state;
    }

    private void requireNotReserved(ContentItem item) {
        Instant now = clock.instant();
        if (PublishQueueService.hasActiveReservation(item, now, contentProperties.getPublishClaimTimeout())) {
            throw new PreconditionViolationException(item.getId(), LifecycleState.of(item),
                    "Item " + item.getId() + " is being published");
        }
    }

    private ContentItem load(Long itemId) {
        return contentItemRepository.findById(itemId)
                .orElseThrow(() -> NotFoundException.item(itemId));
    }
}
