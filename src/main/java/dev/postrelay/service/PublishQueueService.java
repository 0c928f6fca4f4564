package dev.postrelay.service;

import dev.postrelay.config.ContentProperties;
import dev.postrelay.entity.ContentItem;
import dev.postrelay.exception.NotFoundException;
import dev.postrelay.exception.PreconditionViolationException;
import dev.postrelay.model.ApprovalState;
import dev.postrelay.model.LifecycleState;
import dev.postrelay.model.LifecycleTransition;
import dev.postrelay.repository.ContentItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Chooses the next approved item to publish and applies the Approved → Published transition.
 *
 * <p>An item picked for publication is reserved ({@code publishClaimedAt}) for the duration of the
 * external publish so that approval changes and deletion are refused meanwhile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PublishQueueService {

    private final ContentItemRepository contentItemRepository;
    private final ContentProperties contentProperties;
    private final ContentLifecycleService lifecycleService;
    private final Clock clock;

    /**
     * True while a publish reservation younger than the timeout exists on the item.
     */
    public static boolean hasActiveReservation(ContentItem item, Instant now, Duration timeout) {
        Instant claimedAt = item.getPublishClaimedAt();
        return claimedAt != null && claimedAt.isAfter(now.minus(timeout));
    }

    /**
     * Highest priority auto-post item, oldest approval first within a priority.
     */
    @Transactional(readOnly = true)
    public Optional<ContentItem> nextEligible() {
        Instant claimExpiry = clock.instant().minus(contentProperties.getPublishClaimTimeout());
        return contentItemRepository.findPublishCandidates(
                        ApprovalState.APPROVED,
                        contentProperties.getMinWordCount(),
                        claimExpiry,
                        PageRequest.of(0, 1))
                .stream()
                .findFirst();
    }

    /**
     * Reserve the next eligible item for publication.
     *
     * @return the reserved item, or empty when nothing qualifies
     */
    @Transactional
    public Optional<ContentItem> reserveNext() {
        return nextEligible().map(this::claim);
    }

    /**
     * Reserve a specific item for a manual publish. Bypasses {@code autoPostEnabled}.
     */
    @Transactional
    public ContentItem reserve(Long itemId) {
        ContentItem item = load(itemId);
        requirePublishable(item);
        return claim(item);
    }

    /**
     * Fail fast unless the item exists and is approved and unpublished. Nothing is written.
     */
    @Transactional(readOnly = true)
    public ContentItem validateManualTarget(Long itemId) {
        ContentItem item = load(itemId);
        requirePublishable(item);
        return item;
    }

    /**
     * Apply Approved → Published after the external publish succeeded.
     */
    public ContentItem completePublish(Long itemId) {
        return lifecycleService.markPublished(itemId);
    }

    /**
     * Drop the publish reservation after a failed publish. Missing items are ignored.
     */
    @Transactional
    public void release(Long itemId) {
        contentItemRepository.findById(itemId).ifPresent(item -> {
            if (item.getPublishClaimedAt() != null) {
                item.setPublishClaimedAt(null);
                contentItemRepository.save(item);
                log.debug("Released publish reservation on item {}", itemId);
            }
        });
    }

    private ContentItem claim(ContentItem item) {
        item.setPublishClaimedAt(clock.instant());
        ContentItem saved = contentItemRepository.save(item);
        log.debug("Reserved item {} for publication", item.getId());
        return saved;
    }

    private void requirePublishable(ContentItem item) {
        LifecycleState state = LifecycleState.of(item);
        if (!LifecycleTransition.PUBLISH.isAllowedFrom(state)) {
            throw PreconditionViolationException.of(item.getId(), state, LifecycleTransition.PUBLISH);
        }
        if (hasActiveReservation(item, clock.instant(), contentProperties.getPublishClaimTimeout())) {
            throw new PreconditionViolationException(item.getId(), state,
                    "Item " + item.getId() + " is already being published");
        }
    }

    private ContentItem load(Long itemId) {
        return contentItemRepository.findById(itemId)
                .orElseThrow(() -> NotFoundException.item(itemId));
    }
}
