package dev.postrelay.repository;

import dev.postrelay.entity.ContentItem;
import dev.postrelay.model.ApprovalState;
import dev.postrelay.model.LifecycleBucket;
import org.springframework.data.jpa.domain.Specification;

/**
 * Query predicates for the lifecycle buckets. Counts and listings both go through
 * {@link #inBucket(LifecycleBucket, int)} so they always agree.
 */
public final class ContentSpecifications {

    private ContentSpecifications() {
    }

    public static Specification<ContentItem> inBucket(LifecycleBucket bucket, int minWordCount) {
        return aboveWordCount(minWordCount).and(bucketPredicate(bucket));
    }

    public static Specification<ContentItem> aboveWordCount(int minWordCount) {
        return (root, query, cb) -> cb.greaterThan(root.get("wordCount"), minWordCount);
    }

    private static Specification<ContentItem> bucketPredicate(LifecycleBucket bucket) {
        return switch (bucket) {
            case ALL -> (root, query, cb) -> cb.conjunction();
            case AWAITING_MEDIA -> notPublished()
                    .and(approval(ApprovalState.UNSET))
                    .and((root, query, cb) -> cb.isFalse(root.get("mediaGenerated")));
            case PENDING -> notPublished()
                    .and(approval(ApprovalState.UNSET))
                    .and((root, query, cb) -> cb.isTrue(root.get("mediaGenerated")));
            case APPROVED -> notPublished().and(approval(ApprovalState.APPROVED));
            case APPROVED_AUTO -> notPublished().and(approval(ApprovalState.APPROVED))
                    .and((root, query, cb) -> cb.isTrue(root.get("autoPostEnabled")));
            case APPROVED_MANUAL -> notPublished().and(approval(ApprovalState.APPROVED))
                    .and((root, query, cb) -> cb.isFalse(root.get("autoPostEnabled")));
            case REJECTED -> notPublished().and(approval(ApprovalState.REJECTED));
            case PUBLISHED -> (root, query, cb) -> cb.isTrue(root.get("publishedToTarget"));
            case DOWNLOADED -> (root, query, cb) -> cb.and(
                    cb.isTrue(root.get("publishedToTarget")),
                    cb.isTrue(root.get("downloaded")));
        };
    }

    private static Specification<ContentItem> notPublished() {
        return (root, query, cb) -> cb.isFalse(root.get("publishedToTarget"));
    }

    private static Specification<ContentItem> approval(ApprovalState state) {
        return (root, query, cb) -> cb.equal(root.get("approvalState"), state);
    }
}
