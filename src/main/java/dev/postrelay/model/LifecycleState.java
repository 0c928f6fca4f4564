package dev.postrelay.model;

import dev.postrelay.entity.ContentItem;

/**
 * Lifecycle state of a content item, derived from its stored flags.
 *
 * <p>Flags are the persistence format; all transition guards are expressed against this enum
 * (see {@link LifecycleTransition}).
 */
public enum LifecycleState {

    /** Ingested, no generated media yet. */
    SCRAPED,

    /** Media generated, waiting for an approval decision. */
    MEDIA_GENERATED,

    /** Approved and not yet published. Protected from deletion. */
    APPROVED,

    REJECTED,

    PUBLISHED,

    /** Published and the artifact was handed to an operator. */
    DOWNLOADED;

    /**
     * Derive the state from the flag combination of an item.
     */
    public static LifecycleState of(ContentItem item) {
        if (item.isPublishedToTarget()) {
            return item.isDownloaded() ? DOWNLOADED : PUBLISHED;
        }
        ApprovalState approval = item.getApprovalState() != null ? item.getApprovalState() : ApprovalState.UNSET;
        return switch (approval) {
            case APPROVED -> APPROVED;
            case REJECTED -> REJECTED;
            case UNSET -> item.isMediaGenerated() ? MEDIA_GENERATED : SCRAPED;
        };
    }

    public boolean isProtected() {
        return this == APPROVED;
    }

    public boolean isPublished() {
        return this == PUBLISHED || this == DOWNLOADED;
    }
}
