package dev.postrelay.model;

/**
 * Listing/counting buckets offered to the admin surface.
 */
public enum LifecycleBucket {
    ALL,
    AWAITING_MEDIA,
    PENDING,
    APPROVED,
    APPROVED_AUTO,
    APPROVED_MANUAL,
    REJECTED,
    PUBLISHED,
    DOWNLOADED
}
