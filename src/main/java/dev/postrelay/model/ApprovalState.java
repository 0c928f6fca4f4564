package dev.postrelay.model;

/**
 * Operator decision on a content item. {@code UNSET} means no decision yet.
 */
public enum ApprovalState {
    UNSET,
    APPROVED,
    REJECTED
}
