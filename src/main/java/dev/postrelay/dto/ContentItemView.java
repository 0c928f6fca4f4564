package dev.postrelay.dto;

import dev.postrelay.entity.ContentItem;
import dev.postrelay.model.ApprovalMode;
import dev.postrelay.model.ApprovalState;
import dev.postrelay.model.LifecycleState;

import java.time.Instant;

/**
 * Content item as returned by the admin API, with its derived lifecycle state.
 */
public record ContentItemView(Long id,
                              LifecycleState state,
                              String source,
                              String text,
                              int wordCount,
                              String sourceMediaUrl,
                              Instant scrapedAt,
                              boolean mediaGenerated,
                              String mediaRef,
                              ApprovalState approvalState,
                              ApprovalMode approvalMode,
                              Instant approvedAt,
                              boolean autoPostEnabled,
                              int publishPriority,
                              boolean published,
                              Instant publishedAt,
                              boolean downloaded,
                              Instant downloadedAt) {

    public static ContentItemView from(ContentItem item) {
        return new ContentItemView(
                item.getId(),
                LifecycleState.of(item),
                item.getSourceProfile() != null ? item.getSourceProfile().getUsername() : null,
                item.getRawText(),
                item.getWordCount(),
                item.getSourceMediaUrl(),
                item.getScrapedAt(),
                item.isMediaGenerated(),
                item.getMediaRef(),
                item.getApprovalState(),
                item.getApprovalMode(),
                item.getApprovedAt(),
                item.isAutoPostEnabled(),
                item.getPublishPriority(),
                item.isPublishedToTarget(),
                item.getPublishedAt(),
                item.isDownloaded(),
                item.getDownloadedAt());
    }
}
