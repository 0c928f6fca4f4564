package dev.postrelay.entity;

import dev.postrelay.model.ApprovalMode;
import dev.postrelay.model.ApprovalState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * A single scraped post tracked through the publication lifecycle.
 * The lifecycle state is never stored; see {@link dev.postrelay.model.LifecycleState#of(ContentItem)}.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "content_items", indexes = {
        @Index(name = "idx_publish_queue", columnList = "approvalState, autoPostEnabled, publishedToTarget"),
        @Index(name = "idx_downloaded_at", columnList = "downloadedAt")
})
public class ContentItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true, length = 64)
    private String contentHash;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne
    @JoinColumn(name = "source_profile_id")
    private SourceProfile sourceProfile;

    @Column(nullable = false, length = 8000)
    private String rawText;

    @Column(nullable = false)
    private int wordCount;

    @Column(length = 2048)
    private String sourceMediaUrl;

    @Column(nullable = false)
    private Instant scrapedAt;

    // Generated media
    @Column(nullable = false)
    private boolean mediaGenerated;

    @Column(length = 512)
    private String mediaRef;

    // Approval
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ApprovalState approvalState = ApprovalState.UNSET;

    private Instant approvedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private ApprovalMode approvalMode;

    @Column(nullable = false)
    private boolean autoPostEnabled;

    @Column(nullable = false)
    private int publishPriority;

    // Publication
    private Instant publishClaimedAt;

    @Column(nullable = false)
    private boolean publishedToTarget;

    private Instant publishedAt;

    // Download
    @Column(nullable = false)
    private boolean downloaded;

    private Instant downloadedAt;
}
