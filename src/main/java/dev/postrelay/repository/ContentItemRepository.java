package dev.postrelay.repository;

import dev.postrelay.entity.ContentItem;
import dev.postrelay.model.ApprovalState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Repository for scraped content items.
 */
@Repository
public interface ContentItemRepository extends JpaRepository<ContentItem, Long>, JpaSpecificationExecutor<ContentItem> {

    /**
     * Check if an item with this content hash already exists.
     */
    boolean existsByContentHash(String contentHash);

    /**
     * Find hashes from a batch that are already stored.
     */
    @Query("SELECT c.contentHash FROM ContentItem c WHERE c.contentHash IN :hashes")
    Set<String> findExistingHashes(Collection<String> hashes);

    /**
     * Auto-publish candidates, highest priority first, oldest approval first within a priority.
     */
    @Query("""
            SELECT c FROM ContentItem c
            WHERE c.approvalState = :approved
              AND c.autoPostEnabled = true
              AND c.publishedToTarget = false
              AND c.wordCount > :minWordCount
              AND (c.publishClaimedAt IS NULL OR c.publishClaimedAt < :claimExpiry)
            ORDER BY c.publishPriority DESC, c.approvedAt ASC, c.id ASC
            """)
    List<ContentItem> findPublishCandidates(ApprovalState approved, int minWordCount,
                                            Instant claimExpiry, Pageable pageable);

    /**
     * Items still waiting for the media generator, oldest first.
     */
    @Query("""
            SELECT c FROM ContentItem c
            WHERE c.mediaGenerated = false
              AND c.approvalState = :unset
              AND c.publishedToTarget = false
              AND c.wordCount > :minWordCount
            ORDER BY c.scrapedAt ASC, c.id ASC
            """)
    List<ContentItem> findAwaitingMedia(ApprovalState unset, int minWordCount, Pageable pageable);

    /**
     * Downloaded items whose artifact is older than the cutoff and still on record.
     */
    @Query("""
            SELECT c FROM ContentItem c
            WHERE c.downloaded = true
              AND c.mediaGenerated = true
              AND c.downloadedAt IS NOT NULL
              AND c.downloadedAt < :cutoff
            """)
    List<ContentItem> findExpiredDownloads(Instant cutoff);
}
