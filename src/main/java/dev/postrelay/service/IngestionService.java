package dev.postrelay.service;

import dev.postrelay.entity.ContentItem;
import dev.postrelay.entity.ScrapingSession;
import dev.postrelay.entity.SourceProfile;
import dev.postrelay.model.RawContent;
import dev.postrelay.repository.ScrapingSessionRepository;
import dev.postrelay.repository.SourceProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Receives batches from the scraper, records one scraping session per batch and feeds each post
 * through the deduplicator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    static final String STOP_COMPLETED = "completed";
    static final String STOP_DUPLICATE_REACHED = "duplicate_reached";

    private final ContentDeduplicationService deduplicationService;
    private final SourceProfileRepository sourceProfileRepository;
    private final ScrapingSessionRepository scrapingSessionRepository;
    private final Clock clock;

    /**
     * Result of one ingestion batch.
     */
    public record IngestionResult(Long sessionId, int found, int created, int duplicates) {
    }

    /**
     * Ingest a batch of posts scraped from one profile.
     *
     * @param sourceRef profile username, null for unattributed posts
     * @param posts     posts in scrape order
     * @return counts of the batch
     */
    public IngestionResult ingestBatch(String sourceRef, List<RawContent> posts) {
        SourceProfile profile = resolveProfile(sourceRef);
        ScrapingSession session = scrapingSessionRepository.save(ScrapingSession.builder()
                .sourceProfile(profile)
                .startedAt(clock.instant())
                .build());

        Set<String> seenTexts = new HashSet<>();
        int created = 0;
        int duplicates = 0;

        for (RawContent post : posts) {
            String normalized = deduplicationService.normalize(post.rawText());
            if (normalized.isEmpty()) {
                continue;
            }
            if (!seenTexts.add(normalized)) {
                duplicates++;
                continue;
            }
            Optional<ContentItem> item = deduplicationService.ingest(post, profile);
            if (item.isPresent()) {
                created++;
            } else {
                duplicates++;
            }
        }

        Instant now = clock.instant();
        session.setCompletedAt(now);
        session.setItemsFound(posts.size());
        session.setItemsNew(created);
        session.setStoppedReason(duplicates > 0 ? STOP_DUPLICATE_REACHED : STOP_COMPLETED);
        scrapingSessionRepository.save(session);

        if (profile != null) {
            profile.setLastScrapedAt(now);
            sourceProfileRepository.save(profile);
        }

        log.info("Ingestion from {}: {} posts, {} new, {} duplicates",
                sourceRef != null ? sourceRef : "<unattributed>", posts.size(), created, duplicates);
        return new IngestionResult(session.getId(), posts.size(), created, duplicates);
    }

    /**
     * Ingest a single post.
     */
    public Optional<ContentItem> ingest(RawContent post) {
        return deduplicationService.ingest(post, resolveProfile(post.sourceRef()));
    }

    /**
     * Recent ingestion sessions, newest first.
     */
    public List<ScrapingSession> recentSessions() {
        return scrapingSessionRepository.findTop50ByOrderByStartedAtDesc();
    }

    private SourceProfile resolveProfile(String sourceRef) {
        if (sourceRef == null || sourceRef.isBlank()) {
            return null;
        }
        String username = sourceRef.trim();
        return sourceProfileRepository.findByUsername(username)
                .orElseGet(() -> createProfile(username));
    }

    private SourceProfile createProfile(String username) {
        try {
            SourceProfile profile = sourceProfileRepository.saveAndFlush(SourceProfile.builder()
                    .username(username)
                    .createdAt(clock.instant())
                    .build());
            log.info("Registered new source profile {}", username);
            return profile;
        } catch (DataIntegrityViolationException e) {
            return sourceProfileRepository.findByUsername(username)
                    .orElseThrow(() -> e);
        }
    }
}
