package dev.postrelay.service;

import dev.postrelay.config.ContentProperties;
import dev.postrelay.entity.ContentItem;
import dev.postrelay.entity.SourceProfile;
import dev.postrelay.metrics.RelayMetrics;
import dev.postrelay.model.ApprovalState;
import dev.postrelay.model.RawContent;
import dev.postrelay.repository.ContentItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Gates scraped posts into the content store exactly once, keyed by the SHA-256 of the
 * normalized text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentDeduplicationService {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private final ContentItemRepository contentItemRepository;
    private final ContentProperties contentProperties;
    private final RelayMetrics metrics;
    private final Clock clock;

    /**
     * Normalize text for comparison: strip markup, lowercase, collapse whitespace and drop
     * platform UI words such as "share" or "me gusta".
     */
    public String normalize(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return "";
        }
        String text = Jsoup.parse(rawText).text();
        String normalized = collapse(text.toLowerCase(Locale.ROOT));

        for (String artifact : contentProperties.getUiArtifacts()) {
            normalized = artifactPattern(artifact).matcher(normalized).replaceAll("");
        }
        return collapse(normalized);
    }

    /**
     * Stable identity of a post: SHA-256 hex of its normalized text.
     */
    public String hash(String rawText) {
        return sha256(normalize(rawText));
    }

    public int wordCount(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(normalizedText.trim()).length;
    }

    /**
     * Check if a post with the same normalized text is already stored.
     */
    public boolean isDuplicate(String rawText) {
        return contentItemRepository.existsByContentHash(hash(rawText));
    }

    /**
     * Store a scraped post unless an item with the same hash exists.
     * Duplicates are an idempotent no-op, not an error.
     *
     * @param content raw post
     * @param profile source profile, may be null
     * @return the new item, or empty when the post was blank or a duplicate
     */
    public Optional<ContentItem> ingest(RawContent content, SourceProfile profile) {
        String normalized = normalize(content.rawText());
        if (normalized.isEmpty()) {
            log.debug("Skipping blank post from {}", content.sourceRef());
            return Optional.empty();
        }

        String hash = sha256(normalized);
        if (contentItemRepository.existsByContentHash(hash)) {
            log.debug("Duplicate post {}: {}", abbreviate(hash), abbreviate(normalized));
            metrics.recordDuplicates(1);
            return Optional.empty();
        }

        int words = wordCount(normalized);
        ContentItem item = ContentItem.builder()
                .contentHash(hash)
                .sourceProfile(profile)
                .rawText(content.rawText())
                .wordCount(words)
                .sourceMediaUrl(content.sourceMediaUrl())
                .scrapedAt(clock.instant())
                .mediaGenerated(false)
                .approvalState(ApprovalState.UNSET)
                .build();

        try {
            ContentItem saved = contentItemRepository.saveAndFlush(item);
            metrics.recordIngested(1);
            if (words <= contentProperties.getMinWordCount()) {
                metrics.recordBelowThreshold();
                log.debug("Item {} stored below word threshold ({} words)", saved.getId(), words);
            }
            return Optional.of(saved);
        } catch (DataIntegrityViolationException e) {
            // Another writer inserted the same hash between our check and our insert
            log.debug("Concurrent insert of hash {} resolved as duplicate", abbreviate(hash));
            metrics.recordDuplicates(1);
            return Optional.empty();
        }
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private static Pattern artifactPattern(String artifact) {
        return PATTERN_CACHE.computeIfAbsent(artifact.toLowerCase(Locale.ROOT),
                a -> Pattern.compile("\\b" + Pattern.quote(a) + "\\b",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    private static String sha256(String normalized) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}
