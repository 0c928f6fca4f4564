package dev.postrelay.service;

import dev.postrelay.config.RetentionProperties;
import dev.postrelay.entity.ContentItem;
import dev.postrelay.entity.RetentionPolicy;
import dev.postrelay.exception.PersistenceConflictException;
import dev.postrelay.exception.StorageFailureException;
import dev.postrelay.metrics.RelayMetrics;
import dev.postrelay.model.SweepReport;
import dev.postrelay.repository.ContentItemRepository;
import dev.postrelay.repository.RetentionPolicyRepository;
import dev.postrelay.repository.ScrapingSessionRepository;
import dev.postrelay.storage.MediaStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reclaims storage of media that was downloaded longer ago than the retention window.
 *
 * <p>Each item is cleared in its own write, so a failure on one item never rolls back or stops
 * the rest of the batch. Clearing is idempotent: a cleared item no longer matches the selection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionService {

    private static final String SEPARATOR = "========================================";

    private final RetentionPolicyRepository policyRepository;
    private final ContentItemRepository contentItemRepository;
    private final ScrapingSessionRepository scrapingSessionRepository;
    private final MediaStorage mediaStorage;
    private final RetentionProperties properties;
    private final RelayMetrics metrics;
    private final Clock clock;

    /**
     * Current policy. Created from {@code relay.retention.*} on first access.
     */
    public RetentionPolicy getPolicy() {
        return policyRepository.findById(RetentionPolicy.SINGLETON_ID).orElseGet(this::seed);
    }

    /**
     * @throws IllegalArgumentException if {@code retentionDays < 1}
     */
    public RetentionPolicy updatePolicy(boolean enabled, int retentionDays) {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retentionDays must be >= 1, was " + retentionDays);
        }
        RetentionPolicy policy = getPolicy();
        policy.setEnabled(enabled);
        policy.setRetentionDays(retentionDays);
        try {
            RetentionPolicy saved = policyRepository.save(policy);
            log.info("Retention policy updated: enabled={}, retentionDays={}", enabled, retentionDays);
            return saved;
        } catch (OptimisticLockingFailureException e) {
            throw new PersistenceConflictException("Retention policy was changed concurrently", e);
        }
    }

    /**
     * Run a sweep with the current retention window, whether or not the policy is enabled.
     */
    public SweepReport sweep() {
        RetentionPolicy policy = getPolicy();
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(policy.getRetentionDays()));

        log.info(SEPARATOR);
        log.info("Retention sweep: downloads before {} ({} days)", cutoff, policy.getRetentionDays());
        log.info(SEPARATOR);

        List<ContentItem> expired = contentItemRepository.findExpiredDownloads(cutoff);
        int cleared = 0;
        int deleted = 0;
        int missing = 0;
        long bytesFreed = 0;
        List<Long> failed = new ArrayList<>();

        for (ContentItem item : expired) {
            String ref = item.getMediaRef();
            boolean removalFailed = false;

            if (ref == null || !mediaStorage.exists(ref)) {
                missing++;
                log.warn("Artifact {} of item {} not found - clearing reference", ref, item.getId());
            } else {
                try {
                    long size = mediaStorage.size(ref);
                    if (mediaStorage.delete(ref)) {
                        deleted++;
                        bytesFreed += size;
                        log.debug("Deleted artifact {} of item {} ({} bytes)", ref, item.getId(), size);
                    } else {
                        missing++;
                    }
                } catch (StorageFailureException e) {
                    removalFailed = true;
                    metrics.recordStorageFailure();
                    log.error("Could not delete artifact {} of item {}: {}", ref, item.getId(), e.getMessage());
                }
            }

            if (clear(item) && !removalFailed) {
                cleared++;
            } else {
                failed.add(item.getId());
            }
        }

        long sessionsPurged = purgeSessions(now);

        policy.setLastSweepAt(now);
        policyRepository.save(policy);
        metrics.updateLastSweep(cleared, bytesFreed);

        SweepReport report = new SweepReport(expired.size(), cleared, deleted, missing, bytesFreed,
                List.copyOf(failed), sessionsPurged, now);
        log.info("Retention sweep complete: {} examined, {} cleared, {} files deleted, {} missing, {} failed, {} KB freed",
                report.examined(), report.cleared(), report.filesDeleted(), report.filesMissing(),
                failed.size(), bytesFreed / 1024);
        return report;
    }

    /**
     * Sweep only if the policy is enabled. Used by the timer.
     */
    public SweepReport sweepIfEnabled() {
        if (!getPolicy().isEnabled()) {
            log.debug("Retention policy disabled - skipping scheduled sweep");
            return SweepReport.skipped(clock.instant());
        }
        return sweep();
    }

    private boolean clear(ContentItem item) {
        item.setMediaGenerated(false);
        item.setMediaRef(null);
        try {
            contentItemRepository.save(item);
            return true;
        } catch (OptimisticLockingFailureException e) {
            log.error("Item {} changed during the sweep and was not cleared", item.getId());
            return false;
        }
    }

    private long purgeSessions(Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(properties.getSessionRetentionDays()));
        long purged = scrapingSessionRepository.deleteByStartedAtBefore(cutoff);
        if (purged > 0) {
            log.info("Purged {} ingestion sessions older than {}", purged, cutoff);
        }
        return purged;
    }

    private RetentionPolicy seed() {
        try {
            return policyRepository.saveAndFlush(RetentionPolicy.builder()
                    .id(RetentionPolicy.SINGLETON_ID)
                    .enabled(properties.isEnabled())
                    .retentionDays(properties.getRetentionDays())
                    .build());
        } catch (DataIntegrityViolationException e) {
            return policyRepository.findById(RetentionPolicy.SINGLETON_ID).orElseThrow(() -> e);
        }
    }
}
