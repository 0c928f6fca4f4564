package dev.postrelay.repository;

import dev.postrelay.entity.ScrapingSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository for ingestion sessions.
 */
@Repository
public interface ScrapingSessionRepository extends JpaRepository<ScrapingSession, Long> {

    List<ScrapingSession> findTop50ByOrderByStartedAtDesc();

    /**
     * Delete sessions older than a certain date (for cleanup).
     */
    @Transactional
    long deleteByStartedAtBefore(Instant cutoff);
}
