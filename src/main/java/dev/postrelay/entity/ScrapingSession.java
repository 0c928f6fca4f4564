package dev.postrelay.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One ingestion batch received from the scraper for a profile.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "scraping_sessions", indexes = {
        @Index(name = "idx_session_started_at", columnList = "startedAt")
})
public class ScrapingSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "source_profile_id")
    private SourceProfile sourceProfile;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant completedAt;

    private int itemsFound;

    private int itemsNew;

    @Column(length = 64)
    private String stoppedReason;
}
