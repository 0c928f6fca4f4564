package dev.postrelay.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Singleton row configuring the retention sweep of downloaded artifacts.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "retention_policy")
public class RetentionPolicy {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false)
    private boolean enabled;

    @Column(nullable = false)
    private int retentionDays;

    private Instant lastSweepAt;
}
