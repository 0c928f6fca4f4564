package dev.postrelay.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Lease row backing a cluster-wide named lock.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "scheduler_locks")
public class SchedulerLock {

    @Id
    @Column(length = 64)
    private String name;

    // Non-null once stored, so saving a fresh row always inserts
    @Version
    private Long version;

    @Column(nullable = false)
    private Instant lockedUntil;

    @Column(nullable = false)
    private Instant lockedAt;

    @Column(nullable = false, length = 128)
    private String lockedBy;
}
