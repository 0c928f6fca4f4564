package dev.postrelay.repository;

import dev.postrelay.entity.SchedulerLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Repository for named lock leases. Each statement runs in its own transaction so that the
 * conditional update is the single atomic step deciding ownership.
 */
@Repository
public interface SchedulerLockRepository extends JpaRepository<SchedulerLock, String> {

    /**
     * Take over the lease if it has expired.
     *
     * @return 1 if this caller now holds the lock, 0 otherwise
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE SchedulerLock l
               SET l.lockedUntil = :until, l.lockedAt = :now, l.lockedBy = :owner
             WHERE l.name = :name AND l.lockedUntil <= :now
            """)
    int acquire(String name, String owner, Instant now, Instant until);

    /**
     * Expire the lease, but only if held by the given owner.
     */
    @Modifying
    @Transactional
    @Query("UPDATE SchedulerLock l SET l.lockedUntil = :now WHERE l.name = :name AND l.lockedBy = :owner")
    int release(String name, String owner, Instant now);
}
