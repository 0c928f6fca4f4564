package dev.postrelay.scheduler;

import dev.postrelay.entity.SchedulerLock;
import dev.postrelay.repository.SchedulerLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cluster-wide named mutex backed by lease rows in {@code scheduler_locks}.
 *
 * <p>Acquisition never blocks: a single conditional update takes over the row only if its lease
 * has expired. The row is created on first use. A crashed holder stops renewing and its lease
 * simply runs out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClusterLockService {

    private final SchedulerLockRepository lockRepository;
    private final InstanceIdentity identity;
    private final Clock clock;

    /**
     * Try to take the named lock for the given lease.
     *
     * @return true if this instance now holds the lock
     */
    public boolean tryLock(String name, Duration lease) {
        Instant now = clock.instant();
        Instant until = now.plus(lease);

        if (lockRepository.acquire(name, identity.getId(), now, until) == 1) {
            return true;
        }
        if (lockRepository.existsById(name)) {
            log.debug("Lock {} is held by another instance", name);
            return false;
        }
        return insert(name, now, until);
    }

    /**
     * Release the named lock if this instance holds it.
     */
    public void unlock(String name) {
        int released = lockRepository.release(name, identity.getId(), clock.instant());
        if (released == 0) {
            log.warn("Lock {} was not held by {} at release", name, identity.getId());
        }
    }

    private boolean insert(String name, Instant now, Instant until) {
        try {
            lockRepository.saveAndFlush(SchedulerLock.builder()
                    .name(name)
                    .lockedAt(now)
                    .lockedUntil(until)
                    .lockedBy(identity.getId())
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Lost the race creating lock {}", name);
            return false;
        }
    }
}
