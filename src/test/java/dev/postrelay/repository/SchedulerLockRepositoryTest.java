package dev.postrelay.repository;

import dev.postrelay.entity.SchedulerLock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class SchedulerLockRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-11-06T10:00:00Z");
    private static final Duration LEASE = Duration.ofMinutes(2);

    @Autowired
    private SchedulerLockRepository repository;

    @Test
    void shouldGrantLeaseToOneOwnerUntilItExpires() {
        repository.deleteAll();
        repository.saveAndFlush(SchedulerLock.builder()
                .name("publish").lockedBy("node-a").lockedAt(NOW).lockedUntil(NOW.plus(LEASE)).build());

        assertThat(repository.acquire("publish", "node-b", NOW.plusSeconds(30), NOW.plusSeconds(30).plus(LEASE)))
                .isZero();
        assertThat(repository.acquire("publish", "node-b", NOW.plus(LEASE), NOW.plus(LEASE).plus(LEASE)))
                .isEqualTo(1);
        assertThat(repository.findById("publish")).get()
                .extracting(SchedulerLock::getLockedBy).isEqualTo("node-b");
    }

    @Test
    void shouldReleaseOnlyOwnLease() {
        repository.deleteAll();
        repository.saveAndFlush(SchedulerLock.builder()
                .name("media-generation").lockedBy("node-a").lockedAt(NOW).lockedUntil(NOW.plus(LEASE)).build());

        assertThat(repository.release("media-generation", "node-b", NOW)).isZero();
        assertThat(repository.release("media-generation", "node-a", NOW.plusSeconds(10))).isEqualTo(1);
        assertThat(repository.acquire("media-generation", "node-b", NOW.plusSeconds(10), NOW.plus(LEASE)))
                .isEqualTo(1);
    }
}
