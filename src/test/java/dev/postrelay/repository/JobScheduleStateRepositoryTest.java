package dev.postrelay.repository;

import dev.postrelay.config.SchedulerProperties;
import dev.postrelay.entity.JobScheduleState;
import dev.postrelay.model.IntervalBounds;
import dev.postrelay.scheduler.InstanceIdentity;
import dev.postrelay.scheduler.IntervalPolicy;
import dev.postrelay.scheduler.JobScheduleStore;
import dev.postrelay.scheduler.ScheduleDecision;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JobScheduleStateRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-11-06T10:00:00Z");
    private static final IntervalBounds BOUNDS = new IntervalBounds(30, 60);

    @Autowired
    private JobScheduleStateRepository repository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private JobScheduleStore storeFor(String instanceId) {
        SchedulerProperties properties = new SchedulerProperties();
        properties.setInstanceId(instanceId);
        IntervalPolicy policy = new IntervalPolicy((min, max) -> 40, properties);
        return new JobScheduleStore(repository, policy, properties, new InstanceIdentity(properties),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCommitOnlyOneOfTwoRacingClaims() {
        repository.deleteAll();
        repository.saveAndFlush(JobScheduleState.builder().jobName("publish")
                .lastRunAt(NOW.minus(Duration.ofHours(2))).chosenIntervalMinutes(45).build());

        JobScheduleStore nodeA = storeFor("node-a");
        JobScheduleStore nodeB = storeFor("node-b");
        TransactionTemplate nodeATx = new TransactionTemplate(transactionManager);
        TransactionTemplate nodeBTx = new TransactionTemplate(transactionManager);
        nodeBTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        AtomicReference<ScheduleDecision> nodeBDecision = new AtomicReference<>();

        // node A reads the row, node B claims and commits, then node A decides on what it read
        assertThatThrownBy(() -> nodeATx.executeWithoutResult(status -> {
            repository.findById("publish").orElseThrow();
            nodeBDecision.set(nodeBTx.execute(s -> nodeB.claim("publish", BOUNDS, false)));
            nodeA.claim("publish", BOUNDS, false);
        })).isInstanceOf(OptimisticLockingFailureException.class);

        assertThat(nodeBDecision.get().isFired()).isTrue();
        JobScheduleState stored = repository.findById("publish").orElseThrow();
        assertThat(stored.getRunningInstance()).isEqualTo("node-b");
        assertThat(stored.getLastRunAt()).isEqualTo(NOW);
        assertThat(stored.getChosenIntervalMinutes()).isEqualTo(40);
    }

    @Test
    void shouldSeeCommittedClaimAsInFlight() {
        repository.deleteAll();
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        ScheduleDecision first = tx.execute(s -> storeFor("node-a").claim("content-scrape", BOUNDS, true));
        ScheduleDecision second = tx.execute(s -> storeFor("node-b").claim("content-scrape", BOUNDS, true));

        assertThat(first.isFired()).isTrue();
        assertThat(second.outcome()).isEqualTo(ScheduleDecision.Outcome.IN_FLIGHT);
        assertThat(repository.findById("content-scrape")).get()
                .extracting(JobScheduleState::getRunningInstance).isEqualTo("node-a");
    }
}
