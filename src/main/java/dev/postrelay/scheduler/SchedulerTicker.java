package dev.postrelay.scheduler;

import dev.postrelay.config.SchedulerProperties;
import dev.postrelay.jobs.JobNames;
import dev.postrelay.service.RetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Timer driving the scheduler tick and the nightly retention sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "relay.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerTicker {

    private final AdaptiveScheduler scheduler;
    private final RetentionService retentionService;
    private final ClusterLockService lockService;
    private final SchedulerProperties properties;

    @Scheduled(fixedDelayString = "#{@schedulerProperties.tickInterval.toMillis()}",
            initialDelayString = "#{@schedulerProperties.tickInterval.toMillis()}")
    public void tick() {
        scheduler.tick();
    }

    @Scheduled(cron = "${relay.retention.cron:0 0 2 * * *}")
    public void sweepRetention() {
        if (!lockService.tryLock(JobNames.RETENTION_SWEEP_LOCK, properties.getLockLease())) {
            log.info("Retention sweep already running on another instance");
            return;
        }
        try {
            retentionService.sweepIfEnabled();
        } catch (RuntimeException e) {
            log.error("Retention sweep failed: {}", e.getMessage(), e);
        } finally {
            lockService.unlock(JobNames.RETENTION_SWEEP_LOCK);
        }
    }
}
