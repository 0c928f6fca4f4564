package dev.postrelay.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus metrics for ingestion, scheduling, publishing and retention.
 */
@Component
public class RelayMetrics {

    private static final String TAG_JOB = "job";
    private final MeterRegistry registry;

    // Counters
    private final Counter itemsIngestedCounter;
    private final Counter duplicatesCounter;
    private final Counter belowThresholdCounter;
    private final Counter itemsPublishedCounter;
    private final Counter artifactsReclaimedCounter;
    private final Counter storageFailuresCounter;

    // Gauges
    private final AtomicInteger lastSweepCleared = new AtomicInteger(0);
    private final AtomicLong lastSweepBytesFreed = new AtomicLong(0);

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.itemsIngestedCounter = Counter.builder("post_relay_items_ingested_total")
                .description("New content items stored after deduplication")
                .register(registry);

        this.duplicatesCounter = Counter.builder("post_relay_items_duplicate_total")
                .description("Scraped posts discarded as duplicates")
                .register(registry);

        this.belowThresholdCounter = Counter.builder("post_relay_items_below_threshold_total")
                .description("Stored items at or below the minimum word count")
                .register(registry);

        this.itemsPublishedCounter = Counter.builder("post_relay_items_published_total")
                .description("Items published to the target")
                .register(registry);

        this.artifactsReclaimedCounter = Counter.builder("post_relay_artifacts_reclaimed_total")
                .description("Media artifacts cleared by the retention sweep")
                .register(registry);

        this.storageFailuresCounter = Counter.builder("post_relay_storage_failures_total")
                .description("Artifact deletions that failed")
                .register(registry);

        Gauge.builder("post_relay_last_sweep_cleared", lastSweepCleared, AtomicInteger::get)
                .description("Items cleared in the last retention sweep")
                .register(registry);

        Gauge.builder("post_relay_last_sweep_bytes_freed", lastSweepBytesFreed, AtomicLong::get)
                .description("Bytes freed in the last retention sweep")
                .register(registry);
    }

    public void recordIngested(int count) {
        itemsIngestedCounter.increment(count);
    }

    public void recordDuplicates(int count) {
        duplicatesCounter.increment(count);
    }

    public void recordBelowThreshold() {
        belowThresholdCounter.increment();
    }

    public void recordPublished() {
        itemsPublishedCounter.increment();
    }

    public void recordStorageFailure() {
        storageFailuresCounter.increment();
    }

    /**
     * Record that the scheduler started a run of a job.
     */
    public void recordJobFired(String jobName) {
        jobCounter("post_relay_job_fired_total", jobName).increment();
    }

    /**
     * Record a run that failed or exited non-zero.
     */
    public void recordJobFailure(String jobName) {
        jobCounter("post_relay_job_failures_total", jobName).increment();
    }

    /**
     * Record a due run suppressed because the previous one is still in flight.
     */
    public void recordOverlapSuppressed(String jobName) {
        jobCounter("post_relay_job_overlap_suppressed_total", jobName).increment();
    }

    /**
     * Record a decision skipped because another instance holds the job lock.
     */
    public void recordLockContention(String jobName) {
        jobCounter("post_relay_job_lock_contention_total", jobName).increment();
    }

    public void updateLastSweep(int cleared, long bytesFreed) {
        artifactsReclaimedCounter.increment(cleared);
        lastSweepCleared.set(cleared);
        lastSweepBytesFreed.set(bytesFreed);
    }

    private Counter jobCounter(String name, String jobName) {
        return Counter.builder(name)
                .tag(TAG_JOB, jobName)
                .register(registry);
    }
}
