package dev.postrelay.scheduler;

import dev.postrelay.config.SchedulerProperties;
import dev.postrelay.entity.JobScheduleState;
import dev.postrelay.model.IntervalBounds;
import dev.postrelay.repository.JobScheduleStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Persistent per-job scheduling state.
 *
 * <p>{@link #claim} is the only writer of {@code lastRunAt} and {@code chosenIntervalMinutes}. It
 * reads, decides and writes in one transaction on a versioned row, so of two instances racing on
 * the same job at most one commits a firing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobScheduleStore {

    private final JobScheduleStateRepository repository;
    private final IntervalPolicy intervalPolicy;
    private final SchedulerProperties properties;
    private final InstanceIdentity identity;
    private final Clock clock;

    /**
     * Decide whether the job fires now and, if so, record the firing.
     *
     * <p>A job that is not due reports {@code NOT_DUE} even while a run is in flight; only a due or
     * forced claim reports {@code IN_FLIGHT}.
     *
     * @param force skip the due check (manual trigger); the in-flight check still applies
     */
    @Transactional
    public ScheduleDecision claim(String jobName, IntervalBounds bounds, boolean force) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        JobScheduleState state = repository.findById(jobName)
                .orElseGet(() -> JobScheduleState.builder().jobName(jobName).build());

        if (!force && !intervalPolicy.isDue(state, now)) {
            return ScheduleDecision.notDue(state.getChosenIntervalMinutes());
        }
        if (isInFlight(state, now)) {
            return ScheduleDecision.inFlight(state.getChosenIntervalMinutes());
        }
        if (state.getRunningSince() != null) {
            log.warn("Ignoring stale in-flight marker on {} set by {} at {}",
                    jobName, state.getRunningInstance(), state.getRunningSince());
        }

        int interval = intervalPolicy.drawInterval(bounds);
        state.setLastRunAt(now);
        state.setChosenIntervalMinutes(interval);
        state.setRunningSince(now);
        state.setRunningInstance(identity.getId());
        repository.saveAndFlush(state);

        log.debug("Claimed run of {} (next interval {} min)", jobName, interval);
        return ScheduleDecision.fired(interval, now);
    }

    /**
     * Record that a run terminated, successfully or not.
     *
     * @param runningSince the marker returned by the claim that started the run; a completion
     *                     whose marker was since taken over by a newer run is ignored
     */
    @Transactional
    public void complete(String jobName, Instant runningSince, int exitStatus) {
        Optional<JobScheduleState> found = repository.findById(jobName);
        if (found.isEmpty()) {
            log.warn("Completion reported for {} which has no schedule state", jobName);
            return;
        }
        JobScheduleState state = found.get();
        if (!sameMarker(state.getRunningSince(), runningSince)) {
            log.warn("Late completion of {} started at {} ignored, marker now {} by {}",
                    jobName, runningSince, state.getRunningSince(), state.getRunningInstance());
            return;
        }
        state.setRunningSince(null);
        state.setRunningInstance(null);
        state.setLastFinishedAt(clock.instant());
        state.setLastExitStatus(exitStatus);
        repository.save(state);
    }

    @Transactional(readOnly = true)
    public Optional<JobScheduleState> find(String jobName) {
        return repository.findById(jobName);
    }

    @Transactional(readOnly = true)
    public List<JobScheduleState> findAll() {
        return repository.findAll();
    }

    private static boolean sameMarker(Instant stored, Instant reported) {
        if (stored == null || reported == null) {
            return false;
        }
        return stored.toEpochMilli() == reported.toEpochMilli();
    }

    private boolean isInFlight(JobScheduleState state, Instant now) {
        Instant since = state.getRunningSince();
        return since != null && since.plus(properties.getOverlapExpiry()).isAfter(now);
    }
}
