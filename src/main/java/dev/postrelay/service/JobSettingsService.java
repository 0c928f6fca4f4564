package dev.postrelay.service;

import dev.postrelay.config.SchedulerProperties;
import dev.postrelay.config.SchedulerProperties.JobDefaults;
import dev.postrelay.entity.JobSettings;
import dev.postrelay.model.IntervalBounds;
import dev.postrelay.repository.JobSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Operator-editable job switches and interval bounds.
 *
 * <p>Rows are seeded from {@code relay.scheduler.jobs.*} the first time a job is looked up and are
 * read fresh on every scheduling decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSettingsService {

    private final JobSettingsRepository repository;
    private final SchedulerProperties properties;

    public JobSettings get(String jobName) {
        return repository.findById(jobName).orElseGet(() -> seed(jobName));
    }

    public boolean isEnabled(String jobName) {
        return get(jobName).isEnabled();
    }

    public IntervalBounds bounds(String jobName) {
        JobSettings settings = get(jobName);
        return new IntervalBounds(settings.getMinMinutes(), settings.getMaxMinutes());
    }

    public JobSettings setEnabled(String jobName, boolean enabled) {
        JobSettings settings = get(jobName);
        settings.setEnabled(enabled);
        log.info("Job {} {}", jobName, enabled ? "enabled" : "disabled");
        return repository.save(settings);
    }

    /**
     * Replace the interval bounds. Takes effect at the next firing; the interval already drawn
     * for the pending run is kept.
     *
     * @throws IllegalArgumentException if {@code min < 1} or {@code max < min}
     */
    public JobSettings updateBounds(String jobName, int minMinutes, int maxMinutes) {
        IntervalBounds bounds = new IntervalBounds(minMinutes, maxMinutes);
        JobSettings settings = get(jobName);
        settings.setMinMinutes(bounds.minMinutes());
        settings.setMaxMinutes(bounds.maxMinutes());
        log.info("Job {} interval bounds set to {}-{} min", jobName, minMinutes, maxMinutes);
        return repository.save(settings);
    }

    private JobSettings seed(String jobName) {
        JobDefaults defaults = properties.defaultsFor(jobName);
        try {
            return repository.saveAndFlush(JobSettings.builder()
                    .jobName(jobName)
                    .enabled(defaults.isEnabled())
                    .minMinutes(defaults.getMinMinutes())
                    .maxMinutes(defaults.getMaxMinutes())
                    .build());
        } catch (DataIntegrityViolationException e) {
            return repository.findById(jobName).orElseThrow(() -> e);
        }
    }
}
