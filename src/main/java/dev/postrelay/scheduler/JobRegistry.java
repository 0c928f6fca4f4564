package dev.postrelay.scheduler;

import dev.postrelay.config.SchedulerProperties;
import dev.postrelay.exception.NotFoundException;
import dev.postrelay.jobs.AutomatedJob;
import dev.postrelay.service.JobSettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All automated jobs known to the scheduler, keyed by name.
 */
@Slf4j
@Component
public class JobRegistry {

    private final Map<String, RegisteredJob> jobs = new LinkedHashMap<>();

    public JobRegistry(List<AutomatedJob> automatedJobs,
                       JobSettingsService settingsService,
                       SchedulerProperties properties) {
        for (AutomatedJob job : automatedJobs) {
            String name = job.getName();
            Boolean delayOverride = properties.defaultsFor(name).getStartupDelay();
            boolean startupDelay = delayOverride != null ? delayOverride : job.usesStartupDelay();

            jobs.put(name, new RegisteredJob(job,
                    () -> settingsService.bounds(name),
                    () -> settingsService.isEnabled(name),
                    startupDelay));
        }
        log.info("Registered automated jobs: {}", jobs.keySet());
    }

    public RegisteredJob get(String name) {
        RegisteredJob job = jobs.get(name);
        if (job == null) {
            throw NotFoundException.job(name);
        }
        return job;
    }

    public boolean contains(String name) {
        return jobs.containsKey(name);
    }

    public Collection<RegisteredJob> all() {
        return Collections.unmodifiableCollection(jobs.values());
    }
}
