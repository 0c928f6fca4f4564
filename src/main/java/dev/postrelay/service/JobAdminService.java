package dev.postrelay.service;

import dev.postrelay.dto.JobView;
import dev.postrelay.exception.NotFoundException;
import dev.postrelay.exception.PersistenceConflictException;
import dev.postrelay.scheduler.JobRegistry;
import dev.postrelay.scheduler.JobScheduleStore;
import dev.postrelay.scheduler.RegisteredJob;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * Admin view of the registered jobs: settings joined with scheduling state.
 */
@Service
@RequiredArgsConstructor
public class JobAdminService {

    private final JobRegistry registry;
    private final JobSettingsService settingsService;
    private final JobScheduleStore scheduleStore;

    public List<JobView> list() {
        return registry.all().stream()
                .map(RegisteredJob::name)
                .map(this::view)
                .toList();
    }

    public JobView get(String jobName) {
        requireKnown(jobName);
        return view(jobName);
    }

    public JobView setEnabled(String jobName, boolean enabled) {
        requireKnown(jobName);
        guarded(jobName, () -> settingsService.setEnabled(jobName, enabled));
        return view(jobName);
    }

    public JobView updateBounds(String jobName, int minMinutes, int maxMinutes) {
        requireKnown(jobName);
        guarded(jobName, () -> settingsService.updateBounds(jobName, minMinutes, maxMinutes));
        return view(jobName);
    }

    private JobView view(String jobName) {
        return JobView.of(settingsService.get(jobName), scheduleStore.find(jobName).orElse(null));
    }

    private void requireKnown(String jobName) {
        if (!registry.contains(jobName)) {
            throw NotFoundException.job(jobName);
        }
    }

    private <T> T guarded(String jobName, Supplier<T> action) {
        try {
            return action.get();
        } catch (OptimisticLockingFailureException e) {
            throw new PersistenceConflictException("Settings of " + jobName + " were changed concurrently", e);
        }
    }
}
