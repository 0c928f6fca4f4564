package dev.postrelay.controller;

import dev.postrelay.dto.IntervalBoundsRequest;
import dev.postrelay.dto.JobView;
import dev.postrelay.jobs.JobRequest;
import dev.postrelay.scheduler.AdaptiveScheduler;
import dev.postrelay.scheduler.TickOutcome;
import dev.postrelay.service.JobAdminService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Per-job switches, interval bounds and manual triggers.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class SchedulerAdminController {

    private final JobAdminService jobAdminService;
    private final AdaptiveScheduler scheduler;

    @GetMapping
    public List<JobView> list() {
        return jobAdminService.list();
    }

    @GetMapping("/{name}")
    public JobView get(@PathVariable String name) {
        return jobAdminService.get(name);
    }

    @PostMapping("/{name}/enable")
    public JobView enable(@PathVariable String name) {
        return jobAdminService.setEnabled(name, true);
    }

    @PostMapping("/{name}/disable")
    public JobView disable(@PathVariable String name) {
        return jobAdminService.setEnabled(name, false);
    }

    @PutMapping("/{name}/bounds")
    public JobView updateBounds(@PathVariable String name, @Valid @RequestBody IntervalBoundsRequest request) {
        return jobAdminService.updateBounds(name, request.getMinMinutes(), request.getMaxMinutes());
    }

    /**
     * Run the job now regardless of its switch and interval.
     *
     * Example:
     * POST /api/jobs/content-scrape/trigger?skipDelay=true
     */
    @PostMapping("/{name}/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@PathVariable String name,
                                                       @RequestParam(defaultValue = "true") boolean skipDelay) {
        TickOutcome outcome = scheduler.trigger(name, JobRequest.manual(skipDelay));
        HttpStatus status = outcome == TickOutcome.FIRED ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(Map.of("job", name, "outcome", outcome));
    }
}
