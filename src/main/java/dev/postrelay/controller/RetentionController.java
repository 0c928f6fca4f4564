package dev.postrelay.controller;

import dev.postrelay.dto.RetentionPolicyRequest;
import dev.postrelay.entity.RetentionPolicy;
import dev.postrelay.model.SweepReport;
import dev.postrelay.service.RetentionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/retention")
@RequiredArgsConstructor
public class RetentionController {

    private final RetentionService retentionService;

    @GetMapping
    public RetentionPolicy getPolicy() {
        return retentionService.getPolicy();
    }

    @PutMapping
    public RetentionPolicy updatePolicy(@Valid @RequestBody RetentionPolicyRequest request) {
        return retentionService.updatePolicy(request.isEnabled(), request.getRetentionDays());
    }

    /**
     * Run a sweep now, even if the policy is disabled.
     */
    @PostMapping("/sweep")
    public SweepReport sweep() {
        return retentionService.sweep();
    }
}
