package dev.postrelay.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RetentionPolicyRequest {

    private boolean enabled;

    @Min(value = 1, message = "retentionDays must be at least 1")
    private int retentionDays;
}
