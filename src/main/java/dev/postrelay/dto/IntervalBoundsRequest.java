package dev.postrelay.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class IntervalBoundsRequest {

    @Min(value = 1, message = "minMinutes must be at least 1")
    private int minMinutes;

    @Min(value = 1, message = "maxMinutes must be at least 1")
    private int maxMinutes;
}
