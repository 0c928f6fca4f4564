package dev.postrelay.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class BulkActionRequest {

    @NotEmpty(message = "At least one item id is required")
    private List<Long> ids;

    private boolean autoPost = true;

    private Integer priority;
}
