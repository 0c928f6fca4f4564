package dev.postrelay.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MediaGeneratedRequest {

    @NotBlank(message = "mediaRef is required")
    private String mediaRef;
}
