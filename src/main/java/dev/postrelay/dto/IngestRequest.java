package dev.postrelay.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * Batch of posts scraped from one profile.
 */
@Data
public class IngestRequest {

    /**
     * Profile username. Absent for unattributed posts.
     */
    private String sourceRef;

    @Valid
    @NotNull(message = "posts is required")
    private List<Post> posts;

    @Data
    public static class Post {

        @NotBlank(message = "Post text is required")
        private String text;

        private String mediaUrl;
    }
}
