package dev.postrelay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for content normalization, counting and publishing.
 * Loaded from application.yml under 'relay.content' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "relay.content")
public class ContentProperties {

    /**
     * Items with this many normalized words or fewer are kept but never counted or listed.
     */
    private int minWordCount = 4;

    /**
     * Age after which an unreleased publish reservation is ignored.
     */
    private Duration publishClaimTimeout = Duration.ofMinutes(30);

    /**
     * Platform UI words removed before hashing.
     */
    private List<String> uiArtifacts = new ArrayList<>(List.of(
            "compartir", "comentar", "me gusta", "reaccionar",
            "share", "comment", "like", "react"));
}
