package dev.postrelay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for media artifact storage.
 * Loaded from application.yml under 'relay.storage' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "relay.storage")
public class StorageProperties {

    private String mediaDir = "data/media";
}
