package dev.postrelay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Seed values for the retention policy row and the sweep schedule.
 * Loaded from application.yml under 'relay.retention' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "relay.retention")
public class RetentionProperties {

    private boolean enabled = false;
    private int retentionDays = 7;
    private String cron = "0 0 2 * * *";

    /**
     * Ingestion sessions older than this are purged by the sweep.
     */
    private int sessionRetentionDays = 30;
}
