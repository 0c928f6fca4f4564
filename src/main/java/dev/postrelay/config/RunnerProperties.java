package dev.postrelay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the external job runner.
 * Loaded from application.yml under 'relay.runner' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "relay.runner")
public class RunnerProperties {

    /**
     * {@code process} runs local command lines, {@code http} calls a remote worker.
     */
    private String type = "process";
    private String workingDirectory = ".";
    private String logDirectory = "logs";

    /**
     * Command line per job name.
     */
    private Map<String, List<String>> commands = new HashMap<>();

    private Http http = new Http();

    public List<String> commandFor(String jobName) {
        return commands.getOrDefault(jobName, new ArrayList<>());
    }

    @Data
    public static class Http {
        private String baseUrl = "http://localhost:8090";
        private Duration timeout = Duration.ofHours(2);
    }
}
