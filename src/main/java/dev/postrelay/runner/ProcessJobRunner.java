package dev.postrelay.runner;

import dev.postrelay.config.RunnerProperties;
import dev.postrelay.exception.ExternalProcessFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs each job as a local process from its configured command line.
 * Output and errors are appended to {@code <log-directory>/<job>.log}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "relay.runner", name = "type", havingValue = "process", matchIfMissing = true)
public class ProcessJobRunner implements JobRunner {

    private final RunnerProperties properties;

    @Override
    public Mono<Integer> invoke(JobInvocation invocation) {
        return Mono.fromCallable(() -> execute(invocation));
    }

    private int execute(JobInvocation invocation) {
        String jobName = invocation.jobName();
        List<String> command = new ArrayList<>(properties.commandFor(jobName));
        if (command.isEmpty()) {
            throw new ExternalProcessFailureException(jobName, "No command configured for job " + jobName);
        }
        command.addAll(invocation.args());

        try {
            Path logDir = Path.of(properties.getLogDirectory());
            Files.createDirectories(logDir);
            File logFile = logDir.resolve(jobName + ".log").toFile();

            ProcessBuilder builder = new ProcessBuilder(command)
                    .directory(new File(properties.getWorkingDirectory()))
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile));

            log.info("Starting {}: {}", jobName, String.join(" ", command));
            Process process = builder.start();
            int exitCode = process.waitFor();
            log.info("{} exited with {}", jobName, exitCode);
            return exitCode;
        } catch (IOException e) {
            throw new ExternalProcessFailureException(jobName, "Could not start " + jobName + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalProcessFailureException(jobName, "Interrupted while waiting for " + jobName, e);
        }
    }
}
