package dev.postrelay.runner;

import dev.postrelay.config.RunnerProperties;
import dev.postrelay.exception.ExternalProcessFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Asks a remote worker to run the job. The worker answers once the job has terminated.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "relay.runner", name = "type", havingValue = "http")
public class HttpJobRunner implements JobRunner {

    static final String RUN_PATH = "/jobs/run";

    private final WebClient webClient;
    private final RunnerProperties properties;

    public HttpJobRunner(WebClient.Builder webClientBuilder, RunnerProperties properties) {
        this.webClient = webClientBuilder
                .baseUrl(properties.getHttp().getBaseUrl())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.properties = properties;
    }

    @Override
    public Mono<Integer> invoke(JobInvocation invocation) {
        String jobName = invocation.jobName();
        log.info("Requesting remote run of {} {}", jobName, invocation.args());

        return webClient.post()
                .uri(RUN_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RunRequest(jobName, invocation.args()))
                .retrieve()
                .bodyToMono(RunResponse.class)
                .timeout(properties.getHttp().getTimeout())
                .flatMap(response -> response.exitCode() == null
                        ? Mono.error(new ExternalProcessFailureException(jobName, "Worker response without exitCode"))
                        : Mono.just(response.exitCode()))
                .doOnNext(exitCode -> log.info("Remote {} exited with {}", jobName, exitCode))
                .onErrorMap(e -> !(e instanceof ExternalProcessFailureException), e -> toFailure(jobName, e));
    }

    private static ExternalProcessFailureException toFailure(String jobName, Throwable e) {
        if (e instanceof WebClientResponseException wre) {
            return new ExternalProcessFailureException(jobName,
                    "Worker returned " + wre.getStatusCode().value() + " for " + jobName, e);
        }
        return new ExternalProcessFailureException(jobName, "Worker call for " + jobName + " failed: " + e.getMessage(), e);
    }

    public record RunRequest(String job, List<String> args) {
    }

    public record RunResponse(Integer exitCode) {
    }
}
