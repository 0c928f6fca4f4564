package dev.postrelay.runner;

import java.util.List;

/**
 * One request to run an external job.
 */
public record JobInvocation(String jobName, List<String> args) {

    public JobInvocation {
        args = args == null ? List.of() : List.copyOf(args);
    }
}
