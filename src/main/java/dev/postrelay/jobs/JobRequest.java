package dev.postrelay.jobs;

import java.util.List;

/**
 * Parameters of one run of an automated job.
 *
 * @param targetItemIds items to act on in order, for a manual publish; empty lets the job choose
 * @param skipDelay     run without the random startup delay
 * @param manual        started by an operator rather than by the timer
 */
public record JobRequest(List<Long> targetItemIds, boolean skipDelay, boolean manual) {

    public JobRequest {
        targetItemIds = targetItemIds == null ? List.of() : List.copyOf(targetItemIds);
    }

    public static JobRequest scheduled() {
        return new JobRequest(List.of(), false, false);
    }

    public static JobRequest manual(boolean skipDelay) {
        return new JobRequest(List.of(), skipDelay, true);
    }

    public static JobRequest forItems(List<Long> itemIds) {
        return new JobRequest(itemIds, true, true);
    }

    public boolean hasTargets() {
        return !targetItemIds.isEmpty();
    }
}
