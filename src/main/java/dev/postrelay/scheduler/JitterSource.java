package dev.postrelay.scheduler;

/**
 * Source of uniformly distributed random integers used to jitter job intervals.
 */
public interface JitterSource {

    /**
     * Uniform random value in {@code [minInclusive, maxInclusive]}.
     */
    long uniform(long minInclusive, long maxInclusive);
}
