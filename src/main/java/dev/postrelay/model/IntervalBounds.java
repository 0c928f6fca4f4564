package dev.postrelay.model;

/**
 * Inclusive bounds, in minutes, of the randomly drawn interval between two runs of a job.
 */
public record IntervalBounds(int minMinutes, int maxMinutes) {

    public IntervalBounds {
        if (minMinutes < 1) {
            throw new IllegalArgumentException("minMinutes must be >= 1, was " + minMinutes);
        }
        if (maxMinutes < minMinutes) {
            throw new IllegalArgumentException(
                    "maxMinutes (" + maxMinutes + ") must be >= minMinutes (" + minMinutes + ")");
        }
    }

    public double averageSeconds() {
        return (minMinutes + maxMinutes) / 2.0 * 60;
    }
}
