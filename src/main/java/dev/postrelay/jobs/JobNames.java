package dev.postrelay.jobs;

/**
 * Names under which the automated jobs are scheduled, locked and configured.
 */
public final class JobNames {

    public static final String CONTENT_SCRAPE = "content-scrape";
    public static final String MEDIA_GENERATION = "media-generation";
    public static final String PUBLISH = "publish";

    public static final String RETENTION_SWEEP_LOCK = "retention-sweep";

    private JobNames() {
    }
}
