package dev.postrelay.jobs.impl;

import dev.postrelay.jobs.AbstractExternalJob;
import dev.postrelay.jobs.JobNames;
import dev.postrelay.runner.JobRunner;
import org.springframework.stereotype.Component;

/**
 * Runs the scraper. The scraper posts what it finds back through the ingestion endpoint.
 */
@Component
public class ContentScrapeJob extends AbstractExternalJob {

    public ContentScrapeJob(JobRunner jobRunner) {
        super(jobRunner);
    }

    @Override
    public String getName() {
        return JobNames.CONTENT_SCRAPE;
    }
}
