package dev.postrelay.scheduler;

import dev.postrelay.config.SchedulerProperties;
import dev.postrelay.exception.NotFoundException;
import dev.postrelay.jobs.AutomatedJob;
import dev.postrelay.model.IntervalBounds;
import dev.postrelay.service.JobSettingsService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobRegistryTest {

    @Mock
    private AutomatedJob scrapeJob;

    @Mock
    private AutomatedJob publishJob;

    @Mock
    private JobSettingsService settingsService;

    @Test
    void shouldReadSettingsOnEveryEvaluation() {
        when(scrapeJob.getName()).thenReturn("content-scrape");
        when(publishJob.getName()).thenReturn("publish");
        JobRegistry registry = new JobRegistry(List.of(scrapeJob, publishJob), settingsService,
                new SchedulerProperties());

        when(settingsService.isEnabled("content-scrape")).thenReturn(false, true);
        when(settingsService.bounds("content-scrape")).thenReturn(new IntervalBounds(30, 60));

        RegisteredJob job = registry.get("content-scrape");
        assertThat(job.enabled().getAsBoolean()).isFalse();
        assertThat(job.enabled().getAsBoolean()).isTrue();
        assertThat(job.bounds().get()).isEqualTo(new IntervalBounds(30, 60));
        assertThat(registry.all()).extracting(RegisteredJob::name).containsExactly("content-scrape", "publish");
    }

    @Test
    void shouldApplyStartupDelayOverride() {
        when(scrapeJob.getName()).thenReturn("content-scrape");
        when(publishJob.getName()).thenReturn("publish");
        when(publishJob.usesStartupDelay()).thenReturn(false);
        SchedulerProperties properties = new SchedulerProperties();
        SchedulerProperties.JobDefaults scrapeDefaults = new SchedulerProperties.JobDefaults();
        scrapeDefaults.setStartupDelay(false);
        properties.getJobs().put("content-scrape", scrapeDefaults);

        JobRegistry registry = new JobRegistry(List.of(scrapeJob, publishJob), settingsService, properties);

        assertThat(registry.get("content-scrape").startupDelay()).isFalse();
        assertThat(registry.get("publish").startupDelay()).isFalse();
    }

    @Test
    void shouldRejectUnknownJob() {
        JobRegistry registry = new JobRegistry(List.of(), settingsService, new SchedulerProperties());

        assertThat(registry.contains("publish")).isFalse();
        assertThatThrownBy(() -> registry.get("publish")).isInstanceOf(NotFoundException.class);
    }
}
