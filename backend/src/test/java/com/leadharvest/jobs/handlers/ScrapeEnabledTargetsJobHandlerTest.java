package com.leadharvest.jobs.handlers;

import com.leadharvest.jobs.FollowUpJob;
import com.leadharvest.jobs.ScrapeEnabledTargetsJob;
import com.leadharvest.jobs.ScrapeTargetJob;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.RunTrigger;
import com.leadharvest.scrape.model.Target;
import com.leadharvest.scrape.persistence.ScrapeJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeEnabledTargetsJobHandlerTest {

    @Mock
    private ScrapeJdbcRepository repository;

    private ScrapeEnabledTargetsJobHandler handler;

    @BeforeEach
    void setUp() {
        handler = new ScrapeEnabledTargetsJobHandler(repository);
        Instant now = Instant.now();
        when(repository.findEnabledTargets()).thenReturn(List.of(
            new Target(1L, "never-run", true, RenderMode.STATIC, "https://a.example.com", 60, "{}", null),
            new Target(2L, "ran-recently", true, RenderMode.STATIC, "https://b.example.com", 60, "{}", now.minusSeconds(60)),
            new Target(3L, "overdue", true, RenderMode.BROWSER, "https://c.example.com", 5, "{}", now.minusSeconds(3600))
        ));
    }

    @Test
    void scheduledSweepOnlyEnqueuesDueTargets() {
        List<FollowUpJob> followUps = handler.handle(new ScrapeEnabledTargetsJob(RunTrigger.SCHEDULED));

        assertThat(followUps).extracting(FollowUpJob::job).containsExactly(
            new ScrapeTargetJob(1L, RunTrigger.SCHEDULED),
            new ScrapeTargetJob(3L, RunTrigger.SCHEDULED)
        );
    }

    @Test
    void manualSweepEnqueuesEveryEnabledTarget() {
        List<FollowUpJob> followUps = handler.handle(new ScrapeEnabledTargetsJob(RunTrigger.MANUAL));

        assertThat(followUps).hasSize(3);
    }
}
