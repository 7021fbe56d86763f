package com.leadharvest.jobs;

import com.leadharvest.config.CrmSettings;
import com.leadharvest.config.PipelineProperties;
import com.leadharvest.scrape.model.RunTrigger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class PipelineSchedulerTest {

    @Mock
    private JobQueue jobQueue;

    @Test
    void tickEnqueuesScrapeSweepAndCrmSweepWhenEnabled() {
        CrmSettings crm = new CrmSettings(true, "https://crm.example.com", "t", 20, null, null, 8, 50, Map.of());
        PipelineScheduler scheduler = new PipelineScheduler(jobQueue, new PipelineProperties(), crm);

        scheduler.tick();

        verify(jobQueue).enqueue(new ScrapeEnabledTargetsJob(RunTrigger.SCHEDULED));
        verify(jobQueue).enqueue(new SyncDueRecordsJob(50));
    }

    @Test
    void tickSkipsCrmSweepWhenDisabled() {
        CrmSettings crm = new CrmSettings(false, "", "", 20, null, null, 8, 50, Map.of());
        PipelineScheduler scheduler = new PipelineScheduler(jobQueue, new PipelineProperties(), crm);

        scheduler.tick();

        verify(jobQueue).enqueue(new ScrapeEnabledTargetsJob(RunTrigger.SCHEDULED));
        verifyNoMoreInteractions(jobQueue);
    }

    @Test
    void tickSurvivesQueueFailures() {
        CrmSettings crm = new CrmSettings(false, "", "", 20, null, null, 8, 50, Map.of());
        PipelineScheduler scheduler = new PipelineScheduler(jobQueue, new PipelineProperties(), crm);
        doThrow(new IllegalStateException("queue closed")).when(jobQueue).enqueue(any());

        scheduler.tick();

        assertThat(scheduler.isRunning()).isFalse();
    }
}
