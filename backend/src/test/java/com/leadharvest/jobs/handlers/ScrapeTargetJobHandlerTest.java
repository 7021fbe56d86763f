package com.leadharvest.jobs.handlers;

import com.leadharvest.jobs.ScrapeTargetJob;
import com.leadharvest.scrape.config.TargetConfigException;
import com.leadharvest.scrape.http.PageFetchException;
import com.leadharvest.scrape.model.FetchFailureKind;
import com.leadharvest.scrape.model.RunTrigger;
import com.leadharvest.scrape.service.ScrapeRunService;
import com.leadharvest.scrape.service.TargetNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeTargetJobHandlerTest {

    @Mock
    private ScrapeRunService scrapeRunService;

    @Test
    void containsNetworkTimeoutAndConfigFailures() {
        ScrapeTargetJobHandler handler = new ScrapeTargetJobHandler(scrapeRunService);
        when(scrapeRunService.runTarget(1L, RunTrigger.MANUAL))
            .thenThrow(new PageFetchException(FetchFailureKind.DNS, "https://x.invalid", "dns resolution failed for host x.invalid"));
        when(scrapeRunService.runTarget(2L, RunTrigger.MANUAL))
            .thenThrow(new PageFetchException(FetchFailureKind.TIMEOUT, "https://slow.example.com", "request timed out after 5s"));
        when(scrapeRunService.runTarget(3L, RunTrigger.MANUAL))
            .thenThrow(new TargetConfigException("item_selector is required"));
        when(scrapeRunService.runTarget(4L, RunTrigger.MANUAL)).thenThrow(new TargetNotFoundException(4L));

        assertThat(handler.handle(new ScrapeTargetJob(1L, RunTrigger.MANUAL))).isEmpty();
        assertThat(handler.handle(new ScrapeTargetJob(2L, RunTrigger.MANUAL))).isEmpty();
        assertThat(handler.handle(new ScrapeTargetJob(3L, RunTrigger.MANUAL))).isEmpty();
        assertThat(handler.handle(new ScrapeTargetJob(4L, RunTrigger.MANUAL))).isEmpty();
    }

    @Test
    void propagatesUnclassifiedFailures() {
        ScrapeTargetJobHandler handler = new ScrapeTargetJobHandler(scrapeRunService);
        when(scrapeRunService.runTarget(1L, RunTrigger.SCHEDULED)).thenThrow(new IllegalStateException("disk full"));

        assertThatThrownBy(() -> handler.handle(new ScrapeTargetJob(1L, RunTrigger.SCHEDULED)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("disk full");
    }
}
