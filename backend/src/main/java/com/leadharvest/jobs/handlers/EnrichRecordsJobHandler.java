package com.leadharvest.jobs.handlers;

import com.leadharvest.jobs.EnrichRecordsJob;
import com.leadharvest.jobs.FollowUpJob;
import com.leadharvest.jobs.JobHandler;
import com.leadharvest.scrape.service.RecordEnrichmentService;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EnrichRecordsJobHandler implements JobHandler<EnrichRecordsJob> {
    private final RecordEnrichmentService enrichmentService;

    public EnrichRecordsJobHandler(RecordEnrichmentService enrichmentService) {
        this.enrichmentService = enrichmentService;
    }

    @Override
    public Class<EnrichRecordsJob> jobType() {
        return EnrichRecordsJob.class;
    }

    @Override
    public List<FollowUpJob> handle(EnrichRecordsJob job) {
        enrichmentService.enrich(job.request());
        return List.of();
    }
}
