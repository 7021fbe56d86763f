package com.leadharvest.jobs;

import com.leadharvest.scrape.model.EnrichmentRequest;

public record EnrichRecordsJob(EnrichmentRequest request) implements PipelineJob {
    @Override
    public String name() {
        return "enrich-records";
    }
}
