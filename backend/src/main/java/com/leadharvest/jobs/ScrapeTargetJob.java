package com.leadharvest.jobs;

import com.leadharvest.scrape.model.RunTrigger;

public record ScrapeTargetJob(long targetId, RunTrigger trigger) implements PipelineJob {
    @Override
    public String name() {
        return "scrape-target";
    }
}
