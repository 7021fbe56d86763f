package com.leadharvest.jobs;

import com.leadharvest.scrape.model.RunTrigger;

public record ScrapeEnabledTargetsJob(RunTrigger trigger) implements PipelineJob {
    @Override
    public String name() {
        return "scrape-enabled-targets";
    }
}
