package com.leadharvest.jobs;

public record SyncDueRecordsJob(int limit) implements PipelineJob {
    @Override
    public String name() {
        return "sync-due-records";
    }
}
