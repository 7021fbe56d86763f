package com.leadharvest.jobs;

/**
 * @param attempt 1-based attempt number of this delivery
 */
public record SyncRecordJob(long recordId, boolean force, int attempt) implements PipelineJob {
    public SyncRecordJob {
        attempt = Math.max(1, attempt);
    }

    public static SyncRecordJob first(long recordId, boolean force) {
        return new SyncRecordJob(recordId, force, 1);
    }

    @Override
    public String name() {
        return "sync-record";
    }
}
