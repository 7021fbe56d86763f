package com.leadharvest.jobs;

import java.time.Duration;

public record FollowUpJob(PipelineJob job, Duration delay) {
    public static FollowUpJob now(PipelineJob job) {
        return new FollowUpJob(job, Duration.ZERO);
    }

    public static FollowUpJob after(PipelineJob job, Duration delay) {
        return new FollowUpJob(job, delay == null ? Duration.ZERO : delay);
    }
}
