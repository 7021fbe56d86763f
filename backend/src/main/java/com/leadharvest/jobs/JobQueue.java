package com.leadharvest.jobs;

import java.time.Duration;

public interface JobQueue {
    void enqueue(PipelineJob job);

    void enqueueAfter(PipelineJob job, Duration delay);
}
