package com.leadharvest.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Component
public class ExecutorJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(ExecutorJobQueue.class);

    private final ScheduledExecutorService executor;
    private final JobDispatcher dispatcher;

    public ExecutorJobQueue(@Qualifier("jobExecutor") ScheduledExecutorService executor, JobDispatcher dispatcher) {
        this.executor = executor;
        this.dispatcher = dispatcher;
    }

    @Override
    public void enqueue(PipelineJob job) {
        enqueueAfter(job, Duration.ZERO);
    }

    @Override
    public void enqueueAfter(PipelineJob job, Duration delay) {
        long delayMs = delay == null ? 0L : Math.max(0L, delay.toMillis());
        try {
            executor.schedule(() -> execute(job), delayMs, TimeUnit.MILLISECONDS);
            log.debug("Enqueued {} {} delayMs={}", job.name(), job, delayMs);
        } catch (RejectedExecutionException e) {
            log.warn("Job executor rejected {} {}, executor is shutting down", job.name(), job);
        }
    }

    void execute(PipelineJob job) {
        List<FollowUpJob> followUps;
        try {
            followUps = dispatcher.dispatch(job);
        } catch (RuntimeException e) {
            log.error("Job {} failed: {}", job.name(), job, e);
            return;
        }
        for (FollowUpJob followUp : followUps) {
            enqueueAfter(followUp.job(), followUp.delay());
        }
    }
}
