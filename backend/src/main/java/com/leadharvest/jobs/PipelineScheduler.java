package com.leadharvest.jobs;

import com.leadharvest.config.CrmSettings;
import com.leadharvest.config.PipelineProperties;
import com.leadharvest.scrape.model.RunTrigger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class PipelineScheduler {
    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final JobQueue jobQueue;
    private final PipelineProperties properties;
    private final CrmSettings crmSettings;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService ticker;

    public PipelineScheduler(JobQueue jobQueue, PipelineProperties properties, CrmSettings crmSettings) {
        this.jobQueue = jobQueue;
        this.properties = properties;
        this.crmSettings = crmSettings;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int tickSeconds = properties.getScheduler().getTickSeconds();
            ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("pipeline-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            ticker.scheduleWithFixedDelay(this::tick, 0, tickSeconds, TimeUnit.SECONDS);
            log.info("Pipeline scheduler started tickSeconds={}", tickSeconds);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (ticker != null) {
                ticker.shutdownNow();
                try {
                    ticker.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                ticker = null;
            }
            log.info("Pipeline scheduler stopped");
        }
    }

    void tick() {
        try {
            jobQueue.enqueue(new ScrapeEnabledTargetsJob(RunTrigger.SCHEDULED));
            if (crmSettings.enabled()) {
                jobQueue.enqueue(new SyncDueRecordsJob(crmSettings.sweepBatchSize()));
            }
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            log.warn("Pipeline scheduler tick failed", e);
        }
    }
}
