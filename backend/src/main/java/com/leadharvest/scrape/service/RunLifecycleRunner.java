package com.leadharvest.scrape.service;

import com.leadharvest.config.PipelineProperties;
import com.leadharvest.scrape.persistence.ScrapeJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
public class RunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(RunLifecycleRunner.class);

    private final ScrapeJdbcRepository repository;
    private final PipelineProperties properties;

    public RunLifecycleRunner(ScrapeJdbcRepository repository, PipelineProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            log.debug("Database reachability check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping scrape run cleanup because database is unreachable");
            return;
        }

        int staleMinutes = properties.getRuns().getStaleRunMinutes();
        Instant now = Instant.now();
        Instant cutoff = now.minus(Duration.ofMinutes(staleMinutes));
        int failed = repository.failStaleRuns(cutoff, now, "aborted_on_startup: run still RUNNING after " + staleMinutes + " minutes");
        if (failed > 0) {
            log.info("Marked {} stale scrape runs started before {} as FAILED", failed, cutoff);
        }
    }
}
