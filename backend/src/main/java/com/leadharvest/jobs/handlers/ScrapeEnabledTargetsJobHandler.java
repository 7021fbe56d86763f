package com.leadharvest.jobs.handlers;

import com.leadharvest.jobs.FollowUpJob;
import com.leadharvest.jobs.JobHandler;
import com.leadharvest.jobs.ScrapeEnabledTargetsJob;
import com.leadharvest.jobs.ScrapeTargetJob;
import com.leadharvest.scrape.model.RunTrigger;
import com.leadharvest.scrape.model.Target;
import com.leadharvest.scrape.persistence.ScrapeJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class ScrapeEnabledTargetsJobHandler implements JobHandler<ScrapeEnabledTargetsJob> {
    private static final Logger log = LoggerFactory.getLogger(ScrapeEnabledTargetsJobHandler.class);

    private final ScrapeJdbcRepository repository;

    public ScrapeEnabledTargetsJobHandler(ScrapeJdbcRepository repository) {
        this.repository = repository;
    }

    @Override
    public Class<ScrapeEnabledTargetsJob> jobType() {
        return ScrapeEnabledTargetsJob.class;
    }

    @Override
    public List<FollowUpJob> handle(ScrapeEnabledTargetsJob job) {
        Instant now = Instant.now();
        List<FollowUpJob> followUps = new ArrayList<>();
        for (Target target : repository.findEnabledTargets()) {
            if (job.trigger() == RunTrigger.SCHEDULED && !target.isDue(now)) {
                continue;
            }
            followUps.add(FollowUpJob.now(new ScrapeTargetJob(target.id(), job.trigger())));
        }
        log.info("Enqueueing {} scrape jobs trigger={}", followUps.size(), job.trigger());
        return followUps;
    }
}
