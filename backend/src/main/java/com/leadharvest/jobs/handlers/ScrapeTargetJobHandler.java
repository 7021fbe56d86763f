package com.leadharvest.jobs.handlers;

import com.leadharvest.jobs.FollowUpJob;
import com.leadharvest.jobs.JobHandler;
import com.leadharvest.jobs.ScrapeTargetJob;
import com.leadharvest.scrape.model.FailureCategory;
import com.leadharvest.scrape.service.ScrapeRunService;
import com.leadharvest.scrape.service.TargetNotFoundException;
import com.leadharvest.scrape.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ScrapeTargetJobHandler implements JobHandler<ScrapeTargetJob> {
    private static final Logger log = LoggerFactory.getLogger(ScrapeTargetJobHandler.class);

    private final ScrapeRunService scrapeRunService;

    public ScrapeTargetJobHandler(ScrapeRunService scrapeRunService) {
        this.scrapeRunService = scrapeRunService;
    }

    @Override
    public Class<ScrapeTargetJob> jobType() {
        return ScrapeTargetJob.class;
    }

    @Override
    public List<FollowUpJob> handle(ScrapeTargetJob job) {
        try {
            scrapeRunService.runTarget(job.targetId(), job.trigger());
        } catch (TargetNotFoundException e) {
            log.warn("Scrape job skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            FailureCategory category = FailureClassifier.classify(e);
            if (!category.isContained()) {
                throw e;
            }
            log.warn(
                "Scrape of target {} failed with {} error: {}",
                job.targetId(),
                category,
                FailureClassifier.describe(e)
            );
        }
        return List.of();
    }
}
