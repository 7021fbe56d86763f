package com.leadharvest.jobs.handlers;

import com.leadharvest.config.CrmSettings;
import com.leadharvest.jobs.FollowUpJob;
import com.leadharvest.jobs.JobHandler;
import com.leadharvest.jobs.SyncRecordJob;
import com.leadharvest.sync.model.SyncOutcome;
import com.leadharvest.sync.model.SyncResultStatus;
import com.leadharvest.sync.service.CrmSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SyncRecordJobHandler implements JobHandler<SyncRecordJob> {
    private static final Logger log = LoggerFactory.getLogger(SyncRecordJobHandler.class);

    private final CrmSyncService syncService;
    private final CrmSettings settings;

    public SyncRecordJobHandler(CrmSyncService syncService, CrmSettings settings) {
        this.syncService = syncService;
        this.settings = settings;
    }

    @Override
    public Class<SyncRecordJob> jobType() {
        return SyncRecordJob.class;
    }

    @Override
    public List<FollowUpJob> handle(SyncRecordJob job) {
        SyncOutcome outcome = syncService.sync(job.recordId(), job.force());
        if (outcome.status() != SyncResultStatus.FAILED) {
            return List.of();
        }
        if (job.attempt() >= settings.maxAttempts()) {
            log.warn("Giving up CRM sync of record {} after {} attempts", job.recordId(), job.attempt());
            return List.of();
        }
        return List.of(FollowUpJob.after(
            new SyncRecordJob(job.recordId(), job.force(), job.attempt() + 1),
            outcome.retryDelay()
        ));
    }
}
