package com.leadharvest.jobs.handlers;

import com.leadharvest.config.CrmSettings;
import com.leadharvest.jobs.FollowUpJob;
import com.leadharvest.jobs.JobHandler;
import com.leadharvest.jobs.SyncDueRecordsJob;
import com.leadharvest.jobs.SyncRecordJob;
import com.leadharvest.sync.model.SyncState;
import com.leadharvest.sync.persistence.SyncStateJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class SyncDueRecordsJobHandler implements JobHandler<SyncDueRecordsJob> {
    private static final Logger log = LoggerFactory.getLogger(SyncDueRecordsJobHandler.class);

    private final SyncStateJdbcRepository syncStateRepository;
    private final CrmSettings settings;

    public SyncDueRecordsJobHandler(SyncStateJdbcRepository syncStateRepository, CrmSettings settings) {
        this.syncStateRepository = syncStateRepository;
        this.settings = settings;
    }

    @Override
    public Class<SyncDueRecordsJob> jobType() {
        return SyncDueRecordsJob.class;
    }

    @Override
    public List<FollowUpJob> handle(SyncDueRecordsJob job) {
        if (!settings.enabled()) {
            return List.of();
        }
        int limit = job.limit() > 0 ? job.limit() : settings.sweepBatchSize();
        List<SyncState> due = syncStateRepository.findDue(Instant.now(), settings.maxAttempts(), limit);
        List<FollowUpJob> followUps = new ArrayList<>(due.size());
        for (SyncState state : due) {
            followUps.add(FollowUpJob.now(new SyncRecordJob(state.recordId(), false, state.attempts() + 1)));
        }
        if (!followUps.isEmpty()) {
            log.info("Enqueueing {} due CRM sync jobs", followUps.size());
        }
        return followUps;
    }
}
