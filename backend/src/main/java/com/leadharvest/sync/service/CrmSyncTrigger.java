package com.leadharvest.sync.service;

import com.leadharvest.config.CrmSettings;
import com.leadharvest.jobs.JobQueue;
import com.leadharvest.jobs.SyncRecordJob;
import com.leadharvest.scrape.model.RecordUpsertedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class CrmSyncTrigger {
    private static final Logger log = LoggerFactory.getLogger(CrmSyncTrigger.class);

    private final CrmSettings settings;
    private final JobQueue jobQueue;

    public CrmSyncTrigger(CrmSettings settings, JobQueue jobQueue) {
        this.settings = settings;
        this.jobQueue = jobQueue;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRecordUpserted(RecordUpsertedEvent event) {
        if (!settings.enabled()) {
            return;
        }
        log.debug("Record {} upserted (created={}), enqueueing CRM sync", event.recordId(), event.created());
        jobQueue.enqueue(SyncRecordJob.first(event.recordId(), false));
    }
}
