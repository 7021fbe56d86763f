package com.leadharvest.scrape.service;

import com.leadharvest.scrape.model.ProspectRecord;
import com.leadharvest.scrape.model.RecordStatus;
import com.leadharvest.scrape.persistence.ProspectJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
public class RecordStatusService {
    private static final Logger log = LoggerFactory.getLogger(RecordStatusService.class);

    private final ProspectJdbcRepository repository;

    public RecordStatusService(ProspectJdbcRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public ProspectRecord changeStatus(long recordId, RecordStatus next) {
        ProspectRecord record = repository.findById(recordId).orElseThrow(() -> new RecordNotFoundException(recordId));
        if (!record.status().canTransitionTo(next)) {
            throw new IllegalStatusTransitionException(recordId, record.status(), next);
        }
        if (record.status() == next) {
            return record;
        }
        if (!repository.updateStatus(recordId, record.status(), next)) {
            RecordStatus current = repository.findById(recordId)
                .map(ProspectRecord::status)
                .orElseThrow(() -> new RecordNotFoundException(recordId));
            throw new IllegalStatusTransitionException(recordId, current, next);
        }
        log.info("Record {} status {} -> {}", recordId, record.status(), next);
        return record.withStatus(next);
    }

    /**
     * Moves the record to {@code next} only when that transition is allowed from its
     * stored status at the time of the call. The write is conditional on that status, so
     * a concurrent move to a terminal status is never overwritten.
     *
     * @return true when the status changed
     */
    public boolean advanceIfAllowed(long recordId, RecordStatus next) {
        Optional<RecordStatus> current = repository.findById(recordId).map(ProspectRecord::status);
        if (current.isEmpty() || current.get() == next || !current.get().canTransitionTo(next)) {
            return false;
        }
        boolean changed = repository.updateStatus(recordId, current.get(), next);
        if (!changed) {
            log.info("Record {} changed status concurrently, not moving it to {}", recordId, next);
        }
        return changed;
    }
}
