package com.leadharvest.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadharvest.config.CrmSettings;
import com.leadharvest.scrape.model.ProspectRecord;
import com.leadharvest.scrape.model.RecordStatus;
import com.leadharvest.scrape.persistence.ProspectJdbcRepository;
import com.leadharvest.scrape.service.RecordStatusService;
import com.leadharvest.scrape.util.FailureClassifier;
import com.leadharvest.scrape.util.HashUtils;
import com.leadharvest.sync.client.CrmClient;
import com.leadharvest.sync.model.SyncOutcome;
import com.leadharvest.sync.model.SyncResultStatus;
import com.leadharvest.sync.model.SyncState;
import com.leadharvest.sync.model.SyncStatus;
import com.leadharvest.sync.persistence.SyncStateJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pushes one record to the CRM. A payload identical to the last successful one
 * is not sent again unless forced; failures are persisted with a backoff delay
 * that the caller uses to schedule the next attempt. Only the holder of the
 * record's sync lease talks to the CRM.
 */
@Service
public class CrmSyncService {
    private static final Logger log = LoggerFactory.getLogger(CrmSyncService.class);
    private static final List<String> ID_KEYS = List.of("id", "lead_id", "data", "result");

    private final CrmSettings settings;
    private final ProspectJdbcRepository recordRepository;
    private final SyncStateJdbcRepository syncStateRepository;
    private final RecordStatusService recordStatusService;
    private final CrmPayloadBuilder payloadBuilder;
    private final CrmClient crmClient;
    private final TransactionTemplate transactionTemplate;

    public CrmSyncService(
        CrmSettings settings,
        ProspectJdbcRepository recordRepository,
        SyncStateJdbcRepository syncStateRepository,
        RecordStatusService recordStatusService,
        CrmPayloadBuilder payloadBuilder,
        CrmClient crmClient,
        TransactionTemplate transactionTemplate
    ) {
        this.settings = settings;
        this.recordRepository = recordRepository;
        this.syncStateRepository = syncStateRepository;
        this.recordStatusService = recordStatusService;
        this.payloadBuilder = payloadBuilder;
        this.crmClient = crmClient;
        this.transactionTemplate = transactionTemplate;
    }

    public SyncOutcome sync(long recordId, boolean force) {
        if (!settings.enabled()) {
            return SyncOutcome.of(recordId, SyncResultStatus.DISABLED);
        }
        if (!settings.isConfigured()) {
            log.warn("CRM sync requested for record {} but base URL or token is not configured", recordId);
            return SyncOutcome.of(recordId, SyncResultStatus.NOT_CONFIGURED);
        }
        Optional<ProspectRecord> maybeRecord = recordRepository.findById(recordId);
        if (maybeRecord.isEmpty()) {
            log.warn("CRM sync skipped, record {} does not exist", recordId);
            return SyncOutcome.of(recordId, SyncResultStatus.RECORD_MISSING);
        }
        ProspectRecord record = maybeRecord.get();
        if (!record.hasMeaningfulField()) {
            log.info("CRM sync skipped, record {} has no name, email, phone, company or website", recordId);
            return SyncOutcome.of(recordId, SyncResultStatus.INCOMPLETE);
        }

        Map<String, Object> payload = payloadBuilder.build(record);
        String payloadJson = HashUtils.canonicalJson(payload);
        String payloadHash = HashUtils.sha256Hex(payloadJson);

        syncStateRepository.getOrCreate(recordId);
        Instant now = Instant.now();
        if (!syncStateRepository.tryAcquireLease(recordId, now, now.plus(leaseDuration()))) {
            log.info("CRM sync of record {} is already running in another worker", recordId);
            return SyncOutcome.of(recordId, SyncResultStatus.IN_PROGRESS);
        }
        // re-read under the lease, a previous holder may have stored an external id
        SyncState state = syncStateRepository.getOrCreate(recordId);

        if (!force && state.status() == SyncStatus.SYNCED && payloadHash.equals(state.payloadHash())) {
            syncStateRepository.releaseLease(recordId);
            log.debug("CRM payload of record {} unchanged, skipping", recordId);
            return SyncOutcome.of(recordId, SyncResultStatus.SKIPPED);
        }

        JsonNode response;
        try {
            response = state.hasExternalId()
                ? crmClient.updateLead(state.externalId(), payload)
                : crmClient.createLead(payload);
        } catch (RuntimeException e) {
            return recordFailure(state, payloadJson, e);
        }

        String discoveredId = extractExternalId(response);
        logTransition(state, SyncStatus.SYNCED);
        transactionTemplate.executeWithoutResult(tx -> {
            syncStateRepository.markSynced(recordId, discoveredId, payloadHash, payloadJson, Instant.now());
            recordStatusService.advanceIfAllowed(recordId, RecordStatus.SYNCED);
        });
        String externalId = discoveredId.isEmpty() ? state.externalId() : discoveredId;
        log.info("Record {} synced to CRM externalId={}", recordId, externalId);
        return SyncOutcome.synced(recordId, externalId);
    }

    private Duration leaseDuration() {
        return Duration.ofSeconds(Math.max(60L, settings.timeoutSeconds() * 3L));
    }

    private SyncOutcome recordFailure(SyncState state, String payloadJson, RuntimeException error) {
        int attempts = state.attempts() + 1;
        Duration delay = SyncBackoff.delayFor(attempts);
        String errorText = FailureClassifier.describe(error);
        logTransition(state, SyncStatus.ERROR);
        syncStateRepository.markFailure(state.recordId(), attempts, errorText, payloadJson, Instant.now().plus(delay));
        log.warn(
            "CRM sync failed for record {} attempt={} retryIn={}s: {}",
            state.recordId(),
            attempts,
            delay.toSeconds(),
            errorText
        );
        return SyncOutcome.failed(state.recordId(), attempts, delay, errorText);
    }

    /**
     * Looks for a new id under {@code id}, {@code lead_id}, {@code data} or {@code result},
     * either as a scalar or as the {@code id}/{@code lead_id} of a nested object.
     */
    static String extractExternalId(JsonNode response) {
        if (response == null || !response.isObject()) {
            return "";
        }
        for (String key : ID_KEYS) {
            JsonNode value = response.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isTextual() || value.isNumber()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
                continue;
            }
            if (value.isObject()) {
                for (String innerKey : List.of("id", "lead_id")) {
                    JsonNode inner = value.get(innerKey);
                    if (inner != null && (inner.isTextual() || inner.isNumber()) && !inner.asText().isBlank()) {
                        return inner.asText().trim();
                    }
                }
            }
        }
        return "";
    }

    private void logTransition(SyncState state, SyncStatus next) {
        if (!state.status().canTransitionTo(next)) {
            log.warn("Rejected sync state transition {} -> {} for record {}", state.status(), next, state.recordId());
            throw new IllegalStateException("Invalid sync state transition " + state.status() + " -> " + next);
        }
    }
}
