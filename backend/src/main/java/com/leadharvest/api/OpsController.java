package com.leadharvest.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadharvest.config.CrmSettings;
import com.leadharvest.config.PipelineProperties;
import com.leadharvest.jobs.EnrichRecordsJob;
import com.leadharvest.jobs.JobQueue;
import com.leadharvest.jobs.PipelineJob;
import com.leadharvest.jobs.ScrapeEnabledTargetsJob;
import com.leadharvest.jobs.ScrapeTargetJob;
import com.leadharvest.jobs.SyncDueRecordsJob;
import com.leadharvest.jobs.SyncRecordJob;
import com.leadharvest.scrape.model.EnrichmentFilter;
import com.leadharvest.scrape.model.EnrichmentProfile;
import com.leadharvest.scrape.model.EnrichmentRequest;
import com.leadharvest.scrape.model.ProspectRecord;
import com.leadharvest.scrape.model.RecordStatus;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.RunTrigger;
import com.leadharvest.scrape.model.ScrapeRun;
import com.leadharvest.scrape.model.TargetSyncOptions;
import com.leadharvest.scrape.model.TargetSyncSummary;
import com.leadharvest.scrape.persistence.ScrapeJdbcRepository;
import com.leadharvest.scrape.service.RecordEnrichmentService;
import com.leadharvest.scrape.service.RecordStatusService;
import com.leadharvest.scrape.service.TargetDefinitionSyncService;
import com.leadharvest.scrape.service.TargetNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Locale;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.UNAUTHORIZED;

@RestController
@RequestMapping("/ops")
public class OpsController {
    private static final Logger log = LoggerFactory.getLogger(OpsController.class);
    static final String TOKEN_HEADER = "X-OPS-TOKEN";
    private static final int DEFAULT_RUN_LIMIT = 20;
    private static final int MAX_RUN_LIMIT = 200;

    private final JobQueue jobQueue;
    private final ScrapeJdbcRepository scrapeRepository;
    private final RecordStatusService recordStatusService;
    private final TargetDefinitionSyncService targetSyncService;
    private final RecordEnrichmentService enrichmentService;
    private final PipelineProperties properties;
    private final CrmSettings crmSettings;

    public OpsController(
        JobQueue jobQueue,
        ScrapeJdbcRepository scrapeRepository,
        RecordStatusService recordStatusService,
        TargetDefinitionSyncService targetSyncService,
        RecordEnrichmentService enrichmentService,
        PipelineProperties properties,
        CrmSettings crmSettings
    ) {
        this.jobQueue = jobQueue;
        this.scrapeRepository = scrapeRepository;
        this.recordStatusService = recordStatusService;
        this.targetSyncService = targetSyncService;
        this.enrichmentService = enrichmentService;
        this.properties = properties;
        this.crmSettings = crmSettings;
    }

    @PostMapping("/trigger-scrape")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobAcceptedResponse triggerScrape(
        @RequestHeader(name = TOKEN_HEADER, required = false) String token,
        @RequestBody(required = false) TriggerScrapeRequest request
    ) {
        requireToken(token);
        if (request == null || request.targetId() == null) {
            return enqueue(new ScrapeEnabledTargetsJob(RunTrigger.MANUAL), null, null);
        }
        long targetId = request.targetId();
        if (scrapeRepository.findTarget(targetId).isEmpty()) {
            throw new TargetNotFoundException(targetId);
        }
        return enqueue(new ScrapeTargetJob(targetId, RunTrigger.MANUAL), targetId, null);
    }

    @PostMapping("/trigger-sync")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobAcceptedResponse triggerSync(
        @RequestHeader(name = TOKEN_HEADER, required = false) String token,
        @RequestBody(required = false) TriggerSyncRequest request
    ) {
        requireToken(token);
        if (request == null || request.recordId() == null) {
            return enqueue(new SyncDueRecordsJob(crmSettings.sweepBatchSize()), null, null);
        }
        boolean force = request.force() != null && request.force();
        return enqueue(SyncRecordJob.first(request.recordId(), force), null, request.recordId());
    }

    @PostMapping("/trigger-enrich")
    public ResponseEntity<?> triggerEnrich(
        @RequestHeader(name = TOKEN_HEADER, required = false) String token,
        @RequestBody(required = false) TriggerEnrichRequest request
    ) {
        requireToken(token);
        EnrichmentRequest enrichment = toEnrichmentRequest(request);
        if (enrichment.dryRun()) {
            return ResponseEntity.ok(enrichmentService.enrich(enrichment));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(enqueue(new EnrichRecordsJob(enrichment), null, null));
    }

    @PostMapping("/records/{id}/status")
    public RecordStatusResponse changeRecordStatus(
        @RequestHeader(name = TOKEN_HEADER, required = false) String token,
        @PathVariable("id") long recordId,
        @RequestBody(required = false) StatusChangeRequest request
    ) {
        requireToken(token);
        RecordStatus next;
        try {
            next = RecordStatus.parse(request == null ? null : request.status());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage());
        }
        ProspectRecord updated = recordStatusService.changeStatus(recordId, next);
        return new RecordStatusResponse(updated.id(), updated.status());
    }

    @GetMapping("/targets/{id}/runs")
    public List<ScrapeRun> recentRuns(
        @RequestHeader(name = TOKEN_HEADER, required = false) String token,
        @PathVariable("id") long targetId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        requireToken(token);
        if (scrapeRepository.findTarget(targetId).isEmpty()) {
            throw new TargetNotFoundException(targetId);
        }
        int safeLimit = limit == null ? DEFAULT_RUN_LIMIT : Math.min(Math.max(1, limit), MAX_RUN_LIMIT);
        return scrapeRepository.findRecentRuns(targetId, safeLimit);
    }

    @PostMapping("/targets/sync")
    public TargetSyncSummary syncTargets(
        @RequestHeader(name = TOKEN_HEADER, required = false) String token,
        @RequestParam(name = "update", defaultValue = "false") boolean update,
        @RequestParam(name = "disable_missing", defaultValue = "false") boolean disableMissing,
        @RequestParam(name = "dry_run", defaultValue = "false") boolean dryRun,
        @RequestBody(required = false) JsonNode definitions
    ) {
        requireToken(token);
        if (definitions == null || !definitions.isArray()) {
            throw new ResponseStatusException(BAD_REQUEST, "body must be a JSON list of target definitions");
        }
        return targetSyncService.sync(definitions, new TargetSyncOptions(update, disableMissing, dryRun));
    }

    private static EnrichmentRequest toEnrichmentRequest(TriggerEnrichRequest request) {
        if (request == null) {
            return EnrichmentRequest.unenriched();
        }
        try {
            return new EnrichmentRequest(
                request.recordIds(),
                EnrichmentFilter.parse(request.filter()),
                request.source(),
                EnrichmentProfile.parse(request.profile()),
                parseRenderMode(request.renderMode()),
                request.maxRecords() == null ? 0 : request.maxRecords(),
                request.dryRun() != null && request.dryRun()
            );
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage());
        }
    }

    private static RenderMode parseRenderMode(String value) {
        if (value == null || value.isBlank()) {
            return RenderMode.STATIC;
        }
        try {
            return RenderMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown render mode: " + value);
        }
    }

    private JobAcceptedResponse enqueue(PipelineJob job, Long targetId, Long recordId) {
        jobQueue.enqueue(job);
        log.info("Operator enqueued {} {}", job.name(), job);
        return JobAcceptedResponse.queued(job.name(), targetId, recordId);
    }

    private void requireToken(String provided) {
        String expected = properties.getOps().getToken();
        if (expected == null || expected.isBlank() || provided == null || provided.isBlank()) {
            throw new ResponseStatusException(UNAUTHORIZED, "missing or invalid ops token");
        }
        boolean matches = MessageDigest.isEqual(
            expected.trim().getBytes(StandardCharsets.UTF_8),
            provided.trim().getBytes(StandardCharsets.UTF_8)
        );
        if (!matches) {
            throw new ResponseStatusException(UNAUTHORIZED, "missing or invalid ops token");
        }
    }
}
