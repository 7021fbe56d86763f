package com.leadharvest.scrape.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadharvest.scrape.config.TargetConfigParser;
import com.leadharvest.scrape.model.FailureCategory;
import com.leadharvest.scrape.model.PaginatedFetchResult;
import com.leadharvest.scrape.model.RecordUpsertedEvent;
import com.leadharvest.scrape.model.RunStatus;
import com.leadharvest.scrape.model.RunSummary;
import com.leadharvest.scrape.model.RunTrigger;
import com.leadharvest.scrape.model.Target;
import com.leadharvest.scrape.model.TargetConfig;
import com.leadharvest.scrape.model.UpsertResult;
import com.leadharvest.scrape.persistence.ScrapeJdbcRepository;
import com.leadharvest.scrape.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ScrapeRunService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunService.class);

    private final ScrapeJdbcRepository repository;
    private final TargetConfigParser configParser;
    private final PaginatingFetcher paginatingFetcher;
    private final RecordUpsertService upsertService;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    public ScrapeRunService(
        ScrapeJdbcRepository repository,
        TargetConfigParser configParser,
        PaginatingFetcher paginatingFetcher,
        RecordUpsertService upsertService,
        TransactionTemplate transactionTemplate,
        ApplicationEventPublisher eventPublisher,
        ObjectMapper objectMapper
    ) {
        this.repository = repository;
        this.configParser = configParser;
        this.paginatingFetcher = paginatingFetcher;
        this.upsertService = upsertService;
        this.transactionTemplate = transactionTemplate;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs the target once. Any failure is stored on the run and then rethrown
     * so the caller can decide whether it is contained.
     */
    public RunSummary runTarget(long targetId, RunTrigger trigger) {
        Target target = repository.findTarget(targetId).orElseThrow(() -> new TargetNotFoundException(targetId));
        Instant startedAt = Instant.now();
        long runId = repository.insertRun(target.id(), trigger, startedAt);
        log.info("Scrape run {} started for target {} ({}) trigger={}", runId, target.id(), target.name(), trigger);

        RunCounters counters = new RunCounters();
        RunStatus status = RunStatus.FAILED;
        String errorText = null;
        FailureCategory category = null;
        try {
            TargetConfig config = configParser.parse(target.configJson());
            PaginatedFetchResult fetched = paginatingFetcher.fetchAll(target, config);
            counters.pageUrls = fetched.pageUrls();
            counters.items = fetched.rows().size();

            transactionTemplate.executeWithoutResult(tx -> {
                for (Map<String, Object> row : fetched.rows()) {
                    UpsertResult result = upsertService.upsert(target, row);
                    if (!result.written()) {
                        counters.terminalSkipped++;
                        continue;
                    }
                    if (result.created()) {
                        counters.created++;
                    } else {
                        counters.updated++;
                    }
                    eventPublisher.publishEvent(
                        new RecordUpsertedEvent(result.record().id(), result.created(), target.name())
                    );
                }
            });
            status = RunStatus.SUCCESS;
        } catch (RuntimeException e) {
            errorText = FailureClassifier.describe(e);
            category = FailureClassifier.classify(e);
            // rows written before the failure were rolled back with the transaction
            counters.created = 0;
            counters.updated = 0;
            throw e;
        } finally {
            Instant finishedAt = Instant.now();
            boolean finalized = repository.finalizeRun(
                runId,
                status,
                finishedAt,
                counters.pageUrls.size(),
                counters.items,
                counters.created,
                counters.updated,
                statsJson(target, counters),
                errorText,
                category
            );
            if (!finalized) {
                log.warn("Scrape run {} was already finalized elsewhere", runId);
            }
            repository.touchLastRunAt(target.id(), finishedAt);
            if (status == RunStatus.SUCCESS) {
                log.info(
                    "Scrape run {} for target {} succeeded pages={} items={} created={} updated={} terminalSkipped={}",
                    runId,
                    target.id(),
                    counters.pageUrls.size(),
                    counters.items,
                    counters.created,
                    counters.updated,
                    counters.terminalSkipped
                );
            }
        }
        return new RunSummary(
            runId,
            target.id(),
            status,
            counters.pageUrls.size(),
            counters.items,
            counters.created,
            counters.updated,
            counters.terminalSkipped
        );
    }

    private String statsJson(Target target, RunCounters counters) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("render_mode", target.renderMode().name());
        stats.put("page_urls", counters.pageUrls);
        stats.put("terminal_skipped", counters.terminalSkipped);
        try {
            return objectMapper.writeValueAsString(stats);
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialize stats for target {}", target.id(), e);
            return null;
        }
    }

    private static final class RunCounters {
        private List<String> pageUrls = List.of();
        private int items;
        private int created;
        private int updated;
        private int terminalSkipped;
    }
}
