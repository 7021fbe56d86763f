package com.leadharvest.scrape.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EnrichmentSummary(
    @JsonProperty("dry_run") boolean dryRun,
    @JsonProperty("total") int total,
    @JsonProperty("enriched") int enriched,
    @JsonProperty("skipped") int skipped,
    @JsonProperty("failed") int failed,
    @JsonProperty("results") List<RecordEnrichmentResult> results
) {
    public EnrichmentSummary {
        results = List.copyOf(results);
    }

    public static EnrichmentSummary of(List<RecordEnrichmentResult> results) {
        int enriched = 0;
        int skipped = 0;
        int failed = 0;
        for (RecordEnrichmentResult result : results) {
            switch (result.outcome()) {
                case ENRICHED -> enriched++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        return new EnrichmentSummary(false, results.size(), enriched, skipped, failed, results);
    }

    public static EnrichmentSummary dryRun(List<Long> candidateIds) {
        List<RecordEnrichmentResult> results = candidateIds.stream()
            .map(id -> RecordEnrichmentResult.skipped(id, "dry run"))
            .toList();
        return new EnrichmentSummary(true, results.size(), 0, results.size(), 0, results);
    }
}
