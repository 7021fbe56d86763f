package com.leadharvest.scrape.model;

import java.util.List;

/**
 * @param recordIds explicit records to enrich; when empty the filter selects candidates
 * @param sourceName only candidates from this source, or null for every source
 * @param maxRecords upper bound on records visited, 0 for the configured default
 */
public record EnrichmentRequest(
    List<Long> recordIds,
    EnrichmentFilter filter,
    String sourceName,
    EnrichmentProfile profile,
    RenderMode renderMode,
    int maxRecords,
    boolean dryRun
) {
    public EnrichmentRequest {
        recordIds = recordIds == null ? List.of() : List.copyOf(recordIds);
        filter = filter == null ? EnrichmentFilter.UNENRICHED : filter;
        sourceName = sourceName == null || sourceName.isBlank() ? null : sourceName.trim();
        profile = profile == null ? EnrichmentProfile.GENERIC : profile;
        renderMode = renderMode == null ? RenderMode.STATIC : renderMode;
        maxRecords = Math.max(0, maxRecords);
    }

    public static EnrichmentRequest unenriched() {
        return new EnrichmentRequest(List.of(), EnrichmentFilter.UNENRICHED, null, null, null, 0, false);
    }
}
