package com.leadharvest.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TriggerEnrichRequest(
    @JsonProperty("record_ids") List<Long> recordIds,
    @JsonProperty("filter") String filter,
    @JsonProperty("source") String source,
    @JsonProperty("profile") String profile,
    @JsonProperty("render_mode") String renderMode,
    @JsonProperty("max_records") Integer maxRecords,
    @JsonProperty("dry_run") Boolean dryRun
) {
}
