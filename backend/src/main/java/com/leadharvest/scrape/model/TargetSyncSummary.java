package com.leadharvest.scrape.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TargetSyncSummary(
    @JsonProperty("dry_run") boolean dryRun,
    @JsonProperty("created") int created,
    @JsonProperty("updated") int updated,
    @JsonProperty("skipped") int skipped,
    @JsonProperty("invalid") int invalid,
    @JsonProperty("disabled") int disabled,
    @JsonProperty("messages") List<String> messages
) {
    public TargetSyncSummary {
        messages = List.copyOf(messages);
    }
}
