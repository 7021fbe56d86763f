package com.leadharvest.scrape.model;

public record RunSummary(
    long runId,
    long targetId,
    RunStatus status,
    int pageCount,
    int itemCount,
    int createdCount,
    int updatedCount,
    int terminalSkippedCount
) {
}
