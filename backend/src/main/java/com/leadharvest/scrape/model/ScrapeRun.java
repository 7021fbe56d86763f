package com.leadharvest.scrape.model;

import java.time.Instant;

public record ScrapeRun(
    long id,
    long targetId,
    RunTrigger trigger,
    RunStatus status,
    Instant startedAt,
    Instant finishedAt,
    int itemCount,
    int createdCount,
    int updatedCount,
    int pageCount,
    String statsJson,
    String errorText,
    FailureCategory errorCategory
) {
}
