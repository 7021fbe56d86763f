package com.leadharvest.scrape.model;

public record RecordUpsertedEvent(long recordId, boolean created, String sourceName) {
}
