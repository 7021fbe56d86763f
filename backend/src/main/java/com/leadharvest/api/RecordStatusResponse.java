package com.leadharvest.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.leadharvest.scrape.model.RecordStatus;

public record RecordStatusResponse(
    @JsonProperty("record_id") long recordId,
    @JsonProperty("status") RecordStatus status
) {
}
