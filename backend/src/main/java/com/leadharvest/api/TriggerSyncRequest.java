package com.leadharvest.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TriggerSyncRequest(
    @JsonProperty("record_id") Long recordId,
    @JsonProperty("force") Boolean force
) {
}
