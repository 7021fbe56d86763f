package com.leadharvest.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TriggerScrapeRequest(@JsonProperty("target_id") Long targetId) {
}
