package com.leadharvest.scrape.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordEnrichmentResult(
    @JsonProperty("record_id") long recordId,
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("updated_fields") List<String> updatedFields,
    @JsonProperty("message") String message
) {
    public enum Outcome {
        ENRICHED,
        SKIPPED,
        FAILED
    }

    public RecordEnrichmentResult {
        updatedFields = updatedFields == null ? List.of() : List.copyOf(updatedFields);
    }

    public static RecordEnrichmentResult enriched(long recordId, List<String> updatedFields) {
        return new RecordEnrichmentResult(recordId, Outcome.ENRICHED, updatedFields, null);
    }

    public static RecordEnrichmentResult skipped(long recordId, String reason) {
        return new RecordEnrichmentResult(recordId, Outcome.SKIPPED, List.of(), reason);
    }

    public static RecordEnrichmentResult failed(long recordId, String error) {
        return new RecordEnrichmentResult(recordId, Outcome.FAILED, List.of(), error);
    }
}
