package com.leadharvest.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobAcceptedResponse(
    @JsonProperty("status") String status,
    @JsonProperty("job") String job,
    @JsonProperty("target_id") Long targetId,
    @JsonProperty("record_id") Long recordId
) {
    public static JobAcceptedResponse queued(String job, Long targetId, Long recordId) {
        return new JobAcceptedResponse("queued", job, targetId, recordId);
    }
}
