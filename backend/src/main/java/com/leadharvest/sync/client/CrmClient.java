package com.leadharvest.sync.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public interface CrmClient {
    /**
     * @return the parsed response body, or a text node when it is not JSON
     * @throws CrmApiException on non-2xx responses and transport failures
     */
    JsonNode createLead(Map<String, Object> payload);

    JsonNode updateLead(String externalId, Map<String, Object> payload);
}
