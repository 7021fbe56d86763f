package com.leadharvest.config;

import java.util.LinkedHashMap;
import java.util.Map;

public record CrmSettings(
    boolean enabled,
    String baseUrl,
    String token,
    int timeoutSeconds,
    String createPath,
    String updatePath,
    int maxAttempts,
    int sweepBatchSize,
    Map<String, String> defaults
) {
    public CrmSettings {
        baseUrl = baseUrl == null ? "" : baseUrl.trim();
        token = token == null ? "" : token.trim();
        createPath = createPath == null || createPath.isBlank() ? "/api/leads" : createPath.trim();
        updatePath = updatePath == null || updatePath.isBlank() ? "/api/leads/{id}" : updatePath.trim();
        timeoutSeconds = Math.max(1, timeoutSeconds);
        maxAttempts = Math.max(1, maxAttempts);
        sweepBatchSize = Math.max(1, sweepBatchSize);
        defaults = defaults == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(defaults));
    }

    public static CrmSettings from(PipelineProperties.Crm crm) {
        return new CrmSettings(
            crm.isEnabled(),
            crm.getBaseUrl(),
            crm.getToken(),
            crm.getTimeoutSeconds(),
            crm.getCreatePath(),
            crm.getUpdatePath(),
            crm.getMaxAttempts(),
            crm.getSweepBatchSize(),
            crm.getDefaults()
        );
    }

    public boolean isConfigured() {
        return !baseUrl.isEmpty() && !token.isEmpty();
    }
}
