package com.leadharvest.scrape.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TargetConfig(
    String itemSelector,
    Map<String, FieldSpec> fields,
    String nextPageSelector,
    int maxPages,
    Map<String, String> headers,
    int timeoutSeconds,
    String waitUntil
) {
    public static final int DEFAULT_MAX_PAGES = 1;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final String DEFAULT_WAIT_UNTIL = "networkidle";

    public TargetConfig {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public boolean hasNextPageSelector() {
        return nextPageSelector != null && !nextPageSelector.isBlank();
    }
}
