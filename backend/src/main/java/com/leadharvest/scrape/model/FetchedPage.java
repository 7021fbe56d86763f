package com.leadharvest.scrape.model;

import java.time.Duration;
import java.time.Instant;

public record FetchedPage(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    String html,
    Instant fetchedAt,
    Duration duration
) {
    public String finalUrlOrRequested() {
        return finalUrl != null && !finalUrl.isBlank() ? finalUrl : requestedUrl;
    }
}
