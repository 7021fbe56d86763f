package com.leadharvest.scrape.http;

import com.leadharvest.scrape.model.FetchedPage;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.TargetConfig;

public interface PageFetcher {
    RenderMode renderMode();

    /**
     * Fetches one page using the timeout and headers of {@code config}.
     *
     * @throws PageFetchException on DNS, connection, timeout, HTTP status or browser failures
     */
    FetchedPage fetch(String url, TargetConfig config);
}
