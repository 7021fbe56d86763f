package com.leadharvest.scrape.model;

import java.util.List;
import java.util.Map;

public record PaginatedFetchResult(List<Map<String, Object>> rows, List<String> pageUrls) {
    public PaginatedFetchResult {
        rows = List.copyOf(rows);
        pageUrls = List.copyOf(pageUrls);
    }

    public int pageCount() {
        return pageUrls.size();
    }
}
