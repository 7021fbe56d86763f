package com.leadharvest.scrape.service;

import com.leadharvest.scrape.extract.SelectorExtractor;
import com.leadharvest.scrape.http.PageFetcher;
import com.leadharvest.scrape.model.FetchedPage;
import com.leadharvest.scrape.model.PaginatedFetchResult;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.Target;
import com.leadharvest.scrape.model.TargetConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class PaginatingFetcher {
    private static final Logger log = LoggerFactory.getLogger(PaginatingFetcher.class);

    public static final String PAGE_URL_KEY = "_page_url";
    public static final String TARGET_ID_KEY = "_target_id";
    public static final String TARGET_NAME_KEY = "_target_name";

    private final Map<RenderMode, PageFetcher> fetchers = new EnumMap<>(RenderMode.class);
    private final SelectorExtractor extractor;

    public PaginatingFetcher(List<PageFetcher> fetchers, SelectorExtractor extractor) {
        for (PageFetcher fetcher : fetchers) {
            this.fetchers.put(fetcher.renderMode(), fetcher);
        }
        this.extractor = extractor;
    }

    public PaginatedFetchResult fetchAll(Target target, TargetConfig config) {
        PageFetcher fetcher = fetchers.get(target.renderMode());
        if (fetcher == null) {
            throw new IllegalStateException("No page fetcher registered for render mode " + target.renderMode());
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        List<String> pageUrls = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String url = target.startUrl();

        while (pageUrls.size() < config.maxPages()) {
            visited.add(url);
            pageUrls.add(url);
            FetchedPage page = fetcher.fetch(url, config);
            String baseUrl = page.finalUrlOrRequested();

            List<Map<String, String>> items = extractor.extractItems(page.html(), baseUrl, config);
            for (Map<String, String> item : items) {
                Map<String, Object> row = new LinkedHashMap<>(item);
                row.putIfAbsent(PAGE_URL_KEY, url);
                row.putIfAbsent(TARGET_ID_KEY, target.id());
                row.putIfAbsent(TARGET_NAME_KEY, target.name());
                rows.add(row);
            }
            log.info("Target {} page {} yielded {} items from {}", target.id(), pageUrls.size(), items.size(), url);

            if (!config.hasNextPageSelector()) {
                break;
            }
            String next = extractor.extractNextPageUrl(page.html(), baseUrl, config.nextPageSelector());
            if (next.isEmpty()) {
                break;
            }
            if (visited.contains(next)) {
                log.info("Target {} next page {} already visited, stopping", target.id(), next);
                break;
            }
            url = next;
        }
        return new PaginatedFetchResult(rows, pageUrls);
    }
}
