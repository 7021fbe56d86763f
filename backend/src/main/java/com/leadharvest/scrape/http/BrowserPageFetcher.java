package com.leadharvest.scrape.http;

import com.leadharvest.config.PipelineProperties;
import com.leadharvest.scrape.model.FetchFailureKind;
import com.leadharvest.scrape.model.FetchedPage;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.TargetConfig;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
public class BrowserPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(BrowserPageFetcher.class);

    private final PipelineProperties properties;

    public BrowserPageFetcher(PipelineProperties properties) {
        this.properties = properties;
    }

    @Override
    public RenderMode renderMode() {
        return RenderMode.BROWSER;
    }

    @Override
    public FetchedPage fetch(String url, TargetConfig config) {
        StaticPageFetcher.toUri(url);
        Instant startedAt = Instant.now();
        Map<String, String> extraHeaders = new LinkedHashMap<>();
        String userAgent = PipelineProperties.normalizeUserAgent(properties.getHttp().getUserAgent());
        for (Map.Entry<String, String> header : config.headers().entrySet()) {
            if ("user-agent".equals(header.getKey().toLowerCase(Locale.ROOT))) {
                userAgent = header.getValue();
            } else {
                extraHeaders.put(header.getKey(), header.getValue());
            }
        }

        try (Playwright playwright = Playwright.create();
             Browser browser = playwright.chromium().launch(
                 new BrowserType.LaunchOptions().setHeadless(properties.getBrowser().isHeadless()));
             BrowserContext context = browser.newContext(
                 new Browser.NewContextOptions().setUserAgent(userAgent).setExtraHTTPHeaders(extraHeaders))) {
            Page page = context.newPage();
            Response response = page.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(waitUntilState(config.waitUntil()))
                .setTimeout(config.timeoutSeconds() * 1000.0));
            int status = response == null ? 200 : response.status();
            if (status >= 400) {
                throw new PageFetchException(FetchFailureKind.HTTP_STATUS, url, status, "HTTP " + status + " rendering " + url, null);
            }
            String html = page.content();
            Duration elapsed = Duration.between(startedAt, Instant.now());
            log.debug("Rendered {} status={} in {}ms", url, status, elapsed.toMillis());
            return new FetchedPage(url, page.url(), status, html == null ? "" : html, Instant.now(), elapsed);
        } catch (TimeoutError e) {
            throw new PageFetchException(
                FetchFailureKind.TIMEOUT,
                url,
                "browser navigation timed out after " + config.timeoutSeconds() + "s for " + url,
                e
            );
        } catch (PlaywrightException e) {
            throw translate(url, e);
        }
    }

    static PageFetchException translate(String url, PlaywrightException error) {
        String message = error.getMessage() == null ? "" : error.getMessage();
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("err_name_not_resolved")) {
            return new PageFetchException(FetchFailureKind.DNS, url, "dns resolution failed (net::ERR_NAME_NOT_RESOLVED) for " + url, error);
        }
        if (lower.contains("err_connection")) {
            return new PageFetchException(FetchFailureKind.CONNECTION, url, "connection refused or reset (net::ERR_CONNECTION) for " + url, error);
        }
        if (lower.contains("timeout")) {
            return new PageFetchException(FetchFailureKind.TIMEOUT, url, "browser navigation timed out for " + url, error);
        }
        return new PageFetchException(FetchFailureKind.BROWSER, url, "browser navigation failed for " + url + ": " + firstLine(message), error);
    }

    private static WaitUntilState waitUntilState(String waitUntil) {
        return switch (waitUntil == null ? TargetConfig.DEFAULT_WAIT_UNTIL : waitUntil) {
            case "load" -> WaitUntilState.LOAD;
            case "domcontentloaded" -> WaitUntilState.DOMCONTENTLOADED;
            case "commit" -> WaitUntilState.COMMIT;
            default -> WaitUntilState.NETWORKIDLE;
        };
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
