package com.leadharvest.scrape.http;

import com.leadharvest.config.PipelineProperties;
import com.leadharvest.scrape.config.TargetConfigException;
import com.leadharvest.scrape.model.FetchFailureKind;
import com.leadharvest.scrape.model.FetchedPage;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.TargetConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

@Component
public class StaticPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(StaticPageFetcher.class);

    private final PipelineProperties properties;
    private final HttpClient client;

    public StaticPageFetcher(PipelineProperties properties) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getHttp().getDefaultTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public RenderMode renderMode() {
        return RenderMode.STATIC;
    }

    @Override
    public FetchedPage fetch(String url, TargetConfig config) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        HttpRequest request = buildRequest(uri, config);

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpConnectTimeoutException e) {
            throw new PageFetchException(FetchFailureKind.TIMEOUT, url, "connect timed out for " + url, e);
        } catch (HttpTimeoutException e) {
            throw new PageFetchException(
                FetchFailureKind.TIMEOUT,
                url,
                "request timed out after " + config.timeoutSeconds() + "s for " + url,
                e
            );
        } catch (ConnectException e) {
            if (isUnresolvedHost(e)) {
                throw new PageFetchException(FetchFailureKind.DNS, url, "dns resolution failed for host " + uri.getHost(), e);
            }
            throw new PageFetchException(FetchFailureKind.CONNECTION, url, "connection refused by " + uri.getHost(), e);
        } catch (IOException e) {
            if (isUnresolvedHost(e)) {
                throw new PageFetchException(FetchFailureKind.DNS, url, "dns resolution failed for host " + uri.getHost(), e);
            }
            throw new PageFetchException(FetchFailureKind.CONNECTION, url, "connection failed for " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageFetchException(FetchFailureKind.CONNECTION, url, "interrupted while fetching " + url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new PageFetchException(
                FetchFailureKind.HTTP_STATUS,
                url,
                status,
                "HTTP " + status + " fetching " + url,
                null
            );
        }
        Duration elapsed = Duration.between(startedAt, Instant.now());
        log.debug("Fetched {} status={} in {}ms", url, status, elapsed.toMillis());
        return new FetchedPage(
            url,
            response.uri() == null ? url : response.uri().toString(),
            status,
            response.body() == null ? "" : response.body(),
            Instant.now(),
            elapsed
        );
    }

    private HttpRequest buildRequest(URI uri, TargetConfig config) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(config.timeoutSeconds()))
            .header("User-Agent", PipelineProperties.normalizeUserAgent(properties.getHttp().getUserAgent()))
            .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
            .header("Accept-Language", "en-US,en;q=0.8");
        for (Map.Entry<String, String> header : config.headers().entrySet()) {
            try {
                builder.setHeader(header.getKey(), header.getValue());
            } catch (IllegalArgumentException e) {
                throw new TargetConfigException("header '" + header.getKey() + "' cannot be set: " + e.getMessage(), e);
            }
        }
        return builder.GET().build();
    }

    static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            throw new PageFetchException(FetchFailureKind.INVALID_URL, url, "invalid url in target config: empty");
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
                throw new PageFetchException(FetchFailureKind.INVALID_URL, url, "invalid url in target config: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new PageFetchException(FetchFailureKind.INVALID_URL, url, "invalid url in target config: " + url, e);
        }
    }

    private boolean isUnresolvedHost(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof UnknownHostException || current instanceof UnresolvedAddressException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
