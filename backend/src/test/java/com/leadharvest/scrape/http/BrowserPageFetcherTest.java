package com.leadharvest.scrape.http;

import com.leadharvest.scrape.model.FetchFailureKind;
import com.microsoft.playwright.PlaywrightException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BrowserPageFetcherTest {
    private static final String URL = "https://example.com/events";

    @Test
    void translatesNavigationErrors() {
        assertThat(BrowserPageFetcher.translate(URL, new PlaywrightException("net::ERR_NAME_NOT_RESOLVED at " + URL)).getKind())
            .isEqualTo(FetchFailureKind.DNS);
        assertThat(BrowserPageFetcher.translate(URL, new PlaywrightException("net::ERR_CONNECTION_REFUSED at " + URL)).getKind())
            .isEqualTo(FetchFailureKind.CONNECTION);
        assertThat(BrowserPageFetcher.translate(URL, new PlaywrightException("Timeout 30000ms exceeded.")).getKind())
            .isEqualTo(FetchFailureKind.TIMEOUT);
    }

    @Test
    void unknownErrorsKeepTheirFirstLine() {
        PageFetchException translated = BrowserPageFetcher.translate(
            URL,
            new PlaywrightException("Target page crashed\n  at frame main")
        );

        assertThat(translated.getKind()).isEqualTo(FetchFailureKind.BROWSER);
        assertThat(translated.getMessage()).contains("Target page crashed").doesNotContain("frame main");
    }
}
