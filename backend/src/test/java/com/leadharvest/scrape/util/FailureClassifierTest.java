package com.leadharvest.scrape.util;

import com.leadharvest.scrape.config.TargetConfigException;
import com.leadharvest.scrape.model.FailureCategory;
import org.junit.jupiter.api.Test;

import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    @Test
    void classifiesNetworkFailures() {
        assertThat(FailureClassifier.classifyText("dns resolution failed for host nowhere.invalid"))
            .isEqualTo(FailureCategory.NETWORK);
        assertThat(FailureClassifier.classifyText("net::ERR_NAME_NOT_RESOLVED at https://x"))
            .isEqualTo(FailureCategory.NETWORK);
        assertThat(FailureClassifier.classifyText("Connection refused")).isEqualTo(FailureCategory.NETWORK);
    }

    @Test
    void classifiesTimeoutsAndConfigErrors() {
        assertThat(FailureClassifier.classifyText("request timed out after 30s")).isEqualTo(FailureCategory.TIMEOUT);
        assertThat(FailureClassifier.classifyText("Timeout 30000ms exceeded")).isEqualTo(FailureCategory.TIMEOUT);
        assertThat(FailureClassifier.classifyText("bad CSS selector 'div[['")).isEqualTo(FailureCategory.CONFIG);
    }

    @Test
    void unknownOrBlankTextIsFatal() {
        assertThat(FailureClassifier.classifyText("NullPointerException")).isEqualTo(FailureCategory.FATAL);
        assertThat(FailureClassifier.classifyText("")).isEqualTo(FailureCategory.FATAL);
        assertThat(FailureClassifier.classifyText(null)).isEqualTo(FailureCategory.FATAL);
        assertThat(FailureCategory.FATAL.isContained()).isFalse();
        assertThat(FailureCategory.NETWORK.isContained()).isTrue();
    }

    @Test
    void classifiesThroughCauseChain() {
        RuntimeException wrapped = new RuntimeException("fetch failed", new UnknownHostException("nowhere.invalid"));

        assertThat(FailureClassifier.describe(wrapped))
            .isEqualTo("RuntimeException: fetch failed | caused by UnknownHostException: nowhere.invalid");
        assertThat(FailureClassifier.classify(wrapped)).isEqualTo(FailureCategory.NETWORK);
        assertThat(FailureClassifier.classify(new TargetConfigException("item_selector is required")))
            .isEqualTo(FailureCategory.CONFIG);
    }

    @Test
    void sameTextAlwaysYieldsSameCategory() {
        String text = "PageFetchException: timed out fetching https://example.com";
        assertThat(FailureClassifier.classifyText(text)).isEqualTo(FailureClassifier.classifyText(text));
    }
}
