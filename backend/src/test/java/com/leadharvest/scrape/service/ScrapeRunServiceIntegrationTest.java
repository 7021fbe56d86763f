package com.leadharvest.scrape.service;

import com.leadharvest.scrape.config.TargetConfigException;
import com.leadharvest.scrape.http.PageFetchException;
import com.leadharvest.scrape.model.FailureCategory;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.RunStatus;
import com.leadharvest.scrape.model.RunSummary;
import com.leadharvest.scrape.model.RunTrigger;
import com.leadharvest.scrape.model.ScrapeRun;
import com.leadharvest.scrape.persistence.ScrapeJdbcRepository;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ScrapeRunServiceIntegrationTest {
    private static final String PEOPLE_CONFIG = "{\"item_selector\": \".card\", \"fields\": {\"name\": \"h2\"}}";
    private static final String PEOPLE_HTML =
        """
            <html><body>
              <div class="card"><h2>Alice %s</h2></div>
              <div class="card"><h2>Bob %s</h2></div>
            </body></html>
            """;

    @Autowired
    private ScrapeRunService scrapeRunService;

    @Autowired
    private ScrapeJdbcRepository repository;

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void createsOneRecordPerCardAndUpdatesOnRerun() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        String html = PEOPLE_HTML.formatted(suffix, suffix);
        server.enqueue(new MockResponse().setResponseCode(200).setBody(html));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(html));
        long targetId = repository.insertTarget(
            "people-" + suffix, true, RenderMode.STATIC, server.url("/people").toString(), 60, PEOPLE_CONFIG
        );

        RunSummary first = scrapeRunService.runTarget(targetId, RunTrigger.MANUAL);
        RunSummary second = scrapeRunService.runTarget(targetId, RunTrigger.MANUAL);

        assertThat(first.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(first.itemCount()).isEqualTo(2);
        assertThat(first.createdCount()).isEqualTo(2);
        assertThat(first.updatedCount()).isZero();
        assertThat(second.createdCount()).isZero();
        assertThat(second.updatedCount()).isEqualTo(2);

        ScrapeRun stored = repository.findRun(first.runId()).orElseThrow();
        assertThat(stored.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(stored.pageCount()).isEqualTo(1);
        assertThat(stored.createdCount()).isEqualTo(2);
        assertThat(stored.finishedAt()).isNotNull();
        assertThat(stored.statsJson()).contains("\"render_mode\":\"STATIC\"");
        assertThat(repository.findTarget(targetId).orElseThrow().lastRunAt()).isNotNull();
    }

    @Test
    void invalidConfigFailsBeforeAnyFetch() {
        long targetId = repository.insertTarget(
            "broken-" + UUID.randomUUID(), true, RenderMode.STATIC, server.url("/people").toString(), 60,
            "{\"fields\": {\"name\": \"h2\"}}"
        );

        assertThatThrownBy(() -> scrapeRunService.runTarget(targetId, RunTrigger.MANUAL))
            .isInstanceOf(TargetConfigException.class);

        assertThat(server.getRequestCount()).isZero();
        ScrapeRun run = repository.findRecentRuns(targetId, 1).get(0);
        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.errorCategory()).isEqualTo(FailureCategory.CONFIG);
        assertThat(run.errorText()).contains("item_selector");
    }

    @Test
    void httpErrorIsRecordedOnTheRun() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("maintenance"));
        long targetId = repository.insertTarget(
            "down-" + UUID.randomUUID(), true, RenderMode.STATIC, server.url("/people").toString(), 60, PEOPLE_CONFIG
        );

        assertThatThrownBy(() -> scrapeRunService.runTarget(targetId, RunTrigger.SCHEDULED))
            .isInstanceOf(PageFetchException.class);

        ScrapeRun run = repository.findRecentRuns(targetId, 1).get(0);
        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.trigger()).isEqualTo(RunTrigger.SCHEDULED);
        assertThat(run.errorText()).contains("HTTP 503");
        assertThat(run.createdCount()).isZero();
    }

    @Test
    void unknownTargetIsRejected() {
        assertThatThrownBy(() -> scrapeRunService.runTarget(Long.MAX_VALUE, RunTrigger.MANUAL))
            .isInstanceOf(TargetNotFoundException.class);
    }
}
