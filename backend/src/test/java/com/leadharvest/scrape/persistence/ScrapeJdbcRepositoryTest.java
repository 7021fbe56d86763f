package com.leadharvest.scrape.persistence;

import com.leadharvest.scrape.model.FailureCategory;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.RunStatus;
import com.leadharvest.scrape.model.RunTrigger;
import com.leadharvest.scrape.model.ScrapeRun;
import com.leadharvest.scrape.model.Target;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ScrapeJdbcRepositoryTest {

    @Autowired
    private ScrapeJdbcRepository repository;

    @Test
    void storesAndUpdatesTargets() {
        String name = "target-" + UUID.randomUUID();
        long id = repository.insertTarget(name, true, RenderMode.BROWSER, "https://example.com", 15, "{\"a\":1}");

        Target stored = repository.findTarget(id).orElseThrow();
        assertThat(stored.name()).isEqualTo(name);
        assertThat(stored.renderMode()).isEqualTo(RenderMode.BROWSER);
        assertThat(stored.runEveryMinutes()).isEqualTo(15);
        assertThat(stored.lastRunAt()).isNull();
        assertThat(repository.findTargetByName(name)).contains(stored);

        repository.updateTarget(id, false, RenderMode.STATIC, "https://example.org", 30, "{\"b\":2}");
        Instant touched = Instant.parse("2026-01-25T10:00:00Z");
        repository.touchLastRunAt(id, touched);

        Target updated = repository.findTarget(id).orElseThrow();
        assertThat(updated.enabled()).isFalse();
        assertThat(updated.startUrl()).isEqualTo("https://example.org");
        assertThat(updated.configJson()).isEqualTo("{\"b\":2}");
        assertThat(updated.lastRunAt()).isEqualTo(touched);
        assertThat(repository.findEnabledTargets()).extracting(Target::id).doesNotContain(id);
    }

    @Test
    void disablesTargetsMissingFromKeepList() {
        String keep = "keep-" + UUID.randomUUID();
        String drop = "drop-" + UUID.randomUUID();
        long keepId = repository.insertTarget(keep, true, RenderMode.STATIC, "https://example.com/a", 60, "{}");
        long dropId = repository.insertTarget(drop, true, RenderMode.STATIC, "https://example.com/b", 60, "{}");

        int toDisable = repository.countTargetsToDisable(List.of(keep));
        int disabled = repository.disableTargetsExcept(List.of(keep));

        assertThat(disabled).isEqualTo(toDisable).isGreaterThanOrEqualTo(1);
        assertThat(repository.findTarget(keepId).orElseThrow().enabled()).isTrue();
        assertThat(repository.findTarget(dropId).orElseThrow().enabled()).isFalse();
    }

    @Test
    void finalizesRunOnlyOnce() {
        long targetId = repository.insertTarget("runs-" + UUID.randomUUID(), true, RenderMode.STATIC, "https://example.com", 60, "{}");
        Instant startedAt = Instant.parse("2026-01-25T10:00:00Z");
        long runId = repository.insertRun(targetId, RunTrigger.MANUAL, startedAt);

        boolean first = repository.finalizeRun(
            runId, RunStatus.FAILED, startedAt.plusSeconds(5), 1, 3, 0, 0, "{}", "dns resolution failed", FailureCategory.NETWORK
        );
        boolean second = repository.finalizeRun(
            runId, RunStatus.SUCCESS, startedAt.plusSeconds(9), 1, 3, 3, 0, "{}", null, null
        );

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        ScrapeRun run = repository.findRun(runId).orElseThrow();
        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.trigger()).isEqualTo(RunTrigger.MANUAL);
        assertThat(run.errorCategory()).isEqualTo(FailureCategory.NETWORK);
        assertThat(run.errorText()).isEqualTo("dns resolution failed");
        assertThat(run.itemCount()).isEqualTo(3);
        assertThat(run.finishedAt()).isEqualTo(startedAt.plusSeconds(5));
        assertThatThrownBy(() -> repository.finalizeRun(runId, RunStatus.RUNNING, Instant.now(), 0, 0, 0, 0, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listsRecentRunsNewestFirst() {
        long targetId = repository.insertTarget("recent-" + UUID.randomUUID(), true, RenderMode.STATIC, "https://example.com", 60, "{}");
        Instant base = Instant.parse("2026-01-25T10:00:00Z");
        long older = repository.insertRun(targetId, RunTrigger.SCHEDULED, base);
        long newer = repository.insertRun(targetId, RunTrigger.MANUAL, base.plusSeconds(60));
        long newest = repository.insertRun(targetId, RunTrigger.MANUAL, base.plusSeconds(120));

        List<ScrapeRun> runs = repository.findRecentRuns(targetId, 2);

        assertThat(runs).extracting(ScrapeRun::id).containsExactly(newest, newer);
        assertThat(runs).extracting(ScrapeRun::id).doesNotContain(older);
    }

    @Test
    void failsStaleRunningRuns() {
        long targetId = repository.insertTarget("stale-" + UUID.randomUUID(), true, RenderMode.STATIC, "https://example.com", 60, "{}");
        Instant now = Instant.now();
        long stale = repository.insertRun(targetId, RunTrigger.SCHEDULED, now.minusSeconds(3 * 3600));
        long fresh = repository.insertRun(targetId, RunTrigger.SCHEDULED, now.minusSeconds(60));

        int failed = repository.failStaleRuns(now.minusSeconds(3600), now, "aborted_on_startup: stale");

        assertThat(failed).isGreaterThanOrEqualTo(1);
        ScrapeRun staleRun = repository.findRun(stale).orElseThrow();
        assertThat(staleRun.status()).isEqualTo(RunStatus.FAILED);
        assertThat(staleRun.errorCategory()).isEqualTo(FailureCategory.FATAL);
        assertThat(repository.findRun(fresh).orElseThrow().status()).isEqualTo(RunStatus.RUNNING);
    }
}
