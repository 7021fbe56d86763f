package com.leadharvest.scrape.persistence;

import com.leadharvest.scrape.model.ProspectRecord;
import com.leadharvest.scrape.model.RecordStatus;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.Target;
import com.leadharvest.scrape.model.UpsertResult;
import com.leadharvest.scrape.service.PaginatingFetcher;
import com.leadharvest.scrape.service.RecordUpsertService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ProspectJdbcRepositoryTest {

    @Autowired
    private ProspectJdbcRepository repository;

    @Autowired
    private ScrapeJdbcRepository scrapeRepository;

    @Autowired
    private RecordUpsertService upsertService;

    @Test
    void insertsAndReadsBackAllColumns() {
        String email = "Ada." + UUID.randomUUID() + "@Example.com";
        ProspectRecord record = new ProspectRecord(
            null, "expo", "https://example.com/expo", "ref-1", "Ada Lovelace", email,
            "(650) 253-0000", "+16502530000", "US", "Analytical Engines", "https://ada.example.com",
            "Founder", "Expo 2026", LocalDate.of(2026, 1, 25),
            OffsetDateTime.of(2026, 1, 25, 19, 0, 0, 0, ZoneOffset.UTC),
            "{\"name\":\"Ada\"}", "hash-" + UUID.randomUUID(), RecordStatus.NEW, null, null, null
        );

        long id = repository.insert(record);
        ProspectRecord stored = repository.findById(id).orElseThrow();

        assertThat(stored.fullName()).isEqualTo("Ada Lovelace");
        assertThat(stored.position()).isEqualTo("Founder");
        assertThat(stored.eventDate()).isEqualTo(LocalDate.of(2026, 1, 25));
        assertThat(stored.eventDatetime().toInstant()).isEqualTo(record.eventDatetime().toInstant());
        assertThat(stored.status()).isEqualTo(RecordStatus.NEW);
        assertThat(stored.createdAt()).isNotNull();
        assertThat(repository.findLatestByEmail(email.toLowerCase())).map(ProspectRecord::id).contains(id);
        assertThat(repository.findLatestByPhoneE164("+16502530000")).isPresent();
        assertThat(repository.findLatestByRawPayloadHash(record.rawPayloadHash())).map(ProspectRecord::id).contains(id);
        assertThat(repository.findLatestByRawPayloadHashAndSource(record.rawPayloadHash(), "other")).isEmpty();
    }

    @Test
    void blankEmailIsStoredAsNull() {
        long id = repository.insert(record(""));

        assertThat(repository.findById(id).orElseThrow().email()).isNull();
        assertThat(repository.findLatestByEmail("")).isEmpty();
    }

    @Test
    void updatesStatus() {
        long id = repository.insert(record("status-" + UUID.randomUUID() + "@example.com"));

        assertThat(repository.updateStatus(id, RecordStatus.NEW, RecordStatus.CONTACTED)).isTrue();
        assertThat(repository.findById(id).orElseThrow().status()).isEqualTo(RecordStatus.CONTACTED);
        assertThat(repository.updateStatus(Long.MAX_VALUE, RecordStatus.NEW, RecordStatus.CONTACTED)).isFalse();
    }

    @Test
    void statusWriteIsConditionalOnTheExpectedStatus() {
        long id = repository.insert(record("cas-" + UUID.randomUUID() + "@example.com"));
        repository.updateStatus(id, RecordStatus.NEW, RecordStatus.CONVERTED);

        assertThat(repository.updateStatus(id, RecordStatus.NEW, RecordStatus.SYNCED)).isFalse();
        assertThat(repository.findById(id).orElseThrow().status()).isEqualTo(RecordStatus.CONVERTED);
    }

    @Test
    void fieldUpdateSkipsTerminalRows() {
        long id = repository.insert(record("frozen-" + UUID.randomUUID() + "@example.com"));
        ProspectRecord loaded = repository.findById(id).orElseThrow();
        repository.updateStatus(id, RecordStatus.NEW, RecordStatus.REJECTED);

        boolean written = repository.update(new ProspectRecord(
            id, loaded.sourceName(), loaded.sourceUrl(), loaded.sourceRef(), "Changed Name", loaded.email(),
            "", "", "", "Other Co", "", "", "", null, null, "{}", loaded.rawPayloadHash(),
            loaded.status(), null, null, null
        ));

        ProspectRecord stored = repository.findById(id).orElseThrow();
        assertThat(written).isFalse();
        assertThat(stored.fullName()).isEqualTo("Linus");
        assertThat(stored.company()).isEqualTo("Acme");
    }

    @Test
    void upsertingTheSameRowTwiceCreatesOnce() {
        String name = "idem-" + UUID.randomUUID();
        long targetId = scrapeRepository.insertTarget(name, true, RenderMode.STATIC, "https://example.com/idem", 60, "{}");
        Target target = scrapeRepository.findTarget(targetId).orElseThrow();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", "Grace " + name);
        row.put("company", "Navy");
        row.put(PaginatingFetcher.PAGE_URL_KEY, "https://example.com/idem");
        row.put(PaginatingFetcher.TARGET_ID_KEY, targetId);
        row.put(PaginatingFetcher.TARGET_NAME_KEY, name);

        UpsertResult first = upsertService.upsert(target, row);
        UpsertResult second = upsertService.upsert(target, new LinkedHashMap<>(row));

        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
        assertThat(second.record().id()).isEqualTo(first.record().id());
        assertThat(second.record().rawPayloadHash()).isEqualTo(first.record().rawPayloadHash());
    }

    @Test
    void terminalRecordIsNotRewrittenByUpsert() {
        String name = "terminal-" + UUID.randomUUID();
        String email = name + "@example.com";
        long targetId = scrapeRepository.insertTarget(name, true, RenderMode.STATIC, "https://example.com/t", 60, "{}");
        Target target = scrapeRepository.findTarget(targetId).orElseThrow();
        long id = repository.insert(record(email));
        repository.updateStatus(id, RecordStatus.NEW, RecordStatus.REJECTED);

        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", "Someone Else");
        row.put("email", email);
        row.put("company", "New Co");
        UpsertResult result = upsertService.upsert(target, row);

        ProspectRecord stored = repository.findById(id).orElseThrow();
        assertThat(result.written()).isFalse();
        assertThat(stored.fullName()).isEqualTo("Linus");
        assertThat(stored.company()).isEqualTo("Acme");
        assertThat(stored.status()).isEqualTo(RecordStatus.REJECTED);
    }

    private static ProspectRecord record(String email) {
        return new ProspectRecord(
            null, "test", "https://example.com", "", "Linus", email, "", "", "", "Acme", "", "", "",
            null, null, "{}", "hash-" + UUID.randomUUID(), RecordStatus.NEW, null, null, null
        );
    }
}
