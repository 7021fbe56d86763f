package com.leadharvest.sync.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.leadharvest.jobs.JobQueue;
import com.leadharvest.scrape.model.ProspectRecord;
import com.leadharvest.scrape.model.RecordStatus;
import com.leadharvest.scrape.persistence.ProspectJdbcRepository;
import com.leadharvest.sync.client.CrmClient;
import com.leadharvest.sync.model.SyncOutcome;
import com.leadharvest.sync.model.SyncResultStatus;
import com.leadharvest.sync.persistence.SyncStateJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
    "pipeline.crm.enabled=true",
    "pipeline.crm.base-url=https://crm.example.com",
    "pipeline.crm.token=test-token"
})
@ActiveProfiles("test")
@Transactional
class CrmSyncServiceIntegrationTest {

    @Autowired
    private CrmSyncService syncService;

    @Autowired
    private ProspectJdbcRepository prospectRepository;

    @Autowired
    private SyncStateJdbcRepository syncStateRepository;

    @MockBean
    private CrmClient crmClient;

    @MockBean
    private JobQueue jobQueue;

    @Test
    void successfulSyncMarksNewRecordSynced() {
        long id = insertRecord();
        when(crmClient.createLead(anyMap())).thenReturn(JsonNodeFactory.instance.objectNode().put("id", 5));

        SyncOutcome outcome = syncService.sync(id, false);

        assertThat(outcome.status()).isEqualTo(SyncResultStatus.SYNCED);
        assertThat(prospectRepository.findById(id).orElseThrow().status()).isEqualTo(RecordStatus.SYNCED);
    }

    @Test
    void recordConvertedDuringTheCrmCallStaysConverted() {
        long id = insertRecord();
        when(crmClient.createLead(anyMap())).thenAnswer(invocation -> {
            prospectRepository.updateStatus(id, RecordStatus.NEW, RecordStatus.CONVERTED);
            return JsonNodeFactory.instance.objectNode().put("id", 7);
        });

        SyncOutcome outcome = syncService.sync(id, false);

        assertThat(outcome.status()).isEqualTo(SyncResultStatus.SYNCED);
        assertThat(prospectRepository.findById(id).orElseThrow().status()).isEqualTo(RecordStatus.CONVERTED);
        assertThat(syncStateRepository.findByRecordId(id).orElseThrow().externalId()).isEqualTo("7");
    }

    private long insertRecord() {
        return prospectRepository.insert(new ProspectRecord(
            null, "expo", "https://example.com/expo", "", "Alice " + UUID.randomUUID(),
            "alice-" + UUID.randomUUID() + "@example.com", "", "", "", "Acme", "", "", "",
            null, null, "{}", "hash-" + UUID.randomUUID(), RecordStatus.NEW, null, null, null
        ));
    }
}
