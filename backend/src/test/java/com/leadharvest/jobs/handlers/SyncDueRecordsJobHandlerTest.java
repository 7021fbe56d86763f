package com.leadharvest.jobs.handlers;

import com.leadharvest.config.CrmSettings;
import com.leadharvest.jobs.FollowUpJob;
import com.leadharvest.jobs.SyncDueRecordsJob;
import com.leadharvest.jobs.SyncRecordJob;
import com.leadharvest.sync.model.SyncState;
import com.leadharvest.sync.model.SyncStatus;
import com.leadharvest.sync.persistence.SyncStateJdbcRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncDueRecordsJobHandlerTest {

    @Mock
    private SyncStateJdbcRepository repository;

    @Test
    void enqueuesDueStatesWithNextAttemptNumber() {
        CrmSettings settings = new CrmSettings(true, "https://crm.example.com", "t", 20, null, null, 8, 100, Map.of());
        SyncDueRecordsJobHandler handler = new SyncDueRecordsJobHandler(repository, settings);
        when(repository.findDue(any(Instant.class), eq(8), eq(25))).thenReturn(List.of(
            new SyncState(1L, 11L, "", SyncStatus.PENDING, "", null, 0, null, null, null),
            new SyncState(2L, 12L, "", SyncStatus.ERROR, "", null, 2, null, "err", Instant.now())
        ));

        List<FollowUpJob> followUps = handler.handle(new SyncDueRecordsJob(25));

        assertThat(followUps).extracting(FollowUpJob::job).containsExactly(
            new SyncRecordJob(11L, false, 1),
            new SyncRecordJob(12L, false, 3)
        );
    }

    @Test
    void disabledSyncSweepsNothing() {
        CrmSettings settings = new CrmSettings(false, "", "", 20, null, null, 8, 100, Map.of());
        SyncDueRecordsJobHandler handler = new SyncDueRecordsJobHandler(repository, settings);

        assertThat(handler.handle(new SyncDueRecordsJob(25))).isEmpty();
        verifyNoInteractions(repository);
    }
}
