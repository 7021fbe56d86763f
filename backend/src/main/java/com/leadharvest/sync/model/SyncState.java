package com.leadharvest.sync.model;

import java.time.Instant;

public record SyncState(
    long id,
    long recordId,
    String externalId,
    SyncStatus status,
    String payloadHash,
    String lastPayload,
    int attempts,
    Instant lastSyncAt,
    String lastError,
    Instant nextRetryAt
) {
    public boolean hasExternalId() {
        return externalId != null && !externalId.isBlank();
    }
}
