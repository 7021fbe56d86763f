package com.leadharvest.sync.model;

import java.time.Duration;

public record SyncOutcome(
    long recordId,
    SyncResultStatus status,
    String externalId,
    int attempts,
    Duration retryDelay,
    String message
) {
    public static SyncOutcome of(long recordId, SyncResultStatus status) {
        return new SyncOutcome(recordId, status, null, 0, null, null);
    }

    public static SyncOutcome synced(long recordId, String externalId) {
        return new SyncOutcome(recordId, SyncResultStatus.SYNCED, externalId, 0, null, null);
    }

    public static SyncOutcome failed(long recordId, int attempts, Duration retryDelay, String message) {
        return new SyncOutcome(recordId, SyncResultStatus.FAILED, null, attempts, retryDelay, message);
    }
}
