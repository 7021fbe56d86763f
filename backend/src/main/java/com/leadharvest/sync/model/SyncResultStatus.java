package com.leadharvest.sync.model;

public enum SyncResultStatus {
    DISABLED,
    NOT_CONFIGURED,
    RECORD_MISSING,
    INCOMPLETE,
    SKIPPED,
    IN_PROGRESS,
    SYNCED,
    FAILED
}
