package com.leadharvest.sync.model;

public enum SyncStatus {
    PENDING,
    SYNCED,
    ERROR;

    public boolean canTransitionTo(SyncStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == SYNCED || next == ERROR;
            case ERROR, SYNCED -> next == SYNCED || next == ERROR;
        };
    }
}
