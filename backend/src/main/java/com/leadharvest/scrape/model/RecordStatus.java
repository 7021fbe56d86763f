package com.leadharvest.scrape.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum RecordStatus {
    NEW,
    CONTACTED,
    SYNCED,
    CONVERTED,
    REJECTED;

    public boolean isTerminal() {
        return this == CONVERTED || this == REJECTED;
    }

    public boolean canTransitionTo(RecordStatus next) {
        if (next == null) {
            return false;
        }
        if (next == this) {
            return true;
        }
        return allowedTargets().contains(next);
    }

    private Set<RecordStatus> allowedTargets() {
        return switch (this) {
            case NEW -> EnumSet.of(CONTACTED, SYNCED, CONVERTED, REJECTED);
            case CONTACTED -> EnumSet.of(SYNCED, CONVERTED, REJECTED);
            case SYNCED -> EnumSet.of(CONTACTED, CONVERTED, REJECTED);
            case CONVERTED, REJECTED -> EnumSet.noneOf(RecordStatus.class);
        };
    }

    public static RecordStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return RecordStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown record status: " + value);
        }
    }
}
