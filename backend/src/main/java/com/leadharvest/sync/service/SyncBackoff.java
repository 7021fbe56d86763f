package com.leadharvest.sync.service;

import java.time.Duration;

public final class SyncBackoff {
    static final long BASE_SECONDS = 30;
    static final int MAX_EXPONENT = 10;
    static final long MAX_DELAY_SECONDS = 3600;

    private SyncBackoff() {}

    /**
     * Delay before the next attempt after {@code attempts} failures: 30 * 2^attempts seconds, capped at one hour.
     */
    public static Duration delayFor(int attempts) {
        int exponent = Math.min(Math.max(0, attempts), MAX_EXPONENT);
        long seconds = Math.min(BASE_SECONDS * (1L << exponent), MAX_DELAY_SECONDS);
        return Duration.ofSeconds(seconds);
    }
}
