package com.leadharvest.scrape.model;

import java.time.Instant;

public record Target(
    long id,
    String name,
    boolean enabled,
    RenderMode renderMode,
    String startUrl,
    int runEveryMinutes,
    String configJson,
    Instant lastRunAt
) {
    public boolean isDue(Instant now) {
        if (!enabled) {
            return false;
        }
        if (lastRunAt == null) {
            return true;
        }
        return !lastRunAt.plusSeconds(Math.max(1, runEveryMinutes) * 60L).isAfter(now);
    }
}
