package com.leadharvest.sync.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SyncBackoffTest {

    @Test
    void doublesPerAttempt() {
        assertThat(SyncBackoff.delayFor(1)).isEqualTo(Duration.ofSeconds(60));
        assertThat(SyncBackoff.delayFor(2)).isEqualTo(Duration.ofSeconds(120));
        assertThat(SyncBackoff.delayFor(3)).isEqualTo(Duration.ofSeconds(240));
    }

    @Test
    void capsAtOneHour() {
        assertThat(SyncBackoff.delayFor(7)).isEqualTo(Duration.ofHours(1));
        assertThat(SyncBackoff.delayFor(10)).isEqualTo(Duration.ofHours(1));
        assertThat(SyncBackoff.delayFor(50)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void treatsNegativeAttemptsAsZero() {
        assertThat(SyncBackoff.delayFor(-3)).isEqualTo(Duration.ofSeconds(30));
    }
}
