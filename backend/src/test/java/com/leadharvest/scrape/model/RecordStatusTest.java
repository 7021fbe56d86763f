package com.leadharvest.scrape.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordStatusTest {

    @Test
    void terminalStatusesAllowNoTransitions() {
        for (RecordStatus next : RecordStatus.values()) {
            if (next != RecordStatus.CONVERTED) {
                assertThat(RecordStatus.CONVERTED.canTransitionTo(next)).isFalse();
            }
            if (next != RecordStatus.REJECTED) {
                assertThat(RecordStatus.REJECTED.canTransitionTo(next)).isFalse();
            }
        }
    }

    @Test
    void openStatusesMoveForward() {
        assertThat(RecordStatus.NEW.canTransitionTo(RecordStatus.SYNCED)).isTrue();
        assertThat(RecordStatus.SYNCED.canTransitionTo(RecordStatus.CONTACTED)).isTrue();
        assertThat(RecordStatus.CONTACTED.canTransitionTo(RecordStatus.NEW)).isFalse();
        assertThat(RecordStatus.NEW.canTransitionTo(null)).isFalse();
    }

    @Test
    void parsesCaseInsensitively() {
        assertThat(RecordStatus.parse(" contacted ")).isEqualTo(RecordStatus.CONTACTED);
        assertThatThrownBy(() -> RecordStatus.parse("archived")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecordStatus.parse("")).isInstanceOf(IllegalArgumentException.class);
    }
}
