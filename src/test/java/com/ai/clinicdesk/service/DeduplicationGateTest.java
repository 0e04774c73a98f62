package com.ai.clinicdesk.service;

import com.ai.clinicdesk.platform.Platform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DeduplicationGate")
class DeduplicationGateTest {

    private final DeduplicationGate gate = new DeduplicationGate(1000, Duration.ofHours(1));

    @Test
    @DisplayName("Should let only the first delivery of a message id through")
    void shouldDropRedelivery() {
        assertThat(gate.firstDelivery(Platform.WHATSAPP, "wamid.1")).isTrue();
        assertThat(gate.firstDelivery(Platform.WHATSAPP, "wamid.1")).isFalse();
        assertThat(gate.seen(Platform.WHATSAPP, "wamid.1")).isTrue();
    }

    @Test
    @DisplayName("Should scope message ids per platform")
    void shouldScopeByPlatform() {
        gate.markSeen(Platform.INSTAGRAM, "m-1");

        assertThat(gate.firstDelivery(Platform.TIKTOK, "m-1")).isTrue();
        assertThat(gate.firstDelivery(Platform.INSTAGRAM, "m-1")).isFalse();
    }

    @Test
    @DisplayName("Should always pass messages without an id")
    void shouldPassMissingIds() {
        assertThat(gate.firstDelivery(Platform.WEB, null)).isTrue();
        assertThat(gate.firstDelivery(Platform.WEB, "")).isTrue();
        assertThat(gate.seen(Platform.WEB, null)).isFalse();
    }
}
