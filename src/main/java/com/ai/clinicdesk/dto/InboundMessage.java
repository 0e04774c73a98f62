package com.ai.clinicdesk.dto;

import com.ai.clinicdesk.platform.Platform;

import java.time.Instant;

/**
 * One inbound chat message as every platform adapter hands it to the core.
 * {@code platformMessageId} is the dedup key and may be null.
 */
public record InboundMessage(Platform platform,
                             String senderId,
                             String text,
                             String platformMessageId,
                             Instant receivedAt) {
}
