package com.ai.clinicdesk.platform;

import com.ai.clinicdesk.dto.InboundMessage;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Webhook format of one messaging platform. The core only ever sees {@link InboundMessage}.
 */
public interface PlatformAdapter {

    Platform platform();

    /** Header carrying the HMAC signature of the raw webhook body. */
    String signatureHeader();

    /** Text messages in the webhook body; status updates, echoes and media are skipped. */
    List<InboundMessage> parseInbound(JsonNode body);

    boolean verifySignature(byte[] body, String signature);

    /** @return false when the platform API rejected or could not be reached */
    boolean sendOutbound(String userId, String text);
}
