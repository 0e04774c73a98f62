package com.ai.clinicdesk.platform;

import com.ai.clinicdesk.dto.InboundMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Meta WhatsApp Cloud API: {@code entry[].changes[].value.messages[]}.
 */
@Component
public class WhatsAppAdapter extends AbstractPlatformAdapter {

    private final String verifyToken;

    public WhatsAppAdapter(RestTemplateBuilder builder, ObjectMapper mapper, Clock clock,
                           @Value("${platforms.whatsapp.verify-token:}") String verifyToken,
                           @Value("${platforms.whatsapp.app-secret:}") String appSecret,
                           @Value("${platforms.whatsapp.api-url:}") String apiUrl,
                           @Value("${platforms.whatsapp.access-token:}") String accessToken) {
        super(builder.setConnectTimeout(Duration.ofSeconds(10)).setReadTimeout(Duration.ofSeconds(10)).build(),
                mapper, clock, appSecret, apiUrl, accessToken);
        this.verifyToken = verifyToken;
    }

    @Override
    public Platform platform() {
        return Platform.WHATSAPP;
    }

    /** Subscription handshake: the challenge is echoed back only for a matching token. */
    public Optional<String> verifyWebhook(String mode, String token, String challenge) {
        if ("subscribe".equals(mode) && StringUtils.isNotBlank(verifyToken) && verifyToken.equals(token)) {
            return Optional.ofNullable(challenge);
        }
        return Optional.empty();
    }

    @Override
    public List<InboundMessage> parseInbound(JsonNode body) {
        List<InboundMessage> out = new ArrayList<>();
        for (JsonNode entry : body.path("entry")) {
            for (JsonNode change : entry.path("changes")) {
                for (JsonNode message : change.path("value").path("messages")) {
                    if (!"text".equals(message.path("type").asText("text"))) continue;
                    String from = text(message, "from");
                    String content = text(message.path("text"), "body");
                    if (from == null || content == null) continue;
                    out.add(new InboundMessage(Platform.WHATSAPP, from, content, text(message, "id"),
                            timestamp(message.path("timestamp"), false)));
                }
            }
        }
        return out;
    }

    @Override
    protected ObjectNode outboundBody(String userId, String text) {
        ObjectNode body = mapper.createObjectNode();
        body.put("messaging_product", "whatsapp");
        body.put("to", userId);
        body.put("type", "text");
        body.putObject("text").put("body", text);
        return body;
    }
}
