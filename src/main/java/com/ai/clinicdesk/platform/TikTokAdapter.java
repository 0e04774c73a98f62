package com.ai.clinicdesk.platform;

import com.ai.clinicdesk.dto.InboundMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * TikTok direct messages, delivered flat: {@code {user_id, message_id, text}}.
 */
@Component
public class TikTokAdapter extends AbstractPlatformAdapter {

    public TikTokAdapter(RestTemplateBuilder builder, ObjectMapper mapper, Clock clock,
                         @Value("${platforms.tiktok.app-secret:}") String appSecret,
                         @Value("${platforms.tiktok.api-url:}") String apiUrl,
                         @Value("${platforms.tiktok.access-token:}") String accessToken) {
        super(builder.setConnectTimeout(Duration.ofSeconds(10)).setReadTimeout(Duration.ofSeconds(10)).build(),
                mapper, clock, appSecret, apiUrl, accessToken);
    }

    @Override
    public Platform platform() {
        return Platform.TIKTOK;
    }

    @Override
    public String signatureHeader() {
        return "X-TikTok-Signature";
    }

    @Override
    public List<InboundMessage> parseInbound(JsonNode body) {
        String user = text(body, "user_id");
        String content = text(body, "text");
        if (content == null) content = text(body, "message");
        if (user == null || content == null) return List.of();
        return List.of(new InboundMessage(Platform.TIKTOK, user, content, text(body, "message_id"),
                timestamp(body.path("timestamp"), false)));
    }

    @Override
    protected ObjectNode outboundBody(String userId, String text) {
        ObjectNode body = mapper.createObjectNode();
        body.put("user_id", userId);
        body.put("text", text);
        return body;
    }
}
