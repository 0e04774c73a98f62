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
import java.util.ArrayList;
import java.util.List;

/**
 * Instagram messaging webhooks, Messenger style: {@code entry[].messaging[]}. Echoes of our own
 * replies are ignored.
 */
@Component
public class InstagramAdapter extends AbstractPlatformAdapter {

    public InstagramAdapter(RestTemplateBuilder builder, ObjectMapper mapper, Clock clock,
                            @Value("${platforms.instagram.app-secret:}") String appSecret,
                            @Value("${platforms.instagram.api-url:}") String apiUrl,
                            @Value("${platforms.instagram.access-token:}") String accessToken) {
        super(builder.setConnectTimeout(Duration.ofSeconds(10)).setReadTimeout(Duration.ofSeconds(10)).build(),
                mapper, clock, appSecret, apiUrl, accessToken);
    }

    @Override
    public Platform platform() {
        return Platform.INSTAGRAM;
    }

    @Override
    public List<InboundMessage> parseInbound(JsonNode body) {
        List<InboundMessage> out = new ArrayList<>();
        for (JsonNode entry : body.path("entry")) {
            for (JsonNode event : entry.path("messaging")) {
                JsonNode message = event.path("message");
                if (message.path("is_echo").asBoolean(false)) continue;
                String sender = text(event.path("sender"), "id");
                String content = text(message, "text");
                if (sender == null || content == null) continue;
                out.add(new InboundMessage(Platform.INSTAGRAM, sender, content, text(message, "mid"),
                        timestamp(event.path("timestamp"), true)));
            }
        }
        return out;
    }

    @Override
    protected ObjectNode outboundBody(String userId, String text) {
        ObjectNode body = mapper.createObjectNode();
        body.putObject("recipient").put("id", userId);
        body.putObject("message").put("text", text);
        return body;
    }
}
