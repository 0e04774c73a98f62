package com.ai.clinicdesk.platform;

import com.ai.clinicdesk.utils.UserIdMasker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Shared signature check and outbound send. Without an API URL and token the reply is only logged.
 */
public abstract class AbstractPlatformAdapter implements PlatformAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractPlatformAdapter.class);

    protected final ObjectMapper mapper;
    protected final Clock clock;
    private final RestTemplate restTemplate;
    private final String appSecret;
    private final String apiUrl;
    private final String accessToken;

    protected AbstractPlatformAdapter(RestTemplate restTemplate, ObjectMapper mapper, Clock clock,
                                      String appSecret, String apiUrl, String accessToken) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.clock = clock;
        this.appSecret = appSecret;
        this.apiUrl = apiUrl;
        this.accessToken = accessToken;
    }

    @Override
    public String signatureHeader() {
        return "X-Hub-Signature-256";
    }

    @Override
    public boolean verifySignature(byte[] body, String signature) {
        return SignatureVerifier.verify(appSecret, body, signature);
    }

    @Override
    public boolean sendOutbound(String userId, String text) {
        if (StringUtils.isAnyBlank(apiUrl, accessToken)) {
            log.info("[{}] outbound to {} (not sent, no API credentials): {}", platform(), UserIdMasker.mask(userId), text);
            return true;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(accessToken);
        try {
            restTemplate.postForEntity(StringUtils.removeEnd(apiUrl, "/") + outboundPath(),
                    new HttpEntity<>(outboundBody(userId, text), headers), String.class);
            return true;
        } catch (RestClientException e) {
            log.error("[{}] failed to send to {}: {}", platform(), UserIdMasker.mask(userId), e.getMessage());
            return false;
        }
    }

    protected abstract ObjectNode outboundBody(String userId, String text);

    protected String outboundPath() {
        return "/messages";
    }

    protected Instant timestamp(JsonNode node, boolean millis) {
        if (node == null || node.isMissingNode() || node.isNull()) return clock.instant();
        long value = node.asLong(0);
        if (value <= 0) return clock.instant();
        return millis ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() ? StringUtils.trimToNull(value.asText()) : null;
    }
}
