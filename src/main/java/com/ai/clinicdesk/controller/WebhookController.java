package com.ai.clinicdesk.controller;

import com.ai.clinicdesk.dto.InboundMessage;
import com.ai.clinicdesk.dto.ProcessingOutcome;
import com.ai.clinicdesk.exception.InvalidSignatureException;
import com.ai.clinicdesk.platform.PlatformAdapter;
import com.ai.clinicdesk.platform.PlatformAdapterRegistry;
import com.ai.clinicdesk.platform.WhatsAppAdapter;
import com.ai.clinicdesk.service.MessageProcessingService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final PlatformAdapterRegistry adapters;
    private final WhatsAppAdapter whatsApp;
    private final MessageProcessingService processingService;
    private final ObjectMapper mapper;

    public WebhookController(PlatformAdapterRegistry adapters, WhatsAppAdapter whatsApp,
                             MessageProcessingService processingService, ObjectMapper mapper) {
        this.adapters = adapters;
        this.whatsApp = whatsApp;
        this.processingService = processingService;
        this.mapper = mapper;
    }

    @GetMapping(value = "/webhook/whatsapp", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> verifyWhatsApp(@RequestParam(value = "hub.mode", required = false) String mode,
                                                 @RequestParam(value = "hub.verify_token", required = false) String token,
                                                 @RequestParam(value = "hub.challenge", required = false) String challenge) {
        return whatsApp.verifyWebhook(mode, token, challenge)
                .map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.warn("WhatsApp webhook verification failed (mode={})", mode);
                    return ResponseEntity.status(HttpStatus.FORBIDDEN).body("Verification failed");
                });
    }

    /**
     * Platforms retry on anything but 2xx, so every well-signed delivery is acknowledged with 200
     * even when nothing in it was a text message.
     */
    @PostMapping(value = "/webhook/{platform}", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Map<String, Object>> receive(@PathVariable String platform,
                                                       @RequestBody byte[] body,
                                                       @RequestHeader HttpHeaders headers) {
        PlatformAdapter adapter = adapters.get(platform);
        if (!adapter.verifySignature(body, headers.getFirst(adapter.signatureHeader()))) {
            throw new InvalidSignatureException("Invalid " + adapter.signatureHeader() + " for " + adapter.platform());
        }

        JsonNode json;
        try {
            json = mapper.readTree(body);
        } catch (IOException e) {
            log.warn("[{}] unreadable webhook body: {}", adapter.platform(), e.getMessage());
            return ResponseEntity.ok(Map.of("status", "ok", "processed", 0));
        }
        if (json == null) {
            return ResponseEntity.ok(Map.of("status", "ok", "processed", 0));
        }

        List<InboundMessage> messages = adapter.parseInbound(json);
        int replied = 0;
        for (InboundMessage message : messages) {
            ProcessingOutcome outcome = processingService.process(message);
            if (outcome.hasReply() && adapter.sendOutbound(message.senderId(), outcome.getReply())) {
                replied++;
            }
        }
        return ResponseEntity.ok(Map.of("status", "ok", "processed", messages.size(), "replied", replied));
    }
}
