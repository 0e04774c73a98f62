package com.ai.clinicdesk.controller;

import com.ai.clinicdesk.dto.ChatRequest;
import com.ai.clinicdesk.dto.ChatResponse;
import com.ai.clinicdesk.dto.InboundMessage;
import com.ai.clinicdesk.dto.ProcessingOutcome;
import com.ai.clinicdesk.exception.UnknownPlatformException;
import com.ai.clinicdesk.platform.Platform;
import com.ai.clinicdesk.service.MessageProcessingService;
import jakarta.validation.Valid;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Web chat endpoint for trying the assistant without a messaging platform.
 */
@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final MessageProcessingService processingService;
    private final Clock clock;

    public ChatController(MessageProcessingService processingService, Clock clock) {
        this.processingService = processingService;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        Platform platform = StringUtils.isBlank(request.getPlatform())
                ? Platform.WEB
                : Platform.fromPath(request.getPlatform())
                        .orElseThrow(() -> new UnknownPlatformException(request.getPlatform()));

        ProcessingOutcome outcome = processingService.process(new InboundMessage(
                platform, request.getUserId().trim(), request.getMessage(), request.getMessageId(), clock.instant()));
        return ResponseEntity.ok(new ChatResponse(outcome.getReply(), outcome.getType().name()));
    }
}
