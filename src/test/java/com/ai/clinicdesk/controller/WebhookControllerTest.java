package com.ai.clinicdesk.controller;

import com.ai.clinicdesk.dto.InboundMessage;
import com.ai.clinicdesk.dto.ProcessingOutcome;
import com.ai.clinicdesk.platform.Platform;
import com.ai.clinicdesk.platform.SignatureVerifier;
import com.ai.clinicdesk.service.MessageProcessingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("WebhookController Integration Tests")
class WebhookControllerTest {

    private static final String WHATSAPP_BODY = "{\"object\":\"whatsapp_business_account\",\"entry\":[{\"changes\":[{\"value\":{"
            + "\"messages\":[{\"from\":\"966501234567\",\"id\":\"wamid.W1\",\"timestamp\":\"1772434800\","
            + "\"type\":\"text\",\"text\":{\"body\":\"hello\"}}]}}]}]}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MessageProcessingService processingService;

    @Test
    @DisplayName("Should echo the hub challenge for the configured verify token")
    void shouldVerifySubscription() throws Exception {
        mockMvc.perform(get("/webhook/whatsapp")
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "test-verify-token")
                        .param("hub.challenge", "1158201444"))
                .andExpect(status().isOk())
                .andExpect(content().string("1158201444"));

        mockMvc.perform(get("/webhook/whatsapp")
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "nope")
                        .param("hub.challenge", "1158201444"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Should process a signed delivery and acknowledge it")
    void shouldProcessSignedDelivery() throws Exception {
        // Given
        when(processingService.process(any())).thenReturn(ProcessingOutcome.reply("Hello!"));
        byte[] body = WHATSAPP_BODY.getBytes(StandardCharsets.UTF_8);

        // When / Then
        mockMvc.perform(post("/webhook/whatsapp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Hub-Signature-256", "sha256=" + SignatureVerifier.sign("test-secret", body))
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.processed").value(1))
                .andExpect(jsonPath("$.replied").value(1));

        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(processingService).process(captor.capture());
        assertThat(captor.getValue().platform()).isEqualTo(Platform.WHATSAPP);
        assertThat(captor.getValue().platformMessageId()).isEqualTo("wamid.W1");
    }

    @Test
    @DisplayName("Should refuse a delivery with a bad signature")
    void shouldRejectBadSignature() throws Exception {
        mockMvc.perform(post("/webhook/whatsapp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Hub-Signature-256", "sha256=deadbeef")
                        .content(WHATSAPP_BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_SIGNATURE"));

        verify(processingService, never()).process(any());
    }

    @Test
    @DisplayName("Should acknowledge an unreadable body without processing")
    void shouldAcknowledgeGarbage() throws Exception {
        mockMvc.perform(post("/webhook/tiktok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(0));
    }

    @Test
    @DisplayName("Should return 404 for a platform without a webhook")
    void shouldRejectUnknownPlatform() throws Exception {
        mockMvc.perform(post("/webhook/telegram")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_PLATFORM"));
    }
}
