package com.ai.clinicdesk.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Web chat message. {@code platform} defaults to WEB; {@code messageId} enables duplicate detection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "userId cannot be blank")
    @Size(max = 100)
    private String userId;

    private String platform;

    @NotBlank(message = "message cannot be blank")
    @Size(max = 2000)
    private String message;

    private String messageId;
}
