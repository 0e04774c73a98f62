package com.ai.clinicdesk.llm;

import com.ai.clinicdesk.dto.EscalationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link LlmCapability} backed by OpenAI Chat Completions. Classification uses strict
 * structured output. Connect and read timeouts bound each socket operation; the whole call
 * is bounded by {@code openai.total-timeout}.
 */
@Service
public class OpenAiLlmClient implements LlmCapability {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private static final String CLASSIFY_PROMPT = String.join("\n",
            "You classify messages sent to a medical clinic's chat (English or Arabic).",
            "Intents: GREETING, BOOKING_REQUEST (wants an appointment), AVAILABILITY_QUERY (is a doctor in / working on a day),",
            "PRICE_QUERY (cost of a service), INFO_QUERY (doctors, services, branches, opening hours, contact), UNKNOWN.",
            "Copy entity values exactly as the user wrote them; use null when absent.",
            "topic is one of DOCTOR, SERVICE, BRANCH, HOURS, CONTACT for INFO_QUERY, otherwise null.",
            "Use confidence LOW when the message is unrelated to the clinic or unclear.");

    private static final String GENERATE_PROMPT = String.join("\n",
            "You are the front desk of a medical clinic answering on a chat app.",
            "Answer in the user's language in at most three short sentences.",
            "Use only the clinic facts below. If they do not answer the question, say so and",
            "suggest calling the branch. Never give a diagnosis or medical advice.",
            "Never confirm a doctor is present on a day unless the facts say so.");

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String model;
    private final String baseUrl;
    private final Duration totalTimeout;
    private final ExecutorService executor;

    public OpenAiLlmClient(RestTemplateBuilder builder, ObjectMapper mapper,
                           @Value("${openai.api-key:}") String apiKey,
                           @Value("${openai.model:gpt-4o-mini}") String model,
                           @Value("${openai.base-url:https://api.openai.com/v1}") String baseUrl,
                           @Value("${openai.timeout:10s}") Duration timeout,
                           @Value("${openai.total-timeout:20s}") Duration totalTimeout) {
        this.restTemplate = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
        this.mapper = mapper;
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = baseUrl;
        this.totalTimeout = totalTimeout;
        this.executor = Executors.newCachedThreadPool(new BasicThreadFactory.Builder()
                .namingPattern("llm-call-%d")
                .daemon(true)
                .build());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    @Override
    public LlmResult<LlmClassification> classify(String text, List<String> recentTurns) {
        ObjectNode body = baseBody(0.0);
        ArrayNode messages = body.putArray("messages");
        messages.add(message("system", CLASSIFY_PROMPT + history(recentTurns)));
        messages.add(message("user", text));

        ObjectNode format = body.putObject("response_format");
        format.put("type", "json_schema");
        ObjectNode jsonSchema = format.putObject("json_schema");
        jsonSchema.put("name", ClassificationSchema.NAME);
        jsonSchema.put("strict", true);
        jsonSchema.set("schema", ClassificationSchema.schema(mapper));

        LlmResult<String> content = complete(body);
        if (!content.isSuccess()) {
            return LlmResult.failure(content.getFailure(), content.getDetail());
        }
        LlmResult<LlmClassification> parsed = ClassificationSchema.parse(mapper, content.getValue());
        if (!parsed.isSuccess()) {
            log.warn("LLM classification rejected: {}", parsed);
        }
        return parsed;
    }

    @Override
    public LlmResult<String> generate(EscalationContext context) {
        StringBuilder system = new StringBuilder(GENERATE_PROMPT);
        system.append("\n\nCLINIC FACTS:\n").append(StringUtils.defaultIfBlank(context.clinicFacts(), "(not available)"));
        if (context.unresolvedFields() != null && !context.unresolvedFields().isEmpty()) {
            system.append("\n\nThe user did not make these clear: ")
                    .append(String.join(", ", context.unresolvedFields()))
                    .append(". Ask for them briefly.");
        }
        system.append(history(context.recentTurns()));

        ObjectNode body = baseBody(0.3);
        ArrayNode messages = body.putArray("messages");
        messages.add(message("system", system.toString()));
        messages.add(message("user", StringUtils.defaultString(context.userText())));
        return complete(body);
    }

    private LlmResult<String> complete(ObjectNode body) {
        if (StringUtils.isBlank(apiKey)) {
            return LlmResult.failure(LlmFailure.UNAVAILABLE, "OPENAI_API_KEY is not set");
        }
        Future<LlmResult<String>> call = executor.submit(() -> post(body));
        try {
            return call.get(totalTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            call.cancel(true);
            log.warn("LLM call exceeded {} overall", totalTimeout);
            return LlmResult.failure(LlmFailure.TIMEOUT, "no reply within " + totalTimeout);
        } catch (InterruptedException ex) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return LlmResult.failure(LlmFailure.ERROR, "interrupted");
        } catch (ExecutionException ex) {
            log.error("LLM call failed", ex.getCause());
            return LlmResult.failure(LlmFailure.ERROR, ExceptionUtils.getRootCauseMessage(ex));
        }
    }

    private LlmResult<String> post(ObjectNode body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/chat/completions", new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String content = root.path("choices").path(0).path("message").path("content").asText("").trim();
            if (content.isEmpty()) {
                return LlmResult.failure(LlmFailure.EMPTY_RESPONSE, null);
            }
            return LlmResult.success(content);
        } catch (ResourceAccessException ex) {
            if (ExceptionUtils.indexOfThrowable(ex, SocketTimeoutException.class) >= 0) {
                log.warn("LLM call timed out");
                return LlmResult.failure(LlmFailure.TIMEOUT, ex.getMessage());
            }
            if (ExceptionUtils.indexOfThrowable(ex, ConnectException.class) >= 0) {
                log.warn("LLM endpoint unreachable: {}", ex.getMessage());
                return LlmResult.failure(LlmFailure.UNAVAILABLE, ex.getMessage());
            }
            log.error("LLM transport failure", ex);
            return LlmResult.failure(LlmFailure.ERROR, ex.getMessage());
        } catch (RestClientResponseException ex) {
            log.error("LLM call failed status={}", ex.getStatusCode().value());
            return LlmResult.failure(LlmFailure.ERROR, "HTTP " + ex.getStatusCode().value());
        } catch (RestClientException | IOException ex) {
            log.error("Failed to get LLM reply", ex);
            return LlmResult.failure(LlmFailure.ERROR, ex.getMessage());
        }
    }

    private ObjectNode baseBody(double temperature) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", temperature);
        return body;
    }

    private ObjectNode message(String role, String content) {
        ObjectNode m = mapper.createObjectNode();
        m.put("role", role);
        m.put("content", content);
        return m;
    }

    private static String history(List<String> turns) {
        if (turns == null || turns.isEmpty()) return "";
        return "\n\nRECENT CONVERSATION:\n" + String.join("\n", turns);
    }
}
