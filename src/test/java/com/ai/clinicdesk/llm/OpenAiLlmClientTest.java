package com.ai.clinicdesk.llm;

import com.ai.clinicdesk.conversation.Intent;
import com.ai.clinicdesk.dto.EscalationContext;
import com.ai.clinicdesk.dto.EscalationContext.Reason;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("OpenAiLlmClient Unit Tests")
class OpenAiLlmClientTest {

    private static final String URL = "https://llm.example/v1/chat/completions";

    private final ObjectMapper mapper = new ObjectMapper();
    private final MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
    private OpenAiLlmClient client;

    private OpenAiLlmClient client(String apiKey, Duration totalTimeout) {
        client = new OpenAiLlmClient(new RestTemplateBuilder(customizer), mapper, apiKey, "gpt-4o-mini",
                "https://llm.example/v1", Duration.ofSeconds(10), totalTimeout);
        return client;
    }

    @AfterEach
    void tearDown() {
        if (client != null) client.shutdown();
    }

    private static EscalationContext question() {
        return new EscalationContext(Reason.UNKNOWN_INTENT, null, Intent.UNKNOWN, List.of(), List.of(), null)
                .withConversation("my tooth hurts", List.of(), "Olaya Branch, 0112345678");
    }

    @Test
    @DisplayName("Should return the generated text")
    void shouldGenerate() {
        OpenAiLlmClient llm = client("key-1", Duration.ofSeconds(5));
        MockRestServiceServer server = customizer.getServer();
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer key-1"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\" Please call the branch. \"}}]}",
                        MediaType.APPLICATION_JSON));

        LlmResult<String> result = llm.generate(question());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo("Please call the branch.");
        server.verify();
    }

    @Test
    @DisplayName("Should give up with TIMEOUT when the whole call outlasts the deadline")
    void shouldEnforceOverallDeadline() {
        // Given a response that keeps the connection busy far beyond the deadline
        OpenAiLlmClient llm = client("key-1", Duration.ofMillis(200));
        customizer.getServer().expect(requestTo(URL)).andRespond(request -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("cancelled");
            }
            return withSuccess("{}", MediaType.APPLICATION_JSON).createResponse(request);
        });

        // When
        long started = System.nanoTime();
        LlmResult<String> result = llm.generate(question());
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        // Then
        assertThat(result.getFailure()).isEqualTo(LlmFailure.TIMEOUT);
        assertThat(elapsedMillis).isLessThan(3_000);
    }

    @Test
    @DisplayName("Should map a socket read timeout to TIMEOUT")
    void shouldMapReadTimeout() {
        OpenAiLlmClient llm = client("key-1", Duration.ofSeconds(5));
        customizer.getServer().expect(requestTo(URL)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThat(llm.generate(question()).getFailure()).isEqualTo(LlmFailure.TIMEOUT);
    }

    @Test
    @DisplayName("Should report an HTTP error and an empty reply as failures")
    void shouldReportFailures() {
        OpenAiLlmClient llm = client("key-1", Duration.ofSeconds(5));
        MockRestServiceServer server = customizer.getServer();
        server.expect(requestTo(URL)).andRespond(withServerError());
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThat(llm.generate(question()).getFailure()).isEqualTo(LlmFailure.ERROR);
        assertThat(llm.generate(question()).getFailure()).isEqualTo(LlmFailure.EMPTY_RESPONSE);
    }

    @Test
    @DisplayName("Should not call out without an API key")
    void shouldBeUnavailableWithoutKey() {
        OpenAiLlmClient llm = client("", Duration.ofSeconds(5));

        assertThat(llm.classify("hello", List.of()).getFailure()).isEqualTo(LlmFailure.UNAVAILABLE);
        customizer.getServer().verify();
    }
}
