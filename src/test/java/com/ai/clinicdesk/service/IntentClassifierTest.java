package com.ai.clinicdesk.service;

import com.ai.clinicdesk.ReferenceFixtures;
import com.ai.clinicdesk.component.DateParser;
import com.ai.clinicdesk.component.ReferenceMatcher;
import com.ai.clinicdesk.conversation.BookingStep;
import com.ai.clinicdesk.conversation.ClassificationContext;
import com.ai.clinicdesk.conversation.ClassificationResult;
import com.ai.clinicdesk.conversation.ClassificationResult.Source;
import com.ai.clinicdesk.conversation.Confidence;
import com.ai.clinicdesk.conversation.EntityType;
import com.ai.clinicdesk.conversation.EntityValue;
import com.ai.clinicdesk.conversation.Intent;
import com.ai.clinicdesk.conversation.PendingClarification;
import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.llm.LlmCapability;
import com.ai.clinicdesk.llm.LlmClassification;
import com.ai.clinicdesk.llm.LlmFailure;
import com.ai.clinicdesk.llm.LlmResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("IntentClassifier Unit Tests")
class IntentClassifierTest {

    @Mock
    private LlmCapability llm;

    private IntentClassifier classifier;
    private ReferenceSnapshot snapshot;
    private ClassificationContext context;

    @BeforeEach
    void setUp() {
        classifier = new IntentClassifier(new ReferenceMatcher(0.80), new DateParser(ReferenceFixtures.clock()),
                llm, Duration.ofMinutes(5));
        snapshot = ReferenceFixtures.snapshot();
        context = ClassificationContext.of(snapshot);
    }

    @Nested
    @DisplayName("Rules stage")
    class Rules {

        @Test
        @DisplayName("Should classify an availability question with a resolved doctor and date")
        void shouldClassifyAvailability() {
            // When
            ClassificationResult result = classifier.classify("Is Dr. Sarah Al-Harbi available today?", context);

            // Then
            assertThat(result.getIntent()).isEqualTo(Intent.AVAILABILITY_QUERY);
            assertThat(result.getConfidence()).isEqualTo(Confidence.HIGH);
            assertThat(result.getSource()).isEqualTo(Source.RULES);
            assertThat(result.isExplicit()).isTrue();
            assertThat(result.resolvedId(EntityType.DOCTOR)).isEqualTo("D01");
            assertThat(result.entity(EntityType.DATE).map(EntityValue::getDate)).contains(ReferenceFixtures.TODAY);
            verify(llm, never()).classify(anyString(), anyList());
        }

        @Test
        @DisplayName("Should keep a mentioned but unreadable date as an unresolved entity")
        void shouldFlagUnreadableDate() {
            ClassificationResult impossible = classifier.classify("Is Dr. Sarah Al-Harbi available on 31/02/2026?", context);
            ClassificationResult vague = classifier.classify("Is Dr. Sarah Al-Harbi available next week?", context);

            assertThat(impossible.resolvedId(EntityType.DOCTOR)).isEqualTo("D01");
            assertThat(impossible.entity(EntityType.DATE)).hasValueSatisfying(d -> {
                assertThat(d.isResolved()).isFalse();
                assertThat(d.getDate()).isNull();
            });
            assertThat(vague.entity(EntityType.DATE).map(EntityValue::isResolved)).contains(false);
        }

        @Test
        @DisplayName("Should leave the date out when none is mentioned")
        void shouldNotInventDate() {
            ClassificationResult result = classifier.classify("Is Dr. Sarah Al-Harbi available?", context);

            assertThat(result.entity(EntityType.DATE)).isEmpty();
        }

        @Test
        @DisplayName("Should classify a price question with the service resolved")
        void shouldClassifyPrice() {
            ClassificationResult result = classifier.classify("how much is teeth whitening", context);

            assertThat(result.getIntent()).isEqualTo(Intent.PRICE_QUERY);
            assertThat(result.resolvedId(EntityType.SERVICE)).isEqualTo("S02");
        }

        @Test
        @DisplayName("Should keep an ambiguous doctor with its candidates at medium confidence")
        void shouldKeepAmbiguousDoctor() {
            ClassificationResult result = classifier.classify("Is Dr Ahmed available tomorrow", context);

            assertThat(result.getIntent()).isEqualTo(Intent.AVAILABILITY_QUERY);
            assertThat(result.getConfidence()).isEqualTo(Confidence.MEDIUM);
            EntityValue doctor = result.entity(EntityType.DOCTOR).orElseThrow();
            assertThat(doctor.isAmbiguous()).isTrue();
            assertThat(doctor.getCandidates()).containsExactly("D03", "D04");
        }

        @Test
        @DisplayName("Should pick the hours topic and the named branch")
        void shouldClassifyHours() {
            ClassificationResult result = classifier.classify("what are your opening hours at olaya branch", context);

            assertThat(result.getIntent()).isEqualTo(Intent.INFO_QUERY);
            assertThat(result.entity(EntityType.TOPIC).map(EntityValue::getValue)).contains("HOURS");
            assertThat(result.resolvedId(EntityType.BRANCH)).isEqualTo("B01");
        }

        @Test
        @DisplayName("Should recognise greetings in Arabic")
        void shouldClassifyGreeting() {
            ClassificationResult result = classifier.classify("السلام عليكم", context);

            assertThat(result.getIntent()).isEqualTo(Intent.GREETING);
            assertThat(result.entity(EntityType.TOPIC).map(EntityValue::getValue)).contains("HELLO");
        }

        @Test
        @DisplayName("Should read free text as a booking answer while a booking step is open")
        void shouldNarrowToBookingStep() {
            ClassificationContext booking = new ClassificationContext(snapshot, List.of(), null, BookingStep.NAME);

            ClassificationResult result = classifier.classify("Mohammed Ali", booking);

            assertThat(result.getIntent()).isEqualTo(Intent.BOOKING_REQUEST);
            verify(llm, never()).classify(anyString(), anyList());
        }
    }

    @Nested
    @DisplayName("Clarification answers")
    class Clarification {

        private final PendingClarification pending = new PendingClarification(Intent.AVAILABILITY_QUERY,
                EntityType.DOCTOR, List.of("D03", "D04"), Map.of(), 1);

        @Test
        @DisplayName("Should pick the offered option by number")
        void shouldAnswerByNumber() {
            ClassificationContext ctx = new ClassificationContext(snapshot, List.of(), pending, null);

            ClassificationResult result = classifier.classify("2", ctx);

            assertThat(result.getIntent()).isEqualTo(Intent.CLARIFICATION_ANSWER);
            assertThat(result.resolvedId(EntityType.DOCTOR)).isEqualTo("D04");
        }

        @Test
        @DisplayName("Should match the answer against the offered names first")
        void shouldAnswerByName() {
            ClassificationContext ctx = new ClassificationContext(snapshot, List.of(), pending, null);

            ClassificationResult result = classifier.classify("Zahrani", ctx);

            assertThat(result.resolvedId(EntityType.DOCTOR)).isEqualTo("D03");
        }

        @Test
        @DisplayName("Should treat a new question as a new request")
        void shouldNotHijackNewQuestion() {
            ClassificationContext ctx = new ClassificationContext(snapshot, List.of(), pending, null);

            ClassificationResult result = classifier.classify("how much is teeth cleaning", ctx);

            assertThat(result.getIntent()).isEqualTo(Intent.PRICE_QUERY);
            assertThat(result.resolvedId(EntityType.SERVICE)).isEqualTo("S01");
        }
    }

    @Nested
    @DisplayName("LLM stage")
    class Llm {

        @Test
        @DisplayName("Should fall back to UNKNOWN when the model is unavailable")
        void shouldFallBackOnFailure() {
            // Given
            when(llm.classify(anyString(), anyList())).thenReturn(LlmResult.failure(LlmFailure.TIMEOUT, "read timed out"));

            // When
            ClassificationResult result = classifier.classify("my tooth hurts a lot", context);

            // Then
            assertThat(result.getIntent()).isEqualTo(Intent.UNKNOWN);
            assertThat(result.getConfidence()).isEqualTo(Confidence.LOW);
            assertThat(result.getSource()).isEqualTo(Source.FALLBACK);
        }

        @Test
        @DisplayName("Should ground model entities against reference data and cache the answer")
        void shouldGroundAndCache() {
            // Given
            when(llm.classify(anyString(), any())).thenReturn(LlmResult.success(new LlmClassification(
                    Intent.INFO_QUERY, Confidence.HIGH, Map.of(EntityType.DOCTOR, "sarah"))));

            // When
            ClassificationResult first = classifier.classify("tell me about that dentist lady", context);
            ClassificationResult second = classifier.classify("Tell me about that dentist lady", context);

            // Then
            assertThat(first.getSource()).isEqualTo(Source.LLM);
            assertThat(first.resolvedId(EntityType.DOCTOR)).isEqualTo("D01");
            assertThat(first.entity(EntityType.TOPIC).map(EntityValue::getValue)).contains("DOCTOR");
            assertThat(second.resolvedId(EntityType.DOCTOR)).isEqualTo("D01");
            verify(llm, times(1)).classify(anyString(), any());
        }
    }
}
