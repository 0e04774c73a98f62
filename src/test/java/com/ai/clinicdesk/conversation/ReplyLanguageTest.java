package com.ai.clinicdesk.conversation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReplyLanguage")
class ReplyLanguageTest {

    @Test
    @DisplayName("Should pick the language from the script of the message")
    void shouldDetectScript() {
        assertThat(ReplyLanguage.detect("هل الدكتورة سارة موجودة بكرة؟", ReplyLanguage.ENGLISH)).isEqualTo(ReplyLanguage.ARABIC);
        assertThat(ReplyLanguage.detect("Is Dr Sarah in tomorrow?", ReplyLanguage.ARABIC)).isEqualTo(ReplyLanguage.ENGLISH);
        assertThat(ReplyLanguage.detect("ابي موعد with Dr Sarah", ReplyLanguage.ENGLISH)).isEqualTo(ReplyLanguage.ENGLISH);
    }

    @Test
    @DisplayName("Should keep the fallback for text without letters")
    void shouldKeepFallback() {
        assertThat(ReplyLanguage.detect("0501234567", ReplyLanguage.ARABIC)).isEqualTo(ReplyLanguage.ARABIC);
        assertThat(ReplyLanguage.detect("2", ReplyLanguage.ENGLISH)).isEqualTo(ReplyLanguage.ENGLISH);
        assertThat(ReplyLanguage.detect(null, ReplyLanguage.ARABIC)).isEqualTo(ReplyLanguage.ARABIC);
    }

    @Test
    @DisplayName("Should take the latest user turn with letters from the history")
    void shouldReadHistory() {
        List<String> history = List.of(
                "user: hello",
                "assistant: Hello! How can I help you today?",
                "user: ابي احجز",
                "assistant: ما اسمك؟",
                "user: 0501234567");

        assertThat(ReplyLanguage.fromHistory(history)).isEqualTo(ReplyLanguage.ARABIC);
        assertThat(ReplyLanguage.fromHistory(List.of("assistant: ما اسمك؟"))).isEqualTo(ReplyLanguage.ENGLISH);
        assertThat(ReplyLanguage.fromHistory(null)).isEqualTo(ReplyLanguage.ENGLISH);
    }
}
