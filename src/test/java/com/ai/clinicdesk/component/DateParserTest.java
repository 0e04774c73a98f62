package com.ai.clinicdesk.component;

import com.ai.clinicdesk.ReferenceFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DateParser")
class DateParserTest {

    private final DateParser parser = new DateParser(ReferenceFixtures.clock());
    private final LocalDate today = ReferenceFixtures.TODAY;

    @Nested
    @DisplayName("Dates")
    class Dates {

        @Test
        @DisplayName("Should resolve relative English and Arabic words")
        void shouldResolveRelativeWords() {
            assertThat(parser.parseDate("is she in today?")).contains(today);
            assertThat(parser.parseDate("tomorrow please")).contains(today.plusDays(1));
            assertThat(parser.parseDate("day after tomorrow")).contains(today.plusDays(2));
            assertThat(parser.parseDate("بكرة")).contains(today.plusDays(1));
            assertThat(parser.parseDate("بعد بكره")).contains(today.plusDays(2));
        }

        @Test
        @DisplayName("Should pick the next occurrence of a weekday")
        void shouldResolveWeekdays() {
            // Given today is a Monday
            assertThat(today.getDayOfWeek()).isEqualTo(DayOfWeek.MONDAY);

            // Then
            assertThat(parser.parseDate("wednesday")).contains(today.plusDays(2));
            assertThat(parser.parseDate("monday")).contains(today.plusDays(7));
            assertThat(parser.parseDate("يوم الخميس")).contains(today.plusDays(3));
        }

        @Test
        @DisplayName("Should parse absolute dates and reject impossible ones")
        void shouldParseAbsoluteDates() {
            assertThat(parser.parseDate("2026-03-15")).contains(LocalDate.of(2026, 3, 15));
            assertThat(parser.parseDate("15/03/2026")).contains(LocalDate.of(2026, 3, 15));
            assertThat(parser.parseDate("2026-02-30")).isEmpty();
            assertThat(parser.parseDate("sometime soon")).isEmpty();
        }

        @Test
        @DisplayName("Should read day-month forms without a year as the next such day")
        void shouldParseDayMonth() {
            assertThat(parser.parseDate("on 5 March")).contains(LocalDate.of(2026, 3, 5));
            assertThat(parser.parseDate("march 20th")).contains(LocalDate.of(2026, 3, 20));
            assertThat(parser.parseDate("the 1st of march")).contains(LocalDate.of(2027, 3, 1));
            assertThat(parser.parseDate("10/04")).contains(LocalDate.of(2026, 4, 10));
            assertThat(parser.parseDate("5 مارس")).contains(LocalDate.of(2026, 3, 5));
            assertThat(parser.parseDate("4 April 2027")).contains(LocalDate.of(2027, 4, 4));
            assertThat(parser.parseDate("may 5")).isEmpty();
        }

        @Test
        @DisplayName("Should accept bare Arabic weekday names")
        void shouldAcceptBareArabicWeekdays() {
            assertThat(parser.parseDate("احد")).contains(today.plusDays(6));
            assertThat(parser.parseDate("يوم أحد")).contains(today.plusDays(6));
            assertThat(parser.parseDate("الأحد")).contains(today.plusDays(6));
        }
    }

    @Nested
    @DisplayName("Date mentions")
    class Mentions {

        @Test
        @DisplayName("Should flag dates it cannot read")
        void shouldFlagUnreadableDates() {
            assertThat(parser.parseDate("on 31/02/2026")).isEmpty();
            assertThat(parser.mentionsDate("on 31/02/2026")).isTrue();
            assertThat(parser.mentionsDate("is she in next week?")).isTrue();
            assertThat(parser.mentionsDate("sometime in March")).isTrue();
            assertThat(parser.mentionsDate("on 30/2")).isTrue();
            assertThat(parser.mentionsDate("الاسبوع الجاي")).isTrue();
        }

        @Test
        @DisplayName("Should not flag messages without any date")
        void shouldIgnoreDatelessText() {
            assertThat(parser.mentionsDate("is Dr Sarah available?")).isFalse();
            assertThat(parser.mentionsDate("may I book a cleaning")).isFalse();
            assertThat(parser.mentionsDate("how much is teeth whitening")).isFalse();
            assertThat(parser.mentionsDate("tomorrow")).isTrue();
        }
    }

    @Nested
    @DisplayName("Times")
    class Times {

        @Test
        @DisplayName("Should read 24h and am/pm times")
        void shouldParseTimes() {
            assertThat(parser.parseTime("at 14:30")).contains(LocalTime.of(14, 30));
            assertThat(parser.parseTime("5pm")).contains(LocalTime.of(17, 0));
            assertThat(parser.parseTime("12 am")).contains(LocalTime.MIDNIGHT);
            assertThat(parser.parseTime("10 م")).contains(LocalTime.of(22, 0));
        }

        @Test
        @DisplayName("Should not read bare numbers as times")
        void shouldIgnoreBareNumbers() {
            assertThat(parser.parseTime("option 2")).isEmpty();
            assertThat(parser.parseTime("25:00")).isEmpty();
            assertThat(parser.parseTime("13pm")).isEmpty();
        }
    }
}
