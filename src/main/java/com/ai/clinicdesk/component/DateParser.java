package com.ai.clinicdesk.component;

import com.ai.clinicdesk.utils.TextNormalizer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Month;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses relative and absolute dates and clock times from English or Arabic text.
 * "Today" is taken from the injected clock's zone.
 */
@Component
public class DateParser {

    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})");
    private static final Pattern DMY_DATE = Pattern.compile("(\\d{1,2})[/-](\\d{1,2})[/-](\\d{4})");
    private static final Pattern DM_DATE = Pattern.compile("(?<![\\d/])(\\d{1,2})/(\\d{1,2})(?![\\d/])");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "(?<!\\d)(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?(\\p{L}+)(?:\\s+(\\d{4}))?");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "(\\p{L}+)\\s+(\\d{1,2})(?:st|nd|rd|th)?(?!\\d)(?:,?\\s+(\\d{4}))?");
    private static final Pattern ORDINAL_DAY = Pattern.compile("(?<!\\d)\\d{1,2}(?:st|nd|rd|th)\\b");
    private static final Pattern TIME_24H = Pattern.compile("(?<![\\d:])(\\d{1,2}):(\\d{2})(?![\\d:])\\s*(am|pm|ص|م)?");
    private static final Pattern TIME_MERIDIEM = Pattern.compile("(?<![\\d:])(\\d{1,2})\\s*(am|pm|ص|م)(?![\\p{L}])");

    private static final List<String> DAY_AFTER_TOMORROW = List.of("day after tomorrow", "بعد بكرا", "بعد بكره", "بعد بكرة", "بعد غد");
    private static final List<String> TOMORROW = List.of("tomorrow", "بكرا", "بكره", "بكرة", "غدا", "الغد");
    private static final List<String> TODAY = List.of("today", "tonight", "اليوم", "الليلة");
    private static final List<String> VAGUE = List.of(
            "next week", "this week", "weekend", "next month", "this month", "later this month",
            "الاسبوع الجاي", "الاسبوع القادم", "هذا الاسبوع", "نهايه الاسبوع", "نهاية الاسبوع",
            "الشهر الجاي", "الشهر القادم", "هذا الشهر");

    private static final Map<String, Month> MONTHS = new HashMap<>();

    private static final Map<String, DayOfWeek> WEEKDAYS = new LinkedHashMap<>();

    static {
        for (DayOfWeek d : DayOfWeek.values()) {
            WEEKDAYS.put(d.name().toLowerCase(), d);
        }
        WEEKDAYS.put("السبت", DayOfWeek.SATURDAY);
        WEEKDAYS.put("سبت", DayOfWeek.SATURDAY);
        WEEKDAYS.put("الاحد", DayOfWeek.SUNDAY);
        WEEKDAYS.put("الاثنين", DayOfWeek.MONDAY);
        WEEKDAYS.put("الثلاثاء", DayOfWeek.TUESDAY);
        WEEKDAYS.put("ثلاثاء", DayOfWeek.TUESDAY);
        WEEKDAYS.put("الاربعاء", DayOfWeek.WEDNESDAY);
        WEEKDAYS.put("اربعاء", DayOfWeek.WEDNESDAY);
        WEEKDAYS.put("الخميس", DayOfWeek.THURSDAY);
        WEEKDAYS.put("خميس", DayOfWeek.THURSDAY);
        WEEKDAYS.put("الجمعة", DayOfWeek.FRIDAY);
        WEEKDAYS.put("الجمعه", DayOfWeek.FRIDAY);
        WEEKDAYS.put("جمعة", DayOfWeek.FRIDAY);
        WEEKDAYS.put("احد", DayOfWeek.SUNDAY);
        WEEKDAYS.put("اثنين", DayOfWeek.MONDAY);

        for (Month m : Month.values()) {
            String name = m.name().toLowerCase();
            MONTHS.put(name, m);
            MONTHS.put(name.substring(0, 3), m);
        }
        MONTHS.put("sept", Month.SEPTEMBER);
        String[] arabic = {"يناير", "فبراير", "مارس", "ابريل", "مايو", "يونيو",
                "يوليو", "اغسطس", "سبتمبر", "اكتوبر", "نوفمبر", "ديسمبر"};
        for (int i = 0; i < arabic.length; i++) {
            MONTHS.put(arabic[i], Month.of(i + 1));
        }
    }

    private final Clock clock;

    public DateParser(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public Optional<LocalDate> parseDate(String text) {
        String t = TextNormalizer.normalize(text);
        if (t.isEmpty()) return Optional.empty();
        LocalDate today = today();

        if (TextNormalizer.containsAny(t, DAY_AFTER_TOMORROW)) return Optional.of(today.plusDays(2));
        if (TextNormalizer.containsAny(t, TOMORROW)) return Optional.of(today.plusDays(1));
        if (TextNormalizer.containsAny(t, TODAY)) return Optional.of(today);

        for (Map.Entry<String, DayOfWeek> e : WEEKDAYS.entrySet()) {
            if (TextNormalizer.containsPhrase(t, e.getKey())) {
                return Optional.of(nextOccurrence(today, e.getValue()));
            }
        }

        Matcher iso = ISO_DATE.matcher(t);
        if (iso.find()) {
            return safeDate(iso.group(1), iso.group(2), iso.group(3));
        }
        Matcher dmy = DMY_DATE.matcher(t);
        if (dmy.find()) {
            return safeDate(dmy.group(3), dmy.group(2), dmy.group(1));
        }
        Matcher dm = DM_DATE.matcher(t);
        if (dm.find()) {
            return upcoming(today, Integer.parseInt(dm.group(2)), Integer.parseInt(dm.group(1)));
        }
        Matcher dayMonth = DAY_MONTH.matcher(t);
        while (dayMonth.find()) {
            Month month = MONTHS.get(dayMonth.group(2));
            if (month != null) {
                return withYear(today, dayMonth.group(3), month.getValue(), Integer.parseInt(dayMonth.group(1)));
            }
        }
        Matcher monthDay = MONTH_DAY.matcher(t);
        while (monthDay.find()) {
            String word = monthDay.group(1);
            // "may" in front of a number is too often the verb
            Month month = word.equals("may") ? null : MONTHS.get(word);
            if (month != null) {
                return withYear(today, monthDay.group(3), month.getValue(), Integer.parseInt(monthDay.group(2)));
            }
        }
        return Optional.empty();
    }

    /**
     * True when the text refers to a day at all, parseable or not: "31/02", "in March" and "next week"
     * all count. Callers use it to tell a missing date from one they could not read.
     */
    public boolean mentionsDate(String text) {
        String t = TextNormalizer.normalize(text);
        if (t.isEmpty()) return false;
        if (parseDate(t).isPresent()) return true;
        if (ISO_DATE.matcher(t).find() || DMY_DATE.matcher(t).find() || DM_DATE.matcher(t).find()) return true;
        if (ORDINAL_DAY.matcher(t).find() || TextNormalizer.containsAny(t, VAGUE)) return true;
        // a month word without a number counts only when spelled out; "jan" and "may" are often not months
        for (String token : TextNormalizer.tokens(t)) {
            if (token.length() > 3 && MONTHS.containsKey(token)) return true;
        }
        return false;
    }

    /** Requires either HH:MM or an hour with am/pm, so bare numbers are never read as times. */
    public Optional<LocalTime> parseTime(String text) {
        String t = TextNormalizer.normalize(text);
        if (t.isEmpty()) return Optional.empty();
        Matcher m = TIME_24H.matcher(t);
        if (m.find()) {
            return safeTime(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), m.group(3));
        }
        m = TIME_MERIDIEM.matcher(t);
        if (m.find()) {
            return safeTime(Integer.parseInt(m.group(1)), 0, m.group(2));
        }
        return Optional.empty();
    }

    /** Next occurrence strictly after {@code from}; asking for today's weekday means next week. */
    static LocalDate nextOccurrence(LocalDate from, DayOfWeek day) {
        int ahead = day.getValue() - from.getDayOfWeek().getValue();
        if (ahead <= 0) ahead += 7;
        return from.plusDays(ahead);
    }

    private static Optional<LocalDate> withYear(LocalDate today, String year, int month, int day) {
        if (year != null) return safeDate(year, String.valueOf(month), String.valueOf(day));
        return upcoming(today, month, day);
    }

    /** Day and month without a year: this year, or next year once the day has passed. */
    private static Optional<LocalDate> upcoming(LocalDate today, int month, int day) {
        try {
            LocalDate date = LocalDate.of(today.getYear(), month, day);
            return Optional.of(date.isBefore(today) ? date.plusYears(1) : date);
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> safeDate(String year, String month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalTime> safeTime(int hour, int minute, String meridiem) {
        if (meridiem != null) {
            if (hour < 1 || hour > 12) return Optional.empty();
            boolean pm = meridiem.equals("pm") || meridiem.equals("م");
            if (pm && hour != 12) hour += 12;
            if (!pm && hour == 12) hour = 0;
        }
        if (hour > 23 || minute > 59) return Optional.empty();
        return Optional.of(LocalTime.of(hour, minute));
    }
}
