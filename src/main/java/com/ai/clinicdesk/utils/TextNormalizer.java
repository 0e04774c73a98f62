package com.ai.clinicdesk.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes English and Arabic user text for matching: lower case, Arabic letter variants
 * folded, diacritics and tatweel removed, Arabic-Indic digits mapped to Latin.
 */
public final class TextNormalizer {

    private static final Pattern AR_DIACRITICS = Pattern.compile("[\\u0617-\\u061A\\u064B-\\u0652]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final char TATWEEL = 'ـ';

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (StringUtils.isBlank(text)) return "";
        String s = text.trim().toLowerCase(Locale.ROOT);
        s = s.replace(String.valueOf(TATWEEL), "");
        s = AR_DIACRITICS.matcher(s).replaceAll("");
        s = StringUtils.replaceChars(s, "أإآٱ", "اااا");
        s = StringUtils.replaceChars(s, "ىؤئ", "يوي");
        s = StringUtils.replaceChars(s, "٠١٢٣٤٥٦٧٨٩۰۱۲۳۴۵۶۷۸۹", "01234567890123456789");
        s = s.replace('،', ',').replace('؟', '?');
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /** Letters and digits only, single spaced. Input is expected to be normalized already. */
    public static String words(String normalized) {
        if (StringUtils.isBlank(normalized)) return "";
        return NON_WORD.matcher(normalized).replaceAll(" ").trim();
    }

    public static List<String> tokens(String normalized) {
        String w = words(normalized);
        return w.isEmpty() ? List.of() : Arrays.asList(w.split(" "));
    }

    /** Whole-word phrase containment on the {@link #words(String)} form of both arguments. */
    public static boolean containsPhrase(String normalized, String phrase) {
        String haystack = words(normalized);
        String needle = words(normalize(phrase));
        if (haystack.isEmpty() || needle.isEmpty()) return false;
        return (" " + haystack + " ").contains(" " + needle + " ");
    }

    public static boolean containsAny(String normalized, Iterable<String> phrases) {
        for (String p : phrases) {
            if (containsPhrase(normalized, p)) return true;
        }
        return false;
    }

    public static int countMatches(String normalized, Iterable<String> phrases) {
        int n = 0;
        for (String p : phrases) {
            if (containsPhrase(normalized, p)) n++;
        }
        return n;
    }
}
