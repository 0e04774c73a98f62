package com.ai.clinicdesk.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Saudi mobile numbers. Canonical form is the local {@code 05XXXXXXXX}.
 */
public final class PhoneNormalizer {

    private static final Pattern CANONICAL = Pattern.compile("^05\\d{8}$");
    private static final Pattern CANDIDATE = Pattern.compile("\\+?\\d[\\d\\s().-]{7,18}\\d");

    private PhoneNormalizer() {
    }

    /**
     * Normalizes a string that should contain nothing but a phone number.
     */
    public static Optional<String> normalize(String raw) {
        if (StringUtils.isBlank(raw)) return Optional.empty();
        String s = TextNormalizer.normalize(raw);
        boolean plus = s.startsWith("+");
        String digits = s.replaceAll("\\D", "");
        if (plus && digits.startsWith("966")) {
            digits = "0" + digits.substring(3);
        } else if (digits.startsWith("00966")) {
            digits = "0" + digits.substring(5);
        } else if (digits.startsWith("966") && digits.length() == 12) {
            digits = "0" + digits.substring(3);
        } else if (digits.startsWith("5") && digits.length() == 9) {
            digits = "0" + digits;
        }
        return CANONICAL.matcher(digits).matches() ? Optional.of(digits) : Optional.empty();
    }

    /**
     * Finds the first valid phone number inside free text.
     */
    public static Optional<String> extract(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        Matcher m = CANDIDATE.matcher(TextNormalizer.normalize(text));
        while (m.find()) {
            Optional<String> phone = normalize(m.group());
            if (phone.isPresent()) return phone;
        }
        return Optional.empty();
    }

    public static boolean looksLikePhone(String text) {
        return extract(text).isPresent();
    }
}
