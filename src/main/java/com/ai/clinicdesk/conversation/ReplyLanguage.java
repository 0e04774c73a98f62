package com.ai.clinicdesk.conversation;

import java.util.List;

/**
 * Language a reply is written in. Picked from the script of the user's own message.
 */
public enum ReplyLanguage {
    ENGLISH,
    ARABIC;

    private static final String USER_PREFIX = "user: ";

    /**
     * Arabic when Arabic letters are at least as many as Latin ones. Text with no letters at all
     * (a phone number, an option number) keeps {@code fallback}.
     */
    public static ReplyLanguage detect(String text, ReplyLanguage fallback) {
        if (text == null) return fallback;
        int arabic = 0;
        int latin = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            if (Character.isLetter(cp)) {
                Character.UnicodeScript script = Character.UnicodeScript.of(cp);
                if (script == Character.UnicodeScript.ARABIC) arabic++;
                else if (script == Character.UnicodeScript.LATIN) latin++;
            }
            i += Character.charCount(cp);
        }
        if (arabic == 0 && latin == 0) return fallback;
        return arabic >= latin ? ARABIC : ENGLISH;
    }

    /** Language of the latest user turn that has letters in it; ENGLISH when there is none. */
    public static ReplyLanguage fromHistory(List<String> turns) {
        if (turns != null) {
            for (int i = turns.size() - 1; i >= 0; i--) {
                String line = turns.get(i);
                if (line == null || !line.startsWith(USER_PREFIX)) continue;
                ReplyLanguage found = detect(line.substring(USER_PREFIX.length()), null);
                if (found != null) return found;
            }
        }
        return ENGLISH;
    }
}
