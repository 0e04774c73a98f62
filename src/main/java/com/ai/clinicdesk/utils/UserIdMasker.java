package com.ai.clinicdesk.utils;

/**
 * Masks user ids (often phone numbers) for logs. Keeps the first and last two characters.
 */
public final class UserIdMasker {

    private UserIdMasker() {
    }

    public static String mask(String userId) {
        if (userId == null || userId.length() <= 4) {
            return "****";
        }
        return userId.substring(0, 2) + "****" + userId.substring(userId.length() - 2);
    }
}
