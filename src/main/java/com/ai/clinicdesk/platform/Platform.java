package com.ai.clinicdesk.platform;

import java.util.Locale;
import java.util.Optional;

public enum Platform {
    WHATSAPP,
    INSTAGRAM,
    TIKTOK,
    WEB;

    public static Optional<Platform> fromPath(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(Platform.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
