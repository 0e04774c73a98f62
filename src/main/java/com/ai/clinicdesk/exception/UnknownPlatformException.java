package com.ai.clinicdesk.exception;

public class UnknownPlatformException extends RuntimeException {

    public UnknownPlatformException(String platform) {
        super("Unknown platform: " + platform);
    }
}
