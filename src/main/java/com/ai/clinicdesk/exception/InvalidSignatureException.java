package com.ai.clinicdesk.exception;

/**
 * Webhook body did not match the platform's HMAC signature header.
 */
public class InvalidSignatureException extends RuntimeException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}
