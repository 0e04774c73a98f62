package com.ai.clinicdesk.exception;

/**
 * A booking session or reservation could not be written. The session is left at its previous step.
 */
public class PersistenceFailureException extends RuntimeException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
